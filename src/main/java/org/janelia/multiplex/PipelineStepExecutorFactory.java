package org.janelia.multiplex;

import java.util.EnumMap;
import java.util.Map;

import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.multiplex.RegistrationJob.PipelineStep;

/**
 * Simplifies obtaining a concrete pipeline step executor.
 */
public final class PipelineStepExecutorFactory
{
	final Map< PipelineStep, PipelineStepExecutor > executors;

	public PipelineStepExecutorFactory( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		executors = new EnumMap<>( PipelineStep.class );
		executors.put( PipelineStep.Metadata, new PipelineMetadataStepExecutor( job, sparkContext ) );
		executors.put( PipelineStep.Registration, new PipelineRegistrationStepExecutor( job, sparkContext ) );
		executors.put( PipelineStep.Export, new PipelineExportStepExecutor( job, sparkContext ) );
		executors.put( PipelineStep.Report, new PipelineReportStepExecutor( job, sparkContext ) );
	}

	public PipelineStepExecutor getPipelineStepExecutor( final PipelineStep step )
	{
		return executors.get( step );
	}
}
