package org.janelia.multiplex;

import java.io.IOException;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.dataaccess.PathResolver;

/**
 * Ranks the rounds by their registration error, logs the ranking and saves it next to the registered frames.
 */
public class PipelineReportStepExecutor extends PipelineStepExecutor
{
	private static final long serialVersionUID = -1186417210574622493L;

	public PipelineReportStepExecutor( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		super( job, sparkContext );
	}

	@Override
	public void run() throws PipelineExecutionException
	{
		final List< DisplacementEntry > report = DisplacementReporter.rank( job.getResults().values() );
		DisplacementReporter.log( report );
		job.setReport( report );

		final String reportPath = PathResolver.get( args.outputFolder(), DisplacementReporter.REPORT_FILE_NAME );
		try
		{
			DisplacementReportJSONProvider.saveReport( report, job.getFrameStore().getJsonWriter( reportPath ) );
		}
		catch ( final IOException e )
		{
			throw new PipelineExecutionException( "Cannot save the displacement report to " + reportPath, e );
		}
	}
}
