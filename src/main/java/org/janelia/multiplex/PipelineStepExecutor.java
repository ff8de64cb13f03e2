package org.janelia.multiplex;

import java.io.Serializable;

import org.apache.spark.api.java.JavaSparkContext;

/**
 * Base class for all tasks implementations that should be executed as a part of the pipeline.
 */
public abstract class PipelineStepExecutor implements Serializable
{
	private static final long serialVersionUID = 3546355803511705943L;

	protected final RegistrationArguments args;
	protected final transient RegistrationJob job;
	protected final transient JavaSparkContext sparkContext;

	public PipelineStepExecutor( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		this.job = job;
		this.sparkContext = sparkContext;
		args = job.getArgs();
	}

	public abstract void run() throws PipelineExecutionException;
}
