package org.janelia.multiplex;

import java.util.Map;

import org.apache.spark.api.java.JavaSparkContext;

/**
 * Estimates the shift of every round relative to the anchor round.
 */
public class PipelineRegistrationStepExecutor extends PipelineStepExecutor
{
	private static final long serialVersionUID = 4926127095218874706L;

	public PipelineRegistrationStepExecutor( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		super( job, sparkContext );
	}

	@Override
	public void run() throws PipelineExecutionException
	{
		final RoundRegistrationOrchestrator orchestrator = new RoundRegistrationOrchestrator(
				sparkContext,
				job.getFrameStore(),
				job.getRegistrationSet(),
				job.getCanvas(),
				new DownsampleScheduler( args.downsampleThreshold() ) );

		final Map< String, RoundRegistrationResult > results = orchestrator.run();
		job.setResults( results );
	}
}
