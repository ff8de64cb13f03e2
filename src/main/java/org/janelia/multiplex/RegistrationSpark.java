package org.janelia.multiplex;

import java.io.Serializable;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.multiplex.RegistrationJob.PipelineStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Driver class for running multiplex round registration jobs on a Spark cluster.
 */
public class RegistrationSpark implements Serializable, AutoCloseable
{
	private static final Logger LOG = LoggerFactory.getLogger( RegistrationSpark.class );

	public static void main( final String[] args )
	{
		final RegistrationArguments registrationArgs;
		try
		{
			registrationArgs = new RegistrationArguments( args );
		}
		catch ( final IllegalArgumentException e )
		{
			LOG.error( "Invalid arguments: {}", e.getMessage() );
			System.exit( 1 );
			return;
		}

		if ( !registrationArgs.parsedSuccessfully() )
			System.exit( 1 );

		int exitCode = 0;
		try ( final RegistrationSpark driver = new RegistrationSpark( registrationArgs ) )
		{
			driver.run();
		}
		catch ( final PipelineExecutionException e )
		{
			LOG.error( "Aborted: " + e.getMessage(), e );
			exitCode = 2;
		}

		if ( exitCode != 0 )
			System.exit( exitCode );
	}

	private static final long serialVersionUID = 6006962943789087537L;

	private final RegistrationArguments args;
	private transient JavaSparkContext sparkContext;

	public RegistrationSpark( final RegistrationArguments args )
	{
		this.args = args;
	}

	public RegistrationJob run() throws PipelineExecutionException
	{
		sparkContext = new JavaSparkContext( new SparkConf()
				.setAppName( "MultiplexRegistration" )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
			);

		return runPipeline( new RegistrationJob( args ), sparkContext );
	}

	/**
	 * Executes all steps of the job in order, stopping at the first failing step.
	 */
	public static RegistrationJob runPipeline( final RegistrationJob job, final JavaSparkContext sparkContext ) throws PipelineExecutionException
	{
		final PipelineStepExecutorFactory pipelineExecutorFactory = new PipelineStepExecutorFactory( job, sparkContext );
		for ( final PipelineStep step : job.getPipeline() )
		{
			LOG.info( "Running step: {}", step );
			pipelineExecutorFactory.getPipelineStepExecutor( step ).run();
		}

		LOG.info( "Done" );
		return job;
	}

	@Override
	public void close()
	{
		if ( sparkContext != null )
		{
			sparkContext.close();
			sparkContext = null;
		}
	}
}
