package org.janelia.multiplex;

/**
 * Run-level failure of a pipeline step. Aborts the registration run.
 */
public class PipelineExecutionException extends Exception
{
	private static final long serialVersionUID = -2015347403889233169L;

	public PipelineExecutionException( final String message )
	{
		super( message );
	}

	public PipelineExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
