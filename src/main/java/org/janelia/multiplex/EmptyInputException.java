package org.janelia.multiplex;

/**
 * Thrown when no valid anchor round can be established: there are no frames,
 * fewer than two reference frames, or the reference frames do not match the rounds one to one.
 */
public class EmptyInputException extends PipelineExecutionException
{
	private static final long serialVersionUID = 4467920386216934120L;

	public EmptyInputException( final String message )
	{
		super( message );
	}
}
