package org.janelia.multiplex;

/**
 * Thrown when a frame cannot be placed on the canonical canvas because it is larger in some dimension.
 */
public class ShapeMismatchException extends PipelineExecutionException
{
	private static final long serialVersionUID = 7914853630170533398L;

	public ShapeMismatchException( final String message )
	{
		super( message );
	}
}
