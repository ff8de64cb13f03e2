package org.janelia.multiplex.phasecorrelation;

/**
 * Thrown by {@link PhaseCorrelationEstimator} when one of the images has (almost) no spectral energy
 * besides the DC component, so that no translation can be estimated.
 */
public class LowSignalException extends Exception
{
	private static final long serialVersionUID = -6316101526338227465L;

	public LowSignalException( final String message )
	{
		super( message );
	}
}
