package org.janelia.multiplex;

import java.io.Serializable;

/**
 * Translational offset of a round relative to the anchor round, in pixels.
 * A positive shift means that the moving frame has to be translated by +shift to align with the fixed frame.
 * Also carries the registration error and the diagnostic phase difference reported by the estimator.
 */
public class Shift implements Serializable
{
	private static final long serialVersionUID = 3240987153021853311L;

	public static final Shift ZERO = new Shift( 0, 0 );

	private final double dy;
	private final double dx;
	private final double error;
	private final double phase;

	public Shift( final double dy, final double dx )
	{
		this( dy, dx, 0, 0 );
	}

	public Shift( final double dy, final double dx, final double error, final double phase )
	{
		this.dy = dy;
		this.dx = dx;
		this.error = error;
		this.phase = phase;
	}

	public double getDy() { return dy; }
	public double getDx() { return dx; }
	public double getError() { return error; }
	public double getPhase() { return phase; }

	/**
	 * @return the vertical offset rounded to whole pixels
	 */
	public long getPixelDy() { return Math.round( dy ); }

	/**
	 * @return the horizontal offset rounded to whole pixels
	 */
	public long getPixelDx() { return Math.round( dx ); }

	public boolean isZero()
	{
		return getPixelDy() == 0 && getPixelDx() == 0;
	}

	/**
	 * Scales the offset elementwise, keeping error and phase.
	 */
	public Shift scale( final int factor )
	{
		return new Shift( dy * factor, dx * factor, error, phase );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Shift ) )
			return false;
		final Shift other = ( Shift ) obj;
		return Double.compare( dy, other.dy ) == 0 && Double.compare( dx, other.dx ) == 0
				&& Double.compare( error, other.error ) == 0 && Double.compare( phase, other.phase ) == 0;
	}

	@Override
	public int hashCode()
	{
		int result = Double.hashCode( dy );
		result = 31 * result + Double.hashCode( dx );
		result = 31 * result + Double.hashCode( error );
		result = 31 * result + Double.hashCode( phase );
		return result;
	}

	@Override
	public String toString()
	{
		return String.format( "(dy=%.2f, dx=%.2f)", dy, dx );
	}
}
