package org.janelia.multiplex;

import java.io.Serializable;

import net.imglib2.RandomAccessible;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.NumericType;
import net.imglib2.view.Views;

/**
 * Translates full-resolution frames by the shift of their round, rounded to whole pixels.
 * Every frame of a round goes through the same applier with the same shift, so markers stay aligned with their reference.
 */
public class ShiftApplier implements Serializable
{
	private static final long serialVersionUID = -8124061637095411752L;

	private final ShiftMode mode;

	public ShiftApplier()
	{
		this( ShiftMode.WRAP );
	}

	public ShiftApplier( final ShiftMode mode )
	{
		this.mode = mode;
	}

	public ShiftMode getMode()
	{
		return mode;
	}

	/**
	 * Returns a view of the frame translated by (dy, dx): the output pixel at (y, x) is the input pixel at (y - dy, x - dx).
	 * The output has the same interval as the input.
	 */
	public < T extends NumericType< T > > RandomAccessibleInterval< T > apply( final RandomAccessibleInterval< T > frame, final Shift shift )
	{
		if ( frame.numDimensions() != 2 )
			throw new IllegalArgumentException( "Expected a 2D frame, got " + frame.numDimensions() + "D" );

		if ( shift.isZero() )
			return frame;

		final RandomAccessible< T > extended;
		switch ( mode )
		{
		case WRAP:
			extended = Views.extendPeriodic( frame );
			break;
		case ZERO:
			extended = Views.extendZero( frame );
			break;
		default:
			throw new UnsupportedOperationException( "Shift mode " + mode + " is not supported" );
		}

		// imglib2 axis order is (x, y)
		return Views.interval( Views.translate( extended, shift.getPixelDx(), shift.getPixelDy() ), frame );
	}
}
