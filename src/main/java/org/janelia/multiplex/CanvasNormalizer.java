package org.janelia.multiplex;

import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.NumericType;
import net.imglib2.view.Views;

/**
 * Computes the canonical canvas of a run and zero-pads frames to it.
 * Padding is added on the trailing edge of each axis only, frames are never cropped.
 */
public class CanvasNormalizer
{
	private static final Logger LOG = LoggerFactory.getLogger( CanvasNormalizer.class );

	/**
	 * Size statistics of the shape-only scan, in (height, width) order.
	 */
	public static class Statistics
	{
		private final CanvasSize canvas;
		private final long minHeight, minWidth;

		Statistics( final CanvasSize canvas, final long minHeight, final long minWidth )
		{
			this.canvas = canvas;
			this.minHeight = minHeight;
			this.minWidth = minWidth;
		}

		public CanvasSize getCanvas() { return canvas; }
		public long getMinHeight() { return minHeight; }
		public long getMinWidth() { return minWidth; }

		public long getHeightDifference() { return canvas.getHeight() - minHeight; }
		public long getWidthDifference() { return canvas.getWidth() - minWidth; }

		public double getRelativeHeightDifference() { return ( double ) getHeightDifference() / canvas.getHeight(); }
		public double getRelativeWidthDifference() { return ( double ) getWidthDifference() / canvas.getWidth(); }
	}

	/**
	 * Finds (max height, max width) over the whole set of frames.
	 * Uses only the declared frame shapes, no pixel data is needed.
	 *
	 * @throws EmptyInputException
	 * 			if there are no frames
	 */
	public static CanvasSize getCanonicalSize( final Collection< FrameInfo > frames ) throws EmptyInputException
	{
		return getStatistics( frames ).getCanvas();
	}

	public static Statistics getStatistics( final Collection< FrameInfo > frames ) throws EmptyInputException
	{
		if ( frames.isEmpty() )
			throw new EmptyInputException( "Cannot compute the output frame size of an empty input set" );

		long maxHeight = 0, maxWidth = 0;
		long minHeight = Long.MAX_VALUE, minWidth = Long.MAX_VALUE;
		for ( final FrameInfo frame : frames )
		{
			if ( !frame.hasShape() )
				throw new IllegalArgumentException( "Frame shape is unknown: " + frame );

			maxHeight = Math.max( frame.getHeight(), maxHeight );
			maxWidth = Math.max( frame.getWidth(), maxWidth );
			minHeight = Math.min( frame.getHeight(), minHeight );
			minWidth = Math.min( frame.getWidth(), minWidth );
		}

		final Statistics statistics = new Statistics( new CanvasSize( maxHeight, maxWidth ), minHeight, minWidth );
		LOG.info( "Output frame size: {}", statistics.getCanvas() );
		LOG.info( "Min frame size: ({}, {}), difference: ({}, {}) = ({}, {})",
				minHeight, minWidth,
				statistics.getHeightDifference(), statistics.getWidthDifference(),
				String.format( "%.2f", statistics.getRelativeHeightDifference() ), String.format( "%.2f", statistics.getRelativeWidthDifference() ) );
		return statistics;
	}

	/**
	 * Checks that the declared shape of a frame fits on the canvas.
	 *
	 * @throws ShapeMismatchException
	 * 			if the frame is larger than the canvas in some dimension
	 */
	public static void checkFits( final FrameInfo frame, final CanvasSize canvas ) throws ShapeMismatchException
	{
		if ( !canvas.contains( frame.getHeight(), frame.getWidth() ) )
			throw new ShapeMismatchException( "Frame " + frame + " of size (" + frame.getHeight() + ", " + frame.getWidth() + ") does not fit the canonical canvas " + canvas );
	}

	/**
	 * Pads a 2D frame with zeros on the trailing edges to the canonical canvas.
	 * Returns a view, the frame is not copied.
	 *
	 * @throws ShapeMismatchException
	 * 			if the frame is larger than the canvas in some dimension
	 */
	public static < T extends NumericType< T > > RandomAccessibleInterval< T > pad(
			final RandomAccessibleInterval< T > frame,
			final CanvasSize canvas ) throws ShapeMismatchException
	{
		if ( frame.numDimensions() != 2 )
			throw new IllegalArgumentException( "Expected a 2D frame, got " + frame.numDimensions() + "D" );

		if ( !canvas.contains( frame.dimension( 1 ), frame.dimension( 0 ) ) )
			throw new ShapeMismatchException( "Frame of size (" + frame.dimension( 1 ) + ", " + frame.dimension( 0 ) + ") does not fit the canonical canvas " + canvas );

		if ( frame.dimension( 0 ) == canvas.getWidth() && frame.dimension( 1 ) == canvas.getHeight() )
			return Views.zeroMin( frame );

		return Views.interval( Views.extendZero( Views.zeroMin( frame ) ), canvas.toInterval() );
	}
}
