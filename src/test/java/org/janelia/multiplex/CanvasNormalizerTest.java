package org.janelia.multiplex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;

public class CanvasNormalizerTest
{
	private static FrameInfo frame( final String roundId, final long height, final long width )
	{
		final FrameInfo frame = new FrameInfo( "frame." + roundId + ".DAPI.tif", roundId, "DAPI", true );
		frame.setSize( height, width );
		return frame;
	}

	@Test
	public void testCanonicalSize() throws EmptyInputException
	{
		final List< FrameInfo > frames = Arrays.asList(
				frame( "1", 4000, 4000 ),
				frame( "2", 4200, 3900 ),
				frame( "3", 3900, 4100 ) );

		final CanvasNormalizer.Statistics statistics = CanvasNormalizer.getStatistics( frames );
		Assert.assertEquals( new CanvasSize( 4200, 4100 ), statistics.getCanvas() );
		Assert.assertEquals( 3900, statistics.getMinHeight() );
		Assert.assertEquals( 3900, statistics.getMinWidth() );
		Assert.assertEquals( 300, statistics.getHeightDifference() );
		Assert.assertEquals( 200, statistics.getWidthDifference() );
		Assert.assertEquals( 300.0 / 4200, statistics.getRelativeHeightDifference(), 1e-12 );

		// independent of the order of the frames
		final List< FrameInfo > reversed = new ArrayList<>( frames );
		Collections.reverse( reversed );
		Assert.assertEquals( new CanvasSize( 4200, 4100 ), CanvasNormalizer.getCanonicalSize( reversed ) );
	}

	@Test( expected = EmptyInputException.class )
	public void testEmptyInput() throws EmptyInputException
	{
		CanvasNormalizer.getCanonicalSize( Collections.emptyList() );
	}

	@Test
	public void testPadTrailingEdges() throws ShapeMismatchException
	{
		final ArrayImg< UnsignedByteType, ByteArray > img = ArrayImgs.unsignedBytes( 3, 2 );
		int value = 1;
		for ( final UnsignedByteType t : img )
			t.set( value++ );

		final RandomAccessibleInterval< UnsignedByteType > padded = CanvasNormalizer.pad( img, new CanvasSize( 4, 5 ) );
		Assert.assertArrayEquals( new long[] { 5, 4 }, new long[] { padded.dimension( 0 ), padded.dimension( 1 ) } );
		Assert.assertArrayEquals( new long[] { 0, 0 }, new long[] { padded.min( 0 ), padded.min( 1 ) } );

		final RandomAccess< UnsignedByteType > ra = padded.randomAccess();
		for ( int y = 0; y < 4; ++y )
		{
			for ( int x = 0; x < 5; ++x )
			{
				ra.setPosition( new int[] { x, y } );
				final int expected = x < 3 && y < 2 ? 1 + y * 3 + x : 0;
				Assert.assertEquals( "at (" + y + ", " + x + ")", expected, ra.get().get() );
			}
		}
	}

	@Test
	public void testPadMatchingSize() throws ShapeMismatchException
	{
		final ArrayImg< UnsignedByteType, ByteArray > img = ArrayImgs.unsignedBytes( 5, 4 );
		final RandomAccessibleInterval< UnsignedByteType > padded = CanvasNormalizer.pad( img, new CanvasSize( 4, 5 ) );
		Assert.assertEquals( 5, padded.dimension( 0 ) );
		Assert.assertEquals( 4, padded.dimension( 1 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testPadLargerFrame() throws ShapeMismatchException
	{
		CanvasNormalizer.pad( ArrayImgs.unsignedBytes( 6, 4 ), new CanvasSize( 4, 5 ) );
	}

	@Test( expected = ShapeMismatchException.class )
	public void testCheckFits() throws ShapeMismatchException
	{
		final CanvasSize canvas = new CanvasSize( 4200, 4100 );
		CanvasNormalizer.checkFits( frame( "1", 4200, 4100 ), canvas );
		CanvasNormalizer.checkFits( frame( "2", 4201, 100 ), canvas );
	}
}
