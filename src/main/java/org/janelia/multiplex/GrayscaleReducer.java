package org.janelia.multiplex;

import java.util.ArrayList;
import java.util.List;

import ij.ImagePlus;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.img.imageplus.ImagePlusImgs;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Reduces multi-channel frames to a single 8-bit intensity channel using fixed luminance weights.
 * Single-channel frames are passed through unchanged.
 */
public class GrayscaleReducer
{
	/** Weights of the red, green and blue channels. */
	public static final double[] LUMINANCE_WEIGHTS = new double[] { 0.2125, 0.7154, 0.0721 };

	/**
	 * Converts an opened frame to a single-channel image.
	 * Packed RGB images and channel stacks are reduced to 8-bit intensity, grayscale images are wrapped as is.
	 */
	public static < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > toSingleChannel( final ImagePlus imp )
	{
		if ( imp.getType() == ImagePlus.COLOR_RGB )
		{
			if ( imp.getStackSize() != 1 )
				throw new IllegalArgumentException( "RGB stacks are not supported: " + imp.getTitle() );
			final RandomAccessibleInterval< ARGBType > rgb = ImagePlusImgs.from( imp );
			return asSingleChannel( reduceRGB( rgb ) );
		}

		final RandomAccessibleInterval< T > img = ImagePlusImgs.from( imp );
		if ( img.numDimensions() == 2 )
			return img;

		if ( img.numDimensions() != 3 )
			throw new IllegalArgumentException( "Expected a 2D frame or a channel stack, got " + img.numDimensions() + "D: " + imp.getTitle() );

		final List< RandomAccessibleInterval< T > > channels = new ArrayList<>();
		for ( long channel = 0; channel < img.dimension( 2 ); ++channel )
			channels.add( Views.hyperSlice( img, 2, channel ) );
		return asSingleChannel( reduceChannels( channels ) );
	}

	public static RandomAccessibleInterval< UnsignedByteType > reduceRGB( final RandomAccessibleInterval< ARGBType > rgb )
	{
		final ArrayImg< UnsignedByteType, ByteArray > gray = ArrayImgs.unsignedBytes( Intervals.dimensionsAsLongArray( rgb ) );
		final Cursor< ARGBType > srcCursor = Views.flatIterable( rgb ).cursor();
		final Cursor< UnsignedByteType > dstCursor = gray.cursor();
		while ( dstCursor.hasNext() )
		{
			final int argb = srcCursor.next().get();
			final double luminance =
					LUMINANCE_WEIGHTS[ 0 ] * ARGBType.red( argb ) +
					LUMINANCE_WEIGHTS[ 1 ] * ARGBType.green( argb ) +
					LUMINANCE_WEIGHTS[ 2 ] * ARGBType.blue( argb );
			dstCursor.next().set( toUnsignedByte( luminance / 255 ) );
		}
		return gray;
	}

	/**
	 * Reduces a list of equally sized channels to 8-bit intensity.
	 * Three or four channels are treated as RGB(A) and the alpha channel is ignored,
	 * any other number of channels is averaged with equal weights.
	 * Integer channels are normalized by the maximum value of their type, float channels are expected in [0,1].
	 */
	public static < T extends RealType< T > > RandomAccessibleInterval< UnsignedByteType > reduceChannels( final List< ? extends RandomAccessibleInterval< T > > channels )
	{
		if ( channels.isEmpty() )
			throw new IllegalArgumentException( "No channels to reduce" );

		for ( final RandomAccessibleInterval< T > channel : channels )
			if ( !Intervals.equalDimensions( channel, channels.get( 0 ) ) )
				throw new IllegalArgumentException( "Channels have different dimensions" );

		final double[] weights;
		if ( channels.size() == 3 || channels.size() == 4 )
		{
			weights = LUMINANCE_WEIGHTS;
		}
		else
		{
			weights = new double[ channels.size() ];
			for ( int c = 0; c < weights.length; ++c )
				weights[ c ] = 1.0 / weights.length;
		}

		final List< Cursor< T > > cursors = new ArrayList<>();
		final double[] normalization = new double[ weights.length ];
		for ( int c = 0; c < weights.length; ++c )
		{
			cursors.add( Views.flatIterable( channels.get( c ) ).cursor() );
			final T type = Util.getTypeFromInterval( channels.get( c ) );
			normalization[ c ] = type instanceof IntegerType ? type.getMaxValue() : 1.0;
		}

		final ArrayImg< UnsignedByteType, ByteArray > gray = ArrayImgs.unsignedBytes( Intervals.dimensionsAsLongArray( channels.get( 0 ) ) );
		final Cursor< UnsignedByteType > dstCursor = gray.cursor();
		while ( dstCursor.hasNext() )
		{
			double luminance = 0;
			for ( int c = 0; c < weights.length; ++c )
				luminance += weights[ c ] * cursors.get( c ).next().getRealDouble() / normalization[ c ];
			dstCursor.next().set( toUnsignedByte( luminance ) );
		}
		return gray;
	}

	@SuppressWarnings( "unchecked" )
	private static < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > asSingleChannel( final RandomAccessibleInterval< UnsignedByteType > gray )
	{
		return ( RandomAccessibleInterval< T > ) ( RandomAccessibleInterval< ? > ) gray;
	}

	private static int toUnsignedByte( final double normalizedValue )
	{
		return ( int ) Math.round( Math.max( 0, Math.min( 1, normalizedValue ) ) * 255 );
	}
}
