package org.janelia.util;

import ij.ImagePlus;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.exception.ImgLibException;
import net.imglib2.img.imageplus.ImagePlusImg;
import net.imglib2.img.imageplus.ImagePlusImgFactory;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.util.Util;
import net.imglib2.view.Views;

/**
 * Utility class to convert image data between ImageJ and ImgLib2.
 */

public class Conversions {

	/**
	 * Copies a 2D image into a new {@link ImagePlus} of the same pixel type (8-bit, 16-bit or float).
	 */
	public static < T extends NativeType< T > & RealType< T > > ImagePlus toImagePlus( final RandomAccessibleInterval< T > img, final String title ) throws ImgLibException
	{
		if ( img.numDimensions() != 2 )
			throw new IllegalArgumentException( "Expected a 2D image, got " + img.numDimensions() + "D" );

		final ImagePlusImg< T, ? > dst = new ImagePlusImgFactory<>( Util.getTypeFromInterval( img ) ).create( Intervals.dimensionsAsLongArray( img ) );

		final Cursor< T > srcCursor = Views.flatIterable( img ).cursor();
		final Cursor< T > dstCursor = Views.flatIterable( dst ).cursor();
		while ( dstCursor.hasNext() || srcCursor.hasNext() )
			dstCursor.next().set( srcCursor.next() );

		final ImagePlus imp = dst.getImagePlus();
		imp.setTitle( title );
		return imp;
	}

	/**
	 * Copies a 2D image into a flat float array in (x, y) raster order.
	 */
	public static < T extends RealType< T > > float[] toFloatArray( final RandomAccessibleInterval< T > img )
	{
		final long size = Intervals.numElements( img );
		if ( size > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "Image is too large to fit into an array: " + size );

		final float[] pixels = new float[ ( int ) size ];
		int i = 0;
		for ( final T val : Views.flatIterable( img ) )
			pixels[ i++ ] = val.getRealFloat();
		return pixels;
	}
}
