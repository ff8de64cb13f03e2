package org.janelia.util;

import org.junit.Assert;
import org.junit.Test;

import ij.ImagePlus;
import net.imglib2.exception.ImgLibException;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.img.basictypeaccess.array.ShortArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.integer.UnsignedShortType;
import net.imglib2.type.numeric.real.FloatType;

public class ConversionsTest
{
	@Test
	public void testGray8() throws ImgLibException
	{
		final ArrayImg< UnsignedByteType, ByteArray > img = ArrayImgs.unsignedBytes( new byte[] { 1, 2, 3, ( byte ) 200, 5, 6 }, 3, 2 );
		final ImagePlus imp = Conversions.toImagePlus( img, "S.1.DAPI.tif" );

		Assert.assertEquals( ImagePlus.GRAY8, imp.getType() );
		Assert.assertEquals( "S.1.DAPI.tif", imp.getTitle() );
		Assert.assertEquals( 3, imp.getWidth() );
		Assert.assertEquals( 2, imp.getHeight() );
		Assert.assertEquals( 3, imp.getProcessor().get( 2, 0 ) );
		Assert.assertEquals( 200, imp.getProcessor().get( 0, 1 ) );
	}

	@Test
	public void testGray16() throws ImgLibException
	{
		final ArrayImg< UnsignedShortType, ShortArray > img = ArrayImgs.unsignedShorts( new short[] { 0, 1000, ( short ) 60000, 7 }, 2, 2 );
		final ImagePlus imp = Conversions.toImagePlus( img, "gray16" );

		Assert.assertEquals( ImagePlus.GRAY16, imp.getType() );
		Assert.assertEquals( 1000, imp.getProcessor().get( 1, 0 ) );
		Assert.assertEquals( 60000, imp.getProcessor().get( 0, 1 ) );
	}

	@Test
	public void testGray32() throws ImgLibException
	{
		final ArrayImg< FloatType, FloatArray > img = ArrayImgs.floats( new float[] { 0.5f, -1.25f }, 2, 1 );
		final ImagePlus imp = Conversions.toImagePlus( img, "gray32" );

		Assert.assertEquals( ImagePlus.GRAY32, imp.getType() );
		Assert.assertEquals( -1.25f, imp.getProcessor().getf( 1, 0 ), 0 );
		Assert.assertArrayEquals( new float[] { 0.5f, -1.25f }, Conversions.toFloatArray( img ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testRejectsStack() throws ImgLibException
	{
		Conversions.toImagePlus( ArrayImgs.unsignedBytes( 2, 2, 2 ), "stack" );
	}
}
