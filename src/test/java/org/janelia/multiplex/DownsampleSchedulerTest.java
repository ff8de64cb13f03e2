package org.janelia.multiplex;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.FloatArray;
import net.imglib2.type.numeric.real.FloatType;

public class DownsampleSchedulerTest
{
	@Test
	public void testFactor()
	{
		final DownsampleScheduler scheduler = new DownsampleScheduler();
		Assert.assertEquals( 1, scheduler.getFactor( 1 ) );
		Assert.assertEquals( 1, scheduler.getFactor( 9999 ) );
		Assert.assertEquals( 2, scheduler.getFactor( 10000 ) );
		Assert.assertEquals( 2, scheduler.getFactor( 19999 ) );
		Assert.assertEquals( 3, scheduler.getFactor( 25000 ) );
	}

	@Test
	public void testConfigurableThreshold()
	{
		final DownsampleScheduler scheduler = new DownsampleScheduler( 100 );
		Assert.assertEquals( 1, scheduler.getFactor( 99 ) );
		Assert.assertEquals( 5, scheduler.getFactor( 450 ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidThreshold()
	{
		new DownsampleScheduler( 0 );
	}

	@Test
	public void testDecimate()
	{
		final float[][] frame = TestFrames.random( 21, 7, 10 );
		final ArrayImg< FloatType, FloatArray > img = TestFrames.toImg( frame );

		Assert.assertSame( img, DownsampleScheduler.decimate( img, 1 ) );

		final RandomAccessibleInterval< FloatType > decimated = DownsampleScheduler.decimate( img, 3 );
		Assert.assertEquals( 4, decimated.dimension( 0 ) );
		Assert.assertEquals( 3, decimated.dimension( 1 ) );

		final RandomAccess< FloatType > ra = decimated.randomAccess();
		for ( int y = 0; y < 3; ++y )
		{
			for ( int x = 0; x < 4; ++x )
			{
				ra.setPosition( new int[] { x, y } );
				Assert.assertEquals( frame[ 3 * y ][ 3 * x ], ra.get().get(), 0 );
			}
		}
	}

	@Test
	public void testToFullResolution()
	{
		final Shift shift = DownsampleScheduler.toFullResolution( new Shift( 1.5, -2, 0.1, 0.2 ), 4 );
		Assert.assertEquals( 6, shift.getDy(), 0 );
		Assert.assertEquals( -8, shift.getDx(), 0 );
		Assert.assertEquals( 0.1, shift.getError(), 0 );
		Assert.assertEquals( 0.2, shift.getPhase(), 0 );
	}
}
