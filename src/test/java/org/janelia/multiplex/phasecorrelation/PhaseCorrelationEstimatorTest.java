package org.janelia.multiplex.phasecorrelation;

import java.util.Random;

import org.janelia.multiplex.Shift;
import org.janelia.multiplex.TestFrames;
import org.junit.Assert;
import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;

public class PhaseCorrelationEstimatorTest
{
	private final PhaseCorrelationEstimator estimator = new PhaseCorrelationEstimator();

	@Test
	public void testIdentity() throws LowSignalException
	{
		final float[][] fixed = TestFrames.random( 1, 64, 48 );
		final Shift shift = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( fixed ), 1 );
		Assert.assertEquals( 0, shift.getDy(), 0 );
		Assert.assertEquals( 0, shift.getDx(), 0 );
		Assert.assertEquals( 0, shift.getError(), 1e-3 );
		Assert.assertEquals( 0, shift.getPhase(), 1e-6 );
	}

	@Test
	public void testExactWraparoundRecovery() throws LowSignalException
	{
		final float[][] fixed = TestFrames.random( 2, 500, 400 );
		final float[][] moving = TestFrames.roll( fixed, -37, 12 );

		final Shift shift = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 1 );
		Assert.assertEquals( 37, shift.getDy(), 0 );
		Assert.assertEquals( -12, shift.getDx(), 0 );
		Assert.assertEquals( 0, shift.getError(), 1e-3 );
	}

	@Test
	public void testFullSizeFrameRecovery() throws LowSignalException
	{
		final float[][] fixed = TestFrames.random( 5, 2000, 1600 );
		final float[][] moving = TestFrames.roll( fixed, -37, 12 );

		final Shift shift = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 1 );
		Assert.assertEquals( 37, shift.getDy(), 0 );
		Assert.assertEquals( -12, shift.getDx(), 0 );
		Assert.assertEquals( 0, shift.getError(), 1e-3 );
	}

	@Test
	public void testOddSizesAndLargeOffsets() throws LowSignalException
	{
		final float[][] fixed = TestFrames.random( 3, 97, 131 );

		// offsets beyond half of the size are reported as negative
		final float[][] moving = TestFrames.roll( fixed, 60, -70 );
		final Shift shift = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 1 );
		Assert.assertEquals( 97 - 60, shift.getDy(), 0 );
		Assert.assertEquals( 70 - 131, shift.getDx(), 0 );
	}

	@Test
	public void testUpsampledIntegerShift() throws LowSignalException
	{
		final float[][] fixed = TestFrames.random( 4, 120, 100 );
		final float[][] moving = TestFrames.roll( fixed, 5, -9 );

		final Shift shift = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 4 );
		Assert.assertEquals( -5, shift.getDy(), 1e-9 );
		Assert.assertEquals( 9, shift.getDx(), 1e-9 );
		Assert.assertEquals( 0, shift.getError(), 1e-3 );
	}

	@Test
	public void testSubpixelRefinement() throws LowSignalException
	{
		final int height = 128, width = 128;
		final double dy = 2.5, dx = -1.5;
		final double[][] blobs = randomBlobs( 8, 40, 16, 112 );
		final float[][] fixed = new float[ height ][ width ];
		final float[][] moving = new float[ height ][ width ];
		for ( int y = 0; y < height; ++y )
		{
			for ( int x = 0; x < width; ++x )
			{
				fixed[ y ][ x ] = render( blobs, y, x );
				moving[ y ][ x ] = render( blobs, y + dy, x + dx );
			}
		}

		final Shift coarse = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 1 );
		Assert.assertEquals( dy, coarse.getDy(), 0.5 + 1e-9 );
		Assert.assertEquals( dx, coarse.getDx(), 0.5 + 1e-9 );

		final Shift refined = estimator.estimate( TestFrames.toImg( fixed ), TestFrames.toImg( moving ), 2 );
		Assert.assertEquals( dy, refined.getDy(), 0.26 );
		Assert.assertEquals( dx, refined.getDx(), 0.26 );
		Assert.assertEquals( 0, refined.getDy() * 2 % 1, 1e-9 );
	}

	@Test( expected = LowSignalException.class )
	public void testUniformFixedFrame() throws LowSignalException
	{
		estimator.estimate(
				TestFrames.toImg( TestFrames.constant( 200, 40, 30 ) ),
				TestFrames.toImg( TestFrames.random( 5, 40, 30 ) ),
				1 );
	}

	@Test( expected = LowSignalException.class )
	public void testUniformMovingFrame() throws LowSignalException
	{
		estimator.estimate(
				TestFrames.toImg( TestFrames.random( 6, 40, 30 ) ),
				TestFrames.toImg( TestFrames.constant( 17, 40, 30 ) ),
				1 );
	}

	@Test( expected = LowSignalException.class )
	public void testEmptyFrame() throws LowSignalException
	{
		estimator.estimate( ArrayImgs.floats( 16, 16 ), TestFrames.toImg( TestFrames.random( 7, 16, 16 ) ), 1 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testDifferentSizes() throws LowSignalException
	{
		estimator.estimate( ArrayImgs.floats( 16, 16 ), ArrayImgs.floats( 16, 17 ), 1 );
	}

	@Test
	public void testFoldPeak()
	{
		Assert.assertEquals( 0, PhaseCorrelationEstimator.foldPeak( 0, 10 ) );
		Assert.assertEquals( 5, PhaseCorrelationEstimator.foldPeak( 5, 10 ) );
		Assert.assertEquals( -4, PhaseCorrelationEstimator.foldPeak( 6, 10 ) );
		Assert.assertEquals( 4, PhaseCorrelationEstimator.foldPeak( 4, 9 ) );
		Assert.assertEquals( -4, PhaseCorrelationEstimator.foldPeak( 5, 9 ) );
	}

	@Test
	public void testSignedFrequency()
	{
		Assert.assertEquals( 0, UpsampledDFT.signedFrequency( 0, 4 ) );
		Assert.assertEquals( 1, UpsampledDFT.signedFrequency( 1, 4 ) );
		Assert.assertEquals( -2, UpsampledDFT.signedFrequency( 2, 4 ) );
		Assert.assertEquals( -1, UpsampledDFT.signedFrequency( 3, 4 ) );
		Assert.assertEquals( 2, UpsampledDFT.signedFrequency( 2, 5 ) );
		Assert.assertEquals( -2, UpsampledDFT.signedFrequency( 3, 5 ) );
	}

	/**
	 * @return {y, x, amplitude} of randomly placed blobs
	 */
	private static double[][] randomBlobs( final long seed, final int count, final double min, final double max )
	{
		final Random rnd = new Random( seed );
		final double[][] blobs = new double[ count ][];
		for ( int i = 0; i < count; ++i )
			blobs[ i ] = new double[] { min + rnd.nextDouble() * ( max - min ), min + rnd.nextDouble() * ( max - min ), 50 + rnd.nextDouble() * 200 };
		return blobs;
	}

	private static float render( final double[][] blobs, final double y, final double x )
	{
		final double sigma = 2.5;
		double value = 0;
		for ( final double[] blob : blobs )
		{
			final double ry = y - blob[ 0 ], rx = x - blob[ 1 ];
			value += blob[ 2 ] * Math.exp( -( ry * ry + rx * rx ) / ( 2 * sigma * sigma ) );
		}
		return ( float ) value;
	}
}
