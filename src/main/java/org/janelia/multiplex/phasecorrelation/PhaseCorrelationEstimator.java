package org.janelia.multiplex.phasecorrelation;

import java.io.Serializable;

import org.janelia.multiplex.Shift;
import org.jtransforms.fft.DoubleFFT_2D;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Estimates the translation between two equally sized 2D images by phase correlation.
 * <p>
 * The normalized cross-power spectrum of the fixed and the moving image is transformed back to the spatial domain
 * and the location of its maximum gives the integer shift. Shifts beyond half of the image size are folded to negative
 * offsets because the correlation is circular. With an upsample factor above 1 the peak is refined on a grid of
 * {@code 1/upsampleFactor} pixels by evaluating a small neighborhood of the correlation surface with a matrix DFT.
 * <p>
 * The returned shift is the translation that has to be applied to the moving image to align it with the fixed image.
 * Transforms are computed on the exact image size (no padding), so a circularly shifted copy is recovered exactly.
 */
public class PhaseCorrelationEstimator implements Serializable
{
	private static final long serialVersionUID = -3047411837566812964L;

	/** Cross-power spectrum bins with a smaller magnitude are left unnormalized. */
	public static final double NEGLIGIBLE_MAGNITUDE = 100 * Math.ulp( 1.0 );

	/** Minimum fraction of the spectral energy outside of the DC component. */
	public static final double MIN_RELATIVE_SIGNAL_ENERGY = 1e-12;

	/**
	 * @param fixed
	 * 			reference image
	 * @param moving
	 * 			image to be aligned, same size as the reference
	 * @param upsampleFactor
	 * 			1 for integer precision, otherwise the peak is refined to {@code 1/upsampleFactor} of a pixel
	 * @return shift of the moving image with the registration error and the phase difference at the peak
	 * @throws LowSignalException
	 * 			if either image has (almost) no spectral energy besides the DC component, e.g. a uniform image
	 */
	public < T extends RealType< T >, U extends RealType< U > > Shift estimate(
			final RandomAccessibleInterval< T > fixed,
			final RandomAccessibleInterval< U > moving,
			final int upsampleFactor ) throws LowSignalException
	{
		if ( fixed.numDimensions() != 2 || moving.numDimensions() != 2 )
			throw new IllegalArgumentException( "Phase correlation is implemented for 2D images only" );

		if ( !Intervals.equalDimensions( fixed, moving ) )
			throw new IllegalArgumentException( "Images have different dimensions: " + Intervals.toString( fixed ) + " and " + Intervals.toString( moving ) );

		if ( upsampleFactor < 1 )
			throw new IllegalArgumentException( "Upsample factor must be at least 1: " + upsampleFactor );

		if ( fixed.dimension( 0 ) * fixed.dimension( 1 ) > Integer.MAX_VALUE / 2 )
			throw new IllegalArgumentException( "Images are too large for the transform, consider decimating them: " + Intervals.toString( fixed ) );

		final int rows = ( int ) fixed.dimension( 1 );
		final int cols = ( int ) fixed.dimension( 0 );
		final DoubleFFT_2D fft = new DoubleFFT_2D( rows, cols );

		final double[][] fixedSpectrum = forwardTransform( fixed, rows, cols, fft );
		final double fixedEnergy = checkSignal( fixedSpectrum, "fixed" );

		final double[][] movingSpectrum = forwardTransform( moving, rows, cols, fft );
		final double movingEnergy = checkSignal( movingSpectrum, "moving" );

		// the fixed spectrum array turns into the raw cross-power spectrum, the moving one into its normalized version
		crossPowerSpectrum( fixedSpectrum, movingSpectrum );
		final double[][] crossPower = fixedSpectrum;
		final double[][] surface = movingSpectrum;

		fft.complexInverse( surface, true );

		final int[] peak = findPeak( surface );
		double dy = foldPeak( peak[ 0 ], rows );
		double dx = foldPeak( peak[ 1 ], cols );

		if ( upsampleFactor > 1 )
		{
			final double[] refined = UpsampledDFT.refinePeak( crossPower, dy, dx, upsampleFactor );
			dy = refined[ 0 ];
			dx = refined[ 1 ];
		}

		// singleton axes carry no shift
		if ( rows == 1 )
			dy = 0;
		if ( cols == 1 )
			dx = 0;

		final double numElements = ( double ) rows * cols;
		final double[] correlation = UpsampledDFT.correlationAt( crossPower, dy, dx );
		final double re = correlation[ 0 ] / numElements, im = correlation[ 1 ] / numElements;
		final double fixedAmplitude = fixedEnergy / numElements;
		final double movingAmplitude = movingEnergy / numElements;

		final double error = Math.sqrt( Math.abs( 1.0 - ( re * re + im * im ) / ( fixedAmplitude * movingAmplitude ) ) );
		// taken at the final shift, after upsampled refinement
		final double phase = Math.atan2( im, re );

		return new Shift( dy, dx, error, phase );
	}

	/**
	 * @return the full complex spectrum as {@code rows x 2*cols} interleaved (re, im) values
	 */
	static < T extends RealType< T > > double[][] forwardTransform( final RandomAccessibleInterval< T > img, final int rows, final int cols, final DoubleFFT_2D fft )
	{
		final double[][] spectrum = new double[ rows ][ 2 * cols ];
		int row = 0, col = 0;
		for ( final T val : Views.flatIterable( img ) )
		{
			spectrum[ row ][ col ] = val.getRealDouble();
			if ( ++col == cols )
			{
				col = 0;
				++row;
			}
		}
		fft.realForwardFull( spectrum );
		return spectrum;
	}

	/**
	 * @return total spectral energy
	 * @throws LowSignalException
	 * 			if the energy outside of the DC component is negligible
	 */
	static double checkSignal( final double[][] spectrum, final String description ) throws LowSignalException
	{
		double acEnergy = 0;
		for ( int row = 0; row < spectrum.length; ++row )
			for ( int i = ( row == 0 ? 2 : 0 ); i < spectrum[ row ].length; i += 2 )
				acEnergy += spectrum[ row ][ i ] * spectrum[ row ][ i ] + spectrum[ row ][ i + 1 ] * spectrum[ row ][ i + 1 ];

		final double dcEnergy = spectrum[ 0 ][ 0 ] * spectrum[ 0 ][ 0 ] + spectrum[ 0 ][ 1 ] * spectrum[ 0 ][ 1 ];
		final double totalEnergy = acEnergy + dcEnergy;

		if ( totalEnergy == 0 || acEnergy <= MIN_RELATIVE_SIGNAL_ENERGY * totalEnergy )
			throw new LowSignalException( "The " + description + " image has no structure to correlate (uniform intensity)" );

		return totalEnergy;
	}

	/**
	 * Replaces {@code fixed} with {@code F * conj(M)} and {@code moving} with {@code F * conj(M) / |F * conj(M)|}.
	 * Bins with a negligible magnitude are copied without normalization.
	 */
	static void crossPowerSpectrum( final double[][] fixed, final double[][] moving )
	{
		for ( int row = 0; row < fixed.length; ++row )
		{
			final double[] f = fixed[ row ], m = moving[ row ];
			for ( int i = 0; i < f.length; i += 2 )
			{
				final double re = f[ i ] * m[ i ] + f[ i + 1 ] * m[ i + 1 ];
				final double im = f[ i + 1 ] * m[ i ] - f[ i ] * m[ i + 1 ];
				f[ i ] = re;
				f[ i + 1 ] = im;

				final double magnitude = Math.hypot( re, im );
				if ( magnitude > NEGLIGIBLE_MAGNITUDE )
				{
					m[ i ] = re / magnitude;
					m[ i + 1 ] = im / magnitude;
				}
				else
				{
					m[ i ] = re;
					m[ i + 1 ] = im;
				}
			}
		}
	}

	/**
	 * @return (row, col) of the element with the largest magnitude, the first one in raster order on ties
	 */
	static int[] findPeak( final double[][] surface )
	{
		final int[] peak = new int[ 2 ];
		double maxMagnitude = Double.NEGATIVE_INFINITY;
		for ( int row = 0; row < surface.length; ++row )
		{
			for ( int i = 0; i < surface[ row ].length; i += 2 )
			{
				final double magnitude = surface[ row ][ i ] * surface[ row ][ i ] + surface[ row ][ i + 1 ] * surface[ row ][ i + 1 ];
				if ( magnitude > maxMagnitude )
				{
					maxMagnitude = magnitude;
					peak[ 0 ] = row;
					peak[ 1 ] = i / 2;
				}
			}
		}
		return peak;
	}

	/**
	 * Maps a peak coordinate of the circular correlation to a signed offset.
	 */
	static int foldPeak( final int position, final int size )
	{
		return position > size / 2 ? position - size : position;
	}
}
