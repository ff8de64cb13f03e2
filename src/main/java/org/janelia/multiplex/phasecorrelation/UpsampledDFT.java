package org.janelia.multiplex.phasecorrelation;

/**
 * Evaluates the inverse DFT of a cross-power spectrum at arbitrary (non-integer) spatial positions.
 * <p>
 * Used to refine the phase correlation peak without zero-padding the spectrum: a small neighborhood around the
 * integer peak is sampled at {@code 1/upsampleFactor} pixel spacing, which costs one pass over the spectrum per sampled row and column.
 * Spectra are stored as {@code rows x 2*cols} arrays of interleaved (re, im) values.
 */
class UpsampledDFT
{
	private UpsampledDFT() {}

	/**
	 * @return refined (dy, dx) within {@code +-0.75} pixel around the given integer peak
	 */
	static double[] refinePeak( final double[][] crossPower, final double dy, final double dx, final int upsampleFactor )
	{
		final int regionSize = ( int ) Math.ceil( upsampleFactor * 1.5 );
		final double regionCenter = Math.floor( regionSize / 2.0 );

		final double roundedDy = Math.round( dy * upsampleFactor ) / ( double ) upsampleFactor;
		final double roundedDx = Math.round( dx * upsampleFactor ) / ( double ) upsampleFactor;

		final double offsetY = regionCenter - roundedDy * upsampleFactor;
		final double offsetX = regionCenter - roundedDx * upsampleFactor;

		final double[][] region = upsampledCorrelation( crossPower, regionSize, upsampleFactor, offsetY, offsetX );
		final int[] peak = PhaseCorrelationEstimator.findPeak( region );

		return new double[] {
				roundedDy + ( peak[ 0 ] - regionCenter ) / upsampleFactor,
				roundedDx + ( peak[ 1 ] - regionCenter ) / upsampleFactor
			};
	}

	/**
	 * Samples the correlation surface of the normalized cross-power spectrum on a {@code regionSize x regionSize} grid
	 * with spacing {@code 1/upsampleFactor}, element (a, b) lying at upsampled position {@code (a - offsetY, b - offsetX)}.
	 * Bins are normalized on the fly the same way as for the integer estimate.
	 */
	static double[][] upsampledCorrelation(
			final double[][] crossPower,
			final int regionSize,
			final int upsampleFactor,
			final double offsetY,
			final double offsetX )
	{
		final int rows = crossPower.length;
		final int cols = crossPower[ 0 ].length / 2;

		final double[][] rowKernel = kernel( rows, regionSize, upsampleFactor, offsetY );
		final double[][] colKernel = kernel( cols, regionSize, upsampleFactor, offsetX );

		// sum over the column frequencies first: partial[k0][b]
		final double[][] partial = new double[ rows ][ 2 * regionSize ];
		for ( int k0 = 0; k0 < rows; ++k0 )
		{
			final double[] spectrumRow = crossPower[ k0 ];
			final double[] partialRow = partial[ k0 ];
			for ( int k1 = 0; k1 < cols; ++k1 )
			{
				double re = spectrumRow[ 2 * k1 ], im = spectrumRow[ 2 * k1 + 1 ];
				final double magnitude = Math.hypot( re, im );
				if ( magnitude > PhaseCorrelationEstimator.NEGLIGIBLE_MAGNITUDE )
				{
					re /= magnitude;
					im /= magnitude;
				}

				for ( int b = 0; b < regionSize; ++b )
				{
					final double kr = colKernel[ b ][ 2 * k1 ], ki = colKernel[ b ][ 2 * k1 + 1 ];
					partialRow[ 2 * b ] += re * kr - im * ki;
					partialRow[ 2 * b + 1 ] += re * ki + im * kr;
				}
			}
		}

		final double[][] region = new double[ regionSize ][ 2 * regionSize ];
		for ( int a = 0; a < regionSize; ++a )
		{
			final double[] regionRow = region[ a ];
			for ( int k0 = 0; k0 < rows; ++k0 )
			{
				final double kr = rowKernel[ a ][ 2 * k0 ], ki = rowKernel[ a ][ 2 * k0 + 1 ];
				final double[] partialRow = partial[ k0 ];
				for ( int b = 0; b < regionSize; ++b )
				{
					final double pr = partialRow[ 2 * b ], pi = partialRow[ 2 * b + 1 ];
					regionRow[ 2 * b ] += pr * kr - pi * ki;
					regionRow[ 2 * b + 1 ] += pr * ki + pi * kr;
				}
			}
		}
		return region;
	}

	/**
	 * Evaluates {@code sum( crossPower[k] * exp( 2*pi*i * ( k0*dy/rows + k1*dx/cols ) ) )} with signed frequencies,
	 * i.e. the unscaled inverse DFT of the raw cross-power spectrum at spatial position (dy, dx).
	 *
	 * @return (re, im)
	 */
	static double[] correlationAt( final double[][] crossPower, final double dy, final double dx )
	{
		final int rows = crossPower.length;
		final int cols = crossPower[ 0 ].length / 2;

		final double[] rowPhasors = phasors( rows, dy );
		final double[] colPhasors = phasors( cols, dx );

		double sumRe = 0, sumIm = 0;
		for ( int k0 = 0; k0 < rows; ++k0 )
		{
			final double[] spectrumRow = crossPower[ k0 ];
			double rowRe = 0, rowIm = 0;
			for ( int k1 = 0; k1 < cols; ++k1 )
			{
				final double re = spectrumRow[ 2 * k1 ], im = spectrumRow[ 2 * k1 + 1 ];
				final double pr = colPhasors[ 2 * k1 ], pi = colPhasors[ 2 * k1 + 1 ];
				rowRe += re * pr - im * pi;
				rowIm += re * pi + im * pr;
			}
			final double pr = rowPhasors[ 2 * k0 ], pi = rowPhasors[ 2 * k0 + 1 ];
			sumRe += rowRe * pr - rowIm * pi;
			sumIm += rowRe * pi + rowIm * pr;
		}
		return new double[] { sumRe, sumIm };
	}

	/**
	 * @return {@code exp( 2*pi*i * frequency(k) * position / size )} for every k as interleaved (re, im)
	 */
	private static double[] phasors( final int size, final double position )
	{
		final double[] phasors = new double[ 2 * size ];
		for ( int k = 0; k < size; ++k )
		{
			final double angle = 2 * Math.PI * signedFrequency( k, size ) * position / size;
			phasors[ 2 * k ] = Math.cos( angle );
			phasors[ 2 * k + 1 ] = Math.sin( angle );
		}
		return phasors;
	}

	/**
	 * @return {@code regionSize} rows of {@code exp( 2*pi*i * ( j - offset ) * frequency(k) / ( size * upsampleFactor ) )}
	 */
	private static double[][] kernel( final int size, final int regionSize, final int upsampleFactor, final double offset )
	{
		final double[][] kernel = new double[ regionSize ][ 2 * size ];
		for ( int j = 0; j < regionSize; ++j )
		{
			for ( int k = 0; k < size; ++k )
			{
				final double angle = 2 * Math.PI * ( j - offset ) * signedFrequency( k, size ) / ( ( double ) size * upsampleFactor );
				kernel[ j ][ 2 * k ] = Math.cos( angle );
				kernel[ j ][ 2 * k + 1 ] = Math.sin( angle );
			}
		}
		return kernel;
	}

	/**
	 * @return frequency index in {@code [-size/2, size/2)} as laid out by a DFT of the given size
	 */
	static int signedFrequency( final int k, final int size )
	{
		return k < ( size + 1 ) / 2 ? k : k - size;
	}
}
