package org.janelia.multiplex;

import java.io.Serializable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.view.Views;

/**
 * Bounds the cost of phase correlation on large frames by decimating them.
 * The factor is {@code floor(maxDimension / threshold) + 1}, so frames below the threshold are not decimated.
 */
public class DownsampleScheduler implements Serializable
{
	private static final long serialVersionUID = 5021184669735512913L;

	public static final long DEFAULT_THRESHOLD = 10000;

	private final long threshold;

	public DownsampleScheduler()
	{
		this( DEFAULT_THRESHOLD );
	}

	public DownsampleScheduler( final long threshold )
	{
		if ( threshold <= 0 )
			throw new IllegalArgumentException( "Downsample threshold must be positive: " + threshold );
		this.threshold = threshold;
	}

	public long getThreshold()
	{
		return threshold;
	}

	public int getFactor( final long maxDimension )
	{
		return ( int ) ( maxDimension / threshold ) + 1;
	}

	/**
	 * Nearest-neighbor strided subsampling starting at index 0 on every axis.
	 * Returns the input itself when the factor is 1.
	 */
	public static < T > RandomAccessibleInterval< T > decimate( final RandomAccessibleInterval< T > img, final int factor )
	{
		if ( factor < 1 )
			throw new IllegalArgumentException( "Downsample factor must be at least 1: " + factor );

		if ( factor == 1 )
			return img;

		return Views.subsample( Views.zeroMin( img ), factor );
	}

	/**
	 * Converts a shift estimated on decimated frames to full resolution.
	 */
	public static Shift toFullResolution( final Shift decimatedShift, final int factor )
	{
		return factor == 1 ? decimatedShift : decimatedShift.scale( factor );
	}
}
