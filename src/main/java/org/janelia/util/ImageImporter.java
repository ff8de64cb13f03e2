package org.janelia.util;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.TiffDecoder;

/**
 * Opens TIFF frames with ImageJ.
 */
public class ImageImporter
{
	public static boolean isTiff( final String path )
	{
		final String lowerCasePath = path.toLowerCase();
		return lowerCasePath.endsWith( ".tif" ) || lowerCasePath.endsWith( ".tiff" );
	}

	public static ImagePlus openImage( final String path ) throws IOException
	{
		if ( !isTiff( path ) )
			throw new IOException( "Only TIFF images are supported: " + path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "Cannot open image " + path );

		workaroundImagePlusNSlices( imp );
		return imp;
	}

	/**
	 * Reads the TIFF header without decoding the pixel data.
	 */
	public static FileInfo[] readTiffInfo( final String path ) throws IOException
	{
		final Path filePath = Paths.get( path );
		final FileInfo[] fileInfos = new TiffDecoder(
				filePath.getParent().toString() + "/",
				filePath.getFileName().toString() )
			.getTiffInfo();

		if ( fileInfos == null || fileInfos.length == 0 )
			throw new IOException( "Not a valid TIFF file: " + path );

		return fileInfos;
	}

	/**
	 * Treats a single non-trivial third dimension as the stack dimension, so that channel stacks saved
	 * as z-stacks or time series are handled the same way.
	 */
	public static void workaroundImagePlusNSlices( final ImagePlus imp )
	{
		final int[] possible3rdDim = new int[] { imp.getNChannels(), imp.getNSlices(), imp.getNFrames() };
		Arrays.sort( possible3rdDim );
		if ( possible3rdDim[ 0 ] * possible3rdDim[ 1 ] == 1 )
			imp.setDimensions( 1, possible3rdDim[ 2 ], 1 );
	}
}
