package org.janelia.dataaccess.fs;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.janelia.dataaccess.FrameStore;
import org.janelia.multiplex.FrameInfo;
import org.janelia.multiplex.ImageType;
import org.janelia.util.ImageImporter;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileInfo;

/**
 * Provides filesystem-based access to TIFF frames stored on a local or network drive.
 */
public class FSFrameStore implements FrameStore
{
	private static final long serialVersionUID = 4130873346290725187L;

	@Override
	public List< String > listFrames( final String folderLink ) throws IOException
	{
		final Path folder = getPath( folderLink );
		if ( !Files.isDirectory( folder ) )
			throw new IOException( "Not a folder: " + folderLink );

		final List< String > frames = new ArrayList<>();
		try ( final Stream< Path > files = Files.list( folder ) )
		{
			files
				.filter( Files::isRegularFile )
				.filter( path -> ImageImporter.isTiff( path.getFileName().toString() ) )
				.sorted( ( a, b ) -> a.getFileName().toString().compareTo( b.getFileName().toString() ) )
				.forEach( path -> frames.add( path.toAbsolutePath().toString() ) );
		}
		return frames;
	}

	@Override
	public boolean fileExists( final String link )
	{
		return Files.exists( getPath( link ) );
	}

	@Override
	public void createFolder( final String link ) throws IOException
	{
		Files.createDirectories( getPath( link ) );
	}

	@Override
	public long getFileSize( final String link ) throws IOException
	{
		return Files.size( getPath( link ) );
	}

	@Override
	public void readMetadata( final FrameInfo frame ) throws IOException
	{
		final FileInfo[] fileInfos = ImageImporter.readTiffInfo( getCanonicalPathString( frame.getFilePath() ) );
		final FileInfo fileInfo = fileInfos[ 0 ];

		final ImageType type = getImageType( fileInfo );
		if ( type == null )
			throw new IOException( "Unsupported pixel type " + fileInfo.fileType + " of frame " + frame.getFilePath() );

		// either one IFD per plane or a single IFD describing a contiguous stack
		final int planes = fileInfos.length == 1 ? Math.max( fileInfo.nImages, 1 ) : fileInfos.length;

		frame.setType( type );
		frame.setSize( fileInfo.height, fileInfo.width );
		frame.setChannels( fileInfo.fileType == FileInfo.RGB48 ? 3 : planes );
		frame.setFileSize( getFileSize( frame.getFilePath() ) );
	}

	@Override
	public ImagePlus loadImage( final String link ) throws IOException
	{
		if ( !Files.isRegularFile( getPath( link ) ) )
			throw new NoSuchFileException( link );
		return ImageImporter.openImage( getCanonicalPathString( link ) );
	}

	@Override
	public void saveImage( final ImagePlus imp, final String link ) throws IOException
	{
		createDirs( getPath( link ).toAbsolutePath().getParent() );
		ImageImporter.workaroundImagePlusNSlices( imp );
		if ( !IJ.saveAsTiff( imp, getPath( link ).toAbsolutePath().toString() ) )
			throw new IOException( "Cannot save image " + link );
	}

	@Override
	public Reader getJsonReader( final String link ) throws IOException
	{
		return Files.newBufferedReader( getPath( link ), StandardCharsets.UTF_8 );
	}

	@Override
	public Writer getJsonWriter( final String link ) throws IOException
	{
		createDirs( getPath( link ).toAbsolutePath().getParent() );
		return Files.newBufferedWriter( getPath( link ), StandardCharsets.UTF_8 );
	}

	private static ImageType getImageType( final FileInfo fileInfo )
	{
		switch ( fileInfo.fileType )
		{
		case FileInfo.GRAY8:
		case FileInfo.COLOR8:
			return ImageType.GRAY8;
		case FileInfo.GRAY16_SIGNED:
		case FileInfo.GRAY16_UNSIGNED:
		case FileInfo.RGB48:
			return ImageType.GRAY16;
		case FileInfo.GRAY32_INT:
		case FileInfo.GRAY32_UNSIGNED:
		case FileInfo.GRAY32_FLOAT:
			return ImageType.GRAY32;
		case FileInfo.RGB:
		case FileInfo.BGR:
		case FileInfo.ARGB:
		case FileInfo.BARG:
		case FileInfo.RGB_PLANAR:
			return ImageType.RGB;
		default:
			return null;
		}
	}

	private static Path getPath( final String link )
	{
		return Paths.get( link );
	}

	private static boolean createDirs( final Path path )
	{
		return path != null && path.toFile().mkdirs();
	}

	private static String getCanonicalPathString( final String link ) throws IOException
	{
		return new File( link ).getCanonicalPath();
	}
}
