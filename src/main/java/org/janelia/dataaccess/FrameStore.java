package org.janelia.dataaccess;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.io.Writer;
import java.util.List;

import org.janelia.multiplex.FrameInfo;

import ij.ImagePlus;

/**
 * Provides access to the frames on the used storage system.
 * Implementations are shipped to Spark executors, so they have to be serializable.
 */
public interface FrameStore extends Serializable
{
	/**
	 * @return links to all frame images in the given folder, sorted by file name
	 */
	public List< String > listFrames( final String folderLink ) throws IOException;

	public boolean fileExists( final String link ) throws IOException;
	public void createFolder( final String link ) throws IOException;
	public long getFileSize( final String link ) throws IOException;

	/**
	 * Fills in the pixel type, the shape, the channel count and the file size of a frame
	 * by reading only the image header.
	 */
	public void readMetadata( final FrameInfo frame ) throws IOException;

	public ImagePlus loadImage( final String link ) throws IOException;
	public void saveImage( final ImagePlus imp, final String link ) throws IOException;

	public Reader getJsonReader( final String link ) throws IOException;
	public Writer getJsonWriter( final String link ) throws IOException;
}
