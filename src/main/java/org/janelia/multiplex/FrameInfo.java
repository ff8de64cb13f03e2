package org.janelia.multiplex;

import java.io.Serializable;

/**
 * Represents frame image metadata: where the frame is stored, which round and marker it belongs to,
 * and its declared shape as found by the shape-only scan.
 */
public class FrameInfo implements Serializable
{
	private static final long serialVersionUID = -3815092418467735123L;

	private String file;
	private String roundId;
	private String marker;
	private boolean reference;

	private ImageType type;
	private long width;
	private long height;
	private int channels = 1;
	private long fileSize;

	public FrameInfo( final String file, final String roundId, final String marker, final boolean reference )
	{
		this.file = file;
		this.roundId = roundId;
		this.marker = marker;
		this.reference = reference;
	}

	FrameInfo() { }

	public String getFilePath() { return file; }

	public String getRoundId() { return roundId; }
	public String getMarker() { return marker; }
	public boolean isReference() { return reference; }

	public ImageType getType() { return type; }
	public void setType( final ImageType type ) { this.type = type; }

	public long getWidth() { return width; }
	public long getHeight() { return height; }

	public void setSize( final long height, final long width )
	{
		assert height >= 0 && width >= 0;
		this.height = height;
		this.width = width;
	}

	public int getChannels() { return channels; }
	public void setChannels( final int channels ) { this.channels = channels; }

	public boolean hasShape()
	{
		return width > 0 && height > 0;
	}

	/**
	 * @return size of the stored file in bytes
	 */
	public long getFileSize() { return fileSize; }
	public void setFileSize( final long fileSize ) { this.fileSize = fileSize; }

	@Override
	public String toString()
	{
		return "round " + roundId + " / " + marker + ( reference ? " (reference)" : "" ) + ": " + file;
	}
}
