package org.janelia.multiplex;

/**
 * Pixel type of a frame as stored on disk.
 */
public enum ImageType
{
	/** 8-bit grayscale (unsigned) */
	GRAY8,

	/** 16-bit grayscale (unsigned) */
	GRAY16,

	/** 32-bit floating-point grayscale */
	GRAY32,

	/** 8-bit per channel packed RGB */
	RGB
}
