package org.janelia.multiplex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.dataaccess.PathResolver;

/**
 * Derives round and marker identity from frame file names of the form
 * {@code <anything>.<roundId>.<marker>.tif}, e.g. {@code UNMCPC.LIV.3rf77.1.DAPI.tif} is marker DAPI of round 1.
 * The frame whose marker matches the reference marker (case-insensitive) is the reference channel of its round.
 */
public class FrameNameParser implements Serializable
{
	private static final long serialVersionUID = -5839316412905147719L;

	public static final String DEFAULT_REFERENCE_MARKER = "DAPI";

	private final String referenceMarker;

	public FrameNameParser()
	{
		this( DEFAULT_REFERENCE_MARKER );
	}

	public FrameNameParser( final String referenceMarker )
	{
		if ( referenceMarker == null || referenceMarker.isEmpty() )
			throw new IllegalArgumentException( "Reference marker must not be empty" );
		this.referenceMarker = referenceMarker;
	}

	public String getReferenceMarker()
	{
		return referenceMarker;
	}

	/**
	 * @throws IllegalArgumentException
	 * 			if the file name does not contain a round id and a marker
	 */
	public FrameInfo parse( final String filePath )
	{
		final String fileName = PathResolver.getFileName( filePath );
		final String[] parts = fileName.split( "\\." );
		if ( parts.length < 4 || parts[ parts.length - 3 ].isEmpty() || parts[ parts.length - 2 ].isEmpty() )
			throw new IllegalArgumentException( "Expected a file name of the form <name>.<roundId>.<marker>.tif, got " + fileName );

		final String roundId = parts[ parts.length - 3 ];
		final String marker = parts[ parts.length - 2 ];
		return new FrameInfo( filePath, roundId, marker, marker.equalsIgnoreCase( referenceMarker ) );
	}

	/**
	 * Two-frame mode: the file names carry no round information, every frame forms a round of its own
	 * and serves as its reference. Round ids are assigned in the given order starting from 1,
	 * so the first frame becomes the anchor under the default policy.
	 */
	public static List< FrameInfo > parsePair( final List< String > filePaths )
	{
		if ( filePaths.size() != 2 )
			throw new IllegalArgumentException( "Expected two frames, found " + filePaths.size() );

		final List< FrameInfo > frames = new ArrayList<>( 2 );
		for ( int i = 0; i < filePaths.size(); ++i )
		{
			final String fileName = PathResolver.getFileName( filePaths.get( i ) );
			frames.add( new FrameInfo( filePaths.get( i ), Integer.toString( i + 1 ), fileName, true ) );
		}
		return frames;
	}
}
