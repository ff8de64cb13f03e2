package org.janelia.multiplex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Frames acquired in one imaging round: exactly one reference frame and any number of marker frames.
 */
public class Round implements Serializable
{
	private static final long serialVersionUID = 1706338260424411306L;

	private final String roundId;
	private final FrameInfo reference;
	private final ArrayList< FrameInfo > markers;

	public Round( final String roundId, final FrameInfo reference, final List< FrameInfo > markers )
	{
		this.roundId = roundId;
		this.reference = reference;
		this.markers = new ArrayList<>( markers );
	}

	public String getRoundId() { return roundId; }
	public FrameInfo getReference() { return reference; }
	public List< FrameInfo > getMarkers() { return Collections.unmodifiableList( markers ); }

	/**
	 * @return the reference frame followed by the marker frames
	 */
	public List< FrameInfo > getFrames()
	{
		final List< FrameInfo > frames = new ArrayList<>( markers.size() + 1 );
		frames.add( reference );
		frames.addAll( markers );
		return frames;
	}

	@Override
	public String toString()
	{
		return "round " + roundId + " (" + ( markers.size() + 1 ) + " frames)";
	}
}
