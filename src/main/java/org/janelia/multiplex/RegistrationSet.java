package org.janelia.multiplex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

/**
 * All rounds of a registration run with exactly one designated anchor round.
 */
public class RegistrationSet implements Serializable
{
	private static final long serialVersionUID = -2338917664254163713L;

	private final TreeMap< String, Round > rounds;
	private final String anchorRoundId;

	private RegistrationSet( final TreeMap< String, Round > rounds, final String anchorRoundId )
	{
		this.rounds = rounds;
		this.anchorRoundId = anchorRoundId;
	}

	/**
	 * Groups frames into rounds and designates the anchor round.
	 *
	 * @throws EmptyInputException
	 * 			if there are no frames, fewer than two reference frames,
	 * 			or the reference frames do not match the rounds one to one
	 */
	public static RegistrationSet create( final Collection< FrameInfo > frames, final AnchorSelectionPolicy anchorPolicy ) throws EmptyInputException
	{
		if ( frames.isEmpty() )
			throw new EmptyInputException( "No frames to register" );

		final Map< String, List< FrameInfo > > references = new TreeMap<>( RoundIdComparator.INSTANCE );
		final Map< String, List< FrameInfo > > markers = new TreeMap<>( RoundIdComparator.INSTANCE );
		int referenceCount = 0;
		for ( final FrameInfo frame : frames )
		{
			references.computeIfAbsent( frame.getRoundId(), k -> new ArrayList<>() );
			markers.computeIfAbsent( frame.getRoundId(), k -> new ArrayList<>() );
			if ( frame.isReference() )
			{
				references.get( frame.getRoundId() ).add( frame );
				++referenceCount;
			}
			else
			{
				markers.get( frame.getRoundId() ).add( frame );
			}
		}

		if ( referenceCount < 2 )
			throw new EmptyInputException( "At least two reference frames are needed for registration, found " + referenceCount );

		if ( referenceCount != references.size() )
			throw new EmptyInputException( "The number of reference frames (" + referenceCount + ") does not match the number of imaging rounds (" + references.size() + ")" );

		final TreeMap< String, Round > rounds = new TreeMap<>( RoundIdComparator.INSTANCE );
		for ( final Entry< String, List< FrameInfo > > entry : references.entrySet() )
		{
			if ( entry.getValue().size() != 1 )
				throw new EmptyInputException( "Round " + entry.getKey() + " has " + entry.getValue().size() + " reference frames, expected exactly one" );

			// keep marker order independent of the listing order
			final List< FrameInfo > roundMarkers = markers.get( entry.getKey() );
			roundMarkers.sort( ( a, b ) -> a.getMarker().compareTo( b.getMarker() ) );
			rounds.put( entry.getKey(), new Round( entry.getKey(), entry.getValue().get( 0 ), roundMarkers ) );
		}

		final String anchorRoundId = anchorPolicy.selectAnchor( new ArrayList<>( rounds.keySet() ) );
		return new RegistrationSet( rounds, anchorRoundId );
	}

	public String getAnchorRoundId() { return anchorRoundId; }

	public Round getAnchorRound()
	{
		return rounds.get( anchorRoundId );
	}

	public Round getRound( final String roundId )
	{
		return rounds.get( roundId );
	}

	/**
	 * @return all rounds sorted by round id
	 */
	public List< Round > getRounds()
	{
		return Collections.unmodifiableList( new ArrayList<>( rounds.values() ) );
	}

	/**
	 * @return all rounds except the anchor, sorted by round id
	 */
	public List< Round > getMovingRounds()
	{
		final List< Round > moving = new ArrayList<>();
		for ( final Round round : rounds.values() )
			if ( !round.getRoundId().equals( anchorRoundId ) )
				moving.add( round );
		return moving;
	}

	public List< FrameInfo > getFrames()
	{
		final List< FrameInfo > frames = new ArrayList<>();
		for ( final Round round : rounds.values() )
			frames.addAll( round.getFrames() );
		return frames;
	}

	public int size()
	{
		return rounds.size();
	}
}
