package org.janelia.multiplex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

public class RegistrationSetTest
{
	private final FrameNameParser parser = new FrameNameParser();

	private List< FrameInfo > frames( final String... fileNames )
	{
		final List< FrameInfo > frames = new ArrayList<>();
		for ( final String fileName : fileNames )
			frames.add( parser.parse( "/data/" + fileName ) );
		return frames;
	}

	@Test
	public void testGrouping() throws EmptyInputException
	{
		final RegistrationSet set = RegistrationSet.create( frames(
				"S.10.DAPI.tif", "S.10.CD8.tif",
				"S.2.DAPI.tif", "S.2.CD3.tif", "S.2.CD20.tif",
				"S.1.dapi.tif" ), AnchorSelectionPolicy.lowest() );

		Assert.assertEquals( 3, set.size() );
		Assert.assertEquals( "1", set.getAnchorRoundId() );
		Assert.assertEquals( Arrays.asList( "2", "10" ), roundIds( set.getMovingRounds() ) );

		final Round round = set.getRound( "2" );
		Assert.assertEquals( "DAPI", round.getReference().getMarker() );
		Assert.assertEquals( 2, round.getMarkers().size() );
		Assert.assertEquals( "CD20", round.getMarkers().get( 0 ).getMarker() );
		Assert.assertEquals( round.getReference(), round.getFrames().get( 0 ) );
		Assert.assertEquals( 6, set.getFrames().size() );
	}

	@Test
	public void testAnchorIndependentOfListingOrder() throws EmptyInputException
	{
		final List< FrameInfo > frames = frames( "S.3.DAPI.tif", "S.1.DAPI.tif", "S.2.DAPI.tif" );
		final String anchor = RegistrationSet.create( frames, AnchorSelectionPolicy.lowest() ).getAnchorRoundId();
		for ( int i = 0; i < 5; ++i )
		{
			Collections.rotate( frames, 1 );
			Assert.assertEquals( anchor, RegistrationSet.create( frames, AnchorSelectionPolicy.lowest() ).getAnchorRoundId() );
		}
	}

	@Test
	public void testAnchorPolicies() throws EmptyInputException
	{
		final List< FrameInfo > frames = frames( "S.9.DAPI.tif", "S.10.DAPI.tif", "S.2.DAPI.tif" );
		Assert.assertEquals( "2", RegistrationSet.create( frames, AnchorSelectionPolicy.lowest() ).getAnchorRoundId() );
		Assert.assertEquals( "10", RegistrationSet.create( frames, AnchorSelectionPolicy.highest() ).getAnchorRoundId() );
		Assert.assertEquals( "9", RegistrationSet.create( frames, AnchorSelectionPolicy.fixed( "9" ) ).getAnchorRoundId() );
		Assert.assertEquals( "10", RegistrationSet.create( frames, AnchorSelectionPolicy.forName( "HIGHEST" ) ).getAnchorRoundId() );
	}

	@Test( expected = EmptyInputException.class )
	public void testMissingFixedAnchor() throws EmptyInputException
	{
		RegistrationSet.create( frames( "S.1.DAPI.tif", "S.2.DAPI.tif" ), AnchorSelectionPolicy.fixed( "7" ) );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidPolicyName()
	{
		AnchorSelectionPolicy.forName( "random" );
	}

	@Test( expected = EmptyInputException.class )
	public void testNoFrames() throws EmptyInputException
	{
		RegistrationSet.create( Collections.emptyList(), AnchorSelectionPolicy.lowest() );
	}

	@Test( expected = EmptyInputException.class )
	public void testSingleReference() throws EmptyInputException
	{
		RegistrationSet.create( frames( "S.1.DAPI.tif", "S.1.CD3.tif", "S.2.CD3.tif" ), AnchorSelectionPolicy.lowest() );
	}

	@Test( expected = EmptyInputException.class )
	public void testRoundWithoutReference() throws EmptyInputException
	{
		RegistrationSet.create( frames( "S.1.DAPI.tif", "S.2.DAPI.tif", "S.3.CD3.tif" ), AnchorSelectionPolicy.lowest() );
	}

	@Test( expected = EmptyInputException.class )
	public void testRoundWithTwoReferences() throws EmptyInputException
	{
		RegistrationSet.create( frames( "S.1.DAPI.tif", "T.1.DAPI.tif", "S.2.DAPI.tif", "S.3.DAPI.tif" ), AnchorSelectionPolicy.lowest() );
	}

	@Test
	public void testRoundIdOrdering()
	{
		final List< String > ids = new ArrayList<>( Arrays.asList( "b", "10", "a", "2", "1" ) );
		ids.sort( RoundIdComparator.INSTANCE );
		Assert.assertEquals( Arrays.asList( "1", "2", "10", "a", "b" ), ids );
	}

	private static List< String > roundIds( final List< Round > rounds )
	{
		final List< String > ids = new ArrayList<>();
		for ( final Round round : rounds )
			ids.add( round.getRoundId() );
		return ids;
	}
}
