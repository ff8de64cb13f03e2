package org.janelia.multiplex;

import java.util.List;

/**
 * Decides which round stays fixed. Receives the round ids sorted by {@link RoundIdComparator},
 * so the choice never depends on the order in which frames were listed.
 */
@FunctionalInterface
public interface AnchorSelectionPolicy
{
	public String selectAnchor( final List< String > sortedRoundIds ) throws EmptyInputException;

	public static AnchorSelectionPolicy lowest()
	{
		return sortedRoundIds -> {
			if ( sortedRoundIds.isEmpty() )
				throw new EmptyInputException( "No rounds to select an anchor from" );
			return sortedRoundIds.get( 0 );
		};
	}

	public static AnchorSelectionPolicy highest()
	{
		return sortedRoundIds -> {
			if ( sortedRoundIds.isEmpty() )
				throw new EmptyInputException( "No rounds to select an anchor from" );
			return sortedRoundIds.get( sortedRoundIds.size() - 1 );
		};
	}

	public static AnchorSelectionPolicy fixed( final String roundId )
	{
		return sortedRoundIds -> {
			if ( !sortedRoundIds.contains( roundId ) )
				throw new EmptyInputException( "Requested anchor round " + roundId + " does not exist, available rounds: " + sortedRoundIds );
			return roundId;
		};
	}

	/**
	 * @param name
	 * 			'lowest' or 'highest' (case-insensitive)
	 */
	public static AnchorSelectionPolicy forName( final String name )
	{
		if ( "lowest".equalsIgnoreCase( name ) )
			return lowest();
		else if ( "highest".equalsIgnoreCase( name ) )
			return highest();
		else
			throw new IllegalArgumentException( "Invalid anchor policy. Possible values are: 'lowest' or 'highest'" );
	}
}
