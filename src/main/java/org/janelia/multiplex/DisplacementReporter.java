package org.janelia.multiplex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks the registered rounds by their registration error so that the least reliable ones come first.
 * Failed rounds have no error and are listed before everything else. The anchor round is not reported.
 */
public class DisplacementReporter
{
	private static final Logger LOG = LoggerFactory.getLogger( DisplacementReporter.class );

	public static final String REPORT_FILE_NAME = "displacements.json";

	private static final Comparator< DisplacementEntry > RANKING =
			Comparator
				.comparing( ( final DisplacementEntry entry ) -> entry.getOutcome() != RegistrationOutcome.FAILED )
				.thenComparing( entry -> entry.getError() != null ? entry.getError() : 0.0, Comparator.reverseOrder() )
				.thenComparing( DisplacementEntry::getRoundId, RoundIdComparator.INSTANCE );

	public static List< DisplacementEntry > rank( final Collection< RoundRegistrationResult > results )
	{
		final List< DisplacementEntry > entries = new ArrayList<>();
		for ( final RoundRegistrationResult result : results )
			if ( result.getState() != RoundState.ANCHORED )
				entries.add( new DisplacementEntry( result ) );

		entries.sort( RANKING );
		return entries;
	}

	public static void log( final List< DisplacementEntry > entries )
	{
		LOG.info( "Errors:" );
		for ( final DisplacementEntry entry : entries )
		{
			if ( entry.getOutcome() == RegistrationOutcome.REGISTERED )
				LOG.info( "  {}", entry );
			else
				LOG.warn( "  {}", entry );
		}
	}
}
