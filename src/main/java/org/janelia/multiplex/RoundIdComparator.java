package org.janelia.multiplex;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Comparator;

/**
 * Stable ordering of round ids: numeric ids are compared by value and come first,
 * all other ids are compared lexicographically.
 */
public class RoundIdComparator implements Comparator< String >, Serializable
{
	private static final long serialVersionUID = -1927624373405624049L;

	public static final RoundIdComparator INSTANCE = new RoundIdComparator();

	@Override
	public int compare( final String a, final String b )
	{
		final BigInteger numA = parseNumber( a ), numB = parseNumber( b );
		if ( numA != null && numB != null )
		{
			final int cmp = numA.compareTo( numB );
			return cmp != 0 ? cmp : a.compareTo( b );
		}
		if ( numA != null )
			return -1;
		if ( numB != null )
			return 1;
		return a.compareTo( b );
	}

	private static BigInteger parseNumber( final String id )
	{
		if ( id.isEmpty() )
			return null;
		for ( int i = 0; i < id.length(); ++i )
			if ( !Character.isDigit( id.charAt( i ) ) )
				return null;
		return new BigInteger( id );
	}
}
