package org.janelia.multiplex;

/**
 * Border handling of {@link ShiftApplier}.
 */
public enum ShiftMode
{
	/** Circular translation: content leaving one edge re-enters at the opposite edge. */
	WRAP,

	/** Content leaving the canvas is dropped, vacated pixels are zero. */
	ZERO;

	public static ShiftMode forName( final String name )
	{
		for ( final ShiftMode mode : values() )
			if ( mode.name().equalsIgnoreCase( name ) )
				return mode;
		throw new IllegalArgumentException( "Invalid shift mode. Possible values are: 'wrap' or 'zero'" );
	}
}
