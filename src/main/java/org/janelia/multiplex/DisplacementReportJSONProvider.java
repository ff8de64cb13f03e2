package org.janelia.multiplex;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Arrays;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Stores the displacement report on a disk in JSON format and loads it back.
 */
public class DisplacementReportJSONProvider
{
	public static List< DisplacementEntry > loadReport( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final DisplacementEntry[] entries = createGson().fromJson( closeableReader, DisplacementEntry[].class );
			return entries != null ? Arrays.asList( entries ) : null;
		}
	}

	public static void saveReport( final List< DisplacementEntry > entries, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( entries.toArray( new DisplacementEntry[ 0 ] ) ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder().setPrettyPrinting().create();
	}
}
