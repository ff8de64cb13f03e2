package org.janelia.dataaccess;

import java.nio.file.Paths;

public class PathResolver
{
	/**
	 * Combines base and relative paths.
	 */
	public static String get( final String basePath, final String... relativePaths )
	{
		return Paths.get( basePath, relativePaths ).toString();
	}

	public static String getFileName( final String path )
	{
		return Paths.get( path ).getFileName().toString();
	}
}
