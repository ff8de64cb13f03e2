package org.janelia.multiplex;

import java.io.Serializable;
import java.nio.file.Paths;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for a registration job.
 */
public class RegistrationArguments implements Serializable
{
	private static final long serialVersionUID = 2153306415328712451L;

	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Folder with the input TIFF frames named <name>.<roundId>.<marker>.tif")
	private String inputFolder;

	@Option(name = "-o", aliases = { "--output" }, required = true,
			usage = "Folder for the registered frames and the displacement report")
	private String outputFolder;

	@Option(name = "-r", aliases = { "--referenceMarker" }, required = false,
			usage = "Marker name of the reference channel present in every round (case-insensitive)")
	private String referenceMarker = FrameNameParser.DEFAULT_REFERENCE_MARKER;

	@Option(name = "-a", aliases = { "--anchor" }, required = false,
			usage = "Id of the round that stays fixed. Overrides --anchorPolicy")
	private String anchorRoundId = null;

	@Option(name = "--anchorPolicy", required = false,
			usage = "Which round stays fixed when no anchor is given ('lowest' or 'highest' round id)")
	private String anchorPolicyStr = "lowest";

	@Option(name = "--shiftMode", required = false,
			usage = "Border handling when shifting frames ('wrap' or 'zero')")
	private String shiftModeStr = "wrap";

	@Option(name = "--memoryFraction", required = false,
			usage = "Fraction of the available memory that two frames may occupy")
	private double memoryFraction = MemoryBudget.DEFAULT_FRACTION;

	@Option(name = "--downsampleThreshold", required = false,
			usage = "Frames are decimated by floor(maxDimension / threshold) + 1 for registration")
	private long downsampleThreshold = DownsampleScheduler.DEFAULT_THRESHOLD;

	@Option(name = "--pair", required = false,
			usage = "Register exactly two frames with arbitrary names, the first one by name stays fixed")
	private boolean pairMode = false;

	private ShiftMode shiftMode = null;

	private boolean parsedSuccessfully = false;

	public RegistrationArguments( final String[] args ) throws IllegalArgumentException
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try {
			parser.parseArgument( args );
			parsedSuccessfully = true;
		} catch ( final CmdLineException e ) {
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
			return;
		}

		shiftMode = ShiftMode.forName( shiftModeStr );

		// fails early on an invalid policy name
		anchorPolicy();

		if ( memoryFraction <= 0 || memoryFraction > 1 )
			throw new IllegalArgumentException( "Memory fraction must be in (0, 1], got " + memoryFraction );

		if ( downsampleThreshold <= 0 )
			throw new IllegalArgumentException( "Downsample threshold must be positive, got " + downsampleThreshold );

		inputFolder = Paths.get( inputFolder ).toAbsolutePath().toString();
		outputFolder = Paths.get( outputFolder ).toAbsolutePath().toString();

		if ( inputFolder.equals( outputFolder ) )
			throw new IllegalArgumentException( "Output folder must be different from the input folder" );
	}

	protected RegistrationArguments() { }

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public String inputFolder() { return inputFolder; }
	public String outputFolder() { return outputFolder; }
	public String referenceMarker() { return referenceMarker; }

	public AnchorSelectionPolicy anchorPolicy()
	{
		return anchorRoundId != null ? AnchorSelectionPolicy.fixed( anchorRoundId ) : AnchorSelectionPolicy.forName( anchorPolicyStr );
	}

	public ShiftMode shiftMode() { return shiftMode; }
	public double memoryFraction() { return memoryFraction; }
	public long downsampleThreshold() { return downsampleThreshold; }
	public boolean pairMode() { return pairMode; }
}
