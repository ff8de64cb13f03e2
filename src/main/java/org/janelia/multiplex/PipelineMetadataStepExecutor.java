package org.janelia.multiplex;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.dataaccess.FrameStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prepares the registration run without reading any pixel data:
 * 1) Lists the input frames and derives round and marker identity from their file names
 * 2) Groups the frames into rounds and selects the anchor round
 * 3) Reads the frame shapes from the image headers and computes the canonical canvas
 * 4) Checks that two frames fit into the memory budget.
 */
public class PipelineMetadataStepExecutor extends PipelineStepExecutor
{
	private static final long serialVersionUID = -4817219922945295127L;

	private static final Logger LOG = LoggerFactory.getLogger( PipelineMetadataStepExecutor.class );

	public PipelineMetadataStepExecutor( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		super( job, sparkContext );
	}

	@Override
	public void run() throws PipelineExecutionException
	{
		final FrameStore frameStore = job.getFrameStore();

		final List< String > filePaths;
		try
		{
			filePaths = frameStore.listFrames( args.inputFolder() );
		}
		catch ( final IOException e )
		{
			throw new PipelineExecutionException( "Cannot list frames in " + args.inputFolder(), e );
		}
		LOG.info( "Found {} frames in {}", filePaths.size(), args.inputFolder() );

		final List< FrameInfo > frames = parseFrames( filePaths );

		final RegistrationSet registrationSet = RegistrationSet.create( frames, args.anchorPolicy() );
		LOG.info( "Imaging rounds: {}, frames: {}", registrationSet.size(), registrationSet.getFrames().size() );
		for ( final Round round : registrationSet.getRounds() )
			LOG.info( "  {}", round );

		for ( final FrameInfo frame : registrationSet.getFrames() )
		{
			try
			{
				frameStore.readMetadata( frame );
			}
			catch ( final IOException e )
			{
				throw new PipelineExecutionException( "Cannot read metadata of frame " + frame.getFilePath(), e );
			}
			LOG.info( "({}, {}) {} x{} {}", frame.getHeight(), frame.getWidth(), frame.getType(), frame.getChannels(), frame.getFilePath() );
		}

		final CanvasSize canvas = CanvasNormalizer.getCanonicalSize( registrationSet.getFrames() );
		for ( final FrameInfo frame : registrationSet.getFrames() )
			CanvasNormalizer.checkFits( frame, canvas );

		new MemoryBudget( args.memoryFraction() ).check( registrationSet.getFrames() );

		job.setRegistrationSet( registrationSet );
		job.setCanvas( canvas );
	}

	private List< FrameInfo > parseFrames( final List< String > filePaths ) throws EmptyInputException
	{
		if ( args.pairMode() )
		{
			if ( filePaths.size() != 2 )
				throw new EmptyInputException( "Expected two (2) TIFF files in the input folder, found " + filePaths.size() );
			return FrameNameParser.parsePair( filePaths );
		}

		final FrameNameParser parser = new FrameNameParser( args.referenceMarker() );
		final List< FrameInfo > frames = new ArrayList<>();
		for ( final String filePath : filePaths )
		{
			try
			{
				frames.add( parser.parse( filePath ) );
			}
			catch ( final IllegalArgumentException e )
			{
				LOG.warn( "Skipping {}: {}", filePath, e.getMessage() );
			}
		}
		return frames;
	}
}
