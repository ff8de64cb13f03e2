package org.janelia.multiplex;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.dataaccess.FrameStore;
import org.janelia.dataaccess.PathResolver;
import org.janelia.util.Conversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.exception.ImgLibException;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import scala.Tuple2;

/**
 * Writes every frame to the output folder under its original file name:
 * reduced to a single channel, padded to the canonical canvas and translated by the shift of its round.
 * Frames of the anchor round and of rounds without a usable shift are written unshifted.
 */
public class PipelineExportStepExecutor extends PipelineStepExecutor
{
	private static final long serialVersionUID = -4522846752274871429L;

	private static final Logger LOG = LoggerFactory.getLogger( PipelineExportStepExecutor.class );

	public PipelineExportStepExecutor( final RegistrationJob job, final JavaSparkContext sparkContext )
	{
		super( job, sparkContext );
	}

	@Override
	public void run() throws PipelineExecutionException
	{
		final FrameStore frameStore = job.getFrameStore();
		final String outputFolder = args.outputFolder();
		try
		{
			frameStore.createFolder( outputFolder );
		}
		catch ( final IOException e )
		{
			throw new PipelineExecutionException( "Cannot create output folder " + outputFolder, e );
		}

		final List< Tuple2< Round, Shift > > roundShifts = new ArrayList<>();
		for ( final Round round : job.getRegistrationSet().getRounds() )
			roundShifts.add( new Tuple2<>( round, job.getResults().get( round.getRoundId() ).getShift() ) );

		final CanvasSize canvas = job.getCanvas();
		final ShiftApplier shiftApplier = new ShiftApplier( args.shiftMode() );
		LOG.info( "Writing {} frames to {} ({} border handling)", job.getRegistrationSet().getFrames().size(), outputFolder, shiftApplier.getMode() );

		final List< Tuple2< String, ArrayList< String > > > failures = sparkContext
				.parallelize( roundShifts, roundShifts.size() )
				.map( roundShift -> new Tuple2<>(
						roundShift._1().getRoundId(),
						exportRound( frameStore, canvas, shiftApplier, outputFolder, roundShift._1(), roundShift._2() ) ) )
				.filter( roundFailures -> !roundFailures._2().isEmpty() )
				.collect();

		for ( final Tuple2< String, ArrayList< String > > roundFailures : failures )
		{
			LOG.error( "Round {}: {} frames could not be written", roundFailures._1(), roundFailures._2().size() );
			job.markFailed( roundFailures._1(), String.join( "; ", roundFailures._2() ) );
		}
	}

	/**
	 * Writes all frames of a round with the same shift.
	 *
	 * @return messages of the frames that could not be written
	 */
	static ArrayList< String > exportRound(
			final FrameStore frameStore,
			final CanvasSize canvas,
			final ShiftApplier shiftApplier,
			final String outputFolder,
			final Round round,
			final Shift shift )
	{
		final ArrayList< String > failures = new ArrayList<>();
		for ( final FrameInfo frame : round.getFrames() )
		{
			final String outputPath = PathResolver.get( outputFolder, PathResolver.getFileName( frame.getFilePath() ) );
			try
			{
				exportFrame( frameStore, canvas, shiftApplier, frame, shift, outputPath );
				LOG.info( "Writing: ({}, {}) shift={} {}", canvas.getHeight(), canvas.getWidth(), shift, outputPath );
			}
			catch ( final Exception e )
			{
				LOG.error( "Cannot write " + outputPath, e );
				failures.add( PathResolver.getFileName( frame.getFilePath() ) + ": " + e.getMessage() );
			}
		}
		return failures;
	}

	static < T extends NativeType< T > & RealType< T > > void exportFrame(
			final FrameStore frameStore,
			final CanvasSize canvas,
			final ShiftApplier shiftApplier,
			final FrameInfo frame,
			final Shift shift,
			final String outputPath ) throws IOException, ShapeMismatchException, ImgLibException
	{
		final ImagePlus imp = frameStore.loadImage( frame.getFilePath() );
		final RandomAccessibleInterval< T > singleChannel = GrayscaleReducer.toSingleChannel( imp );
		final RandomAccessibleInterval< T > padded = CanvasNormalizer.pad( singleChannel, canvas );
		final RandomAccessibleInterval< T > shifted = shiftApplier.apply( padded, shift );

		final ImagePlus output = Conversions.toImagePlus( shifted, PathResolver.getFileName( outputPath ) );
		output.setCalibration( imp.getCalibration() );
		frameStore.saveImage( output, outputPath );
	}
}
