package org.janelia.multiplex;

import java.io.IOException;
import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.dataaccess.FrameStore;
import org.janelia.multiplex.phasecorrelation.LowSignalException;
import org.janelia.multiplex.phasecorrelation.PhaseCorrelationEstimator;
import org.janelia.util.Conversions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ij.ImagePlus;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.FloatType;

/**
 * Registers every round of a {@link RegistrationSet} against its anchor round.
 * <p>
 * The reference frame of the anchor round is prepared once on the driver (reduced to a single channel, padded
 * to the canonical canvas and decimated) and broadcast to the executors. Every other round is registered
 * independently in a separate task: its reference frame is prepared the same way and compared to the anchor
 * by phase correlation. A round that fails never affects the other rounds.
 * <p>
 * Round states only move from {@link RoundState#UNPROCESSED} to {@link RoundState#REGISTERED}, and every round
 * receives exactly one result.
 */
public class RoundRegistrationOrchestrator implements Serializable
{
	private static final long serialVersionUID = -2903517484361085627L;

	private static final Logger LOG = LoggerFactory.getLogger( RoundRegistrationOrchestrator.class );

	/**
	 * Decimated single-channel reference frame in a form that can be broadcast.
	 */
	static class ReferenceSample implements Serializable
	{
		private static final long serialVersionUID = 8811307540468512019L;

		final float[] pixels;
		final long width, height;

		ReferenceSample( final float[] pixels, final long width, final long height )
		{
			this.pixels = pixels;
			this.width = width;
			this.height = height;
		}

		RandomAccessibleInterval< FloatType > wrap()
		{
			return ArrayImgs.floats( pixels, width, height );
		}
	}

	private final transient JavaSparkContext sparkContext;
	private final FrameStore frameStore;
	private final RegistrationSet registrationSet;
	private final CanvasSize canvas;
	private final DownsampleScheduler downsampleScheduler;
	private final PhaseCorrelationEstimator estimator;

	private final transient TreeMap< String, RoundState > states;
	private final transient TreeMap< String, RoundRegistrationResult > results;

	public RoundRegistrationOrchestrator(
			final JavaSparkContext sparkContext,
			final FrameStore frameStore,
			final RegistrationSet registrationSet,
			final CanvasSize canvas,
			final DownsampleScheduler downsampleScheduler )
	{
		this.sparkContext = sparkContext;
		this.frameStore = frameStore;
		this.registrationSet = registrationSet;
		this.canvas = canvas;
		this.downsampleScheduler = downsampleScheduler;
		this.estimator = new PhaseCorrelationEstimator();

		states = new TreeMap<>( RoundIdComparator.INSTANCE );
		results = new TreeMap<>( RoundIdComparator.INSTANCE );
		for ( final Round round : registrationSet.getRounds() )
			states.put( round.getRoundId(), RoundState.UNPROCESSED );

		states.put( registrationSet.getAnchorRoundId(), RoundState.ANCHORED );
		results.put( registrationSet.getAnchorRoundId(), RoundRegistrationResult.anchor( registrationSet.getAnchorRoundId() ) );
	}

	/**
	 * Estimates the shift of every non-anchor round.
	 *
	 * @return results of all rounds including the anchor, sorted by round id
	 * @throws PipelineExecutionException
	 * 			if the anchor reference frame cannot be read, or a frame does not fit the canvas
	 */
	public Map< String, RoundRegistrationResult > run() throws PipelineExecutionException
	{
		final int factor = downsampleScheduler.getFactor( canvas.getMaxDimension() );
		LOG.info( "Anchor round: {}, canvas: {}, downsampling factor: {}", registrationSet.getAnchorRoundId(), canvas, factor );

		final Round anchorRound = registrationSet.getAnchorRound();
		final ReferenceSample anchorSample;
		try
		{
			anchorSample = sampleReference( frameStore, anchorRound.getReference(), canvas, factor );
		}
		catch ( final IOException e )
		{
			throw new PipelineExecutionException( "Cannot read the anchor reference frame " + anchorRound.getReference().getFilePath(), e );
		}
		LOG.info( "Fixed reference frame: {} of size ({}, {})", anchorRound.getReference().getFilePath(), anchorSample.height, anchorSample.width );

		final List< Round > movingRounds = registrationSet.getMovingRounds();
		final Broadcast< ReferenceSample > broadcastAnchorSample = sparkContext.broadcast( anchorSample );

		final FrameStore frameStore = this.frameStore;
		final CanvasSize canvas = this.canvas;
		final PhaseCorrelationEstimator estimator = this.estimator;

		final List< RoundRegistrationResult > roundResults = sparkContext
				.parallelize( movingRounds, Math.max( movingRounds.size(), 1 ) )
				.map( round -> registerRound( frameStore, estimator, canvas, factor, broadcastAnchorSample.value(), round ) )
				.collect();

		broadcastAnchorSample.destroy();

		for ( final RoundRegistrationResult result : roundResults )
			record( result );

		checkAllRegistered();

		for ( final RoundRegistrationResult result : roundResults )
			if ( result.isFatal() )
				throw new ShapeMismatchException( result.getMessage() );

		return getResults();
	}

	/**
	 * Registers one round. Never throws, failures are reported in the result.
	 */
	static RoundRegistrationResult registerRound(
			final FrameStore frameStore,
			final PhaseCorrelationEstimator estimator,
			final CanvasSize canvas,
			final int factor,
			final ReferenceSample anchorSample,
			final Round round )
	{
		try
		{
			final Shift decimatedShift = estimate( estimator, anchorSample.wrap(), frameStore, round.getReference(), canvas, factor );
			final Shift shift = DownsampleScheduler.toFullResolution( decimatedShift, factor );

			LOG.info( "Round {}: shift={}, error={}, phase={}",
					round.getRoundId(), shift, String.format( "%.2f", shift.getError() ), String.format( "%.4E", shift.getPhase() ) );
			return RoundRegistrationResult.registered( round.getRoundId(), shift );
		}
		catch ( final LowSignalException e )
		{
			LOG.warn( "Round {}: {}, keeping it in place", round.getRoundId(), e.getMessage() );
			return RoundRegistrationResult.lowSignal( round.getRoundId(), e.getMessage() );
		}
		catch ( final Exception e )
		{
			LOG.error( "Round " + round.getRoundId() + " failed, keeping it in place", e );
			return RoundRegistrationResult.failed( round.getRoundId(), e );
		}
	}

	/**
	 * Loads the reference frame, reduces it to a single channel, pads it to the canvas and decimates it.
	 */
	static < T extends NativeType< T > & RealType< T > > RandomAccessibleInterval< T > prepareReference(
			final FrameStore frameStore,
			final FrameInfo frame,
			final CanvasSize canvas,
			final int factor ) throws IOException, ShapeMismatchException
	{
		final ImagePlus imp = frameStore.loadImage( frame.getFilePath() );
		final RandomAccessibleInterval< T > singleChannel = GrayscaleReducer.toSingleChannel( imp );
		final RandomAccessibleInterval< T > padded = CanvasNormalizer.pad( singleChannel, canvas );
		return DownsampleScheduler.decimate( padded, factor );
	}

	static < T extends NativeType< T > & RealType< T > > ReferenceSample sampleReference(
			final FrameStore frameStore,
			final FrameInfo frame,
			final CanvasSize canvas,
			final int factor ) throws IOException, ShapeMismatchException
	{
		final RandomAccessibleInterval< T > reference = prepareReference( frameStore, frame, canvas, factor );
		return new ReferenceSample( Conversions.toFloatArray( reference ), reference.dimension( 0 ), reference.dimension( 1 ) );
	}

	private static < T extends NativeType< T > & RealType< T > > Shift estimate(
			final PhaseCorrelationEstimator estimator,
			final RandomAccessibleInterval< FloatType > fixed,
			final FrameStore frameStore,
			final FrameInfo movingFrame,
			final CanvasSize canvas,
			final int factor ) throws IOException, ShapeMismatchException, LowSignalException
	{
		final RandomAccessibleInterval< T > moving = prepareReference( frameStore, movingFrame, canvas, factor );
		return estimator.estimate( fixed, moving, factor );
	}

	/**
	 * Stores the result of a round and moves the round to {@link RoundState#REGISTERED}.
	 *
	 * @throws IllegalStateException
	 * 			if the round is unknown or already has a result
	 */
	void record( final RoundRegistrationResult result )
	{
		final String roundId = result.getRoundId();
		final RoundState state = states.get( roundId );
		if ( state == null )
			throw new IllegalStateException( "Unknown round " + roundId );
		if ( state != RoundState.UNPROCESSED || results.containsKey( roundId ) )
			throw new IllegalStateException( "Round " + roundId + " is already " + state + ", cannot record another result" );

		states.put( roundId, RoundState.REGISTERED );
		results.put( roundId, result );
	}

	private void checkAllRegistered()
	{
		for ( final Entry< String, RoundState > entry : states.entrySet() )
			if ( entry.getValue() == RoundState.UNPROCESSED )
				throw new IllegalStateException( "Round " + entry.getKey() + " has not been processed" );
	}

	public RoundState getState( final String roundId )
	{
		return states.get( roundId );
	}

	public Map< String, RoundRegistrationResult > getResults()
	{
		return Collections.unmodifiableMap( new TreeMap<>( results ) );
	}
}
