package org.janelia.multiplex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.janelia.dataaccess.FrameStore;
import org.janelia.dataaccess.fs.FSFrameStore;

/**
 * Represents input parameters of a registration run and the state passed between pipeline steps.
 */
public class RegistrationJob implements Serializable
{
	public enum PipelineStep
	{
		Metadata, // mandatory step
		Registration,
		Export,
		Report
	}

	private static final long serialVersionUID = -6164285410936405518L;

	private final FrameStore frameStore;
	private final EnumSet< PipelineStep > pipeline;
	private final RegistrationArguments args;

	private RegistrationSet registrationSet;
	private CanvasSize canvas;
	private TreeMap< String, RoundRegistrationResult > results;
	private List< DisplacementEntry > report;

	public RegistrationJob( final RegistrationArguments args )
	{
		this( args, new FSFrameStore() );
	}

	public RegistrationJob( final RegistrationArguments args, final FrameStore frameStore )
	{
		this.args = args;
		this.frameStore = frameStore;
		pipeline = EnumSet.allOf( PipelineStep.class );
	}

	public EnumSet< PipelineStep > getPipeline() { return pipeline; }

	public FrameStore getFrameStore() { return frameStore; }

	public RegistrationArguments getArgs() { return args; }

	public RegistrationSet getRegistrationSet() { return registrationSet; }
	public void setRegistrationSet( final RegistrationSet registrationSet ) { this.registrationSet = registrationSet; }

	public CanvasSize getCanvas() { return canvas; }
	public void setCanvas( final CanvasSize canvas ) { this.canvas = canvas; }

	public Map< String, RoundRegistrationResult > getResults()
	{
		return results != null ? Collections.unmodifiableMap( results ) : null;
	}

	public void setResults( final Map< String, RoundRegistrationResult > results )
	{
		this.results = new TreeMap<>( RoundIdComparator.INSTANCE );
		this.results.putAll( results );
	}

	/**
	 * Replaces the result of a round by a failed one with the same shift.
	 */
	public void markFailed( final String roundId, final String message )
	{
		final RoundRegistrationResult result = results.get( roundId );
		if ( result == null )
			throw new IllegalStateException( "Round " + roundId + " has no registration result" );
		results.put( roundId, result.markFailed( message ) );
	}

	public List< DisplacementEntry > getReport() { return report; }
	public void setReport( final List< DisplacementEntry > report ) { this.report = new ArrayList<>( report ); }
}
