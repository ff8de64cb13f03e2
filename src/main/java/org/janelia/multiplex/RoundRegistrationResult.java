package org.janelia.multiplex;

import java.io.Serializable;

/**
 * Outcome of registering one round against the anchor round.
 * Immutable, a failure discovered later produces a new instance via {@link #markFailed(String)}.
 */
public class RoundRegistrationResult implements Serializable
{
	private static final long serialVersionUID = 7786243092107551940L;

	/** Error reported for rounds whose reference frames could not be correlated. */
	public static final double LOW_SIGNAL_ERROR = 1.0;

	private final String roundId;
	private final RoundState state;
	private final RegistrationOutcome outcome;
	private final Shift shift;
	private final String message;
	private final boolean fatal;

	private RoundRegistrationResult(
			final String roundId,
			final RoundState state,
			final RegistrationOutcome outcome,
			final Shift shift,
			final String message,
			final boolean fatal )
	{
		this.roundId = roundId;
		this.state = state;
		this.outcome = outcome;
		this.shift = shift;
		this.message = message;
		this.fatal = fatal;
	}

	public static RoundRegistrationResult anchor( final String roundId )
	{
		return new RoundRegistrationResult( roundId, RoundState.ANCHORED, RegistrationOutcome.ANCHOR, Shift.ZERO, null, false );
	}

	public static RoundRegistrationResult registered( final String roundId, final Shift shift )
	{
		return new RoundRegistrationResult( roundId, RoundState.REGISTERED, RegistrationOutcome.REGISTERED, shift, null, false );
	}

	public static RoundRegistrationResult lowSignal( final String roundId, final String message )
	{
		return new RoundRegistrationResult( roundId, RoundState.REGISTERED, RegistrationOutcome.LOW_SIGNAL, new Shift( 0, 0, LOW_SIGNAL_ERROR, 0 ), message, false );
	}

	/**
	 * @param e
	 * 			the cause; a {@link ShapeMismatchException} makes the failure fatal for the whole run
	 */
	public static RoundRegistrationResult failed( final String roundId, final Exception e )
	{
		final String message = e.getClass().getSimpleName() + ": " + e.getMessage();
		return new RoundRegistrationResult( roundId, RoundState.REGISTERED, RegistrationOutcome.FAILED, Shift.ZERO, message, e instanceof ShapeMismatchException );
	}

	/**
	 * @return a copy of this result with outcome {@link RegistrationOutcome#FAILED}, keeping the shift
	 */
	public RoundRegistrationResult markFailed( final String failureMessage )
	{
		return new RoundRegistrationResult( roundId, state, RegistrationOutcome.FAILED, shift, failureMessage, fatal );
	}

	public String getRoundId() { return roundId; }
	public RoundState getState() { return state; }
	public RegistrationOutcome getOutcome() { return outcome; }
	public Shift getShift() { return shift; }
	public String getMessage() { return message; }
	public boolean isFatal() { return fatal; }

	@Override
	public String toString()
	{
		return "round " + roundId + ": " + outcome + " " + shift + ( message != null ? " (" + message + ")" : "" );
	}
}
