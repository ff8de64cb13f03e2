package org.janelia.multiplex;

import java.io.Serializable;

/**
 * One line of the displacement report. The error is {@code null} for rounds that failed.
 */
public class DisplacementEntry implements Serializable
{
	private static final long serialVersionUID = -1473120394726159004L;

	private String roundId;
	private RegistrationOutcome outcome;
	private Double error;
	private double dy;
	private double dx;
	private String message;

	public DisplacementEntry( final RoundRegistrationResult result )
	{
		roundId = result.getRoundId();
		outcome = result.getOutcome();
		error = outcome == RegistrationOutcome.FAILED ? null : result.getShift().getError();
		dy = result.getShift().getDy();
		dx = result.getShift().getDx();
		message = result.getMessage();
	}

	protected DisplacementEntry() { }

	public String getRoundId() { return roundId; }
	public RegistrationOutcome getOutcome() { return outcome; }
	public Double getError() { return error; }
	public double getDy() { return dy; }
	public double getDx() { return dx; }
	public String getMessage() { return message; }

	@Override
	public String toString()
	{
		switch ( outcome )
		{
		case FAILED:
			return "Round " + roundId + " failed: " + message;
		case LOW_SIGNAL:
			return "Round " + roundId + " error " + String.format( "%.2f", error ) + " (low signal, not shifted)";
		default:
			return "Round " + roundId + " error " + String.format( "%.2f", error ) + ", shift (" + dy + ", " + dx + ")";
		}
	}
}
