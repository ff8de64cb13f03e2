package org.janelia.multiplex;

/**
 * How the registration of a round ended.
 */
public enum RegistrationOutcome
{
	/** The round is the anchor, its shift is zero by definition. */
	ANCHOR,

	/** A shift was estimated. */
	REGISTERED,

	/** The reference frames had no structure to correlate, the shift is zero and flagged as unreliable. */
	LOW_SIGNAL,

	/** The round could not be processed, its frames are written with a zero shift. */
	FAILED
}
