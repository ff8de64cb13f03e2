package org.janelia.multiplex;

/**
 * Registration state of a round. The anchor round is {@link #ANCHORED} from the start and never changes,
 * every other round goes from {@link #UNPROCESSED} to {@link #REGISTERED} exactly once.
 */
public enum RoundState
{
	UNPROCESSED,
	REGISTERED,
	ANCHORED
}
