package org.janelia.multiplex;

/**
 * Thrown before any pixel data is read when the frames that have to be resident at the same time
 * do not fit into the allowed fraction of the available memory.
 */
public class OutOfMemoryBudgetException extends PipelineExecutionException
{
	private static final long serialVersionUID = -1350917261564720548L;

	private final long requiredBytes;
	private final long budgetBytes;

	public OutOfMemoryBudgetException( final long requiredBytes, final long budgetBytes )
	{
		super( "Not enough memory to hold two frames: required " + requiredBytes + " bytes, budget " + budgetBytes + " bytes" );
		this.requiredBytes = requiredBytes;
		this.budgetBytes = budgetBytes;
	}

	public long getRequiredBytes() { return requiredBytes; }
	public long getBudgetBytes() { return budgetBytes; }
}
