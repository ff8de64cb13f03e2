package org.janelia.multiplex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that the frames which have to be resident at the same time, the fixed and one moving frame,
 * fit into a fraction of the available memory. Runs before any pixel data is read.
 */
public class MemoryBudget
{
	private static final Logger LOG = LoggerFactory.getLogger( MemoryBudget.class );

	public static final double DEFAULT_FRACTION = 0.8;

	private final double fraction;
	private final LongSupplier availableMemory;

	public MemoryBudget()
	{
		this( DEFAULT_FRACTION );
	}

	public MemoryBudget( final double fraction )
	{
		this( fraction, MemoryBudget::getHeapHeadroom );
	}

	/**
	 * @param availableMemory
	 * 			supplier of the number of bytes that can still be allocated
	 */
	public MemoryBudget( final double fraction, final LongSupplier availableMemory )
	{
		if ( fraction <= 0 || fraction > 1 )
			throw new IllegalArgumentException( "Memory fraction must be in (0, 1]: " + fraction );
		this.fraction = fraction;
		this.availableMemory = availableMemory;
	}

	public double getFraction()
	{
		return fraction;
	}

	/**
	 * @throws OutOfMemoryBudgetException
	 * 			if the two largest frames by file size exceed the budget
	 */
	public void check( final Collection< FrameInfo > frames ) throws OutOfMemoryBudgetException
	{
		final List< Long > fileSizes = new ArrayList<>();
		for ( final FrameInfo frame : frames )
			fileSizes.add( frame.getFileSize() );
		fileSizes.sort( Collections.reverseOrder() );

		long requiredBytes = 0;
		for ( int i = 0; i < Math.min( 2, fileSizes.size() ); ++i )
			requiredBytes += fileSizes.get( i );

		final long budgetBytes = ( long ) ( availableMemory.getAsLong() * fraction );
		if ( requiredBytes > budgetBytes )
			throw new OutOfMemoryBudgetException( requiredBytes, budgetBytes );

		LOG.info( "Memory check passed: two largest frames take {} MB, budget is {} MB", requiredBytes >> 20, budgetBytes >> 20 );
	}

	/**
	 * @return the number of bytes the JVM heap can still grow by
	 */
	public static long getHeapHeadroom()
	{
		final Runtime runtime = Runtime.getRuntime();
		return runtime.maxMemory() - runtime.totalMemory() + runtime.freeMemory();
	}
}
