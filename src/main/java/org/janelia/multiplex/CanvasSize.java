package org.janelia.multiplex;

import java.io.Serializable;

import net.imglib2.FinalInterval;
import net.imglib2.Interval;

/**
 * Canonical output size shared by every frame of a run, in (height, width) order.
 */
public class CanvasSize implements Serializable
{
	private static final long serialVersionUID = -5176634329950287473L;

	private final long height;
	private final long width;

	public CanvasSize( final long height, final long width )
	{
		if ( height <= 0 || width <= 0 )
			throw new IllegalArgumentException( "canvas must not be empty: " + height + "x" + width );
		this.height = height;
		this.width = width;
	}

	public long getHeight() { return height; }
	public long getWidth() { return width; }

	public long getMaxDimension()
	{
		return Math.max( height, width );
	}

	public boolean contains( final long frameHeight, final long frameWidth )
	{
		return frameHeight <= height && frameWidth <= width;
	}

	/**
	 * @return the canvas as a zero-min interval in ImgLib2 axis order (x, y)
	 */
	public Interval toInterval()
	{
		return new FinalInterval( width, height );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof CanvasSize ) )
			return false;
		final CanvasSize other = ( CanvasSize ) obj;
		return height == other.height && width == other.width;
	}

	@Override
	public int hashCode()
	{
		return 31 * Long.hashCode( height ) + Long.hashCode( width );
	}

	@Override
	public String toString()
	{
		return "(" + height + ", " + width + ")";
	}
}
