package org.lokray.nlmc.semantic.symbol;

/**
 * Position in the described program. Descriptions have no real lines, so the line is the
 * 1-based position of the operation (or declaration) the location belongs to.
 */
public class SourceLocation
{
	private final int line;
	private final int column;
	private final String context;

	public SourceLocation(int line, int column, String context)
	{
		this.line = line;
		this.column = column;
		this.context = context;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getContext()
	{
		return context;
	}

	@Override
	public String toString()
	{
		return line + ":" + column + " (" + context + ")";
	}
}
