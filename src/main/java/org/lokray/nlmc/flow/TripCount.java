package org.lokray.nlmc.flow;

import java.util.Objects;

/**
 * Estimated iteration count of a loop.
 */
public class TripCount
{
	public enum Kind
	{
		CONSTANT, VARIABLE, UNKNOWN
	}

	public static final TripCount UNKNOWN = new TripCount(Kind.UNKNOWN, 0, null);

	private final Kind kind;
	private final long count;
	private final String variable;

	private TripCount(Kind kind, long count, String variable)
	{
		this.kind = kind;
		this.count = count;
		this.variable = variable;
	}

	public static TripCount constant(long count)
	{
		return new TripCount(Kind.CONSTANT, count, null);
	}

	public static TripCount variable(String name)
	{
		return new TripCount(Kind.VARIABLE, 0, Objects.requireNonNull(name));
	}

	public Kind getKind()
	{
		return kind;
	}

	public long getCount()
	{
		return count;
	}

	public String getVariable()
	{
		return variable;
	}

	@Override
	public String toString()
	{
		switch (kind)
		{
			case CONSTANT:
				return "Constant(" + count + ")";
			case VARIABLE:
				return "Variable(" + variable + ")";
			default:
				return "Unknown";
		}
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		TripCount that = (TripCount) o;
		return kind == that.kind && count == that.count && Objects.equals(variable, that.variable);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, count, variable);
	}
}
