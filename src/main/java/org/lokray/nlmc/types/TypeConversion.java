package org.lokray.nlmc.types;

public class TypeConversion
{
	private final String fromType;
	private final String toType;
	private final ConversionKind kind;
	private final boolean safe;
	private final ConversionCost cost;

	public TypeConversion(String fromType, String toType, ConversionKind kind, boolean safe, ConversionCost cost)
	{
		this.fromType = fromType;
		this.toType = toType;
		this.kind = kind;
		this.safe = safe;
		this.cost = cost;
	}

	public String getFromType()
	{
		return fromType;
	}

	public String getToType()
	{
		return toType;
	}

	public ConversionKind getKind()
	{
		return kind;
	}

	public boolean isSafe()
	{
		return safe;
	}

	public ConversionCost getCost()
	{
		return cost;
	}

	@Override
	public String toString()
	{
		return fromType + " -> " + toType + " " + kind + "/" + cost + (safe ? "" : " (unsafe)");
	}
}
