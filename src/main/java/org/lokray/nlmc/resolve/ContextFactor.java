package org.lokray.nlmc.resolve;

import java.util.Objects;

public class ContextFactor
{
	private final ContextFactorType type;
	private final String description;
	private final double weight;

	public ContextFactor(ContextFactorType type, String description, double weight)
	{
		this.type = Objects.requireNonNull(type);
		this.description = Objects.requireNonNull(description);
		this.weight = weight;
	}

	public ContextFactorType getType()
	{
		return type;
	}

	public String getDescription()
	{
		return description;
	}

	public double getWeight()
	{
		return weight;
	}

	@Override
	public String toString()
	{
		return type.getWireName() + "(" + weight + "): " + description;
	}
}
