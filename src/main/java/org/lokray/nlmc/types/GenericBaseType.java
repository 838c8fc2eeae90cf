package org.lokray.nlmc.types;

import java.util.List;
import java.util.Objects;

public class GenericBaseType extends BaseType
{
	private final String parameterName;
	private final List<String> bounds;

	public GenericBaseType(String parameterName, List<String> bounds)
	{
		this.parameterName = Objects.requireNonNull(parameterName);
		this.bounds = List.copyOf(bounds);
	}

	public List<String> getBounds()
	{
		return bounds;
	}

	@Override
	public String getName()
	{
		return bounds.isEmpty() ? parameterName : parameterName + ": " + String.join(" + ", bounds);
	}

	// Generics are boxed until monomorphised
	@Override
	public int sizeBytes()
	{
		return 8;
	}

	@Override
	public int alignment()
	{
		return 8;
	}
}
