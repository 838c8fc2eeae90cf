package org.lokray.nlmc.types;

import java.util.List;
import java.util.Objects;

public class EnumBaseType extends BaseType
{
	private final String enumName;
	private final List<String> variants;
	private final BaseType underlyingType;

	public EnumBaseType(String enumName, List<String> variants, BaseType underlyingType)
	{
		this.enumName = Objects.requireNonNull(enumName);
		this.variants = List.copyOf(variants);
		this.underlyingType = Objects.requireNonNull(underlyingType);
	}

	public List<String> getVariants()
	{
		return variants;
	}

	public BaseType getUnderlyingType()
	{
		return underlyingType;
	}

	@Override
	public String getName()
	{
		return "enum " + enumName;
	}

	@Override
	public int sizeBytes()
	{
		return underlyingType.sizeBytes();
	}

	@Override
	public int alignment()
	{
		return underlyingType.alignment();
	}
}
