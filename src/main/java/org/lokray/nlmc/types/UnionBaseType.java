package org.lokray.nlmc.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class UnionBaseType extends BaseType
{
	private final String unionName;
	private final Map<String, BaseType> variants;

	public UnionBaseType(String unionName, Map<String, BaseType> variants)
	{
		this.unionName = Objects.requireNonNull(unionName);
		this.variants = new LinkedHashMap<>(variants);
	}

	public Map<String, BaseType> getVariants()
	{
		return Collections.unmodifiableMap(variants);
	}

	@Override
	public String getName()
	{
		return "union " + unionName;
	}

	@Override
	public int sizeBytes()
	{
		return variants.values().stream().mapToInt(BaseType::sizeBytes).max().orElse(0);
	}

	@Override
	public int alignment()
	{
		return variants.values().stream().mapToInt(BaseType::alignment).max().orElse(1);
	}
}
