package org.lokray.nlmc.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public class StructBaseType extends BaseType
{
	private final String structName;
	private final Map<String, BaseType> fields;

	public StructBaseType(String structName, Map<String, BaseType> fields)
	{
		this.structName = Objects.requireNonNull(structName);
		this.fields = new LinkedHashMap<>(fields);
	}

	public String getStructName()
	{
		return structName;
	}

	public Map<String, BaseType> getFields()
	{
		return Collections.unmodifiableMap(fields);
	}

	@Override
	public String getName()
	{
		return "struct " + structName;
	}

	// Fields are packed; padding is accounted for by the layout planner
	@Override
	public int sizeBytes()
	{
		return fields.values().stream().mapToInt(BaseType::sizeBytes).sum();
	}

	@Override
	public int alignment()
	{
		return fields.values().stream().mapToInt(BaseType::alignment).max().orElse(8);
	}
}
