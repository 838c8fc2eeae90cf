package org.lokray.nlmc.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class TypeModel
{
	private final Map<String, InferredType> types;
	private final List<TypeConstraint> typeConstraints;
	private final MemoryLayoutPlan memoryLayout;
	private final List<TypeConversion> typeConversions;
	private final List<String> oracleInsights;

	public TypeModel(Map<String, InferredType> types, List<TypeConstraint> typeConstraints, MemoryLayoutPlan memoryLayout,
					 List<TypeConversion> typeConversions, List<String> oracleInsights)
	{
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		this.typeConstraints = List.copyOf(typeConstraints);
		this.memoryLayout = memoryLayout;
		this.typeConversions = List.copyOf(typeConversions);
		this.oracleInsights = List.copyOf(oracleInsights);
	}

	public static TypeModel empty()
	{
		return new TypeModel(Map.of(), List.of(), MemoryLayoutPlan.EMPTY, List.of(), List.of());
	}

	/**
	 * Inferred types keyed by entity name (variable or operation result).
	 */
	public Map<String, InferredType> getTypes()
	{
		return types;
	}

	public Optional<InferredType> getType(String entity)
	{
		return Optional.ofNullable(types.get(entity));
	}

	public List<TypeConstraint> getTypeConstraints()
	{
		return typeConstraints;
	}

	public MemoryLayoutPlan getMemoryLayout()
	{
		return memoryLayout;
	}

	public List<TypeConversion> getTypeConversions()
	{
		return typeConversions;
	}

	public Optional<TypeConversion> findConversion(String from, String to)
	{
		return typeConversions.stream().filter(c -> c.getFromType().equals(from) && c.getToType().equals(to)).findFirst();
	}

	public List<String> getOracleInsights()
	{
		return oracleInsights;
	}
}
