package org.lokray.nlmc.semantic.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public abstract class BaseSymbol implements Symbol
{
	private final String name;
	private final String dataType;
	private final SourceLocation definitionLocation;
	private final List<SourceLocation> usageLocations = new ArrayList<>();

	protected BaseSymbol(String name, String dataType, SourceLocation definitionLocation)
	{
		this.name = Objects.requireNonNull(name);
		this.dataType = Objects.requireNonNull(dataType);
		this.definitionLocation = definitionLocation;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public String getDataType()
	{
		return dataType;
	}

	@Override
	public boolean isDefined()
	{
		return definitionLocation != null;
	}

	@Override
	public boolean isUsed()
	{
		return !usageLocations.isEmpty();
	}

	@Override
	public Optional<SourceLocation> getDefinitionLocation()
	{
		return Optional.ofNullable(definitionLocation);
	}

	@Override
	public List<SourceLocation> getUsageLocations()
	{
		return Collections.unmodifiableList(usageLocations);
	}

	@Override
	public void markUsed(SourceLocation location)
	{
		usageLocations.add(location);
	}

	@Override
	public String toString()
	{
		return getKind() + " " + name + ": " + dataType;
	}
}
