package org.lokray.nlmc.intent;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

public class DataStructure
{
	private final String name;
	private final DataType type;
	private final Integer size;
	private final String initialValue;
	private final StorageScope scope;

	public DataStructure(String name, DataType type, Integer size, String initialValue, StorageScope scope)
	{
		this.name = Objects.requireNonNull(name);
		this.type = Objects.requireNonNull(type);
		this.size = size;
		this.initialValue = initialValue;
		this.scope = Objects.requireNonNull(scope);
	}

	public DataStructure(String name, DataType type, StorageScope scope)
	{
		this(name, type, null, null, scope);
	}

	public String getName()
	{
		return name;
	}

	public DataType getType()
	{
		return type;
	}

	public OptionalInt getSize()
	{
		return size == null ? OptionalInt.empty() : OptionalInt.of(size);
	}

	public Optional<String> getInitialValue()
	{
		return Optional.ofNullable(initialValue);
	}

	public StorageScope getScope()
	{
		return scope;
	}

	@Override
	public String toString()
	{
		return name + ": " + type + " (" + scope + ")";
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
		DataStructure that = (DataStructure) o;
		return name.equals(that.name) && type.equals(that.type) && Objects.equals(size, that.size)
				&& Objects.equals(initialValue, that.initialValue) && scope.equals(that.scope);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, type, size, initialValue, scope);
	}
}
