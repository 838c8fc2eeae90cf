package org.lokray.nlmc.intent.operation;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

public class MemoryAllocationOperation extends OperationType
{
	private final Integer size;
	private final String typeHint;

	public MemoryAllocationOperation(Integer size, String typeHint)
	{
		this.size = size;
		this.typeHint = typeHint;
	}

	public OptionalInt getSize()
	{
		return size == null ? OptionalInt.empty() : OptionalInt.of(size);
	}

	public Optional<String> getTypeHint()
	{
		return Optional.ofNullable(typeHint);
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitMemoryAllocation(this);
	}

	@Override
	public String getKindName()
	{
		return "memory_allocation";
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
		MemoryAllocationOperation that = (MemoryAllocationOperation) o;
		return Objects.equals(size, that.size) && Objects.equals(typeHint, that.typeHint);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(size, typeHint);
	}
}
