package org.lokray.nlmc.types;

import java.util.List;
import java.util.Objects;

/**
 * The inferred type of one named entity: a declared variable or an operation result.
 * Size and alignment always come from the base type.
 */
public class InferredType
{
	private final String name;
	private final BaseType baseType;
	private final boolean nullable;
	private final Lifetime lifetime;
	private final Mutability mutability;
	private final Ownership ownership;
	private final List<String> constraints;

	public InferredType(String name, BaseType baseType, boolean nullable, Lifetime lifetime, Mutability mutability,
						Ownership ownership, List<String> constraints)
	{
		this.name = Objects.requireNonNull(name);
		this.baseType = Objects.requireNonNull(baseType);
		this.nullable = nullable;
		this.lifetime = Objects.requireNonNull(lifetime);
		this.mutability = Objects.requireNonNull(mutability);
		this.ownership = Objects.requireNonNull(ownership);
		this.constraints = List.copyOf(constraints);
	}

	/**
	 * Type name, e.g. "i32" or "arithmetic_result".
	 */
	public String getName()
	{
		return name;
	}

	public BaseType getBaseType()
	{
		return baseType;
	}

	public int getSizeBytes()
	{
		return baseType.sizeBytes();
	}

	public int getAlignment()
	{
		return baseType.alignment();
	}

	public boolean isNullable()
	{
		return nullable;
	}

	public Lifetime getLifetime()
	{
		return lifetime;
	}

	public Mutability getMutability()
	{
		return mutability;
	}

	public Ownership getOwnership()
	{
		return ownership;
	}

	/**
	 * Named value constraints such as "non_zero_divisor".
	 */
	public List<String> getConstraints()
	{
		return constraints;
	}

	@Override
	public String toString()
	{
		return name + " (" + baseType + ", " + getSizeBytes() + "B/" + getAlignment() + ")";
	}
}
