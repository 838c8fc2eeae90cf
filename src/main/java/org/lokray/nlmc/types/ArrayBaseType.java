package org.lokray.nlmc.types;

import java.util.Objects;
import java.util.OptionalInt;

public class ArrayBaseType extends BaseType
{
	// Pointer and length of a dynamic array
	public static final int DYNAMIC_HEADER_BYTES = 16;

	private final BaseType elementType;
	private final Integer length;

	/**
	 * @param length fixed element count, or null for a dynamic array
	 */
	public ArrayBaseType(BaseType elementType, Integer length)
	{
		this.elementType = Objects.requireNonNull(elementType);
		this.length = length;
	}

	public BaseType getElementType()
	{
		return elementType;
	}

	public OptionalInt getLength()
	{
		return length == null ? OptionalInt.empty() : OptionalInt.of(length);
	}

	public boolean isDynamic()
	{
		return length == null;
	}

	@Override
	public String getName()
	{
		return "[" + elementType.getName() + (length == null ? "" : "; " + length) + "]";
	}

	@Override
	public int sizeBytes()
	{
		return length == null ? DYNAMIC_HEADER_BYTES : elementType.sizeBytes() * length;
	}

	@Override
	public int alignment()
	{
		return elementType.alignment();
	}
}
