package org.lokray.nlmc.types;

import org.lokray.nlmc.intent.DataType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Machine-level shape of an inferred type. Size and alignment are pure functions of the
 * variant, so every variant has to answer both.
 */
public abstract class BaseType
{
	BaseType()
	{
	}

	public abstract String getName();

	public abstract int sizeBytes();

	public abstract int alignment();

	public boolean isInteger()
	{
		return false;
	}

	public boolean isFloat()
	{
		return false;
	}

	/**
	 * Pointers, references and slices borrow their storage.
	 */
	public boolean isIndirect()
	{
		return false;
	}

	/**
	 * Lowers an extracted data type.
	 */
	public static BaseType of(DataType dataType)
	{
		if (dataType instanceof DataType.IntegerType integer)
		{
			return new IntegerBaseType(integer.getBits(), integer.isSigned());
		}
		if (dataType instanceof DataType.FloatType floatType)
		{
			return new FloatBaseType(floatType.getPrecision());
		}
		if (dataType instanceof DataType.StringType)
		{
			return new StringBaseType(StringEncoding.UTF8);
		}
		if (dataType instanceof DataType.CharacterType)
		{
			return CharacterBaseType.INSTANCE;
		}
		if (dataType instanceof DataType.BooleanType)
		{
			return BooleanBaseType.INSTANCE;
		}
		if (dataType instanceof DataType.ArrayType array)
		{
			Integer length = array.getLength().isPresent() ? array.getLength().getAsInt() : null;
			return new ArrayBaseType(of(array.getElementType()), length);
		}
		if (dataType instanceof DataType.StructType struct)
		{
			Map<String, BaseType> fields = new LinkedHashMap<>();
			struct.getFields().forEach((name, type) -> fields.put(name, of(type)));
			return new StructBaseType(struct.getStructName(), fields);
		}
		if (dataType instanceof DataType.PointerType pointer)
		{
			return new PointerBaseType(of(pointer.getTarget()), false);
		}
		// Unknown types fall back to a 32-bit signed integer
		return IntegerBaseType.I32;
	}

	@Override
	public String toString()
	{
		return getName();
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
		return getName().equals(((BaseType) o).getName());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), getName());
	}
}
