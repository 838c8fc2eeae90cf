package org.lokray.nlmc.intent;

import org.lokray.nlmc.types.FloatPrecision;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * The declared type of an extracted data structure. This is the coarse, user-level view;
 * the type inferencer lowers it to a {@link org.lokray.nlmc.types.BaseType}.
 */
public abstract class DataType
{
	public static final DataType INT32 = new IntegerType(32, true);
	public static final DataType DOUBLE = new FloatType(FloatPrecision.DOUBLE);

	DataType()
	{
	}

	/**
	 * Short name as used in symbol tables and IR output, e.g. "i32", "f64" or "[i32]".
	 */
	public abstract String getName();

	public boolean isNumeric()
	{
		return false;
	}

	public boolean isInteger()
	{
		return false;
	}

	public boolean isFloat()
	{
		return false;
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
		return getName().equals(((DataType) o).getName());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), getName());
	}

	public static class IntegerType extends DataType
	{
		private final int bits;
		private final boolean signed;

		public IntegerType(int bits, boolean signed)
		{
			this.bits = bits;
			this.signed = signed;
		}

		public int getBits()
		{
			return bits;
		}

		public boolean isSigned()
		{
			return signed;
		}

		@Override
		public String getName()
		{
			return (signed ? "i" : "u") + bits;
		}

		@Override
		public boolean isNumeric()
		{
			return true;
		}

		@Override
		public boolean isInteger()
		{
			return true;
		}
	}

	public static class FloatType extends DataType
	{
		private final FloatPrecision precision;

		public FloatType(FloatPrecision precision)
		{
			this.precision = Objects.requireNonNull(precision);
		}

		public FloatPrecision getPrecision()
		{
			return precision;
		}

		@Override
		public String getName()
		{
			return "f" + precision.getSizeBytes() * 8;
		}

		@Override
		public boolean isNumeric()
		{
			return true;
		}

		@Override
		public boolean isFloat()
		{
			return true;
		}
	}

	public static class StringType extends DataType
	{
		private final Integer maxLength;

		public StringType(Integer maxLength)
		{
			this.maxLength = maxLength;
		}

		public OptionalInt getMaxLength()
		{
			return maxLength == null ? OptionalInt.empty() : OptionalInt.of(maxLength);
		}

		@Override
		public String getName()
		{
			return maxLength == null ? "string" : "string[" + maxLength + "]";
		}
	}

	public static class CharacterType extends DataType
	{
		public static final CharacterType INSTANCE = new CharacterType();

		private CharacterType()
		{
		}

		@Override
		public String getName()
		{
			return "char";
		}
	}

	public static class BooleanType extends DataType
	{
		public static final BooleanType INSTANCE = new BooleanType();

		private BooleanType()
		{
		}

		@Override
		public String getName()
		{
			return "bool";
		}
	}

	public static class ArrayType extends DataType
	{
		private final DataType elementType;
		private final Integer length;

		public ArrayType(DataType elementType, Integer length)
		{
			this.elementType = Objects.requireNonNull(elementType);
			this.length = length;
		}

		public DataType getElementType()
		{
			return elementType;
		}

		public OptionalInt getLength()
		{
			return length == null ? OptionalInt.empty() : OptionalInt.of(length);
		}

		@Override
		public String getName()
		{
			return "[" + elementType.getName() + (length == null ? "" : "; " + length) + "]";
		}
	}

	public static class StructType extends DataType
	{
		private final String structName;
		private final Map<String, DataType> fields;

		public StructType(String structName, Map<String, DataType> fields)
		{
			this.structName = Objects.requireNonNull(structName);
			this.fields = new LinkedHashMap<>(fields);
		}

		public String getStructName()
		{
			return structName;
		}

		/**
		 * Fields in declaration order.
		 */
		public Map<String, DataType> getFields()
		{
			return Collections.unmodifiableMap(fields);
		}

		@Override
		public String getName()
		{
			return "struct " + structName;
		}
	}

	public static class PointerType extends DataType
	{
		private final DataType target;

		public PointerType(DataType target)
		{
			this.target = Objects.requireNonNull(target);
		}

		public DataType getTarget()
		{
			return target;
		}

		@Override
		public String getName()
		{
			return "*" + target.getName();
		}
	}

	public static class UnknownType extends DataType
	{
		public static final UnknownType INSTANCE = new UnknownType();

		private UnknownType()
		{
		}

		@Override
		public String getName()
		{
			return "unknown";
		}
	}

	/**
	 * Maps the lower-case type names an oracle may answer with ("int", "float", "string",
	 * "bool", "char", "array", "pointer") to a data type.
	 */
	public static Optional<DataType> fromName(String name)
	{
		if (name == null)
		{
			return Optional.empty();
		}
		switch (name.trim().toLowerCase(Locale.ROOT))
		{
			case "int":
			case "integer":
			case "i32":
			case "number":
				return Optional.of(INT32);
			case "i64":
			case "long":
				return Optional.of(new IntegerType(64, true));
			case "float":
			case "double":
			case "f64":
			case "decimal":
				return Optional.of(DOUBLE);
			case "f32":
				return Optional.of(new FloatType(FloatPrecision.SINGLE));
			case "string":
			case "str":
			case "text":
				return Optional.of(new StringType(null));
			case "bool":
			case "boolean":
				return Optional.of(BooleanType.INSTANCE);
			case "char":
			case "character":
				return Optional.of(CharacterType.INSTANCE);
			case "array":
			case "list":
				return Optional.of(new ArrayType(INT32, null));
			case "pointer":
			case "reference":
				return Optional.of(new PointerType(INT32));
			default:
				return Optional.empty();
		}
	}
}
