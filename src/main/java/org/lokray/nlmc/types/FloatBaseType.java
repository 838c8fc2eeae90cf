package org.lokray.nlmc.types;

import java.util.Objects;

public class FloatBaseType extends BaseType
{
	public static final FloatBaseType F32 = new FloatBaseType(FloatPrecision.SINGLE);
	public static final FloatBaseType F64 = new FloatBaseType(FloatPrecision.DOUBLE);

	private final FloatPrecision precision;

	public FloatBaseType(FloatPrecision precision)
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
	public int sizeBytes()
	{
		return precision.getSizeBytes();
	}

	@Override
	public int alignment()
	{
		return precision.getAlignment();
	}

	@Override
	public boolean isFloat()
	{
		return true;
	}
}
