package org.lokray.nlmc.types;

public class IntegerBaseType extends BaseType
{
	public static final IntegerBaseType I32 = new IntegerBaseType(32, true);
	public static final IntegerBaseType I64 = new IntegerBaseType(64, true);

	private final int bits;
	private final boolean signed;

	public IntegerBaseType(int bits, boolean signed)
	{
		if (bits <= 0)
		{
			throw new IllegalArgumentException("Integer width must be positive, got " + bits);
		}
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
	public int sizeBytes()
	{
		return bits / 8;
	}

	@Override
	public int alignment()
	{
		return Math.max(1, Math.min(bits / 8, 8));
	}

	@Override
	public boolean isInteger()
	{
		return true;
	}
}
