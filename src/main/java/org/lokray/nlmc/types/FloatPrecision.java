package org.lokray.nlmc.types;

public enum FloatPrecision
{
	HALF(2, 2),
	SINGLE(4, 4),
	DOUBLE(8, 8),
	EXTENDED(10, 8),
	QUAD(16, 16);

	private final int sizeBytes;
	private final int alignment;

	FloatPrecision(int sizeBytes, int alignment)
	{
		this.sizeBytes = sizeBytes;
		this.alignment = alignment;
	}

	public int getSizeBytes()
	{
		return sizeBytes;
	}

	public int getAlignment()
	{
		return alignment;
	}
}
