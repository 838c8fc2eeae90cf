package org.lokray.nlmc.semantic;

public class TypeInfo
{
	private final String name;
	private final int sizeBytes;
	private final int alignment;
	private final boolean primitive;

	public TypeInfo(String name, int sizeBytes, int alignment, boolean primitive)
	{
		this.name = name;
		this.sizeBytes = sizeBytes;
		this.alignment = alignment;
		this.primitive = primitive;
	}

	public String getName()
	{
		return name;
	}

	public int getSizeBytes()
	{
		return sizeBytes;
	}

	public int getAlignment()
	{
		return alignment;
	}

	public boolean isPrimitive()
	{
		return primitive;
	}
}
