package org.lokray.nlmc.types;

public class VoidBaseType extends BaseType
{
	public static final VoidBaseType INSTANCE = new VoidBaseType();

	private VoidBaseType()
	{
	}

	@Override
	public String getName()
	{
		return "void";
	}

	@Override
	public int sizeBytes()
	{
		return 0;
	}

	@Override
	public int alignment()
	{
		return 1;
	}
}
