package org.lokray.nlmc.types;

public class BooleanBaseType extends BaseType
{
	public static final BooleanBaseType INSTANCE = new BooleanBaseType();

	private BooleanBaseType()
	{
	}

	@Override
	public String getName()
	{
		return "bool";
	}

	@Override
	public int sizeBytes()
	{
		return 1;
	}

	@Override
	public int alignment()
	{
		return 1;
	}
}
