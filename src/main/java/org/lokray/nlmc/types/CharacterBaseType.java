package org.lokray.nlmc.types;

// A Unicode scalar value
public class CharacterBaseType extends BaseType
{
	public static final CharacterBaseType INSTANCE = new CharacterBaseType();

	private CharacterBaseType()
	{
	}

	@Override
	public String getName()
	{
		return "char";
	}

	@Override
	public int sizeBytes()
	{
		return 4;
	}

	@Override
	public int alignment()
	{
		return 4;
	}
}
