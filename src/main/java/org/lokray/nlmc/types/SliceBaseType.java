package org.lokray.nlmc.types;

import java.util.Objects;

public class SliceBaseType extends BaseType
{
	private final BaseType elementType;

	public SliceBaseType(BaseType elementType)
	{
		this.elementType = Objects.requireNonNull(elementType);
	}

	public BaseType getElementType()
	{
		return elementType;
	}

	@Override
	public String getName()
	{
		return "&[" + elementType.getName() + "]";
	}

	@Override
	public int sizeBytes()
	{
		return 16;
	}

	@Override
	public int alignment()
	{
		return 8;
	}

	@Override
	public boolean isIndirect()
	{
		return true;
	}
}
