package org.lokray.nlmc.types;

import java.util.Objects;

public class PointerBaseType extends BaseType
{
	private final BaseType targetType;
	private final boolean constTarget;

	public PointerBaseType(BaseType targetType, boolean constTarget)
	{
		this.targetType = Objects.requireNonNull(targetType);
		this.constTarget = constTarget;
	}

	public BaseType getTargetType()
	{
		return targetType;
	}

	public boolean isConstTarget()
	{
		return constTarget;
	}

	@Override
	public String getName()
	{
		return (constTarget ? "*const " : "*") + targetType.getName();
	}

	@Override
	public int sizeBytes()
	{
		return 8;
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
