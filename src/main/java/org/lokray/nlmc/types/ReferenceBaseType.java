package org.lokray.nlmc.types;

import java.util.Objects;

public class ReferenceBaseType extends BaseType
{
	private final BaseType targetType;
	private final boolean constTarget;

	public ReferenceBaseType(BaseType targetType, boolean constTarget)
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
		return (constTarget ? "&" : "&mut ") + targetType.getName();
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
