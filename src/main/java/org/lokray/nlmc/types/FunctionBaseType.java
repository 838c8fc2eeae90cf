package org.lokray.nlmc.types;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

// A function pointer
public class FunctionBaseType extends BaseType
{
	private final List<BaseType> parameterTypes;
	private final BaseType returnType;

	public FunctionBaseType(List<BaseType> parameterTypes, BaseType returnType)
	{
		this.parameterTypes = List.copyOf(parameterTypes);
		this.returnType = Objects.requireNonNull(returnType);
	}

	public List<BaseType> getParameterTypes()
	{
		return parameterTypes;
	}

	public BaseType getReturnType()
	{
		return returnType;
	}

	@Override
	public String getName()
	{
		return "fn(" + parameterTypes.stream().map(BaseType::getName).collect(Collectors.joining(", ")) + ") -> " + returnType.getName();
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
}
