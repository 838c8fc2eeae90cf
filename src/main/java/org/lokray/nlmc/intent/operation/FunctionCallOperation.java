package org.lokray.nlmc.intent.operation;

import java.util.List;
import java.util.Objects;

public class FunctionCallOperation extends OperationType
{
	private final String name;
	private final List<String> args;

	public FunctionCallOperation(String name, List<String> args)
	{
		this.name = Objects.requireNonNull(name);
		this.args = List.copyOf(args);
	}

	public String getName()
	{
		return name;
	}

	public List<String> getArgs()
	{
		return args;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitFunctionCall(this);
	}

	@Override
	public String getKindName()
	{
		return "function_call";
	}

	@Override
	public String toString()
	{
		return "FunctionCall{" + name + args + "}";
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		FunctionCallOperation that = (FunctionCallOperation) o;
		return name.equals(that.name) && args.equals(that.args);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, args);
	}
}
