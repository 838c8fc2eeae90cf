package org.lokray.nlmc.intent.operation;

import java.util.List;
import java.util.Objects;

public class SystemCallOperation extends OperationType
{
	private final String callType;
	private final List<String> parameters;

	public SystemCallOperation(String callType, List<String> parameters)
	{
		this.callType = Objects.requireNonNull(callType);
		this.parameters = List.copyOf(parameters);
	}

	public String getCallType()
	{
		return callType;
	}

	public List<String> getParameters()
	{
		return parameters;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitSystemCall(this);
	}

	@Override
	public String getKindName()
	{
		return "system_call";
	}

	@Override
	public String toString()
	{
		return "SystemCall{" + callType + "}";
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
		SystemCallOperation that = (SystemCallOperation) o;
		return callType.equals(that.callType) && parameters.equals(that.parameters);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(callType, parameters);
	}
}
