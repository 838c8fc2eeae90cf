package org.lokray.nlmc.intent.operation;

import java.util.List;
import java.util.Objects;

public class LoopOperation extends OperationType
{
	public static final String UNKNOWN_CONDITION = "unknown";

	private final String condition;
	private final List<String> body;

	public LoopOperation(String condition, List<String> body)
	{
		this.condition = Objects.requireNonNull(condition);
		this.body = List.copyOf(body);
	}

	public String getCondition()
	{
		return condition;
	}

	/**
	 * Ids of the operations repeated by this loop.
	 */
	public List<String> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitLoop(this);
	}

	@Override
	public String getKindName()
	{
		return "loop";
	}

	@Override
	public String toString()
	{
		return "Loop{" + condition + "}";
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
		LoopOperation that = (LoopOperation) o;
		return condition.equals(that.condition) && body.equals(that.body);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(condition, body);
	}
}
