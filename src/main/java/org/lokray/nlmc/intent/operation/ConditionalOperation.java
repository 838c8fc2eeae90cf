package org.lokray.nlmc.intent.operation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class ConditionalOperation extends OperationType
{
	private final String condition;
	private final List<String> thenBranch;
	private final List<String> elseBranch;

	public ConditionalOperation(String condition, List<String> thenBranch, List<String> elseBranch)
	{
		this.condition = Objects.requireNonNull(condition);
		this.thenBranch = List.copyOf(thenBranch);
		this.elseBranch = elseBranch == null ? null : List.copyOf(elseBranch);
	}

	public String getCondition()
	{
		return condition;
	}

	public List<String> getThenBranch()
	{
		return thenBranch;
	}

	public Optional<List<String>> getElseBranch()
	{
		return Optional.ofNullable(elseBranch);
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitConditional(this);
	}

	@Override
	public String getKindName()
	{
		return "conditional";
	}

	@Override
	public String toString()
	{
		return "Conditional{" + condition + "}";
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
		ConditionalOperation that = (ConditionalOperation) o;
		return condition.equals(that.condition) && thenBranch.equals(that.thenBranch)
				&& Objects.equals(elseBranch, that.elseBranch);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(condition, thenBranch, elseBranch);
	}
}
