package org.lokray.nlmc.intent.operation;

import java.util.Objects;

public class ComparisonOperation extends OperationType
{
	private final ComparisonOp operator;

	public ComparisonOperation(ComparisonOp operator)
	{
		this.operator = Objects.requireNonNull(operator);
	}

	public ComparisonOp getOperator()
	{
		return operator;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitComparison(this);
	}

	@Override
	public String getKindName()
	{
		return "comparison";
	}

	@Override
	public String toString()
	{
		return "Comparison{" + operator + "}";
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
		return operator == ((ComparisonOperation) o).operator;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator);
	}
}
