package org.lokray.nlmc.intent.operation;

import java.util.Objects;

public class ArithmeticOperation extends OperationType
{
	private final ArithmeticOp operator;

	public ArithmeticOperation(ArithmeticOp operator)
	{
		this.operator = Objects.requireNonNull(operator);
	}

	public ArithmeticOp getOperator()
	{
		return operator;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitArithmetic(this);
	}

	@Override
	public String getKindName()
	{
		return "arithmetic";
	}

	@Override
	public String toString()
	{
		return "Arithmetic{" + operator + "}";
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
		return operator == ((ArithmeticOperation) o).operator;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(operator);
	}
}
