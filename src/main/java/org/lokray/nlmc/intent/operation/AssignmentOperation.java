package org.lokray.nlmc.intent.operation;

import java.util.Objects;

public class AssignmentOperation extends OperationType
{
	private final String target;

	public AssignmentOperation(String target)
	{
		this.target = Objects.requireNonNull(target);
	}

	public String getTarget()
	{
		return target;
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitAssignment(this);
	}

	@Override
	public String getKindName()
	{
		return "assignment";
	}

	@Override
	public String toString()
	{
		return "Assignment{" + target + "}";
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
		return target.equals(((AssignmentOperation) o).target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(target);
	}
}
