package org.lokray.nlmc.intent.operation;

import java.util.Objects;
import java.util.Optional;

public class OutputOperation extends OperationType
{
	private final String format;

	public OutputOperation(String format)
	{
		this.format = format;
	}

	public Optional<String> getFormat()
	{
		return Optional.ofNullable(format);
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitOutput(this);
	}

	@Override
	public String getKindName()
	{
		return "output";
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
		return Objects.equals(format, ((OutputOperation) o).format);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(format);
	}
}
