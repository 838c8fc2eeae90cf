package org.lokray.nlmc.intent.operation;

import java.util.Objects;
import java.util.Optional;

public class InputOperation extends OperationType
{
	private final String prompt;

	public InputOperation(String prompt)
	{
		this.prompt = prompt;
	}

	public Optional<String> getPrompt()
	{
		return Optional.ofNullable(prompt);
	}

	@Override
	public <R> R accept(OperationTypeVisitor<R> visitor)
	{
		return visitor.visitInput(this);
	}

	@Override
	public String getKindName()
	{
		return "input";
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
		return Objects.equals(prompt, ((InputOperation) o).prompt);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(prompt);
	}
}
