package org.lokray.nlmc.recovery;

import java.util.Objects;
import java.util.OptionalInt;

public class ErrorLocation
{
	private final CompilationStage stage;
	private final String component;
	private final Integer line;
	private final Integer column;

	public ErrorLocation(CompilationStage stage, String component, Integer line, Integer column)
	{
		this.stage = Objects.requireNonNull(stage);
		this.component = Objects.requireNonNull(component);
		this.line = line;
		this.column = column;
	}

	public ErrorLocation(CompilationStage stage, String component)
	{
		this(stage, component, null, null);
	}

	public CompilationStage getStage()
	{
		return stage;
	}

	public String getComponent()
	{
		return component;
	}

	public OptionalInt getLine()
	{
		return line == null ? OptionalInt.empty() : OptionalInt.of(line);
	}

	public OptionalInt getColumn()
	{
		return column == null ? OptionalInt.empty() : OptionalInt.of(column);
	}

	@Override
	public String toString()
	{
		String position = line == null ? "" : ":" + line + (column == null ? "" : ":" + column);
		return stage + "/" + component + position;
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
		ErrorLocation that = (ErrorLocation) o;
		return stage == that.stage && component.equals(that.component) && Objects.equals(line, that.line)
				&& Objects.equals(column, that.column);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(stage, component, line, column);
	}
}
