package org.lokray.nlmc.intent;

import java.util.Objects;

public class Constraint
{
	public enum Kind
	{
		TYPE_SAFETY, MEMORY_BOUNDS, NULL_POINTER, RESOURCE_LEAK, DEAD_CODE, PERFORMANCE
	}

	public enum Severity
	{
		ERROR, WARNING, INFO
	}

	private final Kind kind;
	private final String description;
	private final Severity severity;

	public Constraint(Kind kind, String description, Severity severity)
	{
		this.kind = Objects.requireNonNull(kind);
		this.description = Objects.requireNonNull(description);
		this.severity = Objects.requireNonNull(severity);
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getDescription()
	{
		return description;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	@Override
	public String toString()
	{
		return severity + " " + kind + ": " + description;
	}
}
