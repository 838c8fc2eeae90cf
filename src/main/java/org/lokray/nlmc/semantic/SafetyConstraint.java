package org.lokray.nlmc.semantic;

import java.util.List;
import java.util.Objects;

/**
 * A runtime check the generated program has to perform.
 */
public class SafetyConstraint
{
	public enum Type
	{
		NULL_POINTER_CHECK, BOUNDS_CHECK, OVERFLOW_CHECK, UNINITIALIZED_ACCESS, USE_AFTER_FREE, DATA_RACE, DEADLOCK_PREVENTION
	}

	public enum Severity
	{
		CRITICAL, HIGH, MEDIUM, LOW
	}

	private final Type type;
	private final String description;
	private final List<String> affectedVariables;
	private final Severity severity;

	public SafetyConstraint(Type type, String description, List<String> affectedVariables, Severity severity)
	{
		this.type = Objects.requireNonNull(type);
		this.description = Objects.requireNonNull(description);
		this.affectedVariables = List.copyOf(affectedVariables);
		this.severity = Objects.requireNonNull(severity);
	}

	public Type getType()
	{
		return type;
	}

	public String getDescription()
	{
		return description;
	}

	public List<String> getAffectedVariables()
	{
		return affectedVariables;
	}

	public Severity getSeverity()
	{
		return severity;
	}
}
