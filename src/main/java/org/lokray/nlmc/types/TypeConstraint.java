package org.lokray.nlmc.types;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class TypeConstraint
{
	public enum Kind
	{
		SIZE, ALIGNMENT, LIFETIME, MUTABILITY, NULLABILITY, THREAD_SAFETY, NUMERIC_RANGE
	}

	public enum Severity
	{
		ERROR, WARNING, INFO
	}

	private final Kind kind;
	private final List<String> affectedTypes;
	private final String description;
	private final Severity severity;

	// Kind-specific parameters, null when they do not apply
	private Long min;
	private Long max;
	private Integer requiredAlignment;
	private Lifetime minLifetime;
	private Mutability requiredMutability;
	private Boolean nullable;

	private TypeConstraint(Kind kind, List<String> affectedTypes, String description, Severity severity)
	{
		this.kind = kind;
		this.affectedTypes = List.copyOf(affectedTypes);
		this.description = Objects.requireNonNull(description);
		this.severity = severity;
	}

	public static TypeConstraint size(Long minSize, Long maxSize, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.SIZE, affected, description, severity);
		c.min = minSize;
		c.max = maxSize;
		return c;
	}

	public static TypeConstraint alignment(int required, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.ALIGNMENT, affected, description, severity);
		c.requiredAlignment = required;
		return c;
	}

	public static TypeConstraint lifetime(Lifetime atLeast, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.LIFETIME, affected, description, severity);
		c.minLifetime = atLeast;
		return c;
	}

	public static TypeConstraint mutability(Mutability required, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.MUTABILITY, affected, description, severity);
		c.requiredMutability = required;
		return c;
	}

	public static TypeConstraint nullability(boolean nullable, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.NULLABILITY, affected, description, severity);
		c.nullable = nullable;
		return c;
	}

	public static TypeConstraint numericRange(Long min, Long max, List<String> affected, String description, Severity severity)
	{
		TypeConstraint c = new TypeConstraint(Kind.NUMERIC_RANGE, affected, description, severity);
		c.min = min;
		c.max = max;
		return c;
	}

	public Kind getKind()
	{
		return kind;
	}

	public List<String> getAffectedTypes()
	{
		return affectedTypes;
	}

	public String getDescription()
	{
		return description;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	/**
	 * Lower bound of a size or numeric range constraint.
	 */
	public Optional<Long> getMin()
	{
		return Optional.ofNullable(min);
	}

	public Optional<Long> getMax()
	{
		return Optional.ofNullable(max);
	}

	public Optional<Integer> getRequiredAlignment()
	{
		return Optional.ofNullable(requiredAlignment);
	}

	public Optional<Lifetime> getMinLifetime()
	{
		return Optional.ofNullable(minLifetime);
	}

	public Optional<Mutability> getRequiredMutability()
	{
		return Optional.ofNullable(requiredMutability);
	}

	public Optional<Boolean> getNullable()
	{
		return Optional.ofNullable(nullable);
	}

	@Override
	public String toString()
	{
		return severity + " " + kind + " " + affectedTypes + ": " + description;
	}
}
