package org.lokray.nlmc.recovery;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class CompilationError
{
	private final ErrorType type;
	private final String message;
	private final ErrorLocation location;
	private final ErrorSeverity severity;
	private final List<String> recoverySuggestions;
	private final String context;

	public CompilationError(ErrorType type, String message, ErrorLocation location, ErrorSeverity severity,
							List<String> recoverySuggestions, String context)
	{
		this.type = Objects.requireNonNull(type);
		this.message = Objects.requireNonNull(message);
		this.location = location;
		this.severity = Objects.requireNonNull(severity);
		this.recoverySuggestions = List.copyOf(recoverySuggestions);
		this.context = context == null ? "" : context;
	}

	public CompilationError(ErrorType type, String message, ErrorSeverity severity)
	{
		this(type, message, null, severity, List.of(), "");
	}

	public ErrorType getType()
	{
		return type;
	}

	public String getMessage()
	{
		return message;
	}

	public Optional<ErrorLocation> getLocation()
	{
		return Optional.ofNullable(location);
	}

	public ErrorSeverity getSeverity()
	{
		return severity;
	}

	public List<String> getRecoverySuggestions()
	{
		return recoverySuggestions;
	}

	public String getContext()
	{
		return context;
	}

	@Override
	public String toString()
	{
		String where = location == null ? "" : " at " + location;
		return severity + " " + type + where + ": " + message;
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
		CompilationError that = (CompilationError) o;
		return type == that.type && message.equals(that.message) && Objects.equals(location, that.location)
				&& severity == that.severity && recoverySuggestions.equals(that.recoverySuggestions) && context.equals(that.context);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, message, location, severity, recoverySuggestions, context);
	}
}
