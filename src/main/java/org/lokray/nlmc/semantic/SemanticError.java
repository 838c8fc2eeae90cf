package org.lokray.nlmc.semantic;

import org.lokray.nlmc.semantic.symbol.SourceLocation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class SemanticError
{
	private final SemanticErrorType type;
	private final String message;
	private final SourceLocation location;
	private final List<String> suggestions;

	public SemanticError(SemanticErrorType type, String message, SourceLocation location, List<String> suggestions)
	{
		this.type = Objects.requireNonNull(type);
		this.message = Objects.requireNonNull(message);
		this.location = location;
		this.suggestions = List.copyOf(suggestions);
	}

	public SemanticErrorType getType()
	{
		return type;
	}

	public String getMessage()
	{
		return message;
	}

	public Optional<SourceLocation> getLocation()
	{
		return Optional.ofNullable(location);
	}

	public List<String> getSuggestions()
	{
		return suggestions;
	}

	@Override
	public String toString()
	{
		return type + ": " + message;
	}
}
