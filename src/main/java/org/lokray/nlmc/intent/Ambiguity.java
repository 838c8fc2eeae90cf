package org.lokray.nlmc.intent;

import java.util.List;
import java.util.Objects;

/**
 * A place where the description can be read more than one way. Interpretations and
 * confidence scores are parallel lists.
 */
public class Ambiguity
{
	public enum Kind
	{
		PRONOUN, OPERATION, OTHER
	}

	private final String id;
	private final Kind kind;
	private final String subject;
	private final String description;
	private final String context;
	private final List<String> possibleInterpretations;
	private final List<Double> confidenceScores;

	public Ambiguity(String id, Kind kind, String subject, String description, String context,
					 List<String> possibleInterpretations, List<Double> confidenceScores)
	{
		if (possibleInterpretations.size() != confidenceScores.size())
		{
			throw new IllegalArgumentException("Ambiguity '" + id + "' has " + possibleInterpretations.size()
					+ " interpretations but " + confidenceScores.size() + " confidence scores");
		}
		this.id = Objects.requireNonNull(id);
		this.kind = Objects.requireNonNull(kind);
		this.subject = subject == null ? "" : subject;
		this.description = Objects.requireNonNull(description);
		this.context = context == null ? "" : context;
		this.possibleInterpretations = List.copyOf(possibleInterpretations);
		this.confidenceScores = List.copyOf(confidenceScores);
	}

	public String getId()
	{
		return id;
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * The word that triggered the ambiguity, e.g. "it" for a pronoun. Empty when unknown.
	 */
	public String getSubject()
	{
		return subject;
	}

	public String getDescription()
	{
		return description;
	}

	public String getContext()
	{
		return context;
	}

	public List<String> getPossibleInterpretations()
	{
		return possibleInterpretations;
	}

	public List<Double> getConfidenceScores()
	{
		return confidenceScores;
	}

	@Override
	public String toString()
	{
		return id + " (" + kind + "): " + description;
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
		Ambiguity that = (Ambiguity) o;
		return id.equals(that.id) && kind == that.kind && subject.equals(that.subject)
				&& description.equals(that.description) && context.equals(that.context)
				&& possibleInterpretations.equals(that.possibleInterpretations)
				&& confidenceScores.equals(that.confidenceScores);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, kind, subject, description, context, possibleInterpretations, confidenceScores);
	}
}
