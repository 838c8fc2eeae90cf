package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;

import java.util.List;
import java.util.Objects;

public class ResolvedAmbiguity
{
	private final Ambiguity originalAmbiguity;
	private final String chosenInterpretation;
	private final double confidence;
	private final String reasoning;
	private final List<ContextFactor> contextFactors;
	private final String strategy;

	public ResolvedAmbiguity(Ambiguity originalAmbiguity, String chosenInterpretation, double confidence, String reasoning,
							 List<ContextFactor> contextFactors, String strategy)
	{
		this.originalAmbiguity = Objects.requireNonNull(originalAmbiguity);
		this.chosenInterpretation = Objects.requireNonNull(chosenInterpretation);
		this.confidence = confidence;
		this.reasoning = Objects.requireNonNull(reasoning);
		this.contextFactors = List.copyOf(contextFactors);
		this.strategy = Objects.requireNonNull(strategy);
	}

	public Ambiguity getOriginalAmbiguity()
	{
		return originalAmbiguity;
	}

	public String getChosenInterpretation()
	{
		return chosenInterpretation;
	}

	public double getConfidence()
	{
		return confidence;
	}

	public String getReasoning()
	{
		return reasoning;
	}

	public List<ContextFactor> getContextFactors()
	{
		return contextFactors;
	}

	/**
	 * Name of the strategy that produced this resolution.
	 */
	public String getStrategy()
	{
		return strategy;
	}

	@Override
	public String toString()
	{
		return originalAmbiguity.getId() + " -> " + chosenInterpretation + " (" + confidence + ", " + strategy + ")";
	}
}
