package org.lokray.nlmc.recovery;

import java.util.List;
import java.util.Objects;

public class RecoveryResult
{
	private final RecoveryOutcome outcome;
	private final RecoveryStrategy.Type strategy;
	private final String actionTaken;
	private final List<String> modifiedElements;
	private final double confidence;
	private final List<String> warnings;

	public RecoveryResult(RecoveryOutcome outcome, RecoveryStrategy.Type strategy, String actionTaken, List<String> modifiedElements,
						  double confidence, List<String> warnings)
	{
		this.outcome = Objects.requireNonNull(outcome);
		this.strategy = Objects.requireNonNull(strategy);
		this.actionTaken = Objects.requireNonNull(actionTaken);
		this.modifiedElements = List.copyOf(modifiedElements);
		this.confidence = confidence;
		this.warnings = List.copyOf(warnings);
	}

	public RecoveryOutcome getOutcome()
	{
		return outcome;
	}

	/**
	 * Strategy that produced this result.
	 */
	public RecoveryStrategy.Type getStrategy()
	{
		return strategy;
	}

	public String getActionTaken()
	{
		return actionTaken;
	}

	public List<String> getModifiedElements()
	{
		return modifiedElements;
	}

	public double getConfidence()
	{
		return confidence;
	}

	public List<String> getWarnings()
	{
		return warnings;
	}

	@Override
	public String toString()
	{
		return outcome + " via " + strategy + ": " + actionTaken;
	}
}
