package org.lokray.nlmc.recovery;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

public class RecoveryStrategy
{
	public enum Type
	{
		SKIP_AND_CONTINUE(0.5),
		USE_DEFAULT(0.8),
		RETRY_WITH_MODIFICATION(0.7),
		FALLBACK_IMPLEMENTATION(0.9),
		USER_INTERACTION(0.4),
		ALTERNATIVE_APPROACH(0.6);

		private final double historicalSuccessRate;

		Type(double historicalSuccessRate)
		{
			this.historicalSuccessRate = historicalSuccessRate;
		}

		public double getHistoricalSuccessRate()
		{
			return historicalSuccessRate;
		}
	}

	private final Type type;
	private final Set<ErrorType> applicableErrors;
	private final double successRate;
	private final String description;

	public RecoveryStrategy(Type type, Set<ErrorType> applicableErrors, double successRate, String description)
	{
		this.type = Objects.requireNonNull(type);
		this.applicableErrors = applicableErrors.isEmpty() ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(applicableErrors));
		this.successRate = successRate;
		this.description = Objects.requireNonNull(description);
	}

	public Type getType()
	{
		return type;
	}

	public Set<ErrorType> getApplicableErrors()
	{
		return applicableErrors;
	}

	public boolean appliesTo(ErrorType errorType)
	{
		return applicableErrors.contains(errorType);
	}

	public double getSuccessRate()
	{
		return successRate;
	}

	public String getDescription()
	{
		return description;
	}

	/**
	 * Success rate weighted by severity, averaged with the strategy type's historical rate.
	 */
	public double score(ErrorSeverity severity)
	{
		return (successRate * severity.getScoreMultiplier() + type.getHistoricalSuccessRate()) / 2.0;
	}

	@Override
	public String toString()
	{
		return type + " (" + successRate + "): " + description;
	}
}
