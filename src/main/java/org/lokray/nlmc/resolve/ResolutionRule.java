package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;

import java.util.Objects;
import java.util.regex.Pattern;

public class ResolutionRule
{
	private final RuleType ruleType;
	private final Pattern pattern;
	private final String resolution;
	private final double confidence;

	public ResolutionRule(RuleType ruleType, String pattern, String resolution, double confidence)
	{
		this.ruleType = Objects.requireNonNull(ruleType);
		this.pattern = Pattern.compile(pattern, Pattern.CASE_INSENSITIVE);
		this.resolution = Objects.requireNonNull(resolution);
		this.confidence = confidence;
	}

	/**
	 * A pronoun rule is tested against the ambiguity's own pronoun when it names one;
	 * other rules look at the context and the description.
	 */
	public boolean matches(Ambiguity ambiguity)
	{
		if (!ruleType.appliesTo(ambiguity.getKind()))
		{
			return false;
		}
		if (ruleType == RuleType.PRONOUN_REFERENCE && !ambiguity.getSubject().isBlank())
		{
			return pattern.matcher(ambiguity.getSubject()).find();
		}
		return pattern.matcher(ambiguity.getContext()).find() || pattern.matcher(ambiguity.getDescription()).find();
	}

	public RuleType getRuleType()
	{
		return ruleType;
	}

	public String getPattern()
	{
		return pattern.pattern();
	}

	public String getResolution()
	{
		return resolution;
	}

	public double getConfidence()
	{
		return confidence;
	}
}
