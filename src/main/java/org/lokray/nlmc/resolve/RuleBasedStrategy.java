package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ProgramIntent;

import java.util.List;
import java.util.Optional;

public class RuleBasedStrategy implements ResolutionStrategy
{
	public static final String NAME = "PrecedenceRules";

	private final List<ResolutionRule> rules;

	// The list is shared with the resolver so that rules added later are seen here
	public RuleBasedStrategy(List<ResolutionRule> rules)
	{
		this.rules = rules;
	}

	@Override
	public String getName()
	{
		return NAME;
	}

	@Override
	public Optional<ResolvedAmbiguity> resolve(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		for (ResolutionRule rule : rules)
		{
			if (rule.matches(ambiguity))
			{
				ContextFactor factor = new ContextFactor(ContextFactorType.SYNTACTIC_PATTERNS,
						"Matched pattern: " + rule.getPattern(), rule.getConfidence());
				return Optional.of(new ResolvedAmbiguity(ambiguity, rule.getResolution(), rule.getConfidence(),
						"Applied rule: " + rule.getRuleType().getDisplayName(), List.of(factor), NAME));
			}
		}
		return Optional.empty();
	}
}
