package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ProgramIntent;

import java.util.List;
import java.util.Optional;

public class DefaultAssumptionStrategy implements ResolutionStrategy
{
	public static final String NAME = "DefaultAssumption";

	@Override
	public String getName()
	{
		return NAME;
	}

	@Override
	public Optional<ResolvedAmbiguity> resolve(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		if (ambiguity.getPossibleInterpretations().isEmpty())
		{
			return Optional.empty();
		}
		return Optional.of(new ResolvedAmbiguity(ambiguity, ambiguity.getPossibleInterpretations().get(0), 0.3,
				"Default resolution - chose first available interpretation",
				List.of(new ContextFactor(ContextFactorType.USER_INTENT, "No strong contextual evidence, using default", 0.3)),
				NAME));
	}
}
