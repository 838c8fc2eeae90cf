package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ProgramIntent;

import java.util.List;
import java.util.Optional;

public class ContextualInferenceStrategy implements ResolutionStrategy
{
	public static final String NAME = "ContextualInference";
	public static final String FLOATING_POINT_OPERATION = "floating_point_operation";

	@Override
	public String getName()
	{
		return NAME;
	}

	@Override
	public Optional<ResolvedAmbiguity> resolve(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		if (ambiguity.getKind() == Ambiguity.Kind.PRONOUN)
		{
			return context.getMostRecentVariable().map(variable -> new ResolvedAmbiguity(ambiguity, variable, 0.75,
					"Resolved pronoun to most recently mentioned variable",
					List.of(new ContextFactor(ContextFactorType.PREVIOUS_OPERATIONS, "Most recent variable: " + variable, 0.8)),
					NAME));
		}

		if (ambiguity.getKind() == Ambiguity.Kind.OPERATION && context.hasFloatVariables() && !context.hasIntegerVariables())
		{
			return Optional.of(new ResolvedAmbiguity(ambiguity, FLOATING_POINT_OPERATION, 0.8,
					"Context contains only floating-point types",
					List.of(new ContextFactor(ContextFactorType.VARIABLE_TYPES, "All variables are floating-point", 0.9)),
					NAME));
		}
		return Optional.empty();
	}
}
