package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.operation.ArithmeticOp;
import org.lokray.nlmc.intent.operation.ArithmeticOperation;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Second pipeline stage. Runs every ambiguity of an intent through the strategy cascade,
 * applies each resolution to the intent's operations and leaves only the unresolved
 * ambiguities on the intent.
 */
public class AmbiguityResolver
{
	public static final String MOST_RECENT_VARIABLE = "most_recent_variable";
	public static final String CURRENT_CONTEXT_VARIABLE = "current_context_variable";
	public static final String ADDITION_OPERATION = "addition_operation";
	public static final String MULTIPLICATION_OPERATION = "multiplication_operation";

	private final List<ResolutionRule> rules = new ArrayList<>();
	private final List<ResolutionStrategy> strategies = new ArrayList<>();
	private final List<ResolutionContext> contextHistory = new ArrayList<>();

	public AmbiguityResolver(ReasoningOracle oracle)
	{
		rules.addAll(defaultRules());
		strategies.add(new RuleBasedStrategy(rules));
		strategies.add(new ContextualInferenceStrategy());
		strategies.add(new OracleReasoningStrategy(oracle));
		strategies.add(new DefaultAssumptionStrategy());
	}

	private static List<ResolutionRule> defaultRules()
	{
		List<ResolutionRule> list = new ArrayList<>();
		list.add(new ResolutionRule(RuleType.PRONOUN_REFERENCE, "\\bit\\b", MOST_RECENT_VARIABLE, 0.7));
		list.add(new ResolutionRule(RuleType.PRONOUN_REFERENCE, "\\bthis\\b", CURRENT_CONTEXT_VARIABLE, 0.8));
		list.add(new ResolutionRule(RuleType.OPERATION_DISAMBIGUATION, "calculate.*sum", ADDITION_OPERATION, 0.9));
		list.add(new ResolutionRule(RuleType.OPERATION_DISAMBIGUATION, "calculate.*product", MULTIPLICATION_OPERATION, 0.9));
		list.add(new ResolutionRule(RuleType.TYPE_INFERENCE, "number|integer|count", "integer_type", 0.8));
		list.add(new ResolutionRule(RuleType.TYPE_INFERENCE, "decimal|float|real", "float_type", 0.8));
		return list;
	}

	/**
	 * Resolves what it can and rewrites the intent in place. After the call the intent's
	 * ambiguity list holds exactly the remaining ambiguities.
	 */
	public ResolutionResult resolveAmbiguities(ProgramIntent intent)
	{
		List<Ambiguity> original = intent.getAmbiguities();
		Debug.logDebug("Resolving " + original.size() + " ambiguities");
		if (original.isEmpty())
		{
			return ResolutionResult.empty();
		}

		ResolutionContext context = ResolutionContext.of(intent);
		contextHistory.add(context);

		List<ResolvedAmbiguity> resolved = new ArrayList<>();
		List<Ambiguity> remaining = new ArrayList<>();
		for (Ambiguity ambiguity : original)
		{
			Optional<ResolvedAmbiguity> resolution = resolveSingle(ambiguity, context, intent);
			if (resolution.isPresent())
			{
				resolved.add(resolution.get());
				applyResolution(resolution.get(), intent, context);
			}
			else
			{
				Debug.logWarning("Could not resolve ambiguity: " + ambiguity.getDescription());
				remaining.add(ambiguity);
			}
		}

		intent.setAmbiguities(remaining);
		Debug.logDebug("Resolved " + resolved.size() + "/" + original.size() + " ambiguities");
		return new ResolutionResult(resolved, remaining);
	}

	Optional<ResolvedAmbiguity> resolveSingle(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		for (ResolutionStrategy strategy : strategies)
		{
			Optional<ResolvedAmbiguity> resolution = strategy.resolve(ambiguity, context, intent);
			if (resolution.isPresent())
			{
				Debug.logDebug("  " + ambiguity.getId() + " resolved by " + strategy.getName());
				return resolution;
			}
		}
		return Optional.empty();
	}

	private void applyResolution(ResolvedAmbiguity resolved, ProgramIntent intent, ResolutionContext context)
	{
		switch (resolved.getOriginalAmbiguity().getKind())
		{
			case PRONOUN -> applyPronounResolution(resolved, intent, context);
			case OPERATION -> applyOperationResolution(resolved, intent);
			default -> Debug.logDebug("Applied generic resolution for ambiguity: " + resolved.getOriginalAmbiguity().getId());
		}
	}

	private void applyPronounResolution(ResolvedAmbiguity resolved, ProgramIntent intent, ResolutionContext context)
	{
		String pronoun = resolved.getOriginalAmbiguity().getSubject();
		if (pronoun.isEmpty())
		{
			return;
		}
		Pattern wholeWord = Pattern.compile("\\b" + Pattern.quote(pronoun) + "\\b", Pattern.CASE_INSENSITIVE);
		String chosen = resolved.getChosenInterpretation();

		String previousResult = null;
		for (Operation operation : intent.getOperations())
		{
			Optional<String> binding = bind(chosen, context, previousResult);
			if (binding.isPresent())
			{
				String target = binding.get();
				for (String input : List.copyOf(operation.getInputs()))
				{
					if (input.equalsIgnoreCase(pronoun))
					{
						operation.replaceInput(input, target);
					}
				}
				Matcher matcher = wholeWord.matcher(operation.getDescription());
				operation.setDescription(matcher.replaceAll(Matcher.quoteReplacement(target)));
			}
			if (!operation.getOutputs().isEmpty())
			{
				previousResult = operation.getOutputs().get(0);
			}
		}
	}

	/**
	 * Turns a chosen interpretation into the name that replaces the pronoun. Symbolic
	 * interpretations need a variable (or an earlier result) to bind to.
	 */
	private static Optional<String> bind(String chosen, ResolutionContext context, String previousResult)
	{
		String lower = chosen.toLowerCase(Locale.ROOT);
		if (lower.equals(MOST_RECENT_VARIABLE) || lower.equals(CURRENT_CONTEXT_VARIABLE) || lower.contains("previously mentioned variable"))
		{
			return context.getMostRecentVariable();
		}
		if (lower.contains("result of previous operation"))
		{
			return Optional.ofNullable(previousResult);
		}
		return chosen.isBlank() ? Optional.empty() : Optional.of(chosen);
	}

	private void applyOperationResolution(ResolvedAmbiguity resolved, ProgramIntent intent)
	{
		String chosen = resolved.getChosenInterpretation().toLowerCase(Locale.ROOT);
		for (Operation operation : intent.getOperations())
		{
			if (!operation.getDescription().toLowerCase(Locale.ROOT).contains("calculate"))
			{
				continue;
			}
			if (chosen.equals(ADDITION_OPERATION) || chosen.equals("addition operation"))
			{
				operation.setType(new ArithmeticOperation(ArithmeticOp.ADD));
			}
			else if (chosen.equals(MULTIPLICATION_OPERATION) || chosen.equals("multiplication operation"))
			{
				operation.setType(new ArithmeticOperation(ArithmeticOp.MULTIPLY));
			}
			else if (chosen.equals(ContextualInferenceStrategy.FLOATING_POINT_OPERATION))
			{
				operation.setDescription(operation.getDescription() + " (floating-point)");
			}
		}
	}

	public Map<String, Integer> getResolutionStats()
	{
		Map<String, Integer> stats = new LinkedHashMap<>();
		stats.put("total_rules", rules.size());
		stats.put("context_history_size", contextHistory.size());
		return stats;
	}

	public void addResolutionRule(ResolutionRule rule)
	{
		rules.add(rule);
	}

	public List<ResolutionStrategy> getStrategies()
	{
		return Collections.unmodifiableList(strategies);
	}
}
