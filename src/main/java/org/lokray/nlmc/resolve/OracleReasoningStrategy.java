package org.lokray.nlmc.resolve;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.oracle.OracleResponses;
import org.lokray.nlmc.oracle.ReasoningOracle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks the oracle to pick an interpretation. An answer missing the chosen interpretation,
 * the confidence or the reasoning counts as no answer.
 */
public class OracleReasoningStrategy implements ResolutionStrategy
{
	public static final String NAME = "LLMReasoning";

	private final ReasoningOracle oracle;

	public OracleReasoningStrategy(ReasoningOracle oracle)
	{
		this.oracle = oracle;
	}

	@Override
	public String getName()
	{
		return NAME;
	}

	@Override
	public Optional<ResolvedAmbiguity> resolve(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		Optional<JsonObject> answer = OracleResponses.queryObject(oracle, "Ambiguity resolution", buildPrompt(ambiguity, context, intent));
		return answer.flatMap(json -> toResolution(ambiguity, json));
	}

	static Optional<ResolvedAmbiguity> toResolution(Ambiguity ambiguity, JsonObject json)
	{
		String interpretation = OracleResponses.getString(json, "chosen_interpretation", null);
		Optional<Double> confidence = OracleResponses.getNumber(json, "confidence");
		String reasoning = OracleResponses.getString(json, "reasoning", null);
		if (interpretation == null || confidence.isEmpty() || reasoning == null)
		{
			return Optional.empty();
		}

		List<ContextFactor> factors = new ArrayList<>();
		JsonElement rawFactors = json.get("context_factors");
		if (rawFactors != null && rawFactors.isJsonArray())
		{
			for (JsonElement element : rawFactors.getAsJsonArray())
			{
				if (!element.isJsonObject())
				{
					continue;
				}
				JsonObject factor = element.getAsJsonObject();
				String type = OracleResponses.getString(factor, "factor_type", null);
				String description = OracleResponses.getString(factor, "description", null);
				Optional<Double> weight = OracleResponses.getNumber(factor, "weight");
				if (type != null && description != null && weight.isPresent())
				{
					factors.add(new ContextFactor(ContextFactorType.fromWireName(type), description, weight.get()));
				}
			}
		}

		double clamped = Math.max(0.0, Math.min(1.0, confidence.get()));
		return Optional.of(new ResolvedAmbiguity(ambiguity, interpretation, clamped, reasoning, factors, NAME));
	}

	static String buildPrompt(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent)
	{
		return "You are an ambiguity resolution agent. Resolve the following ambiguity using context and reasoning.\n\n"
				+ "AMBIGUITY TO RESOLVE:\n"
				+ "Description: " + ambiguity.getDescription() + "\n"
				+ "Possible Interpretations: " + ambiguity.getPossibleInterpretations() + "\n"
				+ "Context: " + ambiguity.getContext() + "\n"
				+ "Confidence Scores: " + ambiguity.getConfidenceScores() + "\n\n"
				+ "PROGRAM CONTEXT:\n"
				+ "Variables in scope: " + context.getVariablesInScope() + "\n"
				+ "Recent operations: " + context.getRecentOperations() + "\n"
				+ "Current types: " + context.getCurrentTypes() + "\n"
				+ "Control flow state: " + context.getControlFlowState() + "\n\n"
				+ "PROGRAM INTENT:\n"
				+ "Total operations: " + intent.getOperations().size() + "\n"
				+ "Data structures: " + intent.getDataStructures().size() + "\n\n"
				+ "Respond with a JSON object:\n"
				+ "{\"chosen_interpretation\": \"...\", \"confidence\": 0.85, \"reasoning\": \"...\", "
				+ "\"context_factors\": [{\"factor_type\": \"VariableTypes\", \"description\": \"...\", \"weight\": 0.8}]}\n"
				+ "Return ONLY the JSON object.";
	}
}
