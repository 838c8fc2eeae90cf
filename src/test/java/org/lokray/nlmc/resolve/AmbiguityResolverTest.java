package org.lokray.nlmc.resolve;

import org.junit.jupiter.api.Test;
import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ControlFlowGraph;
import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.IntentExtractor;
import org.lokray.nlmc.intent.IntentMetadata;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.StorageScope;
import org.lokray.nlmc.intent.operation.ArithmeticOp;
import org.lokray.nlmc.intent.operation.ArithmeticOperation;
import org.lokray.nlmc.oracle.OfflineOracle;
import org.lokray.nlmc.oracle.ScriptedOracle;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class AmbiguityResolverTest
{
	private static final String DECLARES_X_AND_Y = "{\"data_structures\": ["
			+ "{\"name\": \"x\", \"data_type\": \"int\", \"scope\": \"global\"},"
			+ "{\"name\": \"y\", \"data_type\": \"int\", \"scope\": \"global\"}]}";

	private static Ambiguity other(String id, String context, List<String> interpretations, List<Double> scores)
	{
		return new Ambiguity(id, Ambiguity.Kind.OTHER, "", "Which one is meant", context, interpretations, scores);
	}

	private static ProgramIntent intentWith(List<DataStructure> dataStructures, List<Ambiguity> ambiguities)
	{
		List<Operation> operations = new ArrayList<>();
		return new ProgramIntent(operations, dataStructures, ControlFlowGraph.straightLine(operations), List.of(),
				ambiguities, IntentMetadata.EMPTY);
	}

	@Test
	void pronounRuleBindsToMostRecentVariable()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("intent extraction", DECLARES_X_AND_Y);
		ProgramIntent intent = new IntentExtractor(oracle).extractIntent("Add x and y and print it");

		ResolutionResult result = new AmbiguityResolver(oracle).resolveAmbiguities(intent);

		assertEquals(1, result.getResolvedAmbiguities().size());
		ResolvedAmbiguity resolved = result.getResolvedAmbiguities().get(0);
		assertEquals(RuleBasedStrategy.NAME, resolved.getStrategy());
		assertEquals(AmbiguityResolver.MOST_RECENT_VARIABLE, resolved.getChosenInterpretation());
		assertEquals(0.7, resolved.getConfidence());
		assertEquals(List.of("y"), intent.findOperation("op_1").orElseThrow().getInputs());
		assertTrue(intent.getAmbiguities().isEmpty());
	}

	@Test
	void eachPronounIsMatchedByItsOwnRule()
	{
		ProgramIntent intent = new IntentExtractor(OfflineOracle.INSTANCE).extractIntent("number x. print it and show this");

		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intent);

		assertEquals(2, result.getResolvedAmbiguities().size());
		ResolvedAmbiguity it = result.getResolvedAmbiguities().get(0);
		assertEquals("pronoun_ambiguity_it", it.getOriginalAmbiguity().getId());
		assertEquals(AmbiguityResolver.MOST_RECENT_VARIABLE, it.getChosenInterpretation());
		assertEquals(0.7, it.getConfidence());

		ResolvedAmbiguity self = result.getResolvedAmbiguities().get(1);
		assertEquals("pronoun_ambiguity_this", self.getOriginalAmbiguity().getId());
		assertEquals(RuleBasedStrategy.NAME, self.getStrategy());
		assertEquals(AmbiguityResolver.CURRENT_CONTEXT_VARIABLE, self.getChosenInterpretation());
		assertEquals(0.8, self.getConfidence());
	}

	@Test
	void pronounWithoutVariablesKeepsOperationInputs()
	{
		ProgramIntent intent = new IntentExtractor(OfflineOracle.INSTANCE).extractIntent("Add x and y and print it");

		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intent);

		assertEquals(1, result.getResolvedAmbiguities().size());
		assertEquals(List.of("it"), intent.findOperation("op_1").orElseThrow().getInputs());
	}

	@Test
	void resolvedAndRemainingPartitionTheOriginal()
	{
		Ambiguity resolvable = other("units", "length units", List.of("meters", "feet"), List.of(0.5, 0.5));
		Ambiguity hopeless = other("void", "nothing to go on", List.of(), List.of());
		ProgramIntent intent = intentWith(List.of(), List.of(resolvable, hopeless));

		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intent);

		assertEquals(List.of(resolvable), result.getResolvedAmbiguities().stream().map(ResolvedAmbiguity::getOriginalAmbiguity).toList());
		assertEquals(List.of(hopeless), result.getRemainingAmbiguities());
		assertEquals(List.of(hopeless), intent.getAmbiguities());
	}

	@Test
	void defaultAssumptionPicksFirstInterpretation()
	{
		Ambiguity ambiguity = other("units", "length units", List.of("meters", "feet"), List.of(0.4, 0.6));
		ProgramIntent intent = intentWith(List.of(), List.of(ambiguity));

		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intent);

		ResolvedAmbiguity resolved = result.getResolvedAmbiguities().get(0);
		assertEquals("meters", resolved.getChosenInterpretation());
		assertEquals(0.3, resolved.getConfidence());
		assertEquals(DefaultAssumptionStrategy.NAME, resolved.getStrategy());
		assertEquals(0.3, result.getConfidenceScore());
	}

	@Test
	void oracleAnswerIsUsedBeforeDefault()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("ambiguity resolution",
				"```json\n{\"chosen_interpretation\": \"feet\", \"confidence\": 1.4, \"reasoning\": \"US context\","
						+ " \"context_factors\": [{\"factor_type\": \"DomainKnowledge\", \"description\": \"US\", \"weight\": 0.9},"
						+ " {\"factor_type\": \"Mystery\", \"description\": \"?\", \"weight\": 0.1}]}\n```");
		Ambiguity ambiguity = other("units", "length units", List.of("meters", "feet"), List.of(0.5, 0.5));
		ProgramIntent intent = intentWith(List.of(), List.of(ambiguity));

		ResolvedAmbiguity resolved = new AmbiguityResolver(oracle).resolveAmbiguities(intent).getResolvedAmbiguities().get(0);

		assertEquals(OracleReasoningStrategy.NAME, resolved.getStrategy());
		assertEquals("feet", resolved.getChosenInterpretation());
		assertEquals(1.0, resolved.getConfidence());
		assertEquals(List.of(ContextFactorType.DOMAIN_KNOWLEDGE, ContextFactorType.USER_INTENT),
				resolved.getContextFactors().stream().map(ContextFactor::getType).toList());
	}

	@Test
	void incompleteOracleAnswerFallsThrough()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("ambiguity resolution", "{\"chosen_interpretation\": \"feet\"}");
		Ambiguity ambiguity = other("units", "length units", List.of("meters", "feet"), List.of(0.5, 0.5));

		ResolutionResult result = new AmbiguityResolver(oracle).resolveAmbiguities(intentWith(List.of(), List.of(ambiguity)));

		assertEquals(DefaultAssumptionStrategy.NAME, result.getResolvedAmbiguities().get(0).getStrategy());
	}

	@Test
	void contextualStrategyUsesMostRecentVariable()
	{
		List<DataStructure> vars = List.of(new DataStructure("x", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("y", DataType.INT32, StorageScope.GLOBAL));
		Ambiguity pronoun = new Ambiguity("pronoun_ambiguity_that", Ambiguity.Kind.PRONOUN, "that", "Ambiguous pronoun",
				"show that", List.of("a", "b"), List.of(0.5, 0.5));
		ProgramIntent intent = intentWith(vars, List.of(pronoun));

		Optional<ResolvedAmbiguity> resolved = new ContextualInferenceStrategy().resolve(pronoun, ResolutionContext.of(intent), intent);

		assertTrue(resolved.isPresent());
		assertEquals("y", resolved.get().getChosenInterpretation());
		assertEquals(0.75, resolved.get().getConfidence());
	}

	@Test
	void pronounWithoutRuleFallsToContextualStrategy()
	{
		List<DataStructure> vars = List.of(new DataStructure("total", DataType.INT32, StorageScope.GLOBAL));
		Ambiguity pronoun = new Ambiguity("pronoun_ambiguity_that", Ambiguity.Kind.PRONOUN, "that", "Ambiguous pronoun",
				"show that", List.of("a"), List.of(1.0));
		ProgramIntent intent = intentWith(vars, List.of(pronoun));
		AmbiguityResolver resolver = new AmbiguityResolver(OfflineOracle.INSTANCE);

		Optional<ResolvedAmbiguity> resolved = resolver.resolveSingle(pronoun, ResolutionContext.of(intent), intent);

		assertEquals(ContextualInferenceStrategy.NAME, resolved.orElseThrow().getStrategy());
		assertEquals("total", resolved.get().getChosenInterpretation());
	}

	@Test
	void calculateSumRuleRewritesOperation()
	{
		Operation calculate = new Operation("op_0", new ArithmeticOperation(ArithmeticOp.MULTIPLY), List.of("a", "b"),
				List.of("s"), "calculate the sum", 0.5);
		List<Operation> operations = List.of(calculate);
		Ambiguity ambiguity = new Ambiguity("operation_ambiguity", Ambiguity.Kind.OPERATION, "calculate",
				"Ambiguous calculation operation", "calculate the sum of a and b", List.of("Addition operation"), List.of(1.0));
		ProgramIntent intent = new ProgramIntent(operations, List.of(), ControlFlowGraph.straightLine(operations), List.of(),
				List.of(ambiguity), IntentMetadata.EMPTY);

		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intent);

		assertEquals(AmbiguityResolver.ADDITION_OPERATION, result.getResolvedAmbiguities().get(0).getChosenInterpretation());
		assertEquals(0.9, result.getResolvedAmbiguities().get(0).getConfidence());
		assertEquals(new ArithmeticOperation(ArithmeticOp.ADD), calculate.getType());
	}

	@Test
	void addedRulesAreSeenByRuleStrategy()
	{
		AmbiguityResolver resolver = new AmbiguityResolver(OfflineOracle.INSTANCE);
		resolver.addResolutionRule(new ResolutionRule(RuleType.SCOPE_RESOLUTION, "units", "meters", 0.95));
		Ambiguity ambiguity = other("units", "length units", List.of("meters", "feet"), List.of(0.5, 0.5));

		ResolutionResult result = resolver.resolveAmbiguities(intentWith(List.of(), List.of(ambiguity)));

		assertEquals(RuleBasedStrategy.NAME, result.getResolvedAmbiguities().get(0).getStrategy());
		assertEquals(0.95, result.getResolvedAmbiguities().get(0).getConfidence());
		assertEquals(7, resolver.getResolutionStats().get("total_rules"));
		assertEquals(1, resolver.getResolutionStats().get("context_history_size"));
		assertEquals(4, resolver.getStrategies().size());
	}

	@Test
	void noAmbiguitiesIsEmptyResult()
	{
		ResolutionResult result = new AmbiguityResolver(OfflineOracle.INSTANCE).resolveAmbiguities(intentWith(List.of(), List.of()));
		assertTrue(result.getResolvedAmbiguities().isEmpty());
		assertTrue(result.getRemainingAmbiguities().isEmpty());
		assertEquals(0.0, result.getConfidenceScore());
	}
}
