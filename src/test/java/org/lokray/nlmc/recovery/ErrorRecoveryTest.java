package org.lokray.nlmc.recovery;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorRecoveryTest
{
	@Test
	void shipsFiveStrategies()
	{
		List<RecoveryStrategy> strategies = new ErrorRecovery().getStrategies();

		assertEquals(5, strategies.size());
		assertEquals(RecoveryStrategy.Type.USE_DEFAULT, strategies.get(0).getType());
		assertTrue(strategies.get(1).appliesTo(ErrorType.LLM_COMMUNICATION_ERROR));
		assertTrue(strategies.get(2).appliesTo(ErrorType.CODE_GENERATION_ERROR));
		assertFalse(strategies.stream().anyMatch(s -> s.appliesTo(ErrorType.SYSTEM_ERROR)));
	}

	@Test
	void undefinedReferenceUsesDefault()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		CompilationError error = new CompilationError(ErrorType.UNDEFINED_REFERENCE, "Undefined variable or function: y", ErrorSeverity.ERROR);

		RecoveryStrategy strategy = recovery.selectStrategy(error);
		assertEquals(RecoveryStrategy.Type.USE_DEFAULT, strategy.getType());
		assertEquals(0.75, strategy.score(ErrorSeverity.ERROR), 1e-9);

		RecoveryResult result = recovery.handleError(error);
		assertEquals(RecoveryOutcome.SUCCESS, result.getOutcome());
		assertEquals("Inserted default variable definition", result.getActionTaken());
		assertEquals(List.of("variable_definition"), result.getModifiedElements());
		assertEquals(0.8, result.getConfidence(), 1e-9);
	}

	@Test
	void optimizationFailurePrefersFallbackOverRetry()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		CompilationError error = new CompilationError(ErrorType.OPTIMIZATION_FAILURE, "pass crashed", ErrorSeverity.ERROR);

		RecoveryResult result = recovery.handleError(error);

		assertEquals(RecoveryStrategy.Type.FALLBACK_IMPLEMENTATION, result.getStrategy());
		assertEquals("Disabled problematic optimization pass", result.getActionTaken());
	}

	@Test
	void semanticErrorTakesAlternativeApproach()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		CompilationError fatal = new CompilationError(ErrorType.SEMANTIC_ERROR, "analysis failed", ErrorSeverity.FATAL);

		RecoveryStrategy strategy = recovery.selectStrategy(fatal);
		assertEquals(RecoveryStrategy.Type.ALTERNATIVE_APPROACH, strategy.getType());
		assertEquals(0.66, strategy.score(ErrorSeverity.FATAL), 1e-9);

		RecoveryResult result = recovery.handleError(fatal);
		assertEquals(RecoveryOutcome.PARTIAL_SUCCESS, result.getOutcome());
		assertEquals(List.of("semantic_model"), result.getModifiedElements());
	}

	@Test
	void unmatchedErrorGetsFallbackSkip()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		CompilationError error = new CompilationError(ErrorType.SYSTEM_ERROR, "disk full", ErrorSeverity.ERROR);

		RecoveryStrategy strategy = recovery.selectStrategy(error);
		assertEquals(RecoveryStrategy.Type.SKIP_AND_CONTINUE, strategy.getType());
		assertEquals(0.3, strategy.getSuccessRate(), 1e-9);
		assertEquals("Default fallback strategy", strategy.getDescription());

		RecoveryResult result = recovery.handleError(error);
		assertEquals(RecoveryOutcome.PARTIAL_SUCCESS, result.getOutcome());
		assertEquals("Skipped problematic element: disk full", result.getActionTaken());
	}

	@Test
	void handlingTheSameErrorTwiceIsRecordedOnce()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		CompilationError error = new CompilationError(ErrorType.TYPE_MISMATCH, "bool used as number", ErrorSeverity.WARNING);

		RecoveryResult first = recovery.handleError(error);
		RecoveryResult second = recovery.handleError(new CompilationError(ErrorType.TYPE_MISMATCH, "bool used as number", ErrorSeverity.WARNING));

		assertSame(first, second);
		assertEquals(1, recovery.getErrorHistory().size());
	}

	@Test
	void statisticsCountByTypeSeverityAndStage()
	{
		ErrorRecovery recovery = new ErrorRecovery();
		assertEquals(0.0, recovery.getErrorStatistics().getRecoverySuccessRate());

		ErrorLocation location = new ErrorLocation(CompilationStage.SEMANTIC_ANALYSIS, "SemanticAnalyzer", 2, null);
		recovery.handleError(new CompilationError(ErrorType.UNDEFINED_REFERENCE, "Undefined variable or function: a", location,
				ErrorSeverity.ERROR, List.of("Declare a"), "print a"));
		recovery.handleError(new CompilationError(ErrorType.UNDEFINED_REFERENCE, "Undefined variable or function: b", ErrorSeverity.ERROR));
		recovery.handleError(new CompilationError(ErrorType.RUNTIME_ERROR, "boom", ErrorSeverity.FATAL));

		ErrorStatistics statistics = recovery.getErrorStatistics();
		assertEquals(3, statistics.getTotalErrors());
		assertEquals(Map.of(ErrorType.UNDEFINED_REFERENCE, 2, ErrorType.RUNTIME_ERROR, 1), statistics.getErrorsByType());
		assertEquals(Map.of(ErrorSeverity.ERROR, 2, ErrorSeverity.FATAL, 1), statistics.getErrorsBySeverity());
		assertEquals(Map.of(CompilationStage.SEMANTIC_ANALYSIS, 1), statistics.getErrorsByStage());
		assertEquals(1.0, statistics.getRecoverySuccessRate(), 1e-9);

		recovery.clearHistory();
		assertEquals(0, recovery.getErrorStatistics().getTotalErrors());
		assertTrue(recovery.getErrorHistory().isEmpty());
	}

	@Test
	void locationRendersStageComponentAndLine()
	{
		ErrorLocation location = new ErrorLocation(CompilationStage.FLOW_ANALYSIS, "FlowAnalyzer", 4, 2);
		CompilationError error = new CompilationError(ErrorType.OPTIMIZATION_FAILURE, "bad edge", location, ErrorSeverity.WARNING, List.of(), null);

		assertEquals("FLOW_ANALYSIS/FlowAnalyzer:4:2", location.toString());
		assertEquals("WARNING OPTIMIZATION_FAILURE at FLOW_ANALYSIS/FlowAnalyzer:4:2: bad edge", error.toString());
		assertEquals("", error.getContext());
	}
}
