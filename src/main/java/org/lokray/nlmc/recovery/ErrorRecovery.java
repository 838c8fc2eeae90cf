package org.lokray.nlmc.recovery;

import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a recorded compilation error into a recovery action. Never throws, and handling
 * the same error twice returns the first result without recording it again.
 */
public class ErrorRecovery
{
	private static final double FALLBACK_SUCCESS_RATE = 0.3;

	private final List<RecoveryStrategy> strategies;
	private final Map<CompilationError, RecoveryResult> history = new LinkedHashMap<>();

	public ErrorRecovery()
	{
		this.strategies = List.of(
				new RecoveryStrategy(RecoveryStrategy.Type.USE_DEFAULT,
						EnumSet.of(ErrorType.UNDEFINED_REFERENCE, ErrorType.TYPE_MISMATCH, ErrorType.AMBIGUITY_RESOLUTION_FAILURE),
						0.7, "Use sensible defaults for undefined or ambiguous elements"),
				new RecoveryStrategy(RecoveryStrategy.Type.RETRY_WITH_MODIFICATION,
						EnumSet.of(ErrorType.LLM_COMMUNICATION_ERROR, ErrorType.OPTIMIZATION_FAILURE),
						0.8, "Retry the operation with modified parameters"),
				new RecoveryStrategy(RecoveryStrategy.Type.FALLBACK_IMPLEMENTATION,
						EnumSet.of(ErrorType.CODE_GENERATION_ERROR, ErrorType.OPTIMIZATION_FAILURE),
						0.9, "Use a simpler, more reliable implementation"),
				new RecoveryStrategy(RecoveryStrategy.Type.SKIP_AND_CONTINUE,
						EnumSet.of(ErrorType.SEMANTIC_ERROR, ErrorType.MEMORY_LAYOUT_ERROR),
						0.5, "Skip the problematic element and continue compilation"),
				new RecoveryStrategy(RecoveryStrategy.Type.ALTERNATIVE_APPROACH,
						EnumSet.of(ErrorType.SYNTAX_ERROR, ErrorType.SEMANTIC_ERROR),
						0.6, "Try an alternative interpretation or approach"));
	}

	public RecoveryResult handleError(CompilationError error)
	{
		RecoveryResult previous = history.get(error);
		if (previous != null)
		{
			Debug.logDebug("Error already handled, reusing result: " + error);
			return previous;
		}

		Debug.logDebug("Handling compilation error: " + error);
		RecoveryStrategy strategy = selectStrategy(error);
		RecoveryResult result = attemptRecovery(error, strategy);
		history.put(error, result);

		if (result.getOutcome().isRecovered())
		{
			Debug.logDebug("Recovery " + result);
		}
		else
		{
			Debug.logWarning("Recovery " + result);
		}
		return result;
	}

	/**
	 * Highest-scoring strategy applicable to the error; ties go to the earlier strategy.
	 */
	public RecoveryStrategy selectStrategy(CompilationError error)
	{
		RecoveryStrategy best = null;
		double bestScore = 0.0;
		for (RecoveryStrategy strategy : strategies)
		{
			if (strategy.appliesTo(error.getType()))
			{
				double score = strategy.score(error.getSeverity());
				if (score > bestScore)
				{
					bestScore = score;
					best = strategy;
				}
			}
		}

		if (best == null)
		{
			return new RecoveryStrategy(RecoveryStrategy.Type.SKIP_AND_CONTINUE, EnumSet.of(error.getType()),
					FALLBACK_SUCCESS_RATE, "Default fallback strategy");
		}
		return best;
	}

	private RecoveryResult attemptRecovery(CompilationError error, RecoveryStrategy strategy)
	{
		RecoveryStrategy.Type type = strategy.getType();
		switch (type)
		{
			case USE_DEFAULT:
				return applyDefault(error, type);
			case RETRY_WITH_MODIFICATION:
				return applyRetry(error, type);
			case FALLBACK_IMPLEMENTATION:
				return applyFallback(error, type);
			case SKIP_AND_CONTINUE:
				return new RecoveryResult(RecoveryOutcome.PARTIAL_SUCCESS, type, "Skipped problematic element: " + error.getMessage(),
						List.of("program_structure"), 0.5,
						List.of("Skipped problematic code section", "Program functionality may be reduced"));
			case ALTERNATIVE_APPROACH:
				return applyAlternative(error, type);
			case USER_INTERACTION:
			default:
				return new RecoveryResult(RecoveryOutcome.REQUIRES_USER_INPUT, type, "Requested user clarification", List.of(), 0.0,
						List.of("User input required to resolve error"));
		}
	}

	private static RecoveryResult applyDefault(CompilationError error, RecoveryStrategy.Type type)
	{
		switch (error.getType())
		{
			case UNDEFINED_REFERENCE:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Inserted default variable definition",
						List.of("variable_definition"), 0.8, List.of("Using default type i32 for undefined variable"));
			case TYPE_MISMATCH:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Applied implicit type conversion",
						List.of("type_conversion"), 0.7, List.of("Implicit type conversion may lose precision"));
			case AMBIGUITY_RESOLUTION_FAILURE:
				return new RecoveryResult(RecoveryOutcome.PARTIAL_SUCCESS, type, "Used first available interpretation",
						List.of("ambiguity_resolution"), 0.5, List.of("Ambiguity resolved with low confidence"));
			default:
				return new RecoveryResult(RecoveryOutcome.FAILED, type, "No default recovery available", List.of(), 0.0,
						List.of("Could not apply default recovery"));
		}
	}

	private static RecoveryResult applyRetry(CompilationError error, RecoveryStrategy.Type type)
	{
		switch (error.getType())
		{
			case LLM_COMMUNICATION_ERROR:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Retried LLM call with reduced complexity",
						List.of("llm_prompt"), 0.8, List.of("Using simplified prompt for LLM"));
			case OPTIMIZATION_FAILURE:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Retried optimization with lower level",
						List.of("optimization_level"), 0.9, List.of("Reduced optimization level"));
			default:
				return new RecoveryResult(RecoveryOutcome.FAILED, type, "Retry not applicable for this error type", List.of(), 0.0,
						List.of("Retry strategy not suitable"));
		}
	}

	private static RecoveryResult applyFallback(CompilationError error, RecoveryStrategy.Type type)
	{
		switch (error.getType())
		{
			case CODE_GENERATION_ERROR:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Used simple code generation without optimizations",
						List.of("code_generator"), 0.9, List.of("Generated unoptimized code"));
			case OPTIMIZATION_FAILURE:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Disabled problematic optimization pass",
						List.of("optimization_passes"), 0.8, List.of("Some optimizations disabled"));
			default:
				return new RecoveryResult(RecoveryOutcome.PARTIAL_SUCCESS, type, "Applied generic fallback",
						List.of("compilation_strategy"), 0.6, List.of("Using fallback implementation"));
		}
	}

	private static RecoveryResult applyAlternative(CompilationError error, RecoveryStrategy.Type type)
	{
		switch (error.getType())
		{
			case SYNTAX_ERROR:
				return new RecoveryResult(RecoveryOutcome.SUCCESS, type, "Applied alternative syntax interpretation",
						List.of("syntax_tree"), 0.7, List.of("Used alternative syntax interpretation"));
			case SEMANTIC_ERROR:
				return new RecoveryResult(RecoveryOutcome.PARTIAL_SUCCESS, type, "Applied alternative semantic interpretation",
						List.of("semantic_model"), 0.6, List.of("Alternative semantic interpretation may be incorrect"));
			default:
				return new RecoveryResult(RecoveryOutcome.FAILED, type, "No alternative approach available", List.of(), 0.0,
						List.of("Could not find alternative approach"));
		}
	}

	public ErrorStatistics getErrorStatistics()
	{
		Map<ErrorType, Integer> byType = new EnumMap<>(ErrorType.class);
		Map<ErrorSeverity, Integer> bySeverity = new EnumMap<>(ErrorSeverity.class);
		Map<CompilationStage, Integer> byStage = new EnumMap<>(CompilationStage.class);
		int recovered = 0;

		for (Map.Entry<CompilationError, RecoveryResult> entry : history.entrySet())
		{
			CompilationError error = entry.getKey();
			byType.merge(error.getType(), 1, Integer::sum);
			bySeverity.merge(error.getSeverity(), 1, Integer::sum);
			error.getLocation().ifPresent(location -> byStage.merge(location.getStage(), 1, Integer::sum));
			if (entry.getValue().getOutcome().isRecovered())
			{
				recovered++;
			}
		}

		double successRate = history.isEmpty() ? 0.0 : (double) recovered / history.size();
		return new ErrorStatistics(history.size(), byType, bySeverity, byStage, successRate);
	}

	public List<CompilationError> getErrorHistory()
	{
		return Collections.unmodifiableList(new ArrayList<>(history.keySet()));
	}

	public List<RecoveryStrategy> getStrategies()
	{
		return strategies;
	}

	public void clearHistory()
	{
		history.clear();
	}
}
