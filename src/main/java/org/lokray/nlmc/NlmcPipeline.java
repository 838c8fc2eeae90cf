package org.lokray.nlmc;

import org.lokray.nlmc.flow.FlowAnalyzer;
import org.lokray.nlmc.flow.FlowModel;
import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.IntentExtractor;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.recovery.CompilationError;
import org.lokray.nlmc.recovery.CompilationStage;
import org.lokray.nlmc.recovery.ErrorLocation;
import org.lokray.nlmc.recovery.ErrorRecovery;
import org.lokray.nlmc.recovery.ErrorSeverity;
import org.lokray.nlmc.recovery.ErrorType;
import org.lokray.nlmc.recovery.RecoveryOutcome;
import org.lokray.nlmc.recovery.RecoveryResult;
import org.lokray.nlmc.resolve.AmbiguityResolver;
import org.lokray.nlmc.resolve.ResolutionResult;
import org.lokray.nlmc.semantic.SemanticAnalyzer;
import org.lokray.nlmc.semantic.SemanticError;
import org.lokray.nlmc.semantic.SemanticModel;
import org.lokray.nlmc.types.TypeInferencer;
import org.lokray.nlmc.types.TypeModel;
import org.lokray.nlmc.util.Debug;
import org.lokray.nlmc.util.ErrorHandler;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs extraction, ambiguity resolution, semantic analysis, type inference and flow
 * analysis in order. A stage that throws is handed to {@link ErrorRecovery} and replaced
 * by its empty model, unless recovery fails, in which case compilation stops there.
 */
public class NlmcPipeline
{
	private final IntentExtractor extractor;
	private final AmbiguityResolver resolver;
	private final SemanticAnalyzer semanticAnalyzer;
	private final TypeInferencer typeInferencer;
	private final FlowAnalyzer flowAnalyzer;
	private final ErrorRecovery recovery;
	private final ErrorHandler errorHandler;

	public NlmcPipeline(ReasoningOracle oracle, ErrorHandler errorHandler)
	{
		this(new IntentExtractor(oracle), new AmbiguityResolver(oracle), new SemanticAnalyzer(oracle), new TypeInferencer(oracle),
				new FlowAnalyzer(oracle), new ErrorRecovery(), errorHandler);
	}

	public NlmcPipeline(IntentExtractor extractor, AmbiguityResolver resolver, SemanticAnalyzer semanticAnalyzer,
						TypeInferencer typeInferencer, FlowAnalyzer flowAnalyzer, ErrorRecovery recovery, ErrorHandler errorHandler)
	{
		this.extractor = extractor;
		this.resolver = resolver;
		this.semanticAnalyzer = semanticAnalyzer;
		this.typeInferencer = typeInferencer;
		this.flowAnalyzer = flowAnalyzer;
		this.recovery = recovery;
		this.errorHandler = errorHandler;
	}

	public CompilationResult compile(String text)
	{
		Diagnostics diagnostics = new Diagnostics();
		ProgramIntent intent = ProgramIntent.empty();
		ResolutionResult resolution = ResolutionResult.empty();
		SemanticModel semantic = SemanticModel.empty();
		TypeModel types = TypeModel.empty();
		FlowModel flow = FlowModel.empty();

		Debug.logStage(1, "Intent extraction");
		Optional<ProgramIntent> extracted = runStage(CompilationStage.INTENT_EXTRACTION, "IntentExtractor",
				() -> extractor.extractIntent(text), ProgramIntent::empty, diagnostics);
		if (extracted.isEmpty())
		{
			return finish(text, intent, resolution, semantic, types, flow, diagnostics, false);
		}
		intent = extracted.get();

		Debug.logStage(2, "Ambiguity resolution");
		ProgramIntent resolving = intent;
		Optional<ResolutionResult> resolved = runStage(CompilationStage.AMBIGUITY_RESOLUTION, "AmbiguityResolver",
				() -> resolver.resolveAmbiguities(resolving),
				() -> new ResolutionResult(List.of(), resolving.getAmbiguities()), diagnostics);
		if (resolved.isEmpty())
		{
			return finish(text, intent, resolution, semantic, types, flow, diagnostics, false);
		}
		resolution = resolved.get();

		Debug.logStage(3, "Semantic analysis");
		ProgramIntent analysed = intent;
		Optional<SemanticModel> analysedModel = runStage(CompilationStage.SEMANTIC_ANALYSIS, "SemanticAnalyzer",
				() -> semanticAnalyzer.analyze(analysed), SemanticModel::empty, diagnostics);
		if (analysedModel.isEmpty())
		{
			return finish(text, intent, resolution, semantic, types, flow, diagnostics, false);
		}
		semantic = analysedModel.get();

		Debug.logStage(4, "Type inference");
		SemanticModel semanticModel = semantic;
		Optional<TypeModel> inferred = runStage(CompilationStage.TYPE_INFERENCE, "TypeInferencer",
				() -> typeInferencer.inferTypes(analysed, semanticModel), TypeModel::empty, diagnostics);
		if (inferred.isEmpty())
		{
			return finish(text, intent, resolution, semantic, types, flow, diagnostics, false);
		}
		types = inferred.get();

		Debug.logStage(5, "Flow analysis");
		TypeModel typeModel = types;
		Optional<FlowModel> flowModel = runStage(CompilationStage.FLOW_ANALYSIS, "FlowAnalyzer",
				() -> flowAnalyzer.analyzeFlows(analysed, semanticModel, typeModel), FlowModel::empty, diagnostics);
		if (flowModel.isEmpty())
		{
			return finish(text, intent, resolution, semantic, types, flow, diagnostics, false);
		}
		flow = flowModel.get();

		return finish(text, intent, resolution, semantic, types, flow, diagnostics, true);
	}

	/**
	 * Runs one stage. An unexpected exception becomes a fatal {@link CompilationError}; the
	 * fallback model is used when recovery succeeds, and the result is empty when it fails.
	 */
	private <T> Optional<T> runStage(CompilationStage stage, String component, Supplier<T> body, Supplier<T> fallback,
									 Diagnostics diagnostics)
	{
		try
		{
			return Optional.of(body.get());
		}
		catch (RuntimeException e)
		{
			CompilationError error = new CompilationError(errorTypeOf(stage), component + " failed: " + e.getMessage(),
					new ErrorLocation(stage, component), ErrorSeverity.FATAL, List.of(), e.getClass().getSimpleName());
			errorHandler.logError(component, error.getMessage());
			RecoveryResult result = recovery.handleError(error);
			diagnostics.addRecovery(error, result);

			if (result.getOutcome() == RecoveryOutcome.FAILED)
			{
				errorHandler.logError(component, "Recovery failed, stopping: " + result.getActionTaken());
				return Optional.empty();
			}
			errorHandler.logWarning(component, "Continuing after recovery: " + result.getActionTaken());
			return Optional.of(fallback.get());
		}
	}

	private static ErrorType errorTypeOf(CompilationStage stage)
	{
		switch (stage)
		{
			case INTENT_EXTRACTION:
				return ErrorType.SYNTAX_ERROR;
			case AMBIGUITY_RESOLUTION:
				return ErrorType.AMBIGUITY_RESOLUTION_FAILURE;
			case SEMANTIC_ANALYSIS:
				return ErrorType.SEMANTIC_ERROR;
			case TYPE_INFERENCE:
				return ErrorType.TYPE_ERROR;
			case FLOW_ANALYSIS:
				return ErrorType.OPTIMIZATION_FAILURE;
			default:
				return ErrorType.SYSTEM_ERROR;
		}
	}

	private CompilationResult finish(String text, ProgramIntent intent, ResolutionResult resolution, SemanticModel semantic,
									 TypeModel types, FlowModel flow, Diagnostics diagnostics, boolean complete)
	{
		diagnostics.addSemanticErrors(semantic.getSemanticErrors());
		for (SemanticError semanticError : semantic.getSemanticErrors())
		{
			CompilationError error = toCompilationError(semanticError);
			if (error.getSeverity() == ErrorSeverity.ERROR)
			{
				errorHandler.logError("Semantic", semanticError.getMessage());
			}
			else
			{
				errorHandler.logWarning("Semantic", semanticError.getMessage());
			}
			recordRecovery(error, diagnostics);
		}

		diagnostics.addRemainingAmbiguities(resolution.getRemainingAmbiguities());
		for (Ambiguity ambiguity : resolution.getRemainingAmbiguities())
		{
			errorHandler.logWarning("Ambiguity", "Unresolved: " + ambiguity.getDescription());
			CompilationError error = new CompilationError(ErrorType.AMBIGUITY_RESOLUTION_FAILURE, ambiguity.getDescription(),
					new ErrorLocation(CompilationStage.AMBIGUITY_RESOLUTION, "AmbiguityResolver"), ErrorSeverity.WARNING,
					ambiguity.getPossibleInterpretations(), ambiguity.getContext());
			recordRecovery(error, diagnostics);
		}

		CompilationResult result = new CompilationResult(text, intent, resolution, semantic, types, flow, diagnostics, complete);
		Debug.logDebug(result.summary());
		return result;
	}

	private void recordRecovery(CompilationError error, Diagnostics diagnostics)
	{
		RecoveryResult result = recovery.handleError(error);
		diagnostics.addRecovery(error, result);
		for (String warning : result.getWarnings())
		{
			errorHandler.logWarning("Recovery", warning);
		}
	}

	static CompilationError toCompilationError(SemanticError semanticError)
	{
		ErrorType type;
		ErrorSeverity severity;
		switch (semanticError.getType())
		{
			case UNDEFINED_VARIABLE:
				type = ErrorType.UNDEFINED_REFERENCE;
				severity = ErrorSeverity.ERROR;
				break;
			case TYPE_MISMATCH:
				type = ErrorType.TYPE_MISMATCH;
				severity = ErrorSeverity.ERROR;
				break;
			case MEMORY_LEAK:
				type = ErrorType.MEMORY_LAYOUT_ERROR;
				severity = ErrorSeverity.WARNING;
				break;
			case UNREACHABLE_CODE:
			case INFINITE_LOOP:
				type = ErrorType.SEMANTIC_ERROR;
				severity = ErrorSeverity.WARNING;
				break;
			default:
				type = ErrorType.SEMANTIC_ERROR;
				severity = ErrorSeverity.ERROR;
				break;
		}

		ErrorLocation location = semanticError.getLocation()
				.map(l -> new ErrorLocation(CompilationStage.SEMANTIC_ANALYSIS, "SemanticAnalyzer", l.getLine(), l.getColumn()))
				.orElse(new ErrorLocation(CompilationStage.SEMANTIC_ANALYSIS, "SemanticAnalyzer"));
		return new CompilationError(type, semanticError.getMessage(), location, severity, semanticError.getSuggestions(),
				semanticError.getLocation().map(l -> l.getContext()).orElse(""));
	}

	public ErrorRecovery getRecovery()
	{
		return recovery;
	}
}
