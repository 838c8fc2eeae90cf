package org.lokray.nlmc;

import org.lokray.nlmc.flow.FlowModel;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.resolve.ResolutionResult;
import org.lokray.nlmc.semantic.SemanticModel;
import org.lokray.nlmc.types.TypeModel;

/**
 * All models produced for one description. When a stage aborted, it and every later
 * stage hold their empty model and {@link #isComplete()} is false.
 */
public class CompilationResult
{
	private final String source;
	private final ProgramIntent intent;
	private final ResolutionResult resolution;
	private final SemanticModel semanticModel;
	private final TypeModel typeModel;
	private final FlowModel flowModel;
	private final Diagnostics diagnostics;
	private final boolean complete;

	public CompilationResult(String source, ProgramIntent intent, ResolutionResult resolution, SemanticModel semanticModel,
							 TypeModel typeModel, FlowModel flowModel, Diagnostics diagnostics, boolean complete)
	{
		this.source = source;
		this.intent = intent;
		this.resolution = resolution;
		this.semanticModel = semanticModel;
		this.typeModel = typeModel;
		this.flowModel = flowModel;
		this.diagnostics = diagnostics;
		this.complete = complete;
	}

	public String getSource()
	{
		return source;
	}

	public ProgramIntent getIntent()
	{
		return intent;
	}

	public ResolutionResult getResolution()
	{
		return resolution;
	}

	public SemanticModel getSemanticModel()
	{
		return semanticModel;
	}

	public TypeModel getTypeModel()
	{
		return typeModel;
	}

	public FlowModel getFlowModel()
	{
		return flowModel;
	}

	public Diagnostics getDiagnostics()
	{
		return diagnostics;
	}

	public boolean isComplete()
	{
		return complete;
	}

	public String summary()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Intent:     ").append(intent.getOperations().size()).append(" operations, ")
				.append(intent.getDataStructures().size()).append(" data structures\n");
		sb.append("Ambiguity:  ").append(resolution.getResolvedAmbiguities().size()).append(" resolved, ")
				.append(resolution.getRemainingAmbiguities().size()).append(" remaining")
				.append(String.format(" (confidence %.2f)", resolution.getConfidenceScore())).append('\n');
		sb.append("Semantics:  ").append(semanticModel.getVariables().size()).append(" variables, ")
				.append(semanticModel.getFunctions().size()).append(" functions, ")
				.append(semanticModel.getSemanticErrors().size()).append(" errors\n");
		sb.append("Types:      ").append(typeModel.getTypes().size()).append(" inferred, ")
				.append(typeModel.getMemoryLayout().getTotalSize()).append(" bytes laid out\n");
		sb.append("Flow:       ").append(flowModel.getBlocks().size()).append(" blocks, ")
				.append(flowModel.getDataFlows().size()).append(" data flows, ")
				.append(flowModel.getLoopAnalysis().getNaturalLoops().size()).append(" loops, ")
				.append(flowModel.getOptimizationOpportunities().size()).append(" optimization opportunities\n");
		sb.append("Recovery:   ").append(diagnostics.getCompilationErrors().size()).append(" errors handled");
		if (!complete)
		{
			sb.append(" (compilation stopped early)");
		}
		return sb.toString();
	}
}
