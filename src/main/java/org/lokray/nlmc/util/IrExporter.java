package org.lokray.nlmc.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.nlmc.CompilationResult;
import org.lokray.nlmc.Diagnostics;
import org.lokray.nlmc.dto.*;
import org.lokray.nlmc.flow.ControlBlock;
import org.lokray.nlmc.flow.FlowModel;
import org.lokray.nlmc.flow.Instruction;
import org.lokray.nlmc.flow.NaturalLoop;
import org.lokray.nlmc.flow.OptimizationOpportunity;
import org.lokray.nlmc.flow.Operand;
import org.lokray.nlmc.flow.SideEffect;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.recovery.RecoveryResult;
import org.lokray.nlmc.types.InferredType;
import org.lokray.nlmc.types.MemoryLayoutPlan;
import org.lokray.nlmc.types.TypeModel;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Map;

/**
 * Writes the final models as a JSON document a code generator can walk without
 * recomputing dominance, loops or layout.
 */
public class IrExporter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static IrDocumentDTO toDocument(CompilationResult result)
	{
		IrDocumentDTO doc = new IrDocumentDTO();
		doc.source = result.getSource();
		doc.complete = result.isComplete();

		for (Operation operation : result.getIntent().getOperations())
		{
			OperationDTO dto = new OperationDTO();
			dto.id = operation.getId();
			dto.kind = operation.getType().getKindName();
			dto.type = operation.getType().toString();
			dto.inputs.addAll(operation.getInputs());
			dto.outputs.addAll(operation.getOutputs());
			dto.description = operation.getDescription();
			dto.confidence = operation.getConfidence();
			doc.operations.add(dto);
		}

		TypeModel types = result.getTypeModel();
		MemoryLayoutPlan layout = types.getMemoryLayout();
		doc.frameSize = layout.getFrameSize();
		doc.staticSize = layout.getStaticSize();
		for (Map.Entry<String, InferredType> entry : types.getTypes().entrySet())
		{
			doc.types.add(typeToDTO(entry.getKey(), entry.getValue(), layout));
		}

		FlowModel flow = result.getFlowModel();
		doc.entry = flow.getDominanceTree().getRoot();
		doc.immediateDominators.putAll(flow.getDominanceTree().getImmediateDominators());
		for (ControlBlock block : flow.getBlocks())
		{
			doc.blocks.add(blockToDTO(block, flow));
		}
		for (NaturalLoop loop : flow.getLoopAnalysis().getNaturalLoops())
		{
			LoopDTO dto = new LoopDTO();
			dto.header = loop.getHeader();
			dto.latch = loop.getLatch();
			dto.body.addAll(loop.getBody());
			dto.exits.addAll(loop.getExits());
			dto.depth = loop.getDepth();
			dto.parent = loop.getParent().orElse(null);
			dto.tripCount = loop.getTripCount().toString();
			dto.invariantInstructions.addAll(flow.getLoopAnalysis().getLoopInvariants(loop.getHeader()));
			doc.loops.add(dto);
		}
		for (OptimizationOpportunity opportunity : flow.getOptimizationOpportunities())
		{
			OpportunityDTO dto = new OpportunityDTO();
			dto.kind = opportunity.getKind().name();
			dto.description = opportunity.getDescription();
			dto.benefit = opportunity.getBenefit().name();
			dto.affectedBlocks.addAll(opportunity.getAffectedBlocks());
			dto.prerequisites.addAll(opportunity.getPrerequisites());
			doc.optimizationOpportunities.add(dto);
		}

		doc.diagnostics = diagnosticsToDTO(result.getDiagnostics());
		return doc;
	}

	private static TypeDTO typeToDTO(String entity, InferredType type, MemoryLayoutPlan layout)
	{
		TypeDTO dto = new TypeDTO();
		dto.entity = entity;
		dto.name = type.getName();
		dto.baseType = type.getBaseType().getName();
		dto.size = type.getSizeBytes();
		dto.alignment = type.getAlignment();
		dto.lifetime = type.getLifetime().name();
		dto.mutability = type.getMutability().name();
		dto.ownership = type.getOwnership().name();
		dto.nullable = type.isNullable();

		for (MemoryLayoutPlan.Slot slot : layout.getStackSlots())
		{
			if (slot.getName().equals(entity))
			{
				dto.segment = "stack";
				dto.offset = slot.getOffset();
			}
		}
		for (MemoryLayoutPlan.Slot slot : layout.getStaticSlots())
		{
			if (slot.getName().equals(entity))
			{
				dto.segment = "static";
				dto.offset = slot.getOffset();
			}
		}
		return dto;
	}

	private static BlockDTO blockToDTO(ControlBlock block, FlowModel flow)
	{
		BlockDTO dto = new BlockDTO();
		dto.index = block.getIndex();
		dto.id = block.getId();
		dto.kind = block.getKind().name();
		dto.predecessors.addAll(flow.getPredecessorIds(block));
		dto.successors.addAll(flow.getSuccessorIds(block));
		dto.dominators.addAll(flow.getDominanceTree().getDominators(block.getId()));

		for (Instruction instruction : block.getInstructions())
		{
			InstructionDTO insn = new InstructionDTO();
			insn.id = instruction.getId();
			insn.opcode = instruction.getOpcode().name();
			insn.result = instruction.getResult().orElse(null);
			for (Operand operand : instruction.getOperands())
			{
				OperandDTO od = new OperandDTO();
				od.kind = operand.getKind().name();
				od.value = operand.getValue();
				od.dataType = operand.getDataType();
				insn.operands.add(od);
			}
			for (SideEffect effect : instruction.getSideEffects())
			{
				insn.sideEffects.add(effect.name());
			}
			dto.instructions.add(insn);
		}
		return dto;
	}

	private static DiagnosticsDTO diagnosticsToDTO(Diagnostics diagnostics)
	{
		DiagnosticsDTO dto = new DiagnosticsDTO();
		diagnostics.getSemanticErrors().forEach(e -> dto.semanticErrors.add(e.toString()));
		diagnostics.getRemainingAmbiguities().forEach(a -> dto.remainingAmbiguities.add(a.getId() + ": " + a.getDescription()));
		for (RecoveryResult recovery : diagnostics.getRecoveries())
		{
			dto.recoveryActions.add(recovery.toString());
		}
		dto.warnings = new ArrayList<>(diagnostics.getRecoveryWarnings());
		return dto;
	}

	public static String toJson(CompilationResult result)
	{
		return GSON.toJson(toDocument(result));
	}

	public static void write(CompilationResult result, Path outPath) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, toJson(result), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote IR to: " + outPath);
	}
}
