package org.lokray.nlmc.flow;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.lokray.nlmc.intent.ControlFlowGraph;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.oracle.OracleResponses;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.semantic.SemanticModel;
import org.lokray.nlmc.types.TypeModel;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Last analysis stage. Lowers the intent graph to instruction blocks and computes
 * dominance, loops, block-local dataflow facts and optimization opportunities.
 * <p>
 * Reaching definitions, live variables and available expressions are per-block
 * summaries without propagation across block boundaries.
 */
public class FlowAnalyzer
{
	public static final String ORACLE_PREREQUISITE = "oracle_analysis";
	private static final int UNROLL_LIMIT = 10;

	private final ReasoningOracle oracle;

	public FlowAnalyzer(ReasoningOracle oracle)
	{
		this.oracle = oracle;
	}

	public FlowModel analyzeFlows(ProgramIntent intent, SemanticModel semantic, TypeModel types)
	{
		Debug.logDebug("Analyzing flows");

		ControlFlowGraph cfg = intent.getControlFlow();
		List<ControlBlock> blocks = buildControlBlocks(intent, types);
		int entry = findEntry(blocks, cfg.getEntry());

		DominanceTree dominance = blocks.isEmpty() ? DominanceTree.empty(cfg.getEntry()) : computeDominance(blocks, entry);

		LoopDetector detector = new LoopDetector(blocks, dominance);
		List<NaturalLoop> loops = detector.findNaturalLoops();
		Map<String, InductionVariable> inductionVariables = new LinkedHashMap<>();
		Map<String, Set<String>> invariants = new LinkedHashMap<>();
		for (NaturalLoop loop : loops)
		{
			List<String> headerOperations = cfg.getNodes().stream()
					.filter(n -> n.getId().equals(loop.getHeader()))
					.findFirst()
					.map(ControlFlowGraph.Node::getOperations)
					.orElse(List.of());
			loop.setTripCount(LoopDetector.estimateTripCount(LoopDetector.loopOperationOf(intent, headerOperations)));
			invariants.put(loop.getHeader(), detector.findInvariants(loop));
			for (InductionVariable variable : detector.findInductionVariables(loop, intent))
			{
				inductionVariables.putIfAbsent(variable.getName(), variable);
			}
		}
		LoopAnalysis loopAnalysis = new LoopAnalysis(loops, inductionVariables, invariants);
		refineBlockKinds(blocks, loops);

		Map<String, Set<String>> reaching = computeReachingDefinitions(blocks);
		Map<String, Set<String>> live = computeLiveVariables(blocks);
		Map<String, Set<String>> available = computeAvailableExpressions(blocks);
		List<DataFlow> dataFlows = computeDataFlows(blocks, reaching);

		List<OptimizationOpportunity> opportunities = identifyOptimizations(blocks, live, available, loops);
		opportunities.addAll(queryOpportunities(intent, semantic, types, blocks, dataFlows, loops));

		FlowModel model = new FlowModel(blocks, dataFlows, dominance, loopAnalysis, reaching, live, available, opportunities);
		Debug.logDebug("Flow analysis: " + blocks.size() + " blocks, " + model.getInstructionCount() + " instructions, "
				+ dataFlows.size() + " data flows, " + loops.size() + " loops, " + opportunities.size() + " opportunities");
		return model;
	}

	private List<ControlBlock> buildControlBlocks(ProgramIntent intent, TypeModel types)
	{
		ControlFlowGraph cfg = intent.getControlFlow();
		List<ControlBlock> blocks = new ArrayList<>();
		Map<String, ControlBlock> byId = new LinkedHashMap<>();

		for (ControlFlowGraph.Node node : cfg.getNodes())
		{
			InstructionSelector selector = new InstructionSelector(node.getId(), types);
			List<Instruction> instructions = new ArrayList<>();
			for (String operationId : node.getOperations())
			{
				Optional<Operation> operation = intent.findOperation(operationId);
				if (operation.isPresent())
				{
					instructions.add(selector.select(operation.get()));
				}
				else
				{
					Debug.logWarning("Block " + node.getId() + " references unknown operation " + operationId);
				}
			}

			ControlBlock block = new ControlBlock(blocks.size(), node.getId(), blockKindOf(node.getKind()), instructions);
			blocks.add(block);
			byId.put(node.getId(), block);
		}

		for (ControlFlowGraph.Edge edge : cfg.getEdges())
		{
			ControlBlock from = byId.get(edge.getFrom());
			ControlBlock to = byId.get(edge.getTo());
			if (from == null || to == null)
			{
				Debug.logWarning("Ignoring edge " + edge.getFrom() + " -> " + edge.getTo() + " to an unknown block");
				continue;
			}
			from.addSuccessor(to);
		}
		return blocks;
	}

	private static BlockKind blockKindOf(ControlFlowGraph.NodeKind kind)
	{
		return switch (kind)
		{
			case ENTRY -> BlockKind.ENTRY;
			case EXIT -> BlockKind.EXIT;
			case CONDITIONAL -> BlockKind.CONDITIONAL;
			case LOOP -> BlockKind.LOOP_HEADER;
			case BASIC_BLOCK, FUNCTION_CALL -> BlockKind.BASIC;
		};
	}

	private static int findEntry(List<ControlBlock> blocks, String entryId)
	{
		for (ControlBlock block : blocks)
		{
			if (block.getId().equals(entryId))
			{
				return block.getIndex();
			}
		}
		for (ControlBlock block : blocks)
		{
			if (block.getKind() == BlockKind.ENTRY)
			{
				return block.getIndex();
			}
		}
		return 0;
	}

	/**
	 * Iterative dominator sets: {@code dom(entry) = {entry}}, every other block starts at the
	 * universe and is refined to {@code {b} ∪ ⋂ dom(p)} over its predecessors until stable.
	 */
	static DominanceTree computeDominance(List<ControlBlock> blocks, int entry)
	{
		int n = blocks.size();
		BitSet[] dom = new BitSet[n];
		for (int i = 0; i < n; i++)
		{
			dom[i] = new BitSet(n);
			if (i == entry)
			{
				dom[i].set(entry);
			}
			else
			{
				dom[i].set(0, n);
			}
		}

		boolean changed = true;
		while (changed)
		{
			changed = false;
			for (ControlBlock block : blocks)
			{
				int b = block.getIndex();
				if (b == entry)
				{
					continue;
				}

				BitSet next = new BitSet(n);
				List<Integer> predecessors = block.getPredecessors();
				if (!predecessors.isEmpty())
				{
					next.or(dom[predecessors.get(0)]);
					for (int p : predecessors.subList(1, predecessors.size()))
					{
						next.and(dom[p]);
					}
				}
				next.set(b);

				if (!next.equals(dom[b]))
				{
					dom[b] = next;
					changed = true;
				}
			}
		}

		int[] idom = new int[n];
		for (int b = 0; b < n; b++)
		{
			idom[b] = -1;
			int best = -1;
			for (int d = dom[b].nextSetBit(0); d >= 0; d = dom[b].nextSetBit(d + 1))
			{
				if (d == b || dom[d].cardinality() >= dom[b].cardinality())
				{
					continue;
				}
				if (best == -1 || dom[d].cardinality() > dom[best].cardinality())
				{
					best = d;
				}
			}
			idom[b] = best;
		}

		Map<String, Set<String>> dominators = new LinkedHashMap<>();
		Map<String, String> immediate = new LinkedHashMap<>();
		Map<String, List<String>> children = new LinkedHashMap<>();
		Map<String, Integer> levels = new LinkedHashMap<>();
		Map<String, Set<String>> frontiers = new LinkedHashMap<>();
		for (ControlBlock block : blocks)
		{
			Set<String> ids = new LinkedHashSet<>();
			for (int d = dom[block.getIndex()].nextSetBit(0); d >= 0; d = dom[block.getIndex()].nextSetBit(d + 1))
			{
				ids.add(blocks.get(d).getId());
			}
			dominators.put(block.getId(), ids);
			children.put(block.getId(), new ArrayList<>());
			frontiers.put(block.getId(), new LinkedHashSet<>());
		}

		for (ControlBlock block : blocks)
		{
			int b = block.getIndex();
			int level = 0;
			for (int up = idom[b]; up != -1; up = idom[up])
			{
				level++;
			}
			levels.put(block.getId(), level);
			if (idom[b] != -1)
			{
				String parent = blocks.get(idom[b]).getId();
				immediate.put(block.getId(), parent);
				children.get(parent).add(block.getId());
			}
		}

		for (ControlBlock block : blocks)
		{
			if (block.getPredecessors().size() < 2)
			{
				continue;
			}
			int b = block.getIndex();
			for (int p : block.getPredecessors())
			{
				for (int runner = p; runner != -1 && runner != idom[b]; runner = idom[runner])
				{
					frontiers.get(blocks.get(runner).getId()).add(block.getId());
				}
			}
		}

		return new DominanceTree(blocks.get(entry).getId(), dominators, immediate, children, levels, frontiers);
	}

	private static void refineBlockKinds(List<ControlBlock> blocks, List<NaturalLoop> loops)
	{
		Set<String> headers = new LinkedHashSet<>();
		Set<String> latches = new LinkedHashSet<>();
		for (NaturalLoop loop : loops)
		{
			headers.add(loop.getHeader());
			latches.add(loop.getLatch());
		}

		for (ControlBlock block : blocks)
		{
			if (block.getKind() == BlockKind.ENTRY || block.getKind() == BlockKind.EXIT)
			{
				continue;
			}
			if (headers.contains(block.getId()))
			{
				block.setKind(BlockKind.LOOP_HEADER);
			}
			else if (latches.contains(block.getId()))
			{
				block.setKind(BlockKind.LOOP_LATCH);
			}
			else if (block.getKind() == BlockKind.BASIC && block.getPredecessors().size() >= 2)
			{
				block.setKind(BlockKind.MERGE);
			}
		}
	}

	static Map<String, Set<String>> computeReachingDefinitions(List<ControlBlock> blocks)
	{
		Map<String, Set<String>> reaching = new LinkedHashMap<>();
		for (ControlBlock block : blocks)
		{
			for (Instruction instruction : block.getInstructions())
			{
				instruction.getResult().ifPresent(result -> reaching.computeIfAbsent(result, k -> new LinkedHashSet<>()).add(instruction.getId()));
			}
		}
		return reaching;
	}

	static Map<String, Set<String>> computeLiveVariables(List<ControlBlock> blocks)
	{
		Map<String, Set<String>> live = new LinkedHashMap<>();
		for (ControlBlock block : blocks)
		{
			Set<String> liveHere = new LinkedHashSet<>();
			for (Instruction instruction : block.getInstructions())
			{
				liveHere.addAll(instruction.getRegisterOperands());
				instruction.getResult().ifPresent(liveHere::remove);
			}
			live.put(block.getId(), liveHere);
		}
		return live;
	}

	static Map<String, Set<String>> computeAvailableExpressions(List<ControlBlock> blocks)
	{
		Map<String, Set<String>> available = new LinkedHashMap<>();
		for (ControlBlock block : blocks)
		{
			Set<String> expressions = new LinkedHashSet<>();
			for (Instruction instruction : block.getInstructions())
			{
				Opcode opcode = instruction.getOpcode();
				if (opcode == Opcode.ADD || opcode == Opcode.SUB || opcode == Opcode.MUL || opcode == Opcode.DIV)
				{
					expressions.add(expressionKey(instruction));
				}
			}
			available.put(block.getId(), expressions);
		}
		return available;
	}

	/**
	 * Canonical text of an expression; operands of commutative opcodes are sorted so
	 * {@code x + y} and {@code y + x} compare equal.
	 */
	static String expressionKey(Instruction instruction)
	{
		List<String> operands = new ArrayList<>(instruction.getOperands().stream().map(Operand::getValue).toList());
		if (instruction.getOpcode().isCommutative())
		{
			operands.sort(String::compareTo);
		}
		return instruction.getOpcode() + "(" + String.join(", ", operands) + ")";
	}

	static List<DataFlow> computeDataFlows(List<ControlBlock> blocks, Map<String, Set<String>> reaching)
	{
		Map<String, Integer> positions = new LinkedHashMap<>();
		List<Instruction> ordered = new ArrayList<>();
		for (ControlBlock block : blocks)
		{
			for (Instruction instruction : block.getInstructions())
			{
				positions.put(instruction.getId(), ordered.size());
				ordered.add(instruction);
			}
		}

		List<DataFlow> flows = new ArrayList<>();
		for (Instruction instruction : ordered)
		{
			int usePosition = positions.get(instruction.getId());
			for (String variable : instruction.getRegisterOperands())
			{
				Set<String> definitions = reaching.getOrDefault(variable, Set.of());
				for (String definition : definitions)
				{
					if (!definition.equals(instruction.getId()))
					{
						flows.add(new DataFlow(definition, instruction.getId(), variable, DataFlowKind.DEF_USE,
								Math.abs(usePosition - positions.get(definition))));
					}
				}

				definitions.stream()
						.filter(definition -> positions.get(definition) > usePosition)
						.findFirst()
						.ifPresent(redefinition -> flows.add(new DataFlow(instruction.getId(), redefinition, variable,
								DataFlowKind.ANTI_DEPENDENCE, positions.get(redefinition) - usePosition)));
			}
		}

		reaching.forEach((variable, definitions) ->
		{
			String previous = null;
			for (String definition : definitions)
			{
				if (previous != null)
				{
					flows.add(new DataFlow(previous, definition, variable, DataFlowKind.OUTPUT_DEPENDENCE,
							positions.get(definition) - positions.get(previous)));
				}
				previous = definition;
			}
		});
		return flows;
	}

	static List<OptimizationOpportunity> identifyOptimizations(List<ControlBlock> blocks, Map<String, Set<String>> live,
															   Map<String, Set<String>> available, List<NaturalLoop> loops)
	{
		List<OptimizationOpportunity> opportunities = new ArrayList<>();

		for (ControlBlock block : blocks)
		{
			for (Instruction instruction : block.getInstructions())
			{
				Optional<String> result = instruction.getResult();
				if (result.isEmpty() || instruction.hasSideEffects())
				{
					continue;
				}
				boolean isLive = live.values().stream().anyMatch(set -> set.contains(result.get()));
				if (!isLive)
				{
					opportunities.add(new OptimizationOpportunity(OptimizationKind.DEAD_CODE_ELIMINATION,
							"Dead instruction: " + instruction.getId(), List.of(block.getId()), OptimizationBenefit.MEDIUM, List.of()));
				}
			}
		}

		Map<String, List<String>> blocksByExpression = new LinkedHashMap<>();
		available.forEach((blockId, expressions) ->
		{
			for (String expression : expressions)
			{
				blocksByExpression.computeIfAbsent(expression, k -> new ArrayList<>()).add(blockId);
			}
		});
		blocksByExpression.forEach((expression, blockIds) ->
		{
			if (blockIds.size() > 1)
			{
				opportunities.add(new OptimizationOpportunity(OptimizationKind.COMMON_SUBEXPRESSION_ELIMINATION,
						"Common subexpression: " + expression + " (appears " + blockIds.size() + " times)", blockIds,
						OptimizationBenefit.HIGH, List.of("dominance_analysis")));
			}
		});

		for (NaturalLoop loop : loops)
		{
			List<String> body = new ArrayList<>(loop.getBody());
			opportunities.add(new OptimizationOpportunity(OptimizationKind.LOOP_INVARIANT_CODE_MOTION,
					"Loop invariant code motion for loop " + loop.getHeader(), body, OptimizationBenefit.HIGH, List.of("loop_analysis")));
			if (loop.getBody().size() < UNROLL_LIMIT)
			{
				opportunities.add(new OptimizationOpportunity(OptimizationKind.LOOP_UNROLLING,
						"Loop unrolling for loop " + loop.getHeader(), body, OptimizationBenefit.MEDIUM, List.of("trip_count_analysis")));
			}
		}
		return opportunities;
	}

	private List<OptimizationOpportunity> queryOpportunities(ProgramIntent intent, SemanticModel semantic, TypeModel types,
															 List<ControlBlock> blocks, List<DataFlow> dataFlows, List<NaturalLoop> loops)
	{
		StringBuilder blockSummary = new StringBuilder();
		for (ControlBlock block : blocks)
		{
			blockSummary.append("- ").append(block).append('\n');
			for (Instruction instruction : block.getInstructions())
			{
				blockSummary.append("    ").append(instruction).append('\n');
			}
		}

		String prompt = "You are a flow analysis agent. Suggest optimization opportunities the analysis below may have missed.\n\n"
				+ "Operations: " + intent.getOperations().size() + "\n"
				+ "Variables: " + semantic.getVariables().size() + "\n"
				+ "Typed entities: " + types.getTypes().size() + "\n"
				+ "Data flows: " + dataFlows.size() + "\n"
				+ "Natural loops: " + loops.size() + "\n"
				+ "Control blocks:\n" + blockSummary + "\n"
				+ "Respond with a JSON object {\"opportunities\": [{\"type\": \"loop_unrolling\", \"description\": \"...\", "
				+ "\"benefit\": \"high|medium|low|negligible\", \"affected_blocks\": [\"...\"]}]}. "
				+ "Known types: " + List.of(OptimizationKind.values()) + ". Return ONLY the JSON object.";

		Optional<JsonObject> answer = OracleResponses.queryObject(oracle, "Flow analysis", prompt);
		return answer.map(FlowAnalyzer::parseOpportunities).orElse(List.of());
	}

	static List<OptimizationOpportunity> parseOpportunities(JsonObject json)
	{
		List<OptimizationOpportunity> opportunities = new ArrayList<>();
		JsonElement array = json.get("opportunities");
		if (array == null || !array.isJsonArray())
		{
			return opportunities;
		}

		for (JsonElement element : array.getAsJsonArray())
		{
			if (!element.isJsonObject())
			{
				continue;
			}
			JsonObject entry = element.getAsJsonObject();
			Optional<OptimizationKind> kind = OptimizationKind.fromName(OracleResponses.getString(entry, "type", ""));
			if (kind.isEmpty())
			{
				Debug.logDebug("Skipping unrecognised optimization " + entry);
				continue;
			}
			OptimizationBenefit benefit = OptimizationBenefit.fromName(OracleResponses.getString(entry, "benefit", ""))
					.orElse(OptimizationBenefit.MEDIUM);
			String description = OracleResponses.getString(entry, "description", "Oracle-identified " + kind.get());
			opportunities.add(new OptimizationOpportunity(kind.get(), description,
					OracleResponses.getStringArray(entry, "affected_blocks"), benefit, List.of(ORACLE_PREREQUISITE)));
		}
		return opportunities;
	}
}
