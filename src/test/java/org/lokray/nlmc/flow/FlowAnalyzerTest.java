package org.lokray.nlmc.flow;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.lokray.nlmc.intent.ControlFlowGraph;
import org.lokray.nlmc.intent.ControlFlowGraph.EdgeKind;
import org.lokray.nlmc.intent.ControlFlowGraph.NodeKind;
import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.IntentExtractor;
import org.lokray.nlmc.intent.IntentMetadata;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.StorageScope;
import org.lokray.nlmc.intent.operation.ArithmeticOp;
import org.lokray.nlmc.intent.operation.ArithmeticOperation;
import org.lokray.nlmc.intent.operation.LoopOperation;
import org.lokray.nlmc.intent.operation.OutputOperation;
import org.lokray.nlmc.oracle.OfflineOracle;
import org.lokray.nlmc.oracle.ScriptedOracle;
import org.lokray.nlmc.semantic.SemanticModel;
import org.lokray.nlmc.types.TypeModel;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FlowAnalyzerTest
{
	/**
	 * entry -> loop -> body -> loop, loop -> after -> exit. The body computes a + b (invariant)
	 * and i = i + 1; after the loop a + b is computed again and printed.
	 */
	private static ProgramIntent countingLoop()
	{
		List<Operation> operations = List.of(
				new Operation("op_0", new LoopOperation("i < 10", List.of("op_1", "op_2")), List.of(), List.of(), "loop", 0.9),
				new Operation("op_1", new ArithmeticOperation(ArithmeticOp.ADD), List.of("a", "b"), List.of("t"), "a plus b", 0.9),
				new Operation("op_2", new ArithmeticOperation(ArithmeticOp.ADD), List.of("i", "1"), List.of("i"), "increment", 0.9),
				new Operation("op_3", new ArithmeticOperation(ArithmeticOp.ADD), List.of("b", "a"), List.of("u"), "b plus a", 0.9),
				new Operation("op_4", new OutputOperation(null), List.of("u"), List.of(), "print u", 0.9));
		List<DataStructure> dataStructures = List.of(
				new DataStructure("a", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("b", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("i", DataType.INT32, null, "0", StorageScope.GLOBAL));
		ControlFlowGraph cfg = new ControlFlowGraph("entry", List.of("exit"),
				List.of(new ControlFlowGraph.Node("entry", NodeKind.ENTRY, List.of()),
						new ControlFlowGraph.Node("loop", NodeKind.LOOP, List.of("op_0")),
						new ControlFlowGraph.Node("body", NodeKind.BASIC_BLOCK, List.of("op_1", "op_2")),
						new ControlFlowGraph.Node("after", NodeKind.BASIC_BLOCK, List.of("op_3", "op_4")),
						new ControlFlowGraph.Node("exit", NodeKind.EXIT, List.of())),
				List.of(new ControlFlowGraph.Edge("entry", "loop", EdgeKind.UNCONDITIONAL),
						new ControlFlowGraph.Edge("loop", "body", EdgeKind.CONDITIONAL_TRUE),
						new ControlFlowGraph.Edge("body", "loop", EdgeKind.LOOP_BACK),
						new ControlFlowGraph.Edge("loop", "after", EdgeKind.CONDITIONAL_FALSE),
						new ControlFlowGraph.Edge("after", "exit", EdgeKind.UNCONDITIONAL)));
		return new ProgramIntent(operations, dataStructures, cfg, List.of(), List.of(), IntentMetadata.EMPTY);
	}

	private static FlowModel analyze(ProgramIntent intent)
	{
		return new FlowAnalyzer(OfflineOracle.INSTANCE).analyzeFlows(intent, SemanticModel.empty(), TypeModel.empty());
	}

	@Test
	void straightLineProgramHasChainOfDominators()
	{
		ProgramIntent intent = new IntentExtractor(OfflineOracle.INSTANCE).extractIntent("Add x and y and print it");

		FlowModel flow = analyze(intent);

		assertEquals(List.of("entry", "block_0", "block_1", "exit"), flow.getBlocks().stream().map(ControlBlock::getId).toList());
		DominanceTree dom = flow.getDominanceTree();
		assertEquals(Set.of("entry"), dom.getDominators("entry"));
		assertEquals(Set.of("entry", "block_0", "block_1", "exit"), dom.getDominators("exit"));
		assertEquals("block_1", dom.getImmediateDominator("exit").orElseThrow());
		assertTrue(dom.getImmediateDominator("entry").isEmpty());
		assertEquals(3, dom.getLevel("exit"));
		assertTrue(flow.getLoopAnalysis().getNaturalLoops().isEmpty());

		Instruction add = flow.findBlock("block_0").orElseThrow().getInstructions().get(0);
		assertEquals(Opcode.ADD, add.getOpcode());
		assertEquals("block_0_0", add.getId());
		assertEquals("op_0_result", add.getResult().orElseThrow());

		Instruction print = flow.findBlock("block_1").orElseThrow().getInstructions().get(0);
		assertEquals(Opcode.CALL, print.getOpcode());
		assertEquals(Operand.label(InstructionSelector.OUTPUT_FUNCTION), print.getOperands().get(0));
		assertEquals(List.of(SideEffect.HAS_IO), print.getSideEffects());
	}

	@Test
	void entryDominatesEveryReachableBlock()
	{
		FlowModel flow = analyze(countingLoop());
		DominanceTree dom = flow.getDominanceTree();

		assertEquals("entry", dom.getRoot());
		for (ControlBlock block : flow.getBlocks())
		{
			assertTrue(dom.dominates("entry", block.getId()), block.getId());
			assertTrue(dom.dominates(block.getId(), block.getId()), block.getId());
		}
		assertEquals("loop", dom.getImmediateDominator("body").orElseThrow());
		assertEquals("loop", dom.getImmediateDominator("after").orElseThrow());
		assertEquals("after", dom.getImmediateDominator("exit").orElseThrow());
		assertEquals(List.of("body", "after"), dom.getChildren("loop"));
		assertFalse(dom.dominates("body", "after"));
		assertTrue(dom.getDominanceFrontier("body").contains("loop"));
	}

	@Test
	void dominanceIsTransitive()
	{
		DominanceTree dom = analyze(countingLoop()).getDominanceTree();
		List<String> ids = List.of("entry", "loop", "body", "after", "exit");
		for (String a : ids)
		{
			for (String b : ids)
			{
				for (String c : ids)
				{
					if (dom.dominates(a, b) && dom.dominates(b, c))
					{
						assertTrue(dom.dominates(a, c), a + " dom " + b + " dom " + c);
					}
				}
			}
		}
	}

	@Test
	void backEdgeFormsNaturalLoop()
	{
		FlowModel flow = analyze(countingLoop());
		LoopAnalysis loops = flow.getLoopAnalysis();

		assertEquals(1, loops.getNaturalLoops().size());
		NaturalLoop loop = loops.findLoop("loop").orElseThrow();
		assertEquals("body", loop.getLatch());
		assertEquals(Set.of("loop", "body"), loop.getBody());
		assertEquals(List.of("after"), loop.getExits());
		assertEquals(1, loop.getDepth());
		assertTrue(loop.getParent().isEmpty());
		assertEquals(TripCount.constant(10), loop.getTripCount());

		for (String member : loop.getBody())
		{
			assertTrue(flow.getDominanceTree().dominates(loop.getHeader(), member));
		}

		assertEquals(BlockKind.LOOP_HEADER, flow.findBlock("loop").orElseThrow().getKind());
		assertEquals(BlockKind.LOOP_LATCH, flow.findBlock("body").orElseThrow().getKind());
		assertEquals(BlockKind.BASIC, flow.findBlock("after").orElseThrow().getKind());
	}

	@Test
	void invariantsAndInductionVariables()
	{
		LoopAnalysis loops = analyze(countingLoop()).getLoopAnalysis();

		assertEquals(Set.of("body_0"), loops.getLoopInvariants("loop"));

		InductionVariable i = loops.getInductionVariables().get("i");
		assertEquals("loop", i.getLoopHeader());
		assertEquals("0", i.getInitialValue());
		assertEquals("1", i.getStep());
		assertEquals("10", i.getFinalValue().orElseThrow());
		assertTrue(i.isPrimary());
	}

	@Test
	void nestedLoopsKnowTheirParent()
	{
		ControlFlowGraph cfg = new ControlFlowGraph("entry", List.of("exit"),
				List.of(new ControlFlowGraph.Node("entry", NodeKind.ENTRY, List.of()),
						new ControlFlowGraph.Node("outer", NodeKind.LOOP, List.of()),
						new ControlFlowGraph.Node("inner", NodeKind.LOOP, List.of()),
						new ControlFlowGraph.Node("inner_body", NodeKind.BASIC_BLOCK, List.of()),
						new ControlFlowGraph.Node("outer_latch", NodeKind.BASIC_BLOCK, List.of()),
						new ControlFlowGraph.Node("exit", NodeKind.EXIT, List.of())),
				List.of(new ControlFlowGraph.Edge("entry", "outer", EdgeKind.UNCONDITIONAL),
						new ControlFlowGraph.Edge("outer", "inner", EdgeKind.CONDITIONAL_TRUE),
						new ControlFlowGraph.Edge("inner", "inner_body", EdgeKind.CONDITIONAL_TRUE),
						new ControlFlowGraph.Edge("inner_body", "inner", EdgeKind.LOOP_BACK),
						new ControlFlowGraph.Edge("inner", "outer_latch", EdgeKind.CONDITIONAL_FALSE),
						new ControlFlowGraph.Edge("outer_latch", "outer", EdgeKind.LOOP_BACK),
						new ControlFlowGraph.Edge("outer", "exit", EdgeKind.CONDITIONAL_FALSE)));
		ProgramIntent intent = new ProgramIntent(List.of(), List.of(), cfg, List.of(), List.of(), IntentMetadata.EMPTY);

		LoopAnalysis loops = analyze(intent).getLoopAnalysis();

		NaturalLoop inner = loops.findLoop("inner").orElseThrow();
		NaturalLoop outer = loops.findLoop("outer").orElseThrow();
		assertEquals(2, inner.getDepth());
		assertEquals("outer", inner.getParent().orElseThrow());
		assertEquals(1, outer.getDepth());
		assertEquals(Set.of("outer", "inner", "inner_body", "outer_latch"), outer.getBody());
		assertTrue(outer.getBody().containsAll(inner.getBody()));
		assertEquals(List.of("outer"), loops.getRootLoops());
		assertEquals(List.of("inner"), loops.getChildLoops("outer"));
		assertEquals(TripCount.UNKNOWN, outer.getTripCount());
	}

	@Test
	void optimizationOpportunitiesAreFound()
	{
		List<OptimizationOpportunity> opportunities = analyze(countingLoop()).getOptimizationOpportunities();
		List<String> descriptions = opportunities.stream().map(OptimizationOpportunity::getDescription).toList();

		assertTrue(descriptions.contains("Dead instruction: body_0"));
		assertFalse(descriptions.contains("Dead instruction: after_0"));
		assertTrue(descriptions.contains("Common subexpression: ADD(a, b) (appears 2 times)"));
		assertTrue(descriptions.contains("Loop invariant code motion for loop loop"));
		assertTrue(descriptions.contains("Loop unrolling for loop loop"));

		OptimizationOpportunity cse = opportunities.stream()
				.filter(o -> o.getKind() == OptimizationKind.COMMON_SUBEXPRESSION_ELIMINATION)
				.findFirst().orElseThrow();
		assertEquals(List.of("body", "after"), cse.getAffectedBlocks());
		assertEquals(OptimizationBenefit.HIGH, cse.getBenefit());
		assertEquals(List.of("dominance_analysis"), cse.getPrerequisites());
	}

	@Test
	void definitionsReachTheirUses()
	{
		FlowModel flow = analyze(countingLoop());

		assertEquals(Set.of("after_0"), flow.getReachingDefinitions().get("u"));
		DataFlow use = flow.getDataFlows().stream()
				.filter(f -> f.getKind() == DataFlowKind.DEF_USE && f.getVariable().equals("u"))
				.findFirst().orElseThrow();
		assertEquals("after_0", use.getFromInstruction());
		assertEquals("after_1", use.getToInstruction());
		assertEquals(1, use.getDistance());
		assertEquals(Set.of("a", "b", "u"), flow.getLiveVariables().get("after"));
		assertEquals(Set.of("ADD(a, b)", "ADD(1, i)"), flow.getAvailableExpressions().get("body"));
	}

	@Test
	void unknownOperationsAndEdgesAreSkipped()
	{
		ControlFlowGraph cfg = new ControlFlowGraph("entry", List.of("exit"),
				List.of(new ControlFlowGraph.Node("entry", NodeKind.ENTRY, List.of("op_missing")),
						new ControlFlowGraph.Node("exit", NodeKind.EXIT, List.of())),
				List.of(new ControlFlowGraph.Edge("entry", "exit", EdgeKind.UNCONDITIONAL),
						new ControlFlowGraph.Edge("entry", "nowhere", EdgeKind.UNCONDITIONAL)));
		ProgramIntent intent = new ProgramIntent(List.of(), List.of(), cfg, List.of(), List.of(), IntentMetadata.EMPTY);

		FlowModel flow = analyze(intent);

		assertEquals(0, flow.getInstructionCount());
		assertEquals(List.of("exit"), flow.getSuccessorIds(flow.getBlock(0)));
	}

	@Test
	void oracleOpportunitiesAreAppended()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("flow analysis",
				"{\"opportunities\": [{\"type\": \"strength reduction\", \"description\": \"use shifts\", \"affected_blocks\": [\"body\"]}]}");

		FlowModel flow = new FlowAnalyzer(oracle).analyzeFlows(countingLoop(), SemanticModel.empty(), TypeModel.empty());

		OptimizationOpportunity last = flow.getOptimizationOpportunities().get(flow.getOptimizationOpportunities().size() - 1);
		assertEquals(OptimizationKind.STRENGTH_REDUCTION, last.getKind());
		assertEquals(OptimizationBenefit.MEDIUM, last.getBenefit());
		assertEquals(List.of(FlowAnalyzer.ORACLE_PREREQUISITE), last.getPrerequisites());
	}

	@Test
	void parseOpportunitiesSkipsUnknownKinds()
	{
		JsonObject json = JsonParser.parseString("{\"opportunities\": ["
				+ "{\"type\": \"LoopUnrolling\", \"benefit\": \"high\", \"affected_blocks\": [\"loop\"]},"
				+ "{\"type\": \"teleportation\"}, 42]}").getAsJsonObject();

		List<OptimizationOpportunity> parsed = FlowAnalyzer.parseOpportunities(json);

		assertEquals(1, parsed.size());
		assertEquals(OptimizationKind.LOOP_UNROLLING, parsed.get(0).getKind());
		assertEquals(OptimizationBenefit.HIGH, parsed.get(0).getBenefit());
		assertEquals(List.of("loop"), parsed.get(0).getAffectedBlocks());
		assertTrue(FlowAnalyzer.parseOpportunities(new JsonObject()).isEmpty());
	}

	@Test
	void optimizationNamesAreNormalized()
	{
		assertEquals(OptimizationKind.DEAD_CODE_ELIMINATION, OptimizationKind.fromName("dead-code elimination").orElseThrow());
		assertEquals(OptimizationKind.VECTORIZATION, OptimizationKind.fromName("Vectorization").orElseThrow());
		assertTrue(OptimizationKind.fromName("magic").isEmpty());
		assertEquals(OptimizationBenefit.NEGLIGIBLE, OptimizationBenefit.fromName("Negligible").orElseThrow());
	}
}
