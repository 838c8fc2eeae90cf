package org.lokray.nlmc.semantic;

import org.junit.jupiter.api.Test;
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
import org.lokray.nlmc.intent.operation.FunctionCallOperation;
import org.lokray.nlmc.intent.operation.LoopOperation;
import org.lokray.nlmc.oracle.OfflineOracle;
import org.lokray.nlmc.oracle.ScriptedOracle;
import org.lokray.nlmc.semantic.symbol.Symbol;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest
{
	private static ProgramIntent intent(List<Operation> operations, List<DataStructure> dataStructures)
	{
		return new ProgramIntent(operations, dataStructures, ControlFlowGraph.straightLine(operations), List.of(), List.of(),
				IntentMetadata.EMPTY);
	}

	private static DataStructure global(String name, DataType type)
	{
		return new DataStructure(name, type, StorageScope.GLOBAL);
	}

	@Test
	void undeclaredOperandsAreUndefined()
	{
		ProgramIntent intent = new IntentExtractor(OfflineOracle.INSTANCE).extractIntent("Add x and y and print it");

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);

		assertTrue(model.hasErrors());
		assertEquals(List.of("Undefined variable or function: x", "Undefined variable or function: y", "Undefined variable or function: it"),
				model.getSemanticErrors().stream().map(SemanticError::getMessage).toList());
		assertTrue(model.getSemanticErrors().stream().allMatch(e -> e.getType() == SemanticErrorType.UNDEFINED_VARIABLE));
		assertEquals(2, model.getSemanticErrors().get(2).getLocation().orElseThrow().getLine());
	}

	@Test
	void declaredOperandsResolveAndCountUses()
	{
		Operation add = new Operation("op_0", new ArithmeticOperation(ArithmeticOp.ADD), List.of("x", "y"), List.of("s"), "add", 0.8);
		Operation twice = new Operation("op_1", new ArithmeticOperation(ArithmeticOp.MULTIPLY), List.of("x", "2"), List.of("t"), "double", 0.8);
		ProgramIntent intent = intent(List.of(add, twice), List.of(global("x", DataType.INT32), global("y", DataType.INT32)));

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);

		assertFalse(model.hasErrors());
		assertEquals(2, model.getVariable("x").orElseThrow().getUsageCount());
		assertEquals(1, model.getVariable("y").orElseThrow().getUsageCount());
		Symbol x = model.getSymbolTable().resolve("x").orElseThrow();
		assertTrue(x.isUsed());
		assertEquals(2, x.getUsageLocations().size());

		long overflowChecks = model.getSafetyConstraints().stream()
				.filter(c -> c.getType() == SafetyConstraint.Type.OVERFLOW_CHECK)
				.count();
		assertEquals(2, overflowChecks);
	}

	@Test
	void primitiveTypesAreRegisteredWithSizeAndAlignment()
	{
		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent(List.of(), List.of()));

		assertEquals(List.of("i32", "i64", "f32", "f64", "bool", "char"), List.copyOf(model.getTypes().keySet()));
		TypeInfo i32 = model.getTypes().get("i32");
		assertEquals(4, i32.getSizeBytes());
		assertEquals(4, i32.getAlignment());
		assertTrue(i32.isPrimitive());
		assertEquals(8, model.getTypes().get("f64").getAlignment());
		assertEquals(1, model.getTypes().get("char").getSizeBytes());
	}

	@Test
	void arithmeticOnBooleanIsTypeMismatch()
	{
		Operation add = new Operation("op_0", new ArithmeticOperation(ArithmeticOp.ADD), List.of("flag", "n"), List.of("s"), "add", 0.8);
		ProgramIntent intent = intent(List.of(add), List.of(global("flag", DataType.BooleanType.INSTANCE), global("n", DataType.INT32)));

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);

		assertEquals(List.of(SemanticErrorType.TYPE_MISMATCH), model.getSemanticErrors().stream().map(SemanticError::getType).toList());
	}

	@Test
	void constantTrueLoopIsReportedAsInfinite()
	{
		Operation loop = new Operation("op_0", new LoopOperation("true", List.of()), List.of(), List.of(), "forever", 0.8);

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent(List.of(loop), List.of()));

		assertEquals(SemanticErrorType.INFINITE_LOOP, model.getSemanticErrors().get(0).getType());
	}

	@Test
	void calledFunctionsAreDefinedAndImpure()
	{
		Operation call = new Operation("op_0", new FunctionCallOperation("sqrt", List.of("x")), List.of("x"), List.of("r"), "root", 0.8);
		ProgramIntent intent = intent(List.of(call), List.of(global("x", DataType.DOUBLE)));

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);

		assertFalse(model.hasErrors());
		FunctionInfo sqrt = model.getFunctions().get("sqrt");
		assertFalse(sqrt.isPure());
		assertEquals(List.of(FunctionInfo.SideEffect.MODIFIES_GLOBAL_STATE), sqrt.getSideEffects());
		assertTrue(model.getSymbolTable().resolve("sqrt").isPresent());
	}

	@Test
	void pointersAndArraysNeedSafetyChecks()
	{
		ProgramIntent intent = intent(List.of(), List.of(
				global("p", new DataType.PointerType(DataType.INT32)),
				global("values", new DataType.ArrayType(DataType.INT32, 4))));

		SemanticModel model = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);

		List<SafetyConstraint> constraints = model.getSafetyConstraints();
		assertEquals(SafetyConstraint.Type.NULL_POINTER_CHECK, constraints.get(0).getType());
		assertEquals(SafetyConstraint.Severity.CRITICAL, constraints.get(0).getSeverity());
		assertEquals(List.of("p"), constraints.get(0).getAffectedVariables());
		assertEquals(SafetyConstraint.Type.BOUNDS_CHECK, constraints.get(1).getType());
		assertEquals(SafetyConstraint.Severity.HIGH, constraints.get(1).getSeverity());
	}

	@Test
	void memoryLayoutSplitsStackAndStatic()
	{
		ProgramIntent intent = intent(List.of(), List.of(
				global("counter", DataType.INT32),
				new DataStructure("ratio", DataType.DOUBLE, StorageScope.function("main")),
				global("done", DataType.BooleanType.INSTANCE)));

		MemoryLayout layout = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent).getMemoryLayout();

		assertEquals(13, layout.getTotalSize());
		assertEquals(8, layout.getStackSize());
		assertEquals(5, layout.getStaticSize());
		assertEquals(List.of("counter", "ratio"),
				layout.getAlignmentRequirements().stream().map(MemoryLayout.AlignmentRequirement::getVariableName).toList());
	}

	@Test
	void oracleInsightsAreKept()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("semantic analysis", "{\"insights\": [\"x may overflow\"]}");

		SemanticModel model = new SemanticAnalyzer(oracle).analyze(intent(List.of(), List.of()));

		assertEquals(List.of("x may overflow"), model.getOracleInsights());
		assertEquals(1, oracle.getPrompts().size());
	}

	@Test
	void failingOracleGivesNoInsights()
	{
		SemanticModel model = new SemanticAnalyzer(new ScriptedOracle().failing()).analyze(intent(List.of(), List.of()));
		assertTrue(model.getOracleInsights().isEmpty());
	}
}
