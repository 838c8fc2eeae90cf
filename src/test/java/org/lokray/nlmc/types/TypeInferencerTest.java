package org.lokray.nlmc.types;

import org.junit.jupiter.api.Test;
import org.lokray.nlmc.intent.ControlFlowGraph;
import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.IntentMetadata;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.StorageScope;
import org.lokray.nlmc.intent.operation.ArithmeticOp;
import org.lokray.nlmc.intent.operation.ArithmeticOperation;
import org.lokray.nlmc.intent.operation.ComparisonOp;
import org.lokray.nlmc.intent.operation.ComparisonOperation;
import org.lokray.nlmc.intent.operation.OutputOperation;
import org.lokray.nlmc.oracle.OfflineOracle;
import org.lokray.nlmc.oracle.ScriptedOracle;
import org.lokray.nlmc.semantic.SemanticAnalyzer;
import org.lokray.nlmc.semantic.SemanticModel;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TypeInferencerTest
{
	private static ProgramIntent intent(List<Operation> operations, List<DataStructure> dataStructures)
	{
		return new ProgramIntent(operations, dataStructures, ControlFlowGraph.straightLine(operations), List.of(), List.of(),
				IntentMetadata.EMPTY);
	}

	private static TypeModel infer(ProgramIntent intent)
	{
		SemanticModel semantic = new SemanticAnalyzer(OfflineOracle.INSTANCE).analyze(intent);
		return new TypeInferencer(OfflineOracle.INSTANCE).inferTypes(intent, semantic);
	}

	private static InferredType local(BaseType base)
	{
		return new InferredType(base.getName(), base, false, Lifetime.FUNCTION, Mutability.MUTABLE, Ownership.OWNED, List.of());
	}

	@Test
	void dataStructuresKeepTheirDeclaredShape()
	{
		TypeModel model = infer(intent(List.of(), List.of(
				new DataStructure("x", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("small", new DataType.IntegerType(16, true), StorageScope.function("main")),
				new DataStructure("ratio", DataType.DOUBLE, StorageScope.block("b0")),
				new DataStructure("p", new DataType.PointerType(DataType.INT32), StorageScope.GLOBAL))));

		InferredType x = model.getType("x").orElseThrow();
		assertEquals("i32", x.getName());
		assertEquals(4, x.getSizeBytes());
		assertEquals(Lifetime.STATIC, x.getLifetime());
		assertEquals(Mutability.MUTABLE, x.getMutability());
		assertEquals(Ownership.OWNED, x.getOwnership());
		assertFalse(x.isNullable());

		InferredType small = model.getType("small").orElseThrow();
		assertEquals(2, small.getSizeBytes());
		assertEquals(2, small.getAlignment());
		assertEquals(Lifetime.FUNCTION, small.getLifetime());

		InferredType ratio = model.getType("ratio").orElseThrow();
		assertEquals(8, ratio.getAlignment());
		assertEquals(Lifetime.BLOCK, ratio.getLifetime());

		InferredType p = model.getType("p").orElseThrow();
		assertTrue(p.isNullable());
		assertEquals(8, p.getSizeBytes());
		assertEquals(Ownership.BORROWED, p.getOwnership());
	}

	@Test
	void operationOutputsGetResultTypes()
	{
		Operation add = new Operation("op_0", new ArithmeticOperation(ArithmeticOp.ADD), List.of("1", "2"), List.of("sum"), "add", 0.8);
		Operation divide = new Operation("op_1", new ArithmeticOperation(ArithmeticOp.DIVIDE), List.of("sum", "2"), List.of("mean"), "div", 0.8);
		Operation compare = new Operation("op_2", new ComparisonOperation(ComparisonOp.LESS_THAN), List.of("1", "2"), List.of("lt"), "cmp", 0.8);
		Operation print = new Operation("op_3", new OutputOperation(null), List.of("mean"), List.of("ignored"), "print", 0.8);

		TypeModel model = infer(intent(List.of(add, divide, compare, print), List.of()));

		InferredType sum = model.getType("sum").orElseThrow();
		assertEquals("arithmetic_result", sum.getName());
		assertEquals(IntegerBaseType.I32, sum.getBaseType());
		assertEquals(Lifetime.FUNCTION, sum.getLifetime());
		assertEquals(Mutability.IMMUTABLE, sum.getMutability());

		InferredType mean = model.getType("mean").orElseThrow();
		assertEquals("division_result", mean.getName());
		assertEquals(FloatBaseType.F64, mean.getBaseType());
		assertEquals(List.of(TypeInferencer.NON_ZERO_DIVISOR), mean.getConstraints());

		assertEquals(BooleanBaseType.INSTANCE, model.getType("lt").orElseThrow().getBaseType());
		assertEquals(Optional.empty(), model.getType("ignored"));
	}

	@Test
	void safetyConstraintsBecomeTypeConstraints()
	{
		Operation add = new Operation("op_0", new ArithmeticOperation(ArithmeticOp.ADD), List.of("x", "x"), List.of("s"), "add", 0.8);
		TypeModel model = infer(intent(List.of(add), List.of(
				new DataStructure("x", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("p", new DataType.PointerType(DataType.INT32), StorageScope.GLOBAL),
				new DataStructure("arr", new DataType.ArrayType(DataType.INT32, 4), StorageScope.GLOBAL))));

		List<TypeConstraint> constraints = model.getTypeConstraints();
		TypeConstraint nullability = constraints.stream().filter(c -> c.getKind() == TypeConstraint.Kind.NULLABILITY).findFirst().orElseThrow();
		assertEquals(Optional.of(false), nullability.getNullable());
		assertEquals(TypeConstraint.Severity.ERROR, nullability.getSeverity());

		TypeConstraint bounds = constraints.stream().filter(c -> c.getKind() == TypeConstraint.Kind.SIZE).findFirst().orElseThrow();
		assertEquals(Optional.of(0L), bounds.getMin());
		assertEquals(Optional.empty(), bounds.getMax());

		TypeConstraint range = constraints.stream().filter(c -> c.getKind() == TypeConstraint.Kind.NUMERIC_RANGE).findFirst().orElseThrow();
		assertEquals(Optional.of((long) Integer.MIN_VALUE), range.getMin());
		assertEquals(Optional.of((long) Integer.MAX_VALUE), range.getMax());
		assertEquals(TypeConstraint.Severity.WARNING, range.getSeverity());

		assertTrue(constraints.stream().anyMatch(c -> c.getKind() == TypeConstraint.Kind.LIFETIME && c.getAffectedTypes().equals(List.of("p"))));
		assertTrue(constraints.stream().anyMatch(c -> c.getKind() == TypeConstraint.Kind.MUTABILITY && c.getAffectedTypes().equals(List.of("s"))));
		assertTrue(constraints.stream().anyMatch(c -> c.getDescription().equals("Type x requires 4-byte alignment")));
	}

	@Test
	void alignUpRoundsToPowerOfTwo()
	{
		assertEquals(0, TypeInferencer.alignUp(0, 4));
		assertEquals(16, TypeInferencer.alignUp(13, 8));
		assertEquals(16, TypeInferencer.alignUp(16, 8));
		assertEquals(5, TypeInferencer.alignUp(5, 1));
	}

	@Test
	void stackSlotsAreAlignedAndPaddingCounted()
	{
		Map<String, InferredType> types = new LinkedHashMap<>();
		types.put("flag", local(BooleanBaseType.INSTANCE));
		types.put("ratio", local(FloatBaseType.F64));
		types.put("count", local(IntegerBaseType.I32));
		types.put("total", new InferredType("i64", IntegerBaseType.I64, false, Lifetime.STATIC, Mutability.MUTABLE, Ownership.OWNED, List.of()));

		MemoryLayoutPlan plan = TypeInferencer.planMemoryLayout(types, false);

		assertEquals(List.of(0, 8, 16), plan.getStackSlots().stream().map(MemoryLayoutPlan.Slot::getOffset).toList());
		assertEquals(20, plan.getFrameSize());
		assertEquals(1, plan.getStaticSlots().size());
		assertEquals(8, plan.getStaticSize());
		assertEquals(7, plan.getAlignmentPadding());
		assertEquals(28, plan.getTotalSize());
		assertTrue(plan.getAllocationPatterns().isEmpty());
	}

	@Test
	void indirectAndStringTypesGetHeapPatterns()
	{
		Map<String, InferredType> types = new LinkedHashMap<>();
		types.put("name", local(new StringBaseType(StringEncoding.UTF8)));
		types.put("p", local(new PointerBaseType(IntegerBaseType.I32, false)));
		types.put("n", local(IntegerBaseType.I32));

		MemoryLayoutPlan plan = TypeInferencer.planMemoryLayout(types, true);

		List<MemoryLayoutPlan.AllocationPattern> patterns = plan.getAllocationPatterns();
		assertEquals(2, patterns.size());
		assertEquals(MemoryLayoutPlan.AllocationKind.STRING, patterns.get(0).getKind());
		assertEquals(MemoryLayoutPlan.AllocationKind.SINGLE_OBJECT, patterns.get(1).getKind());
		assertEquals(MemoryLayoutPlan.AllocationFrequency.FREQUENT, patterns.get(0).getFrequency());
	}

	@Test
	void conversionsAreComputedBetweenEntities()
	{
		TypeModel model = infer(intent(List.of(), List.of(
				new DataStructure("i", DataType.INT32, StorageScope.GLOBAL),
				new DataStructure("f", DataType.DOUBLE, StorageScope.GLOBAL))));

		TypeConversion widen = model.findConversion("i", "f").orElseThrow();
		assertEquals(ConversionKind.IMPLICIT, widen.getKind());
		assertTrue(widen.isSafe());
		assertFalse(model.findConversion("f", "i").orElseThrow().isSafe());
	}

	@Test
	void oracleInsightsAreAttached()
	{
		ScriptedOracle oracle = new ScriptedOracle().answer("type inference", "{\"insights\": [\"ratio fits in f32\"]}");
		ProgramIntent intent = intent(List.of(), List.of());

		TypeModel model = new TypeInferencer(oracle).inferTypes(intent, SemanticModel.empty());

		assertEquals(List.of("ratio fits in f32"), model.getOracleInsights());
	}
}
