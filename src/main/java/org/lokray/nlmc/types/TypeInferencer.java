package org.lokray.nlmc.types;

import com.google.gson.JsonObject;
import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.operation.*;
import org.lokray.nlmc.oracle.OracleResponses;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.semantic.SafetyConstraint;
import org.lokray.nlmc.semantic.SemanticModel;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fourth pipeline stage: gives every declared variable and every operation result a
 * concrete machine type, then plans where each of them lives.
 */
public class TypeInferencer
{
	public static final String NON_ZERO_DIVISOR = "non_zero_divisor";

	private final ReasoningOracle oracle;

	public TypeInferencer(ReasoningOracle oracle)
	{
		this.oracle = oracle;
	}

	public TypeModel inferTypes(ProgramIntent intent, SemanticModel semantic)
	{
		Debug.logDebug("Inferring types");

		Map<String, InferredType> types = new LinkedHashMap<>();
		inferFromDataStructures(intent, types);
		inferFromOperations(intent, types);

		List<TypeConstraint> constraints = new ArrayList<>();
		applySemanticConstraints(semantic, constraints);
		generateTypeConstraints(types, constraints);

		MemoryLayoutPlan layout = planMemoryLayout(types, intent.hasLoops());
		List<TypeConversion> conversions = ConversionTable.compute(types);
		List<String> insights = queryRefinements(intent, semantic, types, layout);

		Debug.logDebug("Type inference: " + types.size() + " types, " + constraints.size() + " constraints, "
				+ conversions.size() + " conversions, " + layout.getTotalSize() + " bytes");
		return new TypeModel(types, constraints, layout, conversions, insights);
	}

	private void inferFromDataStructures(ProgramIntent intent, Map<String, InferredType> types)
	{
		for (DataStructure ds : intent.getDataStructures())
		{
			BaseType base = BaseType.of(ds.getType());
			boolean pointer = base instanceof PointerBaseType;
			Ownership ownership = base.isIndirect() ? Ownership.BORROWED : Ownership.OWNED;
			types.put(ds.getName(), new InferredType(ds.getType().getName(), base, pointer, Lifetime.of(ds.getScope()),
					Mutability.MUTABLE, ownership, List.of()));
		}
	}

	private void inferFromOperations(ProgramIntent intent, Map<String, InferredType> types)
	{
		ResultTypeVisitor visitor = new ResultTypeVisitor();
		for (Operation operation : intent.getOperations())
		{
			Optional<InferredType> result = operation.getType().accept(visitor);
			if (result.isPresent())
			{
				for (String output : operation.getOutputs())
				{
					types.put(output, result.get());
				}
			}
		}
	}

	private void applySemanticConstraints(SemanticModel semantic, List<TypeConstraint> constraints)
	{
		for (SafetyConstraint safety : semantic.getSafetyConstraints())
		{
			switch (safety.getType())
			{
				case NULL_POINTER_CHECK -> constraints.add(TypeConstraint.nullability(false, safety.getAffectedVariables(),
						safety.getDescription(), TypeConstraint.Severity.ERROR));
				case BOUNDS_CHECK -> constraints.add(TypeConstraint.size(0L, null, safety.getAffectedVariables(),
						safety.getDescription(), TypeConstraint.Severity.ERROR));
				case OVERFLOW_CHECK -> constraints.add(TypeConstraint.numericRange((long) Integer.MIN_VALUE, (long) Integer.MAX_VALUE,
						safety.getAffectedVariables(), safety.getDescription(), TypeConstraint.Severity.WARNING));
				default -> Debug.logDebug("No type constraint for safety constraint " + safety.getType());
			}
		}
	}

	private void generateTypeConstraints(Map<String, InferredType> types, List<TypeConstraint> constraints)
	{
		types.forEach((name, type) ->
		{
			if (type.getAlignment() > 1)
			{
				constraints.add(TypeConstraint.alignment(type.getAlignment(), List.of(name),
						"Type " + name + " requires " + type.getAlignment() + "-byte alignment", TypeConstraint.Severity.WARNING));
			}
			if (type.getMutability() == Mutability.IMMUTABLE)
			{
				constraints.add(TypeConstraint.mutability(Mutability.IMMUTABLE, List.of(name),
						name + " must not be written after initialization", TypeConstraint.Severity.INFO));
			}
			BaseType base = type.getBaseType();
			if (base instanceof PointerBaseType || base instanceof ReferenceBaseType)
			{
				constraints.add(TypeConstraint.lifetime(Lifetime.FUNCTION, List.of(name),
						"Target of " + name + " must live at least as long as the function", TypeConstraint.Severity.WARNING));
			}
		});
	}

	static MemoryLayoutPlan planMemoryLayout(Map<String, InferredType> types, boolean hasLoops)
	{
		List<MemoryLayoutPlan.Slot> stack = new ArrayList<>();
		List<MemoryLayoutPlan.Slot> statics = new ArrayList<>();
		List<MemoryLayoutPlan.AllocationPattern> patterns = new ArrayList<>();
		int stackOffset = 0;
		int staticOffset = 0;
		int padding = 0;

		for (Map.Entry<String, InferredType> entry : types.entrySet())
		{
			String name = entry.getKey();
			InferredType type = entry.getValue();
			int align = type.getAlignment();

			if (type.getLifetime().isStackAllocated())
			{
				int aligned = alignUp(stackOffset, align);
				padding += aligned - stackOffset;
				stack.add(new MemoryLayoutPlan.Slot(name, aligned, type.getSizeBytes(), align));
				stackOffset = aligned + type.getSizeBytes();
			}
			else if (type.getLifetime() == Lifetime.STATIC)
			{
				int aligned = alignUp(staticOffset, align);
				padding += aligned - staticOffset;
				statics.add(new MemoryLayoutPlan.Slot(name, aligned, type.getSizeBytes(), align));
				staticOffset = aligned + type.getSizeBytes();
			}

			heapPattern(name, type, hasLoops).ifPresent(patterns::add);
		}
		return new MemoryLayoutPlan(stack, stackOffset, statics, staticOffset, patterns, padding);
	}

	private static Optional<MemoryLayoutPlan.AllocationPattern> heapPattern(String name, InferredType type, boolean hasLoops)
	{
		BaseType base = type.getBaseType();
		MemoryLayoutPlan.AllocationKind kind;
		if (base instanceof StringBaseType)
		{
			kind = MemoryLayoutPlan.AllocationKind.STRING;
		}
		else if (base instanceof ArrayBaseType array && array.isDynamic())
		{
			kind = MemoryLayoutPlan.AllocationKind.DYNAMIC;
		}
		else if (base instanceof PointerBaseType || type.getLifetime() == Lifetime.HEAP)
		{
			kind = MemoryLayoutPlan.AllocationKind.SINGLE_OBJECT;
		}
		else
		{
			return Optional.empty();
		}
		MemoryLayoutPlan.AllocationFrequency frequency = hasLoops ? MemoryLayoutPlan.AllocationFrequency.FREQUENT : MemoryLayoutPlan.AllocationFrequency.ONCE;
		return Optional.of(new MemoryLayoutPlan.AllocationPattern(name, kind, type.getSizeBytes(), frequency, type.getLifetime()));
	}

	/**
	 * Rounds {@code offset} up to a multiple of {@code alignment}, which must be a power of two.
	 */
	static int alignUp(int offset, int alignment)
	{
		return (offset + alignment - 1) & ~(alignment - 1);
	}

	private List<String> queryRefinements(ProgramIntent intent, SemanticModel semantic, Map<String, InferredType> types, MemoryLayoutPlan layout)
	{
		String prompt = "You are a type inference agent. Analyze the program and provide additional type insights.\n\n"
				+ "Operations: " + intent.getOperations().size() + "\n"
				+ "Data structures: " + intent.getDataStructures().size() + "\n"
				+ "Variables in semantic model: " + semantic.getVariables().size() + "\n"
				+ "Inferred types: " + types.keySet() + "\n"
				+ "Safety constraints: " + semantic.getSafetyConstraints().size() + "\n"
				+ "Memory layout: " + layout.getTotalSize() + " bytes total\n\n"
				+ "Focus on precise type bounds, lifetimes and memory use.\n"
				+ "Respond with a JSON object {\"insights\": [\"...\"]}. Return ONLY the JSON object.";
		Optional<JsonObject> answer = OracleResponses.queryObject(oracle, "Type inference", prompt);
		return answer.map(json -> OracleResponses.getStringArray(json, "insights")).orElse(List.of());
	}

	/**
	 * Result type of each operation kind; empty when the operation produces no typed value.
	 */
	private static class ResultTypeVisitor implements OperationTypeVisitor<Optional<InferredType>>
	{
		private static InferredType result(String name, BaseType base, List<String> constraints)
		{
			return new InferredType(name, base, false, Lifetime.FUNCTION, Mutability.IMMUTABLE, Ownership.OWNED, constraints);
		}

		@Override
		public Optional<InferredType> visitArithmetic(ArithmeticOperation operation)
		{
			switch (operation.getOperator())
			{
				case ADD:
				case SUBTRACT:
				case MULTIPLY:
					return Optional.of(result("arithmetic_result", IntegerBaseType.I32, List.of()));
				case DIVIDE:
					return Optional.of(result("division_result", FloatBaseType.F64, List.of(NON_ZERO_DIVISOR)));
				case MODULO:
					return Optional.of(result("arithmetic_result", IntegerBaseType.I32, List.of(NON_ZERO_DIVISOR)));
				case POWER:
					return Optional.of(result("power_result", FloatBaseType.F64, List.of()));
				default:
					return Optional.empty();
			}
		}

		@Override
		public Optional<InferredType> visitComparison(ComparisonOperation operation)
		{
			return Optional.of(result("comparison_result", BooleanBaseType.INSTANCE, List.of()));
		}

		@Override
		public Optional<InferredType> visitAssignment(AssignmentOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitFunctionCall(FunctionCallOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitLoop(LoopOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitConditional(ConditionalOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitInput(InputOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitOutput(OutputOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitMemoryAllocation(MemoryAllocationOperation operation)
		{
			return Optional.empty();
		}

		@Override
		public Optional<InferredType> visitSystemCall(SystemCallOperation operation)
		{
			return Optional.empty();
		}
	}
}
