package org.lokray.nlmc.flow;

import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.operation.*;
import org.lokray.nlmc.types.TypeModel;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lowers the operations of one block to instructions. One instance per block, since
 * instruction ids are numbered within the block.
 */
class InstructionSelector implements OperationTypeVisitor<Instruction>
{
	static final String INPUT_FUNCTION = "input_function";
	static final String OUTPUT_FUNCTION = "output_function";
	static final String POW_FUNCTION = "pow";
	static final String DEFAULT_TYPE = "i32";
	private static final String UNKNOWN = "unknown";

	private static final Pattern INTEGER_LITERAL = Pattern.compile("-?\\d+");
	private static final Pattern FLOAT_LITERAL = Pattern.compile("-?\\d+\\.\\d+");

	private final String blockId;
	private final TypeModel types;
	private int counter = 0;
	private Operation current;

	InstructionSelector(String blockId, TypeModel types)
	{
		this.blockId = blockId;
		this.types = types;
	}

	Instruction select(Operation operation)
	{
		current = operation;
		Instruction instruction = operation.getType().accept(this);
		counter++;
		return instruction;
	}

	private String nextId()
	{
		return blockId + "_" + counter;
	}

	private String result()
	{
		return current.getOutputs().isEmpty() ? null : current.getOutputs().get(0);
	}

	private String firstInput()
	{
		return current.getInputs().isEmpty() ? UNKNOWN : current.getInputs().get(0);
	}

	Operand value(String name)
	{
		if (INTEGER_LITERAL.matcher(name).matches())
		{
			return new Operand(OperandKind.IMMEDIATE, name, DEFAULT_TYPE);
		}
		if (FLOAT_LITERAL.matcher(name).matches())
		{
			return new Operand(OperandKind.IMMEDIATE, name, "f64");
		}
		String type = types.getType(name).map(t -> t.getBaseType().getName()).orElse(DEFAULT_TYPE);
		return Operand.register(name, type);
	}

	private List<Operand> values(List<String> names)
	{
		return names.stream().map(this::value).toList();
	}

	@Override
	public Instruction visitArithmetic(ArithmeticOperation operation)
	{
		Opcode opcode;
		switch (operation.getOperator())
		{
			case ADD:
				opcode = Opcode.ADD;
				break;
			case SUBTRACT:
				opcode = Opcode.SUB;
				break;
			case MULTIPLY:
				opcode = Opcode.MUL;
				break;
			case DIVIDE:
				opcode = Opcode.DIV;
				break;
			case MODULO:
				opcode = Opcode.MOD;
				break;
			default:
				// No power instruction, lowered to a libm call
				List<Operand> operands = new ArrayList<>();
				operands.add(Operand.label(POW_FUNCTION));
				operands.addAll(values(current.getInputs()));
				return new Instruction(nextId(), Opcode.CALL, operands, result(), List.of(SideEffect.CALLS_FUNCTION));
		}
		return new Instruction(nextId(), opcode, values(current.getInputs()), result(), List.of());
	}

	@Override
	public Instruction visitComparison(ComparisonOperation operation)
	{
		Opcode opcode = switch (operation.getOperator())
		{
			case EQUAL -> Opcode.EQ;
			case NOT_EQUAL -> Opcode.NE;
			case LESS_THAN -> Opcode.LT;
			case LESS_EQUAL -> Opcode.LE;
			case GREATER_THAN -> Opcode.GT;
			case GREATER_EQUAL -> Opcode.GE;
		};
		return new Instruction(nextId(), opcode, values(current.getInputs()), result(), List.of());
	}

	@Override
	public Instruction visitAssignment(AssignmentOperation operation)
	{
		List<Operand> operands = List.of(value(firstInput()), new Operand(OperandKind.MEMORY, operation.getTarget(), "ptr"));
		return new Instruction(nextId(), Opcode.STORE, operands, null, List.of(SideEffect.MODIFIES_MEMORY));
	}

	@Override
	public Instruction visitFunctionCall(FunctionCallOperation operation)
	{
		List<Operand> operands = new ArrayList<>();
		operands.add(Operand.label(operation.getName()));
		operands.addAll(values(current.getInputs().isEmpty() ? operation.getArgs() : current.getInputs()));
		return new Instruction(nextId(), Opcode.CALL, operands, result(), List.of(SideEffect.CALLS_FUNCTION));
	}

	@Override
	public Instruction visitLoop(LoopOperation operation)
	{
		return new Instruction(nextId(), Opcode.COND_BR, List.of(condition(operation.getCondition())), null, List.of());
	}

	@Override
	public Instruction visitConditional(ConditionalOperation operation)
	{
		return new Instruction(nextId(), Opcode.COND_BR, List.of(condition(operation.getCondition())), null, List.of());
	}

	private Operand condition(String condition)
	{
		if (condition.equals("true") || condition.equals("false"))
		{
			return new Operand(OperandKind.IMMEDIATE, condition, "bool");
		}
		return new Operand(OperandKind.REGISTER, condition, "bool");
	}

	@Override
	public Instruction visitInput(InputOperation operation)
	{
		return new Instruction(nextId(), Opcode.CALL, List.of(Operand.label(INPUT_FUNCTION)), result(), List.of(SideEffect.HAS_IO));
	}

	@Override
	public Instruction visitOutput(OutputOperation operation)
	{
		List<Operand> operands = List.of(Operand.label(OUTPUT_FUNCTION), value(firstInput()));
		return new Instruction(nextId(), Opcode.CALL, operands, null, List.of(SideEffect.HAS_IO));
	}

	@Override
	public Instruction visitMemoryAllocation(MemoryAllocationOperation operation)
	{
		List<Operand> operands = new ArrayList<>();
		operation.getSize().ifPresent(size -> operands.add(new Operand(OperandKind.IMMEDIATE, String.valueOf(size), "i64")));
		return new Instruction(nextId(), Opcode.ALLOCA, operands, result(), List.of());
	}

	@Override
	public Instruction visitSystemCall(SystemCallOperation operation)
	{
		List<Operand> operands = new ArrayList<>();
		operands.add(Operand.label(operation.getCallType()));
		operands.addAll(values(operation.getParameters()));
		return new Instruction(nextId(), Opcode.CALL, operands, result(), List.of(SideEffect.CALLS_FUNCTION, SideEffect.HAS_IO));
	}
}
