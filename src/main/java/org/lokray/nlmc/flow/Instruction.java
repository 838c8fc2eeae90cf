package org.lokray.nlmc.flow;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One three-address style instruction, named {@code <block>_<n>}.
 */
public class Instruction
{
	private final String id;
	private final Opcode opcode;
	private final List<Operand> operands;
	private final String result;
	private final List<SideEffect> sideEffects;

	public Instruction(String id, Opcode opcode, List<Operand> operands, String result, List<SideEffect> sideEffects)
	{
		this.id = Objects.requireNonNull(id);
		this.opcode = Objects.requireNonNull(opcode);
		this.operands = List.copyOf(operands);
		this.result = result;
		this.sideEffects = List.copyOf(sideEffects);
	}

	public String getId()
	{
		return id;
	}

	public Opcode getOpcode()
	{
		return opcode;
	}

	public List<Operand> getOperands()
	{
		return operands;
	}

	public List<String> getRegisterOperands()
	{
		return operands.stream().filter(Operand::isRegister).map(Operand::getValue).toList();
	}

	public Optional<String> getResult()
	{
		return Optional.ofNullable(result);
	}

	public List<SideEffect> getSideEffects()
	{
		return sideEffects;
	}

	public boolean hasSideEffects()
	{
		return !sideEffects.isEmpty();
	}

	@Override
	public String toString()
	{
		String prefix = result == null ? "" : result + " = ";
		return id + ": " + prefix + opcode + " " + operands;
	}
}
