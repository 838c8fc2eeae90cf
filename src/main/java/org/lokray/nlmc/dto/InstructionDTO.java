package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class InstructionDTO
{
	public String id;
	public String opcode;
	public List<OperandDTO> operands = new ArrayList<>();
	public String result;
	public List<String> sideEffects = new ArrayList<>();
}
