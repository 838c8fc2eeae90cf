package org.lokray.nlmc.dto;

import java.util.ArrayList;
import java.util.List;

public class BlockDTO
{
	public int index;
	public String id;
	public String kind;
	public List<String> predecessors = new ArrayList<>();
	public List<String> successors = new ArrayList<>();
	public List<String> dominators = new ArrayList<>();
	public List<InstructionDTO> instructions = new ArrayList<>();
}
