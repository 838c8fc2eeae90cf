package org.lokray.nlmc.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A basic block in the flow graph. Blocks live in an arena owned by {@link FlowModel};
 * predecessors and successors are arena indices.
 */
public class ControlBlock
{
	private final int index;
	private final String id;
	private BlockKind kind;
	private final List<Instruction> instructions;
	private final List<Integer> predecessors = new ArrayList<>();
	private final List<Integer> successors = new ArrayList<>();

	public ControlBlock(int index, String id, BlockKind kind, List<Instruction> instructions)
	{
		this.index = index;
		this.id = Objects.requireNonNull(id);
		this.kind = Objects.requireNonNull(kind);
		this.instructions = List.copyOf(instructions);
	}

	public int getIndex()
	{
		return index;
	}

	public String getId()
	{
		return id;
	}

	public BlockKind getKind()
	{
		return kind;
	}

	void setKind(BlockKind kind)
	{
		this.kind = kind;
	}

	public List<Instruction> getInstructions()
	{
		return instructions;
	}

	public List<Integer> getPredecessors()
	{
		return Collections.unmodifiableList(predecessors);
	}

	public List<Integer> getSuccessors()
	{
		return Collections.unmodifiableList(successors);
	}

	void addSuccessor(ControlBlock target)
	{
		if (!successors.contains(target.index))
		{
			successors.add(target.index);
			target.predecessors.add(index);
		}
	}

	@Override
	public String toString()
	{
		return id + " (" + kind + ", " + instructions.size() + " instructions)";
	}
}
