package org.lokray.nlmc.flow;

import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.operation.LoopOperation;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds natural loops from back edges and derives nesting, trip counts, invariant
 * instructions and induction variables.
 */
class LoopDetector
{
	private static final Pattern TIMES = Pattern.compile("\\b(\\d+)\\s+times\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern LESS_THAN = Pattern.compile("<\\s*(\\d+)");
	private static final Pattern LESS_EQUAL = Pattern.compile("<=\\s*(\\d+)");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

	private final List<ControlBlock> blocks;
	private final DominanceTree dominance;

	LoopDetector(List<ControlBlock> blocks, DominanceTree dominance)
	{
		this.blocks = blocks;
		this.dominance = dominance;
	}

	/**
	 * Back edges {@code latch -> header}, grouped by header. A header reached by several
	 * back edges yields one loop.
	 */
	Map<Integer, List<Integer>> findBackEdges()
	{
		Map<Integer, List<Integer>> latchesByHeader = new LinkedHashMap<>();
		for (ControlBlock block : blocks)
		{
			for (int successor : block.getSuccessors())
			{
				if (dominance.dominates(blocks.get(successor).getId(), block.getId()))
				{
					latchesByHeader.computeIfAbsent(successor, k -> new ArrayList<>()).add(block.getIndex());
				}
			}
		}
		return latchesByHeader;
	}

	List<NaturalLoop> findNaturalLoops()
	{
		List<NaturalLoop> loops = new ArrayList<>();
		findBackEdges().forEach((header, latches) ->
		{
			Set<Integer> body = new LinkedHashSet<>();
			body.add(header);
			Deque<Integer> worklist = new ArrayDeque<>();
			for (int latch : latches)
			{
				if (body.add(latch))
				{
					worklist.push(latch);
				}
			}

			while (!worklist.isEmpty())
			{
				int current = worklist.pop();
				for (int predecessor : blocks.get(current).getPredecessors())
				{
					if (body.add(predecessor))
					{
						worklist.push(predecessor);
					}
				}
			}

			List<String> exits = new ArrayList<>();
			Set<String> bodyIds = new LinkedHashSet<>();
			for (int index : body)
			{
				bodyIds.add(blocks.get(index).getId());
				for (int successor : blocks.get(index).getSuccessors())
				{
					String exit = blocks.get(successor).getId();
					if (!body.contains(successor) && !exits.contains(exit))
					{
						exits.add(exit);
					}
				}
			}

			NaturalLoop loop = new NaturalLoop(blocks.get(header).getId(), blocks.get(latches.get(0)).getId(), bodyIds, exits);
			Debug.logDebug("Found " + loop);
			loops.add(loop);
		});
		assignNesting(loops);
		return loops;
	}

	private static void assignNesting(List<NaturalLoop> loops)
	{
		for (NaturalLoop inner : loops)
		{
			NaturalLoop parent = null;
			int depth = 1;
			for (NaturalLoop outer : loops)
			{
				if (outer != inner && outer.getBody().size() > inner.getBody().size() && outer.getBody().containsAll(inner.getBody()))
				{
					depth++;
					if (parent == null || outer.getBody().size() < parent.getBody().size())
					{
						parent = outer;
					}
				}
			}
			inner.setDepth(depth);
			if (parent != null)
			{
				inner.setParent(parent.getHeader());
			}
		}
	}

	/**
	 * Estimates the trip count from the condition of the loop operation in the header block.
	 */
	static TripCount estimateTripCount(Optional<LoopOperation> loopOperation)
	{
		if (loopOperation.isEmpty())
		{
			return TripCount.UNKNOWN;
		}

		String condition = loopOperation.get().getCondition().trim();
		Matcher matcher = TIMES.matcher(condition);
		if (matcher.find())
		{
			return TripCount.constant(Long.parseLong(matcher.group(1)));
		}
		matcher = LESS_EQUAL.matcher(condition);
		if (matcher.find())
		{
			return TripCount.constant(Long.parseLong(matcher.group(1)) + 1);
		}
		matcher = LESS_THAN.matcher(condition);
		if (matcher.find())
		{
			return TripCount.constant(Long.parseLong(matcher.group(1)));
		}
		if (IDENTIFIER.matcher(condition).matches() && !condition.equals("true") && !condition.equals("false")
				&& !condition.equals(LoopOperation.UNKNOWN_CONDITION))
		{
			return TripCount.variable(condition);
		}
		return TripCount.UNKNOWN;
	}

	static Optional<LoopOperation> loopOperationOf(ProgramIntent intent, List<String> operationIds)
	{
		for (String id : operationIds)
		{
			Optional<Operation> operation = intent.findOperation(id);
			if (operation.isPresent() && operation.get().getType() instanceof LoopOperation loop)
			{
				return Optional.of(loop);
			}
		}
		return Optional.empty();
	}

	private List<Instruction> bodyInstructions(NaturalLoop loop)
	{
		List<Instruction> instructions = new ArrayList<>();
		for (ControlBlock block : blocks)
		{
			if (loop.contains(block.getId()))
			{
				instructions.addAll(block.getInstructions());
			}
		}
		return instructions;
	}

	/**
	 * Instructions with no side effect none of whose register operands is written inside the loop.
	 */
	Set<String> findInvariants(NaturalLoop loop)
	{
		List<Instruction> body = bodyInstructions(loop);
		Set<String> definedInLoop = new LinkedHashSet<>();
		for (Instruction instruction : body)
		{
			instruction.getResult().ifPresent(definedInLoop::add);
		}

		Set<String> invariants = new LinkedHashSet<>();
		for (Instruction instruction : body)
		{
			if (instruction.getResult().isEmpty() || instruction.hasSideEffects() || instruction.getOpcode() == Opcode.COND_BR)
			{
				continue;
			}
			if (instruction.getRegisterOperands().stream().noneMatch(definedInLoop::contains))
			{
				invariants.add(instruction.getId());
			}
		}
		return invariants;
	}

	/**
	 * Variables updated as {@code x = x + step} or {@code x = x - step} inside the loop.
	 */
	List<InductionVariable> findInductionVariables(NaturalLoop loop, ProgramIntent intent)
	{
		List<InductionVariable> found = new ArrayList<>();
		for (Instruction instruction : bodyInstructions(loop))
		{
			if ((instruction.getOpcode() != Opcode.ADD && instruction.getOpcode() != Opcode.SUB)
					|| instruction.getResult().isEmpty() || instruction.getOperands().size() != 2)
			{
				continue;
			}

			String variable = instruction.getResult().get();
			Operand left = instruction.getOperands().get(0);
			Operand right = instruction.getOperands().get(1);
			String step;
			if (left.getValue().equals(variable))
			{
				step = right.getValue();
			}
			else if (right.getValue().equals(variable) && instruction.getOpcode() == Opcode.ADD)
			{
				step = left.getValue();
			}
			else
			{
				continue;
			}
			if (instruction.getOpcode() == Opcode.SUB)
			{
				step = step.startsWith("-") ? step.substring(1) : "-" + step;
			}

			String initial = intent.findDataStructure(variable).flatMap(DataStructure::getInitialValue).orElse("unknown");
			String finalValue = switch (loop.getTripCount().getKind())
			{
				case CONSTANT -> String.valueOf(loop.getTripCount().getCount());
				case VARIABLE -> loop.getTripCount().getVariable();
				case UNKNOWN -> null;
			};
			found.add(new InductionVariable(variable, loop.getHeader(), initial, step, finalValue, found.isEmpty()));
		}
		return found;
	}
}
