package org.lokray.nlmc.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Output of the flow analyzer. Blocks form an arena: {@code getBlocks().get(i).getIndex() == i}.
 */
public class FlowModel
{
	private final List<ControlBlock> blocks;
	private final List<DataFlow> dataFlows;
	private final DominanceTree dominanceTree;
	private final LoopAnalysis loopAnalysis;
	private final Map<String, Set<String>> reachingDefinitions;
	private final Map<String, Set<String>> liveVariables;
	private final Map<String, Set<String>> availableExpressions;
	private final List<OptimizationOpportunity> optimizationOpportunities;

	public FlowModel(List<ControlBlock> blocks, List<DataFlow> dataFlows, DominanceTree dominanceTree, LoopAnalysis loopAnalysis,
					 Map<String, Set<String>> reachingDefinitions, Map<String, Set<String>> liveVariables,
					 Map<String, Set<String>> availableExpressions, List<OptimizationOpportunity> optimizationOpportunities)
	{
		this.blocks = List.copyOf(blocks);
		this.dataFlows = List.copyOf(dataFlows);
		this.dominanceTree = dominanceTree;
		this.loopAnalysis = loopAnalysis;
		this.reachingDefinitions = freeze(reachingDefinitions);
		this.liveVariables = freeze(liveVariables);
		this.availableExpressions = freeze(availableExpressions);
		this.optimizationOpportunities = List.copyOf(optimizationOpportunities);
	}

	public static FlowModel empty()
	{
		return new FlowModel(List.of(), List.of(), DominanceTree.empty("entry"), LoopAnalysis.EMPTY, Map.of(), Map.of(), Map.of(), List.of());
	}

	private static Map<String, Set<String>> freeze(Map<String, Set<String>> source)
	{
		Map<String, Set<String>> frozen = new LinkedHashMap<>();
		source.forEach((key, set) -> frozen.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
		return Collections.unmodifiableMap(frozen);
	}

	public List<ControlBlock> getBlocks()
	{
		return blocks;
	}

	public ControlBlock getBlock(int index)
	{
		return blocks.get(index);
	}

	public Optional<ControlBlock> findBlock(String id)
	{
		return blocks.stream().filter(b -> b.getId().equals(id)).findFirst();
	}

	public List<String> getPredecessorIds(ControlBlock block)
	{
		return block.getPredecessors().stream().map(i -> blocks.get(i).getId()).toList();
	}

	public List<String> getSuccessorIds(ControlBlock block)
	{
		return block.getSuccessors().stream().map(i -> blocks.get(i).getId()).toList();
	}

	public List<DataFlow> getDataFlows()
	{
		return dataFlows;
	}

	public DominanceTree getDominanceTree()
	{
		return dominanceTree;
	}

	public LoopAnalysis getLoopAnalysis()
	{
		return loopAnalysis;
	}

	/**
	 * Variable name to the ids of the instructions defining it.
	 */
	public Map<String, Set<String>> getReachingDefinitions()
	{
		return reachingDefinitions;
	}

	/**
	 * Block id to the registers read in the block and not produced by it.
	 */
	public Map<String, Set<String>> getLiveVariables()
	{
		return liveVariables;
	}

	public Map<String, Set<String>> getAvailableExpressions()
	{
		return availableExpressions;
	}

	public List<OptimizationOpportunity> getOptimizationOpportunities()
	{
		return optimizationOpportunities;
	}

	public int getInstructionCount()
	{
		return blocks.stream().mapToInt(b -> b.getInstructions().size()).sum();
	}
}
