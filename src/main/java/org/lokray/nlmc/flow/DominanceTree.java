package org.lokray.nlmc.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Dominance facts keyed by block id. Every block dominates itself.
 */
public class DominanceTree
{
	private final String root;
	private final Map<String, Set<String>> dominators;
	private final Map<String, String> immediateDominators;
	private final Map<String, List<String>> children;
	private final Map<String, Integer> levels;
	private final Map<String, Set<String>> frontiers;

	public DominanceTree(String root, Map<String, Set<String>> dominators, Map<String, String> immediateDominators,
						 Map<String, List<String>> children, Map<String, Integer> levels, Map<String, Set<String>> frontiers)
	{
		this.root = root;
		this.dominators = freezeSets(dominators);
		this.immediateDominators = Collections.unmodifiableMap(new LinkedHashMap<>(immediateDominators));
		Map<String, List<String>> frozenChildren = new LinkedHashMap<>();
		children.forEach((id, list) -> frozenChildren.put(id, List.copyOf(list)));
		this.children = Collections.unmodifiableMap(frozenChildren);
		this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
		this.frontiers = freezeSets(frontiers);
	}

	public static DominanceTree empty(String root)
	{
		return new DominanceTree(root, Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
	}

	private static Map<String, Set<String>> freezeSets(Map<String, Set<String>> source)
	{
		Map<String, Set<String>> frozen = new LinkedHashMap<>();
		source.forEach((id, set) -> frozen.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(set))));
		return Collections.unmodifiableMap(frozen);
	}

	public String getRoot()
	{
		return root;
	}

	/**
	 * Full dominator set of a block, itself included; empty for an unknown block.
	 */
	public Set<String> getDominators(String blockId)
	{
		return dominators.getOrDefault(blockId, Set.of());
	}

	public Map<String, Set<String>> getAllDominators()
	{
		return dominators;
	}

	public boolean dominates(String dominator, String blockId)
	{
		return getDominators(blockId).contains(dominator);
	}

	/**
	 * Blocks strictly dominated by {@code blockId}.
	 */
	public List<String> getDominatedBlocks(String blockId)
	{
		return dominators.entrySet().stream()
				.filter(e -> !e.getKey().equals(blockId) && e.getValue().contains(blockId))
				.map(Map.Entry::getKey)
				.toList();
	}

	public Optional<String> getImmediateDominator(String blockId)
	{
		return Optional.ofNullable(immediateDominators.get(blockId));
	}

	public Map<String, String> getImmediateDominators()
	{
		return immediateDominators;
	}

	public List<String> getChildren(String blockId)
	{
		return children.getOrDefault(blockId, List.of());
	}

	/**
	 * Depth in the dominator tree, the root being 0.
	 */
	public int getLevel(String blockId)
	{
		return levels.getOrDefault(blockId, 0);
	}

	public Set<String> getDominanceFrontier(String blockId)
	{
		return frontiers.getOrDefault(blockId, Set.of());
	}

	public Map<String, Set<String>> getDominanceFrontiers()
	{
		return frontiers;
	}
}
