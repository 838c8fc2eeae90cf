package org.lokray.nlmc.flow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Natural loops and the facts derived from them. Loops are identified by their header.
 */
public class LoopAnalysis
{
	public static final LoopAnalysis EMPTY = new LoopAnalysis(List.of(), Map.of(), Map.of());

	private final List<NaturalLoop> loops;
	private final Map<String, InductionVariable> inductionVariables;
	private final Map<String, Set<String>> loopInvariants;

	public LoopAnalysis(List<NaturalLoop> loops, Map<String, InductionVariable> inductionVariables,
						Map<String, Set<String>> loopInvariants)
	{
		this.loops = List.copyOf(loops);
		this.inductionVariables = Collections.unmodifiableMap(new LinkedHashMap<>(inductionVariables));
		Map<String, Set<String>> invariants = new LinkedHashMap<>();
		loopInvariants.forEach((header, ids) -> invariants.put(header, Collections.unmodifiableSet(new LinkedHashSet<>(ids))));
		this.loopInvariants = Collections.unmodifiableMap(invariants);
	}

	public List<NaturalLoop> getNaturalLoops()
	{
		return loops;
	}

	public Optional<NaturalLoop> findLoop(String header)
	{
		return loops.stream().filter(l -> l.getHeader().equals(header)).findFirst();
	}

	public List<String> getRootLoops()
	{
		return loops.stream().filter(l -> l.getParent().isEmpty()).map(NaturalLoop::getHeader).toList();
	}

	public List<String> getChildLoops(String header)
	{
		return loops.stream()
				.filter(l -> l.getParent().map(header::equals).orElse(false))
				.map(NaturalLoop::getHeader)
				.toList();
	}

	public Map<String, InductionVariable> getInductionVariables()
	{
		return inductionVariables;
	}

	/**
	 * Ids of the instructions whose operands do not change inside the loop with this header.
	 */
	public Set<String> getLoopInvariants(String header)
	{
		return loopInvariants.getOrDefault(header, Set.of());
	}

	public Map<String, Set<String>> getAllLoopInvariants()
	{
		return loopInvariants;
	}
}
