package org.lokray.nlmc.flow;

import java.util.List;
import java.util.Objects;

/**
 * A transformation the backend could apply. Nothing in the analysis core applies it.
 */
public class OptimizationOpportunity
{
	private final OptimizationKind kind;
	private final String description;
	private final List<String> affectedBlocks;
	private final OptimizationBenefit benefit;
	private final List<String> prerequisites;

	public OptimizationOpportunity(OptimizationKind kind, String description, List<String> affectedBlocks,
								   OptimizationBenefit benefit, List<String> prerequisites)
	{
		this.kind = Objects.requireNonNull(kind);
		this.description = Objects.requireNonNull(description);
		this.affectedBlocks = List.copyOf(affectedBlocks);
		this.benefit = Objects.requireNonNull(benefit);
		this.prerequisites = List.copyOf(prerequisites);
	}

	public OptimizationKind getKind()
	{
		return kind;
	}

	public String getDescription()
	{
		return description;
	}

	public List<String> getAffectedBlocks()
	{
		return affectedBlocks;
	}

	public OptimizationBenefit getBenefit()
	{
		return benefit;
	}

	public List<String> getPrerequisites()
	{
		return prerequisites;
	}

	@Override
	public String toString()
	{
		return kind + " (" + benefit + "): " + description;
	}
}
