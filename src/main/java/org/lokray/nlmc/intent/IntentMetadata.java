package org.lokray.nlmc.intent;

import java.util.List;

public class IntentMetadata
{
	public static final IntentMetadata EMPTY = new IntentMetadata(0.0, "O(1)", 0, List.of(), List.of());

	private final double complexityScore;
	private final String estimatedRuntime;
	private final long memoryRequirements;
	private final List<String> systemDependencies;
	private final List<String> optimizationHints;

	public IntentMetadata(double complexityScore, String estimatedRuntime, long memoryRequirements,
						  List<String> systemDependencies, List<String> optimizationHints)
	{
		this.complexityScore = complexityScore;
		this.estimatedRuntime = estimatedRuntime;
		this.memoryRequirements = memoryRequirements;
		this.systemDependencies = List.copyOf(systemDependencies);
		this.optimizationHints = List.copyOf(optimizationHints);
	}

	/**
	 * In [0, 1].
	 */
	public double getComplexityScore()
	{
		return complexityScore;
	}

	public String getEstimatedRuntime()
	{
		return estimatedRuntime;
	}

	/**
	 * Estimated bytes for all declared data structures.
	 */
	public long getMemoryRequirements()
	{
		return memoryRequirements;
	}

	public List<String> getSystemDependencies()
	{
		return systemDependencies;
	}

	public List<String> getOptimizationHints()
	{
		return optimizationHints;
	}
}
