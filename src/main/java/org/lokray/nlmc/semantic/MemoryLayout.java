package org.lokray.nlmc.semantic;

import java.util.List;

/**
 * First-pass memory estimate. The type inferencer produces the real plan with offsets.
 */
public class MemoryLayout
{
	public static class AlignmentRequirement
	{
		private final String variableName;
		private final int requiredAlignment;
		private final String reason;

		public AlignmentRequirement(String variableName, int requiredAlignment, String reason)
		{
			this.variableName = variableName;
			this.requiredAlignment = requiredAlignment;
			this.reason = reason;
		}

		public String getVariableName()
		{
			return variableName;
		}

		public int getRequiredAlignment()
		{
			return requiredAlignment;
		}

		public String getReason()
		{
			return reason;
		}
	}

	public static final MemoryLayout EMPTY = new MemoryLayout(0, 0, 0, 0, List.of());

	private final long totalSize;
	private final long stackSize;
	private final long heapSize;
	private final long staticSize;
	private final List<AlignmentRequirement> alignmentRequirements;

	public MemoryLayout(long totalSize, long stackSize, long heapSize, long staticSize, List<AlignmentRequirement> alignmentRequirements)
	{
		this.totalSize = totalSize;
		this.stackSize = stackSize;
		this.heapSize = heapSize;
		this.staticSize = staticSize;
		this.alignmentRequirements = List.copyOf(alignmentRequirements);
	}

	public long getTotalSize()
	{
		return totalSize;
	}

	public long getStackSize()
	{
		return stackSize;
	}

	// Heap use is only known at run time
	public long getHeapSize()
	{
		return heapSize;
	}

	public long getStaticSize()
	{
		return staticSize;
	}

	public List<AlignmentRequirement> getAlignmentRequirements()
	{
		return alignmentRequirements;
	}
}
