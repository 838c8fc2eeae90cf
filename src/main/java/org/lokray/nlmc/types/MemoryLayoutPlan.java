package org.lokray.nlmc.types;

import java.util.List;

/**
 * Where every typed entity goes: a stack frame, the static segment, or heap allocations.
 */
public class MemoryLayoutPlan
{
	public static class Slot
	{
		private final String name;
		private final int offset;
		private final int size;
		private final int alignment;

		public Slot(String name, int offset, int size, int alignment)
		{
			this.name = name;
			this.offset = offset;
			this.size = size;
			this.alignment = alignment;
		}

		public String getName()
		{
			return name;
		}

		public int getOffset()
		{
			return offset;
		}

		public int getSize()
		{
			return size;
		}

		public int getAlignment()
		{
			return alignment;
		}
	}

	public enum AllocationKind
	{
		SINGLE_OBJECT, ARRAY, STRING, DYNAMIC
	}

	public enum AllocationFrequency
	{
		ONCE, RARE, OCCASIONAL, FREQUENT, CONSTANT
	}

	public static class AllocationPattern
	{
		private final String name;
		private final AllocationKind kind;
		private final int estimatedSize;
		private final AllocationFrequency frequency;
		private final Lifetime lifetime;

		public AllocationPattern(String name, AllocationKind kind, int estimatedSize, AllocationFrequency frequency, Lifetime lifetime)
		{
			this.name = name;
			this.kind = kind;
			this.estimatedSize = estimatedSize;
			this.frequency = frequency;
			this.lifetime = lifetime;
		}

		public String getName()
		{
			return name;
		}

		public AllocationKind getKind()
		{
			return kind;
		}

		public int getEstimatedSize()
		{
			return estimatedSize;
		}

		public AllocationFrequency getFrequency()
		{
			return frequency;
		}

		public Lifetime getLifetime()
		{
			return lifetime;
		}
	}

	public static final MemoryLayoutPlan EMPTY = new MemoryLayoutPlan(List.of(), 0, List.of(), 0, List.of(), 0);

	private final List<Slot> stackSlots;
	private final int frameSize;
	private final List<Slot> staticSlots;
	private final int staticSize;
	private final List<AllocationPattern> allocationPatterns;
	private final int alignmentPadding;

	public MemoryLayoutPlan(List<Slot> stackSlots, int frameSize, List<Slot> staticSlots, int staticSize,
							List<AllocationPattern> allocationPatterns, int alignmentPadding)
	{
		this.stackSlots = List.copyOf(stackSlots);
		this.frameSize = frameSize;
		this.staticSlots = List.copyOf(staticSlots);
		this.staticSize = staticSize;
		this.allocationPatterns = List.copyOf(allocationPatterns);
		this.alignmentPadding = alignmentPadding;
	}

	public List<Slot> getStackSlots()
	{
		return stackSlots;
	}

	public int getFrameSize()
	{
		return frameSize;
	}

	public List<Slot> getStaticSlots()
	{
		return staticSlots;
	}

	public int getStaticSize()
	{
		return staticSize;
	}

	public List<AllocationPattern> getAllocationPatterns()
	{
		return allocationPatterns;
	}

	/**
	 * Bytes inserted by offset rounding, over both the frame and the static segment.
	 */
	public int getAlignmentPadding()
	{
		return alignmentPadding;
	}

	public int getTotalSize()
	{
		return frameSize + staticSize;
	}
}
