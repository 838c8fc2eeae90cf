package org.lokray.nlmc.flow;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Loop found from a back edge {@code latch -> header}. The body always contains both ends.
 */
public class NaturalLoop
{
	private final String header;
	private final String latch;
	private final Set<String> body;
	private final List<String> exits;
	private int depth = 1;
	private String parent;
	private TripCount tripCount = TripCount.UNKNOWN;

	public NaturalLoop(String header, String latch, Set<String> body, List<String> exits)
	{
		this.header = Objects.requireNonNull(header);
		this.latch = Objects.requireNonNull(latch);
		this.body = Collections.unmodifiableSet(new LinkedHashSet<>(body));
		this.exits = List.copyOf(exits);
	}

	public String getHeader()
	{
		return header;
	}

	public String getLatch()
	{
		return latch;
	}

	public Set<String> getBody()
	{
		return body;
	}

	public boolean contains(String blockId)
	{
		return body.contains(blockId);
	}

	public List<String> getExits()
	{
		return exits;
	}

	public int getDepth()
	{
		return depth;
	}

	void setDepth(int depth)
	{
		this.depth = depth;
	}

	/**
	 * Header of the innermost enclosing loop.
	 */
	public Optional<String> getParent()
	{
		return Optional.ofNullable(parent);
	}

	void setParent(String parent)
	{
		this.parent = parent;
	}

	public TripCount getTripCount()
	{
		return tripCount;
	}

	void setTripCount(TripCount tripCount)
	{
		this.tripCount = Objects.requireNonNull(tripCount);
	}

	@Override
	public String toString()
	{
		return "Loop{header=" + header + ", latch=" + latch + ", body=" + body + ", depth=" + depth + "}";
	}
}
