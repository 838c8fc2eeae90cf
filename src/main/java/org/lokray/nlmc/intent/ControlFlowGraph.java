package org.lokray.nlmc.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Coarse control flow of the described program, as produced by the extractor.
 * The flow analyzer builds its own instruction-level CFG from the operations.
 */
public class ControlFlowGraph
{
	public enum NodeKind
	{
		ENTRY, EXIT, BASIC_BLOCK, CONDITIONAL, LOOP, FUNCTION_CALL
	}

	public enum EdgeKind
	{
		UNCONDITIONAL, CONDITIONAL_TRUE, CONDITIONAL_FALSE, LOOP_BACK, FUNCTION_CALL, FUNCTION_RETURN
	}

	public static class Node
	{
		private final String id;
		private final NodeKind kind;
		private final List<String> operations;

		public Node(String id, NodeKind kind, List<String> operations)
		{
			this.id = Objects.requireNonNull(id);
			this.kind = Objects.requireNonNull(kind);
			this.operations = List.copyOf(operations);
		}

		public String getId()
		{
			return id;
		}

		public NodeKind getKind()
		{
			return kind;
		}

		/**
		 * Ids of the operations this node executes.
		 */
		public List<String> getOperations()
		{
			return operations;
		}
	}

	public static class Edge
	{
		private final String from;
		private final String to;
		private final EdgeKind kind;

		public Edge(String from, String to, EdgeKind kind)
		{
			this.from = Objects.requireNonNull(from);
			this.to = Objects.requireNonNull(to);
			this.kind = Objects.requireNonNull(kind);
		}

		public String getFrom()
		{
			return from;
		}

		public String getTo()
		{
			return to;
		}

		public EdgeKind getKind()
		{
			return kind;
		}
	}

	public static final String ENTRY_ID = "entry";
	public static final String EXIT_ID = "exit";

	private final String entry;
	private final List<String> exits;
	private final List<Node> nodes;
	private final List<Edge> edges;

	public ControlFlowGraph(String entry, List<String> exits, List<Node> nodes, List<Edge> edges)
	{
		this.entry = Objects.requireNonNull(entry);
		this.exits = List.copyOf(exits);
		this.nodes = List.copyOf(nodes);
		this.edges = List.copyOf(edges);
	}

	/**
	 * Builds the straight-line graph entry, one block per operation, exit.
	 */
	public static ControlFlowGraph straightLine(List<Operation> operations)
	{
		List<Node> nodes = new ArrayList<>();
		List<Edge> edges = new ArrayList<>();
		nodes.add(new Node(ENTRY_ID, NodeKind.ENTRY, Collections.emptyList()));

		String previous = ENTRY_ID;
		for (int i = 0; i < operations.size(); i++)
		{
			String blockId = "block_" + i;
			nodes.add(new Node(blockId, NodeKind.BASIC_BLOCK, List.of(operations.get(i).getId())));
			edges.add(new Edge(previous, blockId, EdgeKind.UNCONDITIONAL));
			previous = blockId;
		}

		nodes.add(new Node(EXIT_ID, NodeKind.EXIT, Collections.emptyList()));
		edges.add(new Edge(previous, EXIT_ID, EdgeKind.UNCONDITIONAL));
		return new ControlFlowGraph(ENTRY_ID, List.of(EXIT_ID), nodes, edges);
	}

	public String getEntry()
	{
		return entry;
	}

	public List<String> getExits()
	{
		return exits;
	}

	public List<Node> getNodes()
	{
		return nodes;
	}

	public List<Edge> getEdges()
	{
		return edges;
	}
}
