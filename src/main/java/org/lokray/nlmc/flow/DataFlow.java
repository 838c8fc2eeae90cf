package org.lokray.nlmc.flow;

import java.util.Objects;

/**
 * A dependence between two instructions through one variable. Distance is measured
 * in instruction positions over the whole program.
 */
public class DataFlow
{
	private final String fromInstruction;
	private final String toInstruction;
	private final String variable;
	private final DataFlowKind kind;
	private final int distance;

	public DataFlow(String fromInstruction, String toInstruction, String variable, DataFlowKind kind, int distance)
	{
		this.fromInstruction = Objects.requireNonNull(fromInstruction);
		this.toInstruction = Objects.requireNonNull(toInstruction);
		this.variable = Objects.requireNonNull(variable);
		this.kind = Objects.requireNonNull(kind);
		this.distance = distance;
	}

	public String getFromInstruction()
	{
		return fromInstruction;
	}

	public String getToInstruction()
	{
		return toInstruction;
	}

	public String getVariable()
	{
		return variable;
	}

	public DataFlowKind getKind()
	{
		return kind;
	}

	public int getDistance()
	{
		return distance;
	}

	@Override
	public String toString()
	{
		return kind + " " + fromInstruction + " -> " + toInstruction + " [" + variable + "]";
	}
}
