package org.lokray.nlmc.intent;

import org.lokray.nlmc.intent.operation.LoopOperation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the extractor understood about a description. The ambiguity list is the only
 * part replaced after extraction, by the resolver.
 */
public class ProgramIntent
{
	private final List<Operation> operations;
	private final List<DataStructure> dataStructures;
	private final ControlFlowGraph controlFlow;
	private final List<Constraint> constraints;
	private List<Ambiguity> ambiguities;
	private final IntentMetadata metadata;

	public ProgramIntent(List<Operation> operations, List<DataStructure> dataStructures, ControlFlowGraph controlFlow,
						 List<Constraint> constraints, List<Ambiguity> ambiguities, IntentMetadata metadata)
	{
		this.operations = new ArrayList<>(operations);
		this.dataStructures = List.copyOf(dataStructures);
		this.controlFlow = Objects.requireNonNull(controlFlow);
		this.constraints = List.copyOf(constraints);
		this.ambiguities = List.copyOf(ambiguities);
		this.metadata = Objects.requireNonNull(metadata);
	}

	public static ProgramIntent empty()
	{
		return new ProgramIntent(List.of(), List.of(), ControlFlowGraph.straightLine(List.of()), List.of(), List.of(), IntentMetadata.EMPTY);
	}

	public List<Operation> getOperations()
	{
		return Collections.unmodifiableList(operations);
	}

	public Optional<Operation> findOperation(String id)
	{
		return operations.stream().filter(op -> op.getId().equals(id)).findFirst();
	}

	public List<DataStructure> getDataStructures()
	{
		return dataStructures;
	}

	public Optional<DataStructure> findDataStructure(String name)
	{
		return dataStructures.stream().filter(ds -> ds.getName().equals(name)).findFirst();
	}

	public ControlFlowGraph getControlFlow()
	{
		return controlFlow;
	}

	public List<Constraint> getConstraints()
	{
		return constraints;
	}

	public List<Ambiguity> getAmbiguities()
	{
		return ambiguities;
	}

	public void setAmbiguities(List<Ambiguity> ambiguities)
	{
		this.ambiguities = List.copyOf(ambiguities);
	}

	public IntentMetadata getMetadata()
	{
		return metadata;
	}

	public boolean hasLoops()
	{
		return operations.stream().anyMatch(op -> op.getType() instanceof LoopOperation);
	}
}
