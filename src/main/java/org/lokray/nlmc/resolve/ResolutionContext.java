package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What the resolver knows about the program when it looks at an ambiguity.
 */
public class ResolutionContext
{
	private static final int RECENT_OPERATION_LIMIT = 5;

	private final List<String> variablesInScope;
	private final List<String> recentOperations;
	private final Map<String, DataType> currentTypes;
	private final String controlFlowState;

	public ResolutionContext(List<String> variablesInScope, List<String> recentOperations, Map<String, DataType> currentTypes, String controlFlowState)
	{
		this.variablesInScope = List.copyOf(variablesInScope);
		this.recentOperations = List.copyOf(recentOperations);
		this.currentTypes = Collections.unmodifiableMap(new LinkedHashMap<>(currentTypes));
		this.controlFlowState = controlFlowState;
	}

	public static ResolutionContext of(ProgramIntent intent)
	{
		List<String> variables = intent.getDataStructures().stream().map(DataStructure::getName).toList();
		List<String> recent = intent.getOperations().stream()
				.limit(RECENT_OPERATION_LIMIT)
				.map(Operation::getDescription)
				.toList();
		Map<String, DataType> types = new LinkedHashMap<>();
		intent.getDataStructures().forEach(ds -> types.put(ds.getName(), ds.getType()));
		return new ResolutionContext(variables, recent, types, intent.hasLoops() ? "looping" : "sequential");
	}

	/**
	 * Variables in declaration order.
	 */
	public List<String> getVariablesInScope()
	{
		return variablesInScope;
	}

	public Optional<String> getMostRecentVariable()
	{
		return variablesInScope.isEmpty() ? Optional.empty() : Optional.of(variablesInScope.get(variablesInScope.size() - 1));
	}

	public List<String> getRecentOperations()
	{
		return recentOperations;
	}

	public Map<String, DataType> getCurrentTypes()
	{
		return currentTypes;
	}

	public String getControlFlowState()
	{
		return controlFlowState;
	}

	public boolean hasIntegerVariables()
	{
		return currentTypes.values().stream().anyMatch(DataType::isInteger);
	}

	public boolean hasFloatVariables()
	{
		return currentTypes.values().stream().anyMatch(DataType::isFloat);
	}
}
