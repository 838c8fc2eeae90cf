package org.lokray.nlmc.semantic;

import org.lokray.nlmc.semantic.symbol.SymbolTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SemanticModel
{
	private final SymbolTable symbolTable;
	private final Map<String, VariableInfo> variables;
	private final Map<String, FunctionInfo> functions;
	private final Map<String, TypeInfo> types;
	private final MemoryLayout memoryLayout;
	private final List<SafetyConstraint> safetyConstraints;
	private final List<SemanticError> semanticErrors;
	private final List<String> oracleInsights;

	public SemanticModel(SymbolTable symbolTable, Map<String, VariableInfo> variables, Map<String, FunctionInfo> functions,
						 Map<String, TypeInfo> types, MemoryLayout memoryLayout, List<SafetyConstraint> safetyConstraints,
						 List<SemanticError> semanticErrors, List<String> oracleInsights)
	{
		this.symbolTable = symbolTable;
		this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
		this.functions = Collections.unmodifiableMap(new LinkedHashMap<>(functions));
		this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
		this.memoryLayout = memoryLayout;
		this.safetyConstraints = List.copyOf(safetyConstraints);
		this.semanticErrors = List.copyOf(semanticErrors);
		this.oracleInsights = List.copyOf(oracleInsights);
	}

	public static SemanticModel empty()
	{
		return new SemanticModel(new SymbolTable(), Map.of(), Map.of(), Map.of(), MemoryLayout.EMPTY, List.of(), List.of(), List.of());
	}

	public SymbolTable getSymbolTable()
	{
		return symbolTable;
	}

	/**
	 * Declared variables in declaration order.
	 */
	public Map<String, VariableInfo> getVariables()
	{
		return variables;
	}

	public Optional<VariableInfo> getVariable(String name)
	{
		return Optional.ofNullable(variables.get(name));
	}

	public Map<String, FunctionInfo> getFunctions()
	{
		return functions;
	}

	public Map<String, TypeInfo> getTypes()
	{
		return types;
	}

	public MemoryLayout getMemoryLayout()
	{
		return memoryLayout;
	}

	public List<SafetyConstraint> getSafetyConstraints()
	{
		return safetyConstraints;
	}

	public List<SemanticError> getSemanticErrors()
	{
		return semanticErrors;
	}

	public boolean hasErrors()
	{
		return !semanticErrors.isEmpty();
	}

	public List<String> getOracleInsights()
	{
		return oracleInsights;
	}
}
