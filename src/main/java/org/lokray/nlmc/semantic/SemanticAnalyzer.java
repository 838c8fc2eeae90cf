package org.lokray.nlmc.semantic;

import com.google.gson.JsonObject;
import org.lokray.nlmc.intent.DataStructure;
import org.lokray.nlmc.intent.DataType;
import org.lokray.nlmc.intent.Operation;
import org.lokray.nlmc.intent.ProgramIntent;
import org.lokray.nlmc.intent.operation.ArithmeticOperation;
import org.lokray.nlmc.intent.operation.FunctionCallOperation;
import org.lokray.nlmc.intent.operation.LoopOperation;
import org.lokray.nlmc.oracle.OracleResponses;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.semantic.symbol.FunctionSymbol;
import org.lokray.nlmc.semantic.symbol.SourceLocation;
import org.lokray.nlmc.semantic.symbol.Symbol;
import org.lokray.nlmc.semantic.symbol.SymbolTable;
import org.lokray.nlmc.semantic.symbol.VariableSymbol;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Third pipeline stage. Never fails: every problem it finds is recorded as a
 * {@link SemanticError} on the returned model.
 */
public class SemanticAnalyzer
{
	private static final Pattern NUMERIC_LITERAL = Pattern.compile("-?\\d+(\\.\\d+)?");

	private static final List<TypeInfo> PRIMITIVE_TYPES = List.of(
			new TypeInfo("i32", 4, 4, true),
			new TypeInfo("i64", 8, 8, true),
			new TypeInfo("f32", 4, 4, true),
			new TypeInfo("f64", 8, 8, true),
			new TypeInfo("bool", 1, 1, true),
			new TypeInfo("char", 1, 1, true));

	private final ReasoningOracle oracle;

	public SemanticAnalyzer(ReasoningOracle oracle)
	{
		this.oracle = oracle;
	}

	public SemanticModel analyze(ProgramIntent intent)
	{
		Debug.logDebug("Analyzing semantics of " + intent.getOperations().size() + " operations");

		SymbolTable symbolTable = buildSymbolTable(intent);
		Map<String, VariableInfo> variables = analyzeVariables(intent);
		Map<String, FunctionInfo> functions = analyzeFunctions(intent);
		Map<String, TypeInfo> types = analyzeTypes(intent);

		List<SemanticError> errors = new ArrayList<>();
		validateSemantics(intent, symbolTable, variables, functions, errors);
		List<SafetyConstraint> safetyConstraints = generateSafetyConstraints(intent, variables);
		MemoryLayout memoryLayout = calculateMemoryLayout(variables, types);

		List<String> insights = queryInsights(intent, variables, functions, errors);

		Debug.logDebug("Semantic analysis: " + variables.size() + " variables, " + functions.size() + " functions, "
				+ errors.size() + " errors, " + safetyConstraints.size() + " safety constraints");
		return new SemanticModel(symbolTable, variables, functions, types, memoryLayout, safetyConstraints, errors, insights);
	}

	private SymbolTable buildSymbolTable(ProgramIntent intent)
	{
		SymbolTable table = new SymbolTable();
		List<DataStructure> dataStructures = intent.getDataStructures();
		for (int i = 0; i < dataStructures.size(); i++)
		{
			DataStructure ds = dataStructures.get(i);
			table.define(new VariableSymbol(ds.getName(), ds.getType().getName(),
					new SourceLocation(i + 1, 1, "data structure definition")));
		}

		for (Operation operation : intent.getOperations())
		{
			if (operation.getType() instanceof FunctionCallOperation call && table.resolve(call.getName()).isEmpty())
			{
				FunctionSymbol function = new FunctionSymbol(call.getName());
				function.markUsed(locationOf(intent, operation));
				table.define(function);
			}
		}
		return table;
	}

	private Map<String, VariableInfo> analyzeVariables(ProgramIntent intent)
	{
		Map<String, VariableInfo> variables = new LinkedHashMap<>();
		for (DataStructure ds : intent.getDataStructures())
		{
			variables.put(ds.getName(), new VariableInfo(ds.getName(), ds.getType(), ds.getScope(), true,
					ds.getInitialValue().isEmpty()));
		}
		for (Operation operation : intent.getOperations())
		{
			for (String input : operation.getInputs())
			{
				VariableInfo info = variables.get(input);
				if (info != null)
				{
					info.recordUse();
				}
			}
		}
		return variables;
	}

	private Map<String, FunctionInfo> analyzeFunctions(ProgramIntent intent)
	{
		Map<String, FunctionInfo> functions = new LinkedHashMap<>();
		for (Operation operation : intent.getOperations())
		{
			if (operation.getType() instanceof FunctionCallOperation call)
			{
				List<FunctionInfo.Parameter> parameters = call.getArgs().stream()
						.map(arg -> new FunctionInfo.Parameter(arg, "unknown"))
						.toList();
				// Callee bodies are never seen, so assume the worst
				functions.put(call.getName(), new FunctionInfo(call.getName(), parameters, "unknown", false,
						List.of(FunctionInfo.SideEffect.MODIFIES_GLOBAL_STATE),
						new FunctionInfo.Complexity(1, 10, 64)));
			}
		}
		return functions;
	}

	private Map<String, TypeInfo> analyzeTypes(ProgramIntent intent)
	{
		Map<String, TypeInfo> types = new LinkedHashMap<>();
		for (TypeInfo primitive : PRIMITIVE_TYPES)
		{
			types.put(primitive.getName(), primitive);
		}
		for (DataStructure ds : intent.getDataStructures())
		{
			String name = ds.getType().getName();
			if (!types.containsKey(name))
			{
				int size = ds.getSize().isPresent() ? ds.getSize().getAsInt() : 8;
				types.put(name, new TypeInfo(name, size, 8, false));
			}
		}
		return types;
	}

	private void validateSemantics(ProgramIntent intent, SymbolTable symbolTable, Map<String, VariableInfo> variables,
								   Map<String, FunctionInfo> functions, List<SemanticError> errors)
	{
		for (Operation operation : intent.getOperations())
		{
			SourceLocation location = locationOf(intent, operation);
			for (String input : operation.getInputs())
			{
				if (NUMERIC_LITERAL.matcher(input).matches())
				{
					continue;
				}
				Optional<Symbol> symbol = symbolTable.resolve(input);
				if (symbol.isPresent() && (variables.containsKey(input) || functions.containsKey(input)))
				{
					symbol.get().markUsed(location);
					continue;
				}
				errors.add(new SemanticError(SemanticErrorType.UNDEFINED_VARIABLE,
						"Undefined variable or function: " + input, location,
						List.of("Define variable '" + input + "' before use", "Check for typos in variable name")));
			}

			if (operation.getType() instanceof ArithmeticOperation)
			{
				for (String input : operation.getInputs())
				{
					VariableInfo info = variables.get(input);
					if (info != null && (info.getDataType() instanceof DataType.BooleanType || info.getDataType() instanceof DataType.StringType))
					{
						errors.add(new SemanticError(SemanticErrorType.TYPE_MISMATCH,
								"Arithmetic on non-numeric variable " + input + " of type " + info.getTypeName(), location,
								List.of("Convert '" + input + "' to a numeric type", "Use a numeric variable instead")));
					}
				}
			}
		}

		if (intent.getControlFlow().getNodes().size() > intent.getOperations().size() + 2)
		{
			errors.add(new SemanticError(SemanticErrorType.UNREACHABLE_CODE, "Potential unreachable code detected", null,
					List.of("Review control flow logic")));
		}

		for (Operation operation : intent.getOperations())
		{
			if (operation.getType() instanceof LoopOperation loop
					&& (loop.getCondition().equals("true") || loop.getCondition().equals("1")))
			{
				errors.add(new SemanticError(SemanticErrorType.INFINITE_LOOP, "Potential infinite loop detected",
						locationOf(intent, operation),
						List.of("Add loop termination condition", "Ensure loop variable is modified")));
			}
		}
	}

	private List<SafetyConstraint> generateSafetyConstraints(ProgramIntent intent, Map<String, VariableInfo> variables)
	{
		List<SafetyConstraint> constraints = new ArrayList<>();
		variables.forEach((name, info) ->
		{
			if (info.getDataType() instanceof DataType.PointerType)
			{
				constraints.add(new SafetyConstraint(SafetyConstraint.Type.NULL_POINTER_CHECK,
						"Null pointer check required for " + name, List.of(name), SafetyConstraint.Severity.CRITICAL));
			}
		});
		variables.forEach((name, info) ->
		{
			if (info.getDataType() instanceof DataType.ArrayType)
			{
				constraints.add(new SafetyConstraint(SafetyConstraint.Type.BOUNDS_CHECK,
						"Array bounds check required for " + name, List.of(name), SafetyConstraint.Severity.HIGH));
			}
		});
		for (Operation operation : intent.getOperations())
		{
			if (operation.getType() instanceof ArithmeticOperation)
			{
				constraints.add(new SafetyConstraint(SafetyConstraint.Type.OVERFLOW_CHECK,
						"Integer overflow check for arithmetic operation", operation.getInputs(), SafetyConstraint.Severity.MEDIUM));
			}
		}
		return constraints;
	}

	private MemoryLayout calculateMemoryLayout(Map<String, VariableInfo> variables, Map<String, TypeInfo> types)
	{
		long total = 0;
		long stack = 0;
		long statics = 0;
		List<MemoryLayout.AlignmentRequirement> requirements = new ArrayList<>();
		for (VariableInfo info : variables.values())
		{
			TypeInfo type = types.get(info.getTypeName());
			if (type == null)
			{
				continue;
			}
			total += type.getSizeBytes();
			if (info.getScope().isLocal())
			{
				stack += type.getSizeBytes();
			}
			else
			{
				statics += type.getSizeBytes();
			}
			if (type.getAlignment() > 1)
			{
				requirements.add(new MemoryLayout.AlignmentRequirement(info.getName(), type.getAlignment(),
						"Type " + type.getName() + " requires " + type.getAlignment() + "-byte alignment"));
			}
		}
		return new MemoryLayout(total, stack, 0, statics, requirements);
	}

	private List<String> queryInsights(ProgramIntent intent, Map<String, VariableInfo> variables,
									   Map<String, FunctionInfo> functions, List<SemanticError> errors)
	{
		String prompt = "You are a semantic analysis agent. Analyze the following program intent and provide additional semantic insights.\n\n"
				+ "Operations: " + intent.getOperations().size() + "\n"
				+ "Data structures: " + intent.getDataStructures().size() + "\n"
				+ "Control flow nodes: " + intent.getControlFlow().getNodes().size() + "\n"
				+ "Current errors: " + errors.size() + "\n"
				+ "Variables: " + variables.keySet() + "\n"
				+ "Functions: " + functions.keySet() + "\n\n"
				+ "Focus on type compatibility, potential runtime errors, performance bottlenecks and memory safety.\n"
				+ "Respond with a JSON object {\"insights\": [\"...\"]}. Return ONLY the JSON object.";
		Optional<JsonObject> answer = OracleResponses.queryObject(oracle, "Semantic analysis", prompt);
		return answer.map(json -> OracleResponses.getStringArray(json, "insights")).orElse(List.of());
	}

	private static SourceLocation locationOf(ProgramIntent intent, Operation operation)
	{
		return new SourceLocation(intent.getOperations().indexOf(operation) + 1, 1, operation.getDescription());
	}
}
