package org.lokray.nlmc.intent;

import org.lokray.nlmc.intent.operation.*;
import org.lokray.nlmc.oracle.OracleException;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.types.BaseType;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First pipeline stage: turns a natural-language description into a {@link ProgramIntent}.
 * <p>
 * Keyword matchers always run; the oracle answer is appended when it is usable. An oracle
 * failure only costs the oracle's contribution.
 */
public class IntentExtractor
{
	public static final String PRONOUN_AMBIGUITY_PREFIX = "pronoun_ambiguity_";
	public static final String OPERATION_AMBIGUITY_ID = "operation_ambiguity";

	private static final Pattern NUMBER_DECLARATION = Pattern.compile("(number|integer|value|variable)\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
	private static final Pattern ARRAY_DECLARATION = Pattern.compile("(array|list)\\s+of\\s+(\\w+)", Pattern.CASE_INSENSITIVE);
	private static final Pattern PRONOUN = Pattern.compile("\\b(it|this|that|them|they)\\b", Pattern.CASE_INSENSITIVE);

	private final ReasoningOracle oracle;
	private final List<PatternMatcher> matchers;
	private final OracleIntentParser oracleParser = new OracleIntentParser();

	public IntentExtractor(ReasoningOracle oracle)
	{
		this.oracle = oracle;
		this.matchers = defaultMatchers();
	}

	private static List<PatternMatcher> defaultMatchers()
	{
		List<PatternMatcher> list = new ArrayList<>();
		list.add(new PatternMatcher("addition",
				"(add|sum|plus|\\+|calculate.*sum)",
				"\\b(?:add|sum\\s+of|plus)\\s+(?:the\\s+)?(\\w+)\\s+(?:and|to|with|plus)\\s+(\\w+)",
				() -> new ArithmeticOperation(ArithmeticOp.ADD)));
		list.add(new PatternMatcher("multiplication",
				"(multiply|times|\\*|product)",
				"\\b(?:multiply|product\\s+of)\\s+(?:the\\s+)?(\\w+)\\s+(?:and|by|with|times)\\s+(\\w+)",
				() -> new ArithmeticOperation(ArithmeticOp.MULTIPLY)));
		list.add(new PatternMatcher("input",
				"(ask|input|read|get.*from.*user)",
				null,
				() -> new InputOperation(null)));
		list.add(new PatternMatcher("output",
				"(print|display|show|output|write)",
				"\\b(?:print|display|show|output|write)\\s+(?:the\\s+)?(\\w+)",
				() -> new OutputOperation(null)));
		list.add(new PatternMatcher("loop",
				"(loop|repeat|while|for|iterate)",
				null,
				() -> new LoopOperation(LoopOperation.UNKNOWN_CONDITION, List.of())));
		return list;
	}

	public ProgramIntent extractIntent(String text)
	{
		String input = text == null ? "" : text;
		Debug.logDebug("Extracting intent from " + input.length() + " characters");

		List<Operation> operations = extractOperationsWithPatterns(input);
		Map<String, DataStructure> dataStructures = new LinkedHashMap<>();
		extractDataStructuresWithPatterns(input).forEach(ds -> dataStructures.putIfAbsent(ds.getName(), ds));

		List<Ambiguity> ambiguities = detectAmbiguities(input);

		OracleIntentParser.Contribution fromOracle = analyzeWithOracle(input, operations.size());
		operations.addAll(fromOracle.operations);
		fromOracle.dataStructures.forEach(ds -> dataStructures.putIfAbsent(ds.getName(), ds));
		Set<String> knownIds = new LinkedHashSet<>();
		ambiguities.forEach(a -> knownIds.add(a.getId()));
		for (Ambiguity ambiguity : fromOracle.ambiguities)
		{
			if (knownIds.add(ambiguity.getId()))
			{
				ambiguities.add(ambiguity);
			}
		}

		List<DataStructure> declared = new ArrayList<>(dataStructures.values());
		ControlFlowGraph cfg = ControlFlowGraph.straightLine(operations);
		List<Constraint> constraints = extractConstraints(input, operations);
		IntentMetadata metadata = generateMetadata(input, operations, declared);

		Debug.logDebug("Intent: " + operations.size() + " operations, " + declared.size() + " data structures, "
				+ ambiguities.size() + " ambiguities");
		return new ProgramIntent(operations, declared, cfg, constraints, ambiguities, metadata);
	}

	List<Operation> extractOperationsWithPatterns(String input)
	{
		List<Operation> operations = new ArrayList<>();
		for (PatternMatcher matcher : matchers)
		{
			Optional<Operation> operation = matcher.match(input, "op_" + operations.size());
			operation.ifPresent(operations::add);
		}
		return operations;
	}

	List<DataStructure> extractDataStructuresWithPatterns(String input)
	{
		List<DataStructure> result = new ArrayList<>();
		Matcher numbers = NUMBER_DECLARATION.matcher(input);
		while (numbers.find())
		{
			result.add(new DataStructure(numbers.group(2), DataType.INT32, StorageScope.GLOBAL));
		}
		Matcher arrays = ARRAY_DECLARATION.matcher(input);
		while (arrays.find())
		{
			result.add(new DataStructure(arrays.group(2) + "_array", new DataType.ArrayType(DataType.INT32, null), StorageScope.GLOBAL));
		}
		return result;
	}

	private OracleIntentParser.Contribution analyzeWithOracle(String input, int firstOpIndex)
	{
		String response;
		try
		{
			response = oracle.query(buildPrompt(input));
		}
		catch (OracleException e)
		{
			Debug.logWarning("Intent extraction: oracle unavailable, using pattern matches only (" + e.getMessage() + ")");
			return new OracleIntentParser.Contribution();
		}
		return oracleParser.parse(response, firstOpIndex);
	}

	static String buildPrompt(String input)
	{
		return "You are a compiler intent extraction agent. Analyze the following natural language program "
				+ "description and extract its computational intent as JSON.\n\n"
				+ "NATURAL LANGUAGE PROGRAM:\n" + input + "\n\n"
				+ "Return a JSON object with this structure:\n"
				+ "{\n"
				+ "  \"operations\": [{\"id\": \"unique_id\", \"operation_type\": \"add|subtract|multiply|divide|modulo|power|"
				+ "equal|less_than|greater_than|assignment|function_call|loop|conditional|input|output|memory_allocation|system_call\", "
				+ "\"inputs\": [\"input1\"], \"outputs\": [\"output1\"], \"description\": \"what it does\", \"confidence\": 0.95}],\n"
				+ "  \"data_structures\": [{\"name\": \"variable_name\", \"data_type\": \"int|float|string|bool|char|array|pointer\", "
				+ "\"scope\": \"global|function|block\"}],\n"
				+ "  \"ambiguities\": [{\"id\": \"id\", \"description\": \"...\", \"context\": \"...\", "
				+ "\"possible_interpretations\": [\"...\"], \"confidence_scores\": [0.5]}]\n"
				+ "}\n"
				+ "Return ONLY the JSON object.";
	}

	List<Constraint> extractConstraints(String input, List<Operation> operations)
	{
		String lower = input.toLowerCase(Locale.ROOT);
		List<Constraint> constraints = new ArrayList<>();
		if (lower.contains("pointer") || lower.contains("reference"))
		{
			constraints.add(new Constraint(Constraint.Kind.NULL_POINTER, "Potential null pointer dereference detected", Constraint.Severity.WARNING));
		}
		if (lower.contains("array") || lower.contains("index"))
		{
			constraints.add(new Constraint(Constraint.Kind.MEMORY_BOUNDS, "Array bounds checking required", Constraint.Severity.ERROR));
		}
		for (Operation operation : operations)
		{
			if (operation.getType() instanceof LoopOperation)
			{
				constraints.add(new Constraint(Constraint.Kind.PERFORMANCE, "Loop optimization opportunity", Constraint.Severity.INFO));
			}
		}
		return constraints;
	}

	List<Ambiguity> detectAmbiguities(String input)
	{
		List<Ambiguity> ambiguities = new ArrayList<>();

		Set<String> pronouns = new LinkedHashSet<>();
		Matcher matcher = PRONOUN.matcher(input);
		while (matcher.find())
		{
			pronouns.add(matcher.group(1).toLowerCase(Locale.ROOT));
		}
		for (String pronoun : pronouns)
		{
			ambiguities.add(new Ambiguity(PRONOUN_AMBIGUITY_PREFIX + pronoun, Ambiguity.Kind.PRONOUN, pronoun,
					"Ambiguous pronoun reference detected: '" + pronoun + "'", input,
					List.of("Refers to previously mentioned variable", "Refers to result of previous operation"),
					List.of(0.6, 0.4)));
		}

		String lower = input.toLowerCase(Locale.ROOT);
		if (lower.contains("calculate") && !lower.contains("add") && !lower.contains("multiply"))
		{
			ambiguities.add(new Ambiguity(OPERATION_AMBIGUITY_ID, Ambiguity.Kind.OPERATION, "calculate",
					"Ambiguous calculation operation", input,
					List.of("Addition operation", "Multiplication operation", "Complex mathematical formula"),
					List.of(0.4, 0.3, 0.3)));
		}
		return ambiguities;
	}

	IntentMetadata generateMetadata(String input, List<Operation> operations, List<DataStructure> dataStructures)
	{
		long loops = operations.stream().filter(op -> op.getType() instanceof LoopOperation).count();
		long arithmetic = operations.stream().filter(op -> op.getType() instanceof ArithmeticOperation).count();

		double complexity = Math.min(1.0, 0.1 * operations.size() + 0.3 * loops);
		long memory = 0;
		for (DataStructure ds : dataStructures)
		{
			memory += ds.getSize().isPresent() ? ds.getSize().getAsInt() : BaseType.of(ds.getType()).sizeBytes();
		}

		String lower = input.toLowerCase(Locale.ROOT);
		List<String> dependencies = new ArrayList<>();
		if (lower.contains("file") || lower.contains("read"))
		{
			dependencies.add("filesystem");
		}
		if (lower.contains("network") || lower.contains("http"))
		{
			dependencies.add("network");
		}
		if (lower.contains("time") || lower.contains("date"))
		{
			dependencies.add("time");
		}

		List<String> hints = new ArrayList<>();
		if (loops > 0)
		{
			hints.add("Consider loop unrolling for performance");
		}
		if (arithmetic > 3)
		{
			hints.add("Vectorization opportunity detected");
		}
		return new IntentMetadata(complexity, loops > 0 ? "O(n)" : "O(1)", memory, dependencies, hints);
	}
}
