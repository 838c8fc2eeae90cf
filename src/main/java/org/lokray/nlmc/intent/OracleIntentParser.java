package org.lokray.nlmc.intent;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.lokray.nlmc.dto.OracleAmbiguityDTO;
import org.lokray.nlmc.dto.OracleDataStructureDTO;
import org.lokray.nlmc.dto.OracleIntentDTO;
import org.lokray.nlmc.dto.OracleOperationDTO;
import org.lokray.nlmc.intent.operation.*;
import org.lokray.nlmc.oracle.OracleResponses;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns the oracle's JSON answer to the extraction prompt into intent elements.
 * Anything it cannot understand is dropped, never thrown.
 */
public class OracleIntentParser
{
	public static class Contribution
	{
		public final List<Operation> operations = new ArrayList<>();
		public final List<DataStructure> dataStructures = new ArrayList<>();
		public final List<Ambiguity> ambiguities = new ArrayList<>();

		public boolean isEmpty()
		{
			return operations.isEmpty() && dataStructures.isEmpty() && ambiguities.isEmpty();
		}
	}

	private final Gson gson = new GsonBuilder()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.create();

	/**
	 * @param response    raw oracle answer, possibly wrapped in a fenced block
	 * @param firstOpIndex index used for the first accepted operation id
	 */
	public Contribution parse(String response, int firstOpIndex)
	{
		Contribution contribution = new Contribution();
		String body = OracleResponses.extractFencedBlock(response);
		if (body.isEmpty())
		{
			return contribution;
		}

		OracleIntentDTO dto;
		try
		{
			dto = gson.fromJson(body, OracleIntentDTO.class);
		}
		catch (JsonParseException e)
		{
			Debug.logDebug("Oracle intent answer is not usable JSON: " + e.getMessage());
			return contribution;
		}
		if (dto == null)
		{
			return contribution;
		}

		int nextIndex = firstOpIndex;
		if (dto.operations != null)
		{
			for (OracleOperationDTO op : dto.operations)
			{
				if (op == null)
				{
					continue;
				}
				Optional<Operation> converted = toOperation(op, "op_" + nextIndex);
				if (converted.isPresent())
				{
					contribution.operations.add(converted.get());
					nextIndex++;
				}
				else
				{
					Debug.logDebug("Dropping oracle operation with unknown type '" + op.operationType + "'");
				}
			}
		}

		if (dto.dataStructures != null)
		{
			for (OracleDataStructureDTO ds : dto.dataStructures)
			{
				if (ds != null && ds.name != null && !ds.name.isBlank())
				{
					contribution.dataStructures.add(toDataStructure(ds));
				}
			}
		}

		if (dto.ambiguities != null)
		{
			int n = 0;
			for (OracleAmbiguityDTO amb : dto.ambiguities)
			{
				if (amb == null || amb.possibleInterpretations == null || amb.confidenceScores == null
						|| amb.possibleInterpretations.size() != amb.confidenceScores.size()
						|| amb.possibleInterpretations.contains(null) || amb.confidenceScores.contains(null))
				{
					Debug.logDebug("Dropping malformed oracle ambiguity");
					continue;
				}
				String id = amb.id == null ? "oracle_ambiguity_" + n : amb.id;
				n++;
				contribution.ambiguities.add(new Ambiguity(id, Ambiguity.Kind.OTHER, "",
						amb.description == null ? "Ambiguity reported by oracle" : amb.description,
						amb.context, amb.possibleInterpretations, amb.confidenceScores));
			}
		}
		return contribution;
	}

	private Optional<Operation> toOperation(OracleOperationDTO dto, String id)
	{
		Optional<OperationType> type = toOperationType(dto);
		if (type.isEmpty())
		{
			return Optional.empty();
		}
		double confidence = dto.confidence == null ? 0.5 : Math.max(0.0, Math.min(1.0, dto.confidence));
		List<String> inputs = names(dto.inputs);
		List<String> outputs = names(dto.outputs);
		String description = dto.description == null ? "Oracle operation " + dto.operationType : dto.description;
		return Optional.of(new Operation(id, type.get(), inputs, outputs, description, confidence));
	}

	static Optional<OperationType> toOperationType(OracleOperationDTO dto)
	{
		if (dto.operationType == null)
		{
			return Optional.empty();
		}
		String name = dto.operationType.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
		List<String> inputs = names(dto.inputs);
		List<String> outputs = names(dto.outputs);
		switch (name)
		{
			case "add":
			case "addition":
			case "arithmetic":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.ADD));
			case "subtract":
			case "subtraction":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.SUBTRACT));
			case "multiply":
			case "multiplication":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.MULTIPLY));
			case "divide":
			case "division":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.DIVIDE));
			case "modulo":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.MODULO));
			case "power":
				return Optional.of(new ArithmeticOperation(ArithmeticOp.POWER));
			case "equal":
			case "comparison":
				return Optional.of(new ComparisonOperation(ComparisonOp.EQUAL));
			case "not_equal":
				return Optional.of(new ComparisonOperation(ComparisonOp.NOT_EQUAL));
			case "less_than":
				return Optional.of(new ComparisonOperation(ComparisonOp.LESS_THAN));
			case "less_equal":
				return Optional.of(new ComparisonOperation(ComparisonOp.LESS_EQUAL));
			case "greater_than":
				return Optional.of(new ComparisonOperation(ComparisonOp.GREATER_THAN));
			case "greater_equal":
				return Optional.of(new ComparisonOperation(ComparisonOp.GREATER_EQUAL));
			case "assignment":
			case "assign":
			{
				String target = dto.target;
				if (target == null && !outputs.isEmpty())
				{
					target = outputs.get(0);
				}
				return Optional.of(new AssignmentOperation(target == null ? "result" : target));
			}
			case "function_call":
			case "call":
				return Optional.of(new FunctionCallOperation(dto.name == null ? "anonymous" : dto.name, inputs));
			case "loop":
				return Optional.of(new LoopOperation(dto.condition == null ? LoopOperation.UNKNOWN_CONDITION : dto.condition, List.of()));
			case "conditional":
			case "if":
				return Optional.of(new ConditionalOperation(dto.condition == null ? "unknown" : dto.condition, List.of(), null));
			case "input":
				return Optional.of(new InputOperation(null));
			case "output":
			case "print":
				return Optional.of(new OutputOperation(null));
			case "memory_allocation":
			case "allocate":
				return Optional.of(new MemoryAllocationOperation(null, null));
			case "system_call":
				return Optional.of(new SystemCallOperation(dto.name == null ? "unknown" : dto.name, inputs));
			default:
				return Optional.empty();
		}
	}

	/**
	 * Names with null and blank entries removed.
	 */
	static List<String> names(List<String> raw)
	{
		if (raw == null)
		{
			return List.of();
		}
		return raw.stream().filter(n -> n != null && !n.isBlank()).map(String::trim).toList();
	}

	private DataStructure toDataStructure(OracleDataStructureDTO dto)
	{
		DataType type = DataType.fromName(dto.dataType).orElse(DataType.UnknownType.INSTANCE);
		StorageScope scope = StorageScope.GLOBAL;
		if (dto.scope != null)
		{
			String scopeName = dto.scope.trim().toLowerCase(Locale.ROOT);
			if (scopeName.equals("function"))
			{
				scope = StorageScope.function("main");
			}
			else if (scopeName.equals("block"))
			{
				scope = StorageScope.block("main");
			}
		}
		return new DataStructure(dto.name, type, dto.size, dto.initialValue, scope);
	}
}
