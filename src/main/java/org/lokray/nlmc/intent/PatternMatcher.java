package org.lokray.nlmc.intent;

import org.lokray.nlmc.intent.operation.OperationType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One keyword matcher of the extractor. A matcher yields at most one operation per description.
 */
public class PatternMatcher
{
	public static final double CONFIDENCE = 0.8;

	private final String name;
	private final Pattern trigger;
	private final Pattern operands;
	private final Supplier<OperationType> operationType;

	/**
	 * @param operands optional pattern whose groups are the operation's inputs; may be null
	 */
	public PatternMatcher(String name, String trigger, String operands, Supplier<OperationType> operationType)
	{
		this.name = Objects.requireNonNull(name);
		this.trigger = Pattern.compile(trigger, Pattern.CASE_INSENSITIVE);
		this.operands = operands == null ? null : Pattern.compile(operands, Pattern.CASE_INSENSITIVE);
		this.operationType = Objects.requireNonNull(operationType);
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Runs the matcher against the whole description.
	 *
	 * @param id id for the produced operation
	 */
	public Optional<Operation> match(String text, String id)
	{
		Matcher matcher = trigger.matcher(text);
		if (!matcher.find())
		{
			return Optional.empty();
		}

		List<String> inputs = new ArrayList<>();
		if (operands != null)
		{
			Matcher operandMatcher = operands.matcher(text);
			if (operandMatcher.find())
			{
				for (int group = 1; group <= operandMatcher.groupCount(); group++)
				{
					inputs.add(operandMatcher.group(group));
				}
			}
		}

		OperationType type = operationType.get();
		// Captured binary operands produce a named result
		List<String> outputs = inputs.size() >= 2 ? List.of(id + "_result") : List.of();
		String description = "Pattern matched: " + name + " (" + matcher.group() + ")";
		return Optional.of(new Operation(id, type, inputs, outputs, description, CONFIDENCE));
	}
}
