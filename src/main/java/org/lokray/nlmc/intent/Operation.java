package org.lokray.nlmc.intent;

import org.lokray.nlmc.intent.operation.OperationType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One step of the described program. Only the ambiguity resolver rewrites operations after
 * extraction.
 */
public class Operation
{
	private final String id;
	private OperationType type;
	private final List<String> inputs;
	private final List<String> outputs;
	private String description;
	private final double confidence;

	public Operation(String id, OperationType type, List<String> inputs, List<String> outputs, String description, double confidence)
	{
		if (confidence < 0.0 || confidence > 1.0)
		{
			throw new IllegalArgumentException("Confidence must be in [0, 1], got " + confidence);
		}
		this.id = Objects.requireNonNull(id);
		this.type = Objects.requireNonNull(type);
		this.inputs = new ArrayList<>(inputs);
		this.outputs = new ArrayList<>(outputs);
		this.description = Objects.requireNonNull(description);
		this.confidence = confidence;
	}

	public String getId()
	{
		return id;
	}

	public OperationType getType()
	{
		return type;
	}

	public List<String> getInputs()
	{
		return Collections.unmodifiableList(inputs);
	}

	public List<String> getOutputs()
	{
		return Collections.unmodifiableList(outputs);
	}

	public String getDescription()
	{
		return description;
	}

	public double getConfidence()
	{
		return confidence;
	}

	public void setType(OperationType type)
	{
		this.type = Objects.requireNonNull(type);
	}

	public void setDescription(String description)
	{
		this.description = Objects.requireNonNull(description);
	}

	/**
	 * Replaces every input equal to {@code from}. Returns the number of replacements.
	 */
	public int replaceInput(String from, String to)
	{
		int replaced = 0;
		for (int i = 0; i < inputs.size(); i++)
		{
			if (inputs.get(i).equals(from))
			{
				inputs.set(i, to);
				replaced++;
			}
		}
		return replaced;
	}

	@Override
	public String toString()
	{
		return id + " " + type + " " + inputs + " -> " + outputs;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Operation that = (Operation) o;
		return Double.compare(that.confidence, confidence) == 0 && id.equals(that.id) && type.equals(that.type)
				&& inputs.equals(that.inputs) && outputs.equals(that.outputs) && description.equals(that.description);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(id, type, inputs, outputs, description, confidence);
	}
}
