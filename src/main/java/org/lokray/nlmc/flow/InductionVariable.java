package org.lokray.nlmc.flow;

import java.util.Optional;

public class InductionVariable
{
	private final String name;
	private final String loopHeader;
	private final String initialValue;
	private final String step;
	private final String finalValue;
	private final boolean primary;

	public InductionVariable(String name, String loopHeader, String initialValue, String step, String finalValue, boolean primary)
	{
		this.name = name;
		this.loopHeader = loopHeader;
		this.initialValue = initialValue;
		this.step = step;
		this.finalValue = finalValue;
		this.primary = primary;
	}

	public String getName()
	{
		return name;
	}

	public String getLoopHeader()
	{
		return loopHeader;
	}

	public String getInitialValue()
	{
		return initialValue;
	}

	/**
	 * Signed step, e.g. "1" or "-2".
	 */
	public String getStep()
	{
		return step;
	}

	public Optional<String> getFinalValue()
	{
		return Optional.ofNullable(finalValue);
	}

	public boolean isPrimary()
	{
		return primary;
	}
}
