package org.lokray.nlmc.semantic;

import java.util.List;
import java.util.Objects;

public class FunctionInfo
{
	public enum SideEffect
	{
		MODIFIES_GLOBAL_STATE, PERFORMS_IO, ALLOCATES_MEMORY, CALLS_SYSTEM_FUNCTION
	}

	public static class Parameter
	{
		private final String name;
		private final String type;

		public Parameter(String name, String type)
		{
			this.name = name;
			this.type = type;
		}

		public String getName()
		{
			return name;
		}

		public String getType()
		{
			return type;
		}
	}

	public static class Complexity
	{
		private final int cyclomatic;
		private final int estimatedInstructions;
		private final int memoryUsage;

		public Complexity(int cyclomatic, int estimatedInstructions, int memoryUsage)
		{
			this.cyclomatic = cyclomatic;
			this.estimatedInstructions = estimatedInstructions;
			this.memoryUsage = memoryUsage;
		}

		public int getCyclomatic()
		{
			return cyclomatic;
		}

		public int getEstimatedInstructions()
		{
			return estimatedInstructions;
		}

		public int getMemoryUsage()
		{
			return memoryUsage;
		}
	}

	private final String name;
	private final List<Parameter> parameters;
	private final String returnType;
	private final boolean pure;
	private final List<SideEffect> sideEffects;
	private final Complexity complexity;

	public FunctionInfo(String name, List<Parameter> parameters, String returnType, boolean pure, List<SideEffect> sideEffects, Complexity complexity)
	{
		this.name = Objects.requireNonNull(name);
		this.parameters = List.copyOf(parameters);
		this.returnType = returnType;
		this.pure = pure;
		this.sideEffects = List.copyOf(sideEffects);
		this.complexity = complexity;
	}

	public String getName()
	{
		return name;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public String getReturnType()
	{
		return returnType;
	}

	public boolean isPure()
	{
		return pure;
	}

	public List<SideEffect> getSideEffects()
	{
		return sideEffects;
	}

	public Complexity getComplexity()
	{
		return complexity;
	}
}
