package org.lokray.nlmc.flow;

import java.util.Locale;
import java.util.Optional;

public enum OptimizationKind
{
	DEAD_CODE_ELIMINATION,
	COMMON_SUBEXPRESSION_ELIMINATION,
	CONSTANT_PROPAGATION,
	LOOP_INVARIANT_CODE_MOTION,
	STRENGTH_REDUCTION,
	LOOP_UNROLLING,
	VECTORIZATION,
	INSTRUCTION_SCHEDULING;

	/**
	 * Accepts "loop_unrolling", "LoopUnrolling" and "loop unrolling" alike.
	 */
	public static Optional<OptimizationKind> fromName(String name)
	{
		String key = normalize(name);
		for (OptimizationKind kind : values())
		{
			if (normalize(kind.name()).equals(key))
			{
				return Optional.of(kind);
			}
		}
		return Optional.empty();
	}

	static String normalize(String name)
	{
		return name.replaceAll("[\\s_-]", "").toLowerCase(Locale.ROOT);
	}
}
