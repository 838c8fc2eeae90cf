package org.lokray.nlmc.flow;

import java.util.Optional;

public enum OptimizationBenefit
{
	HIGH, MEDIUM, LOW, NEGLIGIBLE;

	public static Optional<OptimizationBenefit> fromName(String name)
	{
		String key = OptimizationKind.normalize(name);
		for (OptimizationBenefit benefit : values())
		{
			if (OptimizationKind.normalize(benefit.name()).equals(key))
			{
				return Optional.of(benefit);
			}
		}
		return Optional.empty();
	}
}
