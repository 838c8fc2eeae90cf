package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ResolutionResult
{
	private final List<ResolvedAmbiguity> resolvedAmbiguities;
	private final List<Ambiguity> remainingAmbiguities;
	private final Map<String, Integer> resolutionsByStrategy;

	public ResolutionResult(List<ResolvedAmbiguity> resolvedAmbiguities, List<Ambiguity> remainingAmbiguities)
	{
		this.resolvedAmbiguities = List.copyOf(resolvedAmbiguities);
		this.remainingAmbiguities = List.copyOf(remainingAmbiguities);
		Map<String, Integer> counts = new LinkedHashMap<>();
		resolvedAmbiguities.forEach(r -> counts.merge(r.getStrategy(), 1, Integer::sum));
		this.resolutionsByStrategy = Collections.unmodifiableMap(counts);
	}

	public static ResolutionResult empty()
	{
		return new ResolutionResult(List.of(), List.of());
	}

	public List<ResolvedAmbiguity> getResolvedAmbiguities()
	{
		return resolvedAmbiguities;
	}

	public List<Ambiguity> getRemainingAmbiguities()
	{
		return remainingAmbiguities;
	}

	/**
	 * Mean confidence of the resolved ambiguities, 0 when nothing was resolved.
	 */
	public double getConfidenceScore()
	{
		return resolvedAmbiguities.stream().mapToDouble(ResolvedAmbiguity::getConfidence).average().orElse(0.0);
	}

	public Map<String, Integer> getResolutionsByStrategy()
	{
		return resolutionsByStrategy;
	}
}
