package org.lokray.nlmc.resolve;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.intent.ProgramIntent;

import java.util.Optional;

/**
 * One tier of the resolution cascade. The resolver asks each strategy in order and keeps
 * the first resolution it gets.
 */
public interface ResolutionStrategy
{
	String getName();

	Optional<ResolvedAmbiguity> resolve(Ambiguity ambiguity, ResolutionContext context, ProgramIntent intent);
}
