package org.lokray.nlmc;

import org.lokray.nlmc.intent.Ambiguity;
import org.lokray.nlmc.recovery.CompilationError;
import org.lokray.nlmc.recovery.ErrorSeverity;
import org.lokray.nlmc.recovery.RecoveryResult;
import org.lokray.nlmc.semantic.SemanticError;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything that went wrong during one compilation, together with how it was recovered.
 */
public class Diagnostics
{
	private final List<SemanticError> semanticErrors = new ArrayList<>();
	private final List<Ambiguity> remainingAmbiguities = new ArrayList<>();
	private final List<CompilationError> compilationErrors = new ArrayList<>();
	private final List<RecoveryResult> recoveries = new ArrayList<>();

	void addSemanticErrors(List<SemanticError> errors)
	{
		semanticErrors.addAll(errors);
	}

	void addRemainingAmbiguities(List<Ambiguity> ambiguities)
	{
		remainingAmbiguities.addAll(ambiguities);
	}

	void addRecovery(CompilationError error, RecoveryResult result)
	{
		compilationErrors.add(error);
		recoveries.add(result);
	}

	public List<SemanticError> getSemanticErrors()
	{
		return Collections.unmodifiableList(semanticErrors);
	}

	public List<Ambiguity> getRemainingAmbiguities()
	{
		return Collections.unmodifiableList(remainingAmbiguities);
	}

	/**
	 * Errors handed to error recovery, in the order they were raised. Parallel to {@link #getRecoveries()}.
	 */
	public List<CompilationError> getCompilationErrors()
	{
		return Collections.unmodifiableList(compilationErrors);
	}

	public List<RecoveryResult> getRecoveries()
	{
		return Collections.unmodifiableList(recoveries);
	}

	public List<String> getRecoveryWarnings()
	{
		return recoveries.stream().flatMap(r -> r.getWarnings().stream()).toList();
	}

	public boolean hasFatalErrors()
	{
		return compilationErrors.stream().anyMatch(e -> e.getSeverity() == ErrorSeverity.FATAL);
	}

	public boolean isEmpty()
	{
		return semanticErrors.isEmpty() && remainingAmbiguities.isEmpty() && compilationErrors.isEmpty();
	}
}
