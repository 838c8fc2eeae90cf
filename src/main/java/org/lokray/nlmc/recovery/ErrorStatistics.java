package org.lokray.nlmc.recovery;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class ErrorStatistics
{
	private final int totalErrors;
	private final Map<ErrorType, Integer> errorsByType;
	private final Map<ErrorSeverity, Integer> errorsBySeverity;
	private final Map<CompilationStage, Integer> errorsByStage;
	private final double recoverySuccessRate;

	public ErrorStatistics(int totalErrors, Map<ErrorType, Integer> errorsByType, Map<ErrorSeverity, Integer> errorsBySeverity,
						   Map<CompilationStage, Integer> errorsByStage, double recoverySuccessRate)
	{
		this.totalErrors = totalErrors;
		this.errorsByType = Collections.unmodifiableMap(errorsByType.isEmpty() ? new EnumMap<>(ErrorType.class) : new EnumMap<>(errorsByType));
		this.errorsBySeverity = Collections.unmodifiableMap(errorsBySeverity.isEmpty() ? new EnumMap<>(ErrorSeverity.class) : new EnumMap<>(errorsBySeverity));
		this.errorsByStage = Collections.unmodifiableMap(errorsByStage.isEmpty() ? new EnumMap<>(CompilationStage.class) : new EnumMap<>(errorsByStage));
		this.recoverySuccessRate = recoverySuccessRate;
	}

	public int getTotalErrors()
	{
		return totalErrors;
	}

	public Map<ErrorType, Integer> getErrorsByType()
	{
		return errorsByType;
	}

	public Map<ErrorSeverity, Integer> getErrorsBySeverity()
	{
		return errorsBySeverity;
	}

	/**
	 * Only errors carrying a location are counted here.
	 */
	public Map<CompilationStage, Integer> getErrorsByStage()
	{
		return errorsByStage;
	}

	/**
	 * Share of handled errors whose recovery succeeded fully or partially; 0 when nothing was handled.
	 */
	public double getRecoverySuccessRate()
	{
		return recoverySuccessRate;
	}
}
