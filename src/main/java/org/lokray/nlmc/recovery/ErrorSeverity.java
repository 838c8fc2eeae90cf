package org.lokray.nlmc.recovery;

public enum ErrorSeverity
{
	FATAL(1.2),
	ERROR(1.0),
	WARNING(0.8),
	INFO(0.5);

	private final double scoreMultiplier;

	ErrorSeverity(double scoreMultiplier)
	{
		this.scoreMultiplier = scoreMultiplier;
	}

	/**
	 * Weight applied to a strategy's success rate when recovering from an error of this severity.
	 */
	public double getScoreMultiplier()
	{
		return scoreMultiplier;
	}
}
