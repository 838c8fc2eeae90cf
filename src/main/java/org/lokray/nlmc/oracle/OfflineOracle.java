package org.lokray.nlmc.oracle;

/**
 * Oracle used when no service is configured. Every answer is empty, so each stage
 * falls back to its deterministic result.
 */
public class OfflineOracle implements ReasoningOracle
{
	public static final OfflineOracle INSTANCE = new OfflineOracle();

	private OfflineOracle()
	{
	}

	@Override
	public String query(String prompt)
	{
		return "";
	}
}
