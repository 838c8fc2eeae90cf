package org.lokray.nlmc.recovery;

public enum RecoveryOutcome
{
	SUCCESS, PARTIAL_SUCCESS, FAILED, REQUIRES_USER_INPUT;

	public boolean isRecovered()
	{
		return this == SUCCESS || this == PARTIAL_SUCCESS;
	}
}
