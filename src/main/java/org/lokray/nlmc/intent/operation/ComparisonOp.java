package org.lokray.nlmc.intent.operation;

public enum ComparisonOp
{
	EQUAL, NOT_EQUAL, LESS_THAN, LESS_EQUAL, GREATER_THAN, GREATER_EQUAL
}
