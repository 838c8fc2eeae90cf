package org.lokray.nlmc.flow;

public enum OperandKind
{
	REGISTER, IMMEDIATE, MEMORY, LABEL
}
