package org.lokray.nlmc.flow;

public enum BlockKind
{
	ENTRY, EXIT, BASIC, LOOP_HEADER, LOOP_LATCH, CONDITIONAL, MERGE
}
