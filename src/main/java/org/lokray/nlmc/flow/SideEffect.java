package org.lokray.nlmc.flow;

public enum SideEffect
{
	MODIFIES_MEMORY, READS_MEMORY, CALLS_FUNCTION, THROWS_EXCEPTION, HAS_IO
}
