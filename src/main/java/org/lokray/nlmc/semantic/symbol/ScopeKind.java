package org.lokray.nlmc.semantic.symbol;

public enum ScopeKind
{
	GLOBAL, FUNCTION, BLOCK, LOOP
}
