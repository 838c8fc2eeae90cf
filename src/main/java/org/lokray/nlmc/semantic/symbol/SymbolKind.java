package org.lokray.nlmc.semantic.symbol;

public enum SymbolKind
{
	VARIABLE, FUNCTION, TYPE, CONSTANT
}
