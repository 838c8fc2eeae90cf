package org.lokray.nlmc.semantic.symbol;

/**
 * A called function. Descriptions only ever call functions, so these start out undefined.
 */
public class FunctionSymbol extends BaseSymbol
{
	public FunctionSymbol(String name)
	{
		super(name, "function", null);
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}
}
