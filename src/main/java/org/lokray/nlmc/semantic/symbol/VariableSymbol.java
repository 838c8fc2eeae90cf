package org.lokray.nlmc.semantic.symbol;

public class VariableSymbol extends BaseSymbol
{
	public VariableSymbol(String name, String dataType, SourceLocation definitionLocation)
	{
		super(name, dataType, definitionLocation);
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.VARIABLE;
	}
}
