package org.lokray.nlmc.semantic.symbol;

import java.util.List;
import java.util.Optional;

public interface Symbol
{
	String getName();

	SymbolKind getKind();

	/**
	 * Name of the symbol's data type, e.g. "i32" or "function".
	 */
	String getDataType();

	boolean isDefined();

	boolean isUsed();

	Optional<SourceLocation> getDefinitionLocation();

	List<SourceLocation> getUsageLocations();

	void markUsed(SourceLocation location);
}
