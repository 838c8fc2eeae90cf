package org.lokray.nlmc.semantic.symbol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One scope of the {@link SymbolTable} arena. Scopes point at their parent by index.
 */
public class Scope
{
	private final int id;
	private final Integer parentId;
	private final ScopeKind kind;
	private final String name;
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	public Scope(int id, Integer parentId, ScopeKind kind, String name)
	{
		this.id = id;
		this.parentId = parentId;
		this.kind = kind;
		this.name = name;
	}

	public void define(Symbol sym)
	{
		symbols.put(sym.getName(), sym);
	}

	public Optional<Symbol> resolveLocally(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public int getId()
	{
		return id;
	}

	public OptionalInt getParentId()
	{
		return parentId == null ? OptionalInt.empty() : OptionalInt.of(parentId);
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return name;
	}

	public Map<String, Symbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}
}
