package org.lokray.nlmc.semantic.symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Arena of scopes. Index 0 is always the global scope. Descriptions currently only
 * produce global symbols.
 */
public class SymbolTable
{
	public static final int GLOBAL_SCOPE = 0;

	private final List<Scope> scopes = new ArrayList<>();
	private int currentScope = GLOBAL_SCOPE;

	public SymbolTable()
	{
		scopes.add(new Scope(GLOBAL_SCOPE, null, ScopeKind.GLOBAL, "global"));
	}

	public void define(Symbol symbol)
	{
		scopes.get(currentScope).define(symbol);
	}

	/**
	 * Looks the name up in the current scope and then in each enclosing scope.
	 */
	public Optional<Symbol> resolve(String name)
	{
		return resolveFrom(currentScope, name);
	}

	public Optional<Symbol> resolveFrom(int scopeId, String name)
	{
		Integer id = scopeId;
		while (id != null)
		{
			Scope scope = scopes.get(id);
			Optional<Symbol> local = scope.resolveLocally(name);
			if (local.isPresent())
			{
				return local;
			}
			OptionalInt parent = scope.getParentId();
			id = parent.isPresent() ? parent.getAsInt() : null;
		}
		return Optional.empty();
	}

	public Scope getGlobalScope()
	{
		return scopes.get(GLOBAL_SCOPE);
	}

	public int getCurrentScope()
	{
		return currentScope;
	}

	public List<Scope> getScopes()
	{
		return Collections.unmodifiableList(scopes);
	}
}
