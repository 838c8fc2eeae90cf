package org.lokray.nlmc.semantic.symbol;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest
{
	@Test
	void symbolsLandInGlobalScopeInDefinitionOrder()
	{
		SymbolTable table = new SymbolTable();
		table.define(new VariableSymbol("y", "i32", new SourceLocation(1, 0, "number y")));
		table.define(new VariableSymbol("x", "f64", new SourceLocation(2, 0, "decimal x")));

		Scope global = table.getGlobalScope();
		assertEquals(SymbolTable.GLOBAL_SCOPE, table.getCurrentScope());
		assertEquals(ScopeKind.GLOBAL, global.getKind());
		assertTrue(global.getParentId().isEmpty());
		assertEquals(List.of("y", "x"), List.copyOf(global.getSymbols().keySet()));
		assertEquals("f64", table.resolve("x").orElseThrow().getDataType());
	}

	@Test
	void unknownNameDoesNotResolve()
	{
		SymbolTable table = new SymbolTable();

		assertTrue(table.resolve("missing").isEmpty());
		assertTrue(table.getGlobalScope().resolveLocally("missing").isEmpty());
		assertThrows(UnsupportedOperationException.class,
				() -> table.getGlobalScope().getSymbols().put("z", new VariableSymbol("z", "i32", null)));
	}
}
