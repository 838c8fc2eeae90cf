package org.lokray.nlmc.oracle;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OracleResponsesTest
{
	@Test
	void fencedBlockDropsLanguageLine()
	{
		String response = "Here you go:\n```json\n{\"a\": 1}\n```\nThanks";
		assertEquals("{\"a\": 1}", OracleResponses.extractFencedBlock(response));
	}

	@Test
	void unfencedResponseIsReturnedTrimmed()
	{
		assertEquals("{\"a\": 1}", OracleResponses.extractFencedBlock("  {\"a\": 1}\n"));
		assertEquals("", OracleResponses.extractFencedBlock(null));
	}

	@Test
	void unterminatedFenceFallsBackToRawText()
	{
		assertEquals("```json\n{}", OracleResponses.extractFencedBlock("```json\n{}"));
	}

	@Test
	void parseObjectRejectsNonObjects()
	{
		assertTrue(OracleResponses.parseObject("[1, 2]").isEmpty());
		assertTrue(OracleResponses.parseObject("not json at all {").isEmpty());
		assertTrue(OracleResponses.parseObject("").isEmpty());
		assertTrue(OracleResponses.parseObject("```json\n{\"ok\": true}\n```").isPresent());
	}

	@Test
	void queryObjectTreatsOracleFailureAsNoAnswer()
	{
		ScriptedOracle oracle = new ScriptedOracle().failing();
		assertEquals(Optional.empty(), OracleResponses.queryObject(oracle, "Test", "prompt"));
		assertEquals(List.of("prompt"), oracle.getPrompts());
	}

	@Test
	void typedGettersIgnoreWrongShapes()
	{
		JsonObject json = OracleResponses.parseObject("{\"name\": \"x\", \"count\": 3, \"tags\": [\"a\", 1, \"b\"], \"flag\": 2}").orElseThrow();

		assertEquals("x", OracleResponses.getString(json, "name", "fallback"));
		assertEquals("fallback", OracleResponses.getString(json, "count", "fallback"));
		assertEquals(Optional.of(3.0), OracleResponses.getNumber(json, "count"));
		assertEquals(Optional.empty(), OracleResponses.getNumber(json, "name"));
		assertEquals(List.of("a", "b"), OracleResponses.getStringArray(json, "tags"));
		assertEquals(List.of(), OracleResponses.getStringArray(json, "missing"));
	}
}
