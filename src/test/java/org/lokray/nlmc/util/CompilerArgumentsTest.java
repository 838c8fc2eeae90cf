package org.lokray.nlmc.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompilerArgumentsTest
{
	@Test
	void noArgumentsShowsHelp()
	{
		assertTrue(CompilerArguments.parse(new String[0], Map.of()).isHelpFlag());
	}

	@Test
	void parsesInputOutputAndModel()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"prog.txt", "-o", "out/prog.json", "--model", "m-1"}, Map.of());

		assertEquals(Paths.get("prog.txt"), args.getInputFile());
		assertEquals(Paths.get("out/prog.json"), args.getOutputPath());
		assertEquals("m-1", args.getModel());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void defaultsModelWhenNotGiven()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"prog.txt"}, Map.of());
		assertEquals(CompilerArguments.DEFAULT_MODEL, args.getModel());
		assertNull(args.getOutputPath());
	}

	@Test
	void badArgumentsFallBackToHelp()
	{
		assertTrue(CompilerArguments.parse(new String[]{"prog.txt", "--bogus"}, Map.of()).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"prog.txt", "-o"}, Map.of()).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"a.txt", "b.txt"}, Map.of()).isHelpFlag());
	}

	@Test
	void onlineOracleNeedsKeyAndNoOfflineSwitch()
	{
		String[] input = {"prog.txt"};
		assertFalse(CompilerArguments.parse(input, Map.of()).useOnlineOracle());
		assertTrue(CompilerArguments.parse(input, Map.of(CompilerArguments.API_KEY_ENV, "key")).useOnlineOracle());
		assertFalse(CompilerArguments.parse(new String[]{"prog.txt", "--offline"}, Map.of(CompilerArguments.API_KEY_ENV, "key")).useOnlineOracle());
		assertFalse(CompilerArguments.parse(input, Map.of(CompilerArguments.API_KEY_ENV, "key", CompilerArguments.OFFLINE_ENV, "1")).useOnlineOracle());
	}

	@Test
	void versionFlagStopsParsing()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"--version", "--bogus"}, Map.of());
		assertTrue(args.isVersionFlag());
		assertFalse(args.isHelpFlag());
	}
}
