package org.lokray.nlmc.util;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.nlmc.CompilationResult;
import org.lokray.nlmc.NlmcPipeline;
import org.lokray.nlmc.dto.BlockDTO;
import org.lokray.nlmc.dto.IrDocumentDTO;
import org.lokray.nlmc.oracle.OfflineOracle;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrExporterTest
{
	private static CompilationResult compile(String text)
	{
		return new NlmcPipeline(OfflineOracle.INSTANCE, new ErrorHandler()).compile(text);
	}

	@Test
	void documentCarriesOperationsBlocksAndDiagnostics()
	{
		IrDocumentDTO doc = IrExporter.toDocument(compile("Add x and y and print it"));

		assertTrue(doc.complete);
		assertEquals(List.of("op_0", "op_1"), doc.operations.stream().map(o -> o.id).toList());
		assertEquals(List.of("x", "y"), doc.operations.get(0).inputs);
		assertEquals("entry", doc.entry);
		assertEquals(List.of("entry", "block_0", "block_1", "exit"), doc.blocks.stream().map(b -> b.id).toList());

		BlockDTO add = doc.blocks.get(1);
		assertEquals(List.of("entry"), add.predecessors);
		assertEquals("ADD", add.instructions.get(0).opcode);
		assertEquals("op_0_result", add.instructions.get(0).result);
		assertEquals("block_0", doc.immediateDominators.get("block_1"));

		assertEquals(3, doc.diagnostics.semanticErrors.size());
		assertFalse(doc.diagnostics.recoveryActions.isEmpty());
	}

	@Test
	void writesParseableJson(@TempDir Path dir) throws IOException
	{
		Path out = dir.resolve("nested").resolve("prog.ir.json");

		IrExporter.write(compile("Add x and y and print it"), out);

		JsonObject json = JsonParser.parseString(Files.readString(out)).getAsJsonObject();
		JsonArray blocks = json.getAsJsonArray("blocks");
		assertEquals(4, blocks.size());
		assertEquals("exit", blocks.get(3).getAsJsonObject().get("id").getAsString());
		assertTrue(json.getAsJsonObject("diagnostics").has("semanticErrors"));
	}

	@Test
	void emptyDescriptionStillExports()
	{
		String json = IrExporter.toJson(compile(""));

		JsonObject doc = JsonParser.parseString(json).getAsJsonObject();
		assertEquals(0, doc.getAsJsonArray("operations").size());
	}
}
