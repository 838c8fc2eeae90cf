package org.lokray.nlmc.oracle;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.lokray.nlmc.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Helpers for reading oracle answers. None of these methods throw on malformed input.
 */
public final class OracleResponses
{
	private static final String FENCE = "```";

	private OracleResponses()
	{
	}

	/**
	 * Returns the body of the first fenced block ({@code ```lang\n...```}) with its language
	 * line removed, or the raw response when it has no complete fenced block.
	 */
	public static String extractFencedBlock(String response)
	{
		if (response == null)
		{
			return "";
		}
		int start = response.indexOf(FENCE);
		if (start < 0)
		{
			return response.trim();
		}
		int bodyStart = start + FENCE.length();
		int end = response.indexOf(FENCE, bodyStart);
		if (end < 0)
		{
			return response.trim();
		}

		String block = response.substring(bodyStart, end);
		int newline = block.indexOf('\n');
		if (newline >= 0)
		{
			return block.substring(newline + 1).trim();
		}
		return block.trim();
	}

	/**
	 * Extracts the fenced block (if any) and parses it as a JSON object.
	 */
	public static Optional<JsonObject> parseObject(String response)
	{
		String body = extractFencedBlock(response);
		if (body.isEmpty())
		{
			return Optional.empty();
		}
		try
		{
			JsonElement element = JsonParser.parseString(body);
			if (element != null && element.isJsonObject())
			{
				return Optional.of(element.getAsJsonObject());
			}
			Debug.logDebug("Oracle answer is JSON but not an object; ignoring it.");
		}
		catch (JsonParseException e)
		{
			Debug.logDebug("Oracle answer is not valid JSON: " + e.getMessage());
		}
		return Optional.empty();
	}

	/**
	 * Queries the oracle and parses the answer as a JSON object. Oracle failures are logged
	 * as warnings and reported as an empty result.
	 */
	public static Optional<JsonObject> queryObject(ReasoningOracle oracle, String stage, String prompt)
	{
		try
		{
			return parseObject(oracle.query(prompt));
		}
		catch (OracleException e)
		{
			Debug.logWarning(stage + ": oracle unavailable, continuing without it (" + e.getMessage() + ")");
			return Optional.empty();
		}
	}

	public static String getString(JsonObject object, String member, String fallback)
	{
		JsonElement element = object.get(member);
		if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isString())
		{
			return element.getAsString();
		}
		return fallback;
	}

	public static Optional<Double> getNumber(JsonObject object, String member)
	{
		JsonElement element = object.get(member);
		if (element != null && element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber())
		{
			return Optional.of(element.getAsDouble());
		}
		return Optional.empty();
	}

	/**
	 * String elements of an array member; non-string elements are skipped.
	 */
	public static List<String> getStringArray(JsonObject object, String member)
	{
		List<String> values = new ArrayList<>();
		JsonElement element = object.get(member);
		if (element != null && element.isJsonArray())
		{
			for (JsonElement item : element.getAsJsonArray())
			{
				if (item.isJsonPrimitive() && item.getAsJsonPrimitive().isString())
				{
					values.add(item.getAsString());
				}
			}
		}
		return values;
	}
}
