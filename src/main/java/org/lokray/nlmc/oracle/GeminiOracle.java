package org.lokray.nlmc.oracle;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.nlmc.util.Debug;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Oracle backed by the Gemini {@code generateContent} REST endpoint.
 * <p>
 * The answer text of the first candidate is returned verbatim; fenced-block handling
 * is left to {@link OracleResponses}.
 */
public class GeminiOracle implements ReasoningOracle
{
	private static final String ENDPOINT = "https://generativelanguage.googleapis.com/v1/models/%s:generateContent?key=%s";

	private final Gson gson = new Gson();
	private final HttpClient client;
	private final String apiKey;
	private final String model;

	public GeminiOracle(String apiKey, String model)
	{
		if (apiKey == null || apiKey.isBlank())
		{
			throw new IllegalArgumentException("API key not found. Set GEMINI_API_KEY or use --offline.");
		}
		this.apiKey = apiKey;
		this.model = model;
		this.client = HttpClient.newBuilder()
				.connectTimeout(Duration.ofSeconds(10))
				.build();
	}

	@Override
	public String query(String prompt) throws OracleException
	{
		Debug.logDebug("Querying oracle model " + model + " (" + prompt.length() + " prompt chars)");

		HttpRequest request = HttpRequest.newBuilder()
				.uri(URI.create(String.format(ENDPOINT, model, apiKey)))
				.header("Content-Type", "application/json")
				.POST(HttpRequest.BodyPublishers.ofString(toRequestJson(prompt)))
				.build();

		HttpResponse<String> response;
		try
		{
			response = client.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e)
		{
			throw new OracleException("Failed to send request to oracle", e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new OracleException("Interrupted while waiting for the oracle", e);
		}

		if (response.statusCode() / 100 != 2)
		{
			throw new OracleException("Oracle request failed with status " + response.statusCode() + ": " + response.body());
		}
		return extractAnswerText(response.body());
	}

	String toRequestJson(String prompt)
	{
		Part part = new Part();
		part.text = prompt;
		Content content = new Content();
		content.parts.add(part);
		GenerateRequest request = new GenerateRequest();
		request.contents.add(content);
		return gson.toJson(request);
	}

	String extractAnswerText(String body) throws OracleException
	{
		GenerateResponse parsed;
		try
		{
			parsed = gson.fromJson(body, GenerateResponse.class);
		}
		catch (JsonParseException e)
		{
			throw new OracleException("Failed to parse oracle response", e);
		}

		if (parsed == null || parsed.candidates == null || parsed.candidates.isEmpty())
		{
			throw new OracleException("No candidates in oracle response");
		}
		Content content = parsed.candidates.get(0).content;
		if (content == null || content.parts == null || content.parts.isEmpty() || content.parts.get(0).text == null)
		{
			throw new OracleException("No parts in oracle response content");
		}
		return content.parts.get(0).text;
	}

	// --- Wire format ---

	static class GenerateRequest
	{
		List<Content> contents = new ArrayList<>();
	}

	static class GenerateResponse
	{
		List<Candidate> candidates;
	}

	static class Candidate
	{
		Content content;
	}

	static class Content
	{
		List<Part> parts = new ArrayList<>();
	}

	static class Part
	{
		String text;
	}
}
