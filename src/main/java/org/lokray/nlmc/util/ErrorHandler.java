// File: src/main/java/org/lokray/nlmc/util/ErrorHandler.java
package org.lokray.nlmc.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics printed while a description is compiled.
 * Errors make {@link #hasErrors()} true; warnings are only recorded.
 */
public class ErrorHandler
{
	private final List<String> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();

	public void logError(String stage, String msg)
	{
		String err = String.format("[%s Error] %s", stage, msg);
		Debug.logError(err);
		errors.add(err);
	}

	public void logWarning(String stage, String msg)
	{
		String warning = String.format("[%s Warning] %s", stage, msg);
		Debug.logWarning(warning);
		warnings.add(warning);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
