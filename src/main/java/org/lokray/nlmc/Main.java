package org.lokray.nlmc;

import org.lokray.nlmc.oracle.GeminiOracle;
import org.lokray.nlmc.oracle.OfflineOracle;
import org.lokray.nlmc.oracle.ReasoningOracle;
import org.lokray.nlmc.util.CompilerArguments;
import org.lokray.nlmc.util.Debug;
import org.lokray.nlmc.util.ErrorHandler;
import org.lokray.nlmc.util.FileUtils;
import org.lokray.nlmc.util.IrExporter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command-line front end: reads a natural-language description, runs the analysis
 * pipeline and writes the resulting IR as JSON.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("nlmc (Natural-Language Machine Compiler) version " + VERSION);
				return;
			}

			if (arguments.getInputFile() == null)
			{
				throw new IllegalArgumentException("No input description provided. Use -h for help.");
			}
			if (!Files.exists(arguments.getInputFile()))
			{
				Debug.logError("Input file not found: " + arguments.getInputFile());
				Debug.logError("Aborting.");
				return;
			}

			compile(arguments, new ErrorHandler());
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Compiler initialization failed: " + e.getMessage());
			CompilerArguments.printUsage();
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
	}

	private static void compile(CompilerArguments args, ErrorHandler errorHandler) throws IOException
	{
		Debug.logDebug("Starting compilation of " + args.getInputFile());
		String description = FileUtils.load(args.getInputFile());
		if (description.isBlank())
		{
			throw new IllegalArgumentException("Input description is empty: " + args.getInputFile());
		}

		NlmcPipeline pipeline = new NlmcPipeline(createOracle(args), errorHandler);
		CompilationResult result = pipeline.compile(description);

		Debug.log(result.summary());
		IrExporter.write(result, getOutputPath(args));

		if (!result.isComplete())
		{
			Debug.logError("Compilation stopped early; the IR holds the models produced before the failure.");
		}
		else if (errorHandler.hasErrors())
		{
			Debug.logWarning("Compilation finished with " + errorHandler.getErrors().size() + " error(s), see diagnostics.");
		}
		else
		{
			Debug.logInfo("Compilation successful.");
		}
	}

	static ReasoningOracle createOracle(CompilerArguments args)
	{
		if (args.useOnlineOracle())
		{
			Debug.logDebug("Using oracle model " + args.getModel());
			return new GeminiOracle(args.getApiKey(), args.getModel());
		}
		if (!args.isOffline())
		{
			Debug.logWarning("No " + CompilerArguments.API_KEY_ENV + " set, running offline.");
		}
		return OfflineOracle.INSTANCE;
	}

	/**
	 * {@code -o} when given, otherwise the input path with its extension replaced by {@code .ir.json}.
	 */
	static Path getOutputPath(CompilerArguments args)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return FileUtils.withExtension(args.getInputFile(), ".ir.json");
	}
}
