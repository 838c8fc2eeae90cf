package org.lokray.nlmc.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Parses and holds all command-line arguments for the nlmc front end.
 * <p>
 * Environment variables fill in what the command line leaves open:
 * {@code GEMINI_API_KEY} for the oracle key and {@code NLMC_OFFLINE=1} to force the offline oracle.
 */
public class CompilerArguments
{
	public static final String DEFAULT_MODEL = "gemini-2.0-flash";
	public static final String API_KEY_ENV = "GEMINI_API_KEY";
	public static final String OFFLINE_ENV = "NLMC_OFFLINE";

	private Path inputFile = null;
	private Path outputPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean offline = false;
	private String model = DEFAULT_MODEL;
	private String apiKey = null;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		return parse(args, System.getenv());
	}

	public static CompilerArguments parse(String[] args, Map<String, String> environment)
	{
		CompilerArguments parsedArgs = new CompilerArguments();
		parsedArgs.apiKey = environment.get(API_KEY_ENV);
		parsedArgs.offline = "1".equals(environment.get(OFFLINE_ENV));

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("--offline"))
				{
					parsedArgs.offline = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-m") || arg.equals("--model"))
				{
					parsedArgs.model = getNextArg(args, ++i, arg);
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				if (parsedArgs.inputFile != null)
				{
					throw new IllegalArgumentException("Only one input description can be compiled at a time, got: " + arg);
				}
				parsedArgs.inputFile = Paths.get(arg);
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.err.println("Usage: nlmc <description.txt> [options]");
		System.err.println("Options:");
		System.err.println("    -o, --output <file>   Write the analysed IR as JSON (default: <input>.ir.json)");
		System.err.println("    -m, --model <name>    Oracle model name (default: " + DEFAULT_MODEL + ")");
		System.err.println("        --offline         Do not contact the oracle; pattern matching only");
		System.err.println("    -v, --verbose         Print debug logs");
		System.err.println("    -h, --help            Show this message");
		System.err.println("        --version         Print the compiler version");
		System.err.println("Environment:");
		System.err.println("    " + API_KEY_ENV + "   Oracle API key");
		System.err.println("    " + OFFLINE_ENV + "=1   Same as --offline");
	}

	/**
	 * The oracle is contacted only when an API key is known and offline mode is off.
	 */
	public boolean useOnlineOracle()
	{
		return !offline && apiKey != null && !apiKey.isBlank();
	}

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isOffline()
	{
		return offline;
	}

	public String getModel()
	{
		return model;
	}

	public String getApiKey()
	{
		return apiKey;
	}
}
