package org.qlower;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.qlower.circuit.Circuit;
import org.qlower.semantic.LoweringException;
import org.qlower.semantic.QasmLowerer;
import org.qlower.util.CircuitDTOConverter;
import org.qlower.util.CompilerArguments;
import org.qlower.util.Debug;
import org.qlower.util.ErrorHandler;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Command-line driver: lowers each input file and prints or writes the resulting circuit.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		int status = run(args, System.out);
		if (status != 0)
		{
			System.exit(status);
		}
	}

	/**
	 * Runs the compiler with the given arguments.
	 *
	 * @return 0 on success, 1 if any input failed to lower, 2 on bad arguments.
	 */
	public static int run(String[] args, PrintStream out)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return args.length == 0 || isHelpRequest(args) ? 0 : 2;
			}
			if (arguments.isVersionFlag())
			{
				out.println("qlower version " + VERSION);
				return 0;
			}
			Debug.ENABLE_DEBUG = arguments.isVerboseFlag();
			Debug.LOG_TO_STDERR = arguments.isJsonOutput() && arguments.getOutputPath() == null;

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (arguments.isCheckOnly() && (arguments.isJsonOutput() || arguments.getOutputPath() != null))
			{
				Debug.logWarning("--check produces no output; --json and --output are ignored.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 2;
			}

			ErrorHandler errorHandler = new ErrorHandler();
			QasmLowerer lowerer = new QasmLowerer();
			Gson gson = new GsonBuilder().setPrettyPrinting().create();
			boolean multiple = arguments.getInputFiles().size() > 1;

			for (Path file : arguments.getInputFiles())
			{
				Debug.logDebug("Lowering " + file + "...");
				Circuit circuit;
				try
				{
					circuit = lowerer.parseFile(file);
				}
				catch (LoweringException e)
				{
					errorHandler.logError(file, e);
					continue;
				}

				if (arguments.isCheckOnly())
				{
					Debug.logDebug("Check passed for " + file);
					continue;
				}

				String rendered = arguments.isJsonOutput()
						? gson.toJson(CircuitDTOConverter.toDTO(circuit)) + System.lineSeparator()
						: circuit.render();

				if (arguments.getOutputPath() != null)
				{
					writeOutput(arguments.getOutputPath(), rendered);
				}
				else
				{
					if (multiple && !arguments.isJsonOutput())
					{
						out.println("// " + file);
					}
					out.print(rendered);
				}
			}

			if (errorHandler.hasErrors())
			{
				Debug.logError("Lowering failed for " + errorHandler.getErrorCount() + " file(s).");
				return 1;
			}
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Initialization failed: " + e.getMessage());
			return 2;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 1;
		}
	}

	private static boolean isHelpRequest(String[] args)
	{
		for (String arg : args)
		{
			if (arg.equals("-h") || arg.equals("--help"))
			{
				return true;
			}
		}
		return false;
	}

	private static void writeOutput(Path outPath, String content) throws IOException
	{
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote circuit to: " + outPath);
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean valid = true;

		for (Path input : args.getInputFiles())
		{
			if (!Files.exists(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
			else if (Files.isDirectory(input))
			{
				Debug.logError("Input path is a directory: " + input);
				valid = false;
			}
		}

		return valid;
	}
}
