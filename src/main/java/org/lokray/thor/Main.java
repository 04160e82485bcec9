// File: src/main/java/org/lokray/thor/Main.java

package org.lokray.thor;

import org.lokray.thor.codegen.CTranslationUnit;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Entry point for the Thor compiler.
 * Translates one .thor file (plus its imports) into a single .c file. It never invokes a C compiler.
 */
public class Main
{
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	private static final String USAGE = "Usage: thorc [-I <dir>]... [--config <file>] <input.thor> [output.c]";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the compiler and returns the process exit status.
	 */
	static int run(String[] args)
	{
		// 1. Argument parsing
		List<Path> includeDirs = new ArrayList<>();
		Path configFile = null;
		List<String> positional = new ArrayList<>();
		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			if (arg.equals("-I") || arg.equals("--config"))
			{
				if (i + 1 >= args.length)
				{
					System.err.println("Error: " + arg + " expects a value.");
					System.err.println(USAGE);
					return 2;
				}
				Path value = Paths.get(args[++i]);
				if (arg.equals("-I"))
				{
					includeDirs.add(value);
				}
				else
				{
					configFile = value;
				}
			}
			else if (arg.startsWith("-I") && arg.length() > 2)
			{
				includeDirs.add(Paths.get(arg.substring(2)));
			}
			else
			{
				positional.add(arg);
			}
		}

		if (positional.isEmpty() || positional.size() > 2)
		{
			System.err.println(USAGE);
			return 2;
		}

		Path input = Paths.get(positional.get(0));
		if (!Files.isRegularFile(input))
		{
			System.err.println("Error: Input file not found: " + input);
			return 1;
		}
		Path output = positional.size() == 2 ? Paths.get(positional.get(1)) : defaultOutputFor(input);

		// 2. Configuration
		CompilerConfig config;
		try
		{
			config = loadConfiguration(configFile).withSearchPaths(includeDirs);
		}
		catch (IllegalArgumentException e)
		{
			System.err.println("Error: Invalid configuration: " + e.getMessage());
			return 1;
		}

		// 3. Compilation
		ErrorReporter errorReporter = new ErrorReporter();
		CTranslationUnit unit;
		try
		{
			unit = new ThorCompiler(config, errorReporter).compile(input);
		}
		catch (CompilationException e)
		{
			errorReporter.printTo(System.err);
			System.err.println("Build failed with " + errorReporter.errorCount() + " error(s).");
			return 1;
		}
		errorReporter.printTo(System.err);

		// 4. Output
		try
		{
			Path parent = output.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.writeString(output, unit.getSource(), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("Error: Could not write " + output + ": " + e.getMessage());
			return 1;
		}
		logger.info("Wrote {}", output.toAbsolutePath());
		return 0;
	}

	static Path defaultOutputFor(Path input)
	{
		String fileName = input.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		String base = dot > 0 ? fileName.substring(0, dot) : fileName;
		Path parent = input.getParent();
		return parent != null ? parent.resolve(base + ".c") : Paths.get(base + ".c");
	}

	/**
	 * Loads {@code --config} if given, else {@code ~/.config/thor/thor.conf} if it exists, else defaults.
	 */
	private static CompilerConfig loadConfiguration(Path explicitFile)
	{
		Properties props = new Properties();
		Path configPath = explicitFile != null
				? explicitFile
				: Paths.get(System.getProperty("user.home"), ".config", "thor", "thor.conf");

		if (Files.exists(configPath))
		{
			try (InputStream input = Files.newInputStream(configPath))
			{
				props.load(input);
				logger.info("Loaded configuration from: {}", configPath);
			}
			catch (IOException e)
			{
				logger.warn("Could not read config file at {}. Using default settings.", configPath);
			}
		}
		else if (explicitFile != null)
		{
			logger.warn("Config file {} does not exist. Using default settings.", configPath);
		}
		else
		{
			logger.debug("No config file found at {}. Using default settings.", configPath);
		}
		return new CompilerConfig(props);
	}
}
