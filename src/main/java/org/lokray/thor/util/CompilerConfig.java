package org.lokray.thor.util;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Holds configuration settings for the Thor compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private final String sourceExtension;
	private final List<Path> searchPaths;
	private final String helperPrefix;
	private final int indentWidth;
	private final int bufferSize;

	public CompilerConfig()
	{
		this(new Properties());
	}

	public CompilerConfig(Properties props)
	{
		String extension = props.getProperty("thor.source_extension", ".thor").trim();
		this.sourceExtension = extension.startsWith(".") ? extension : "." + extension;
		this.searchPaths = parseSearchPaths(props.getProperty("thor.search_paths", ""));
		this.helperPrefix = props.getProperty("codegen.helper_prefix", "thor_").trim();
		this.indentWidth = parsePositiveInt(props.getProperty("codegen.indent"), 4, "codegen.indent");
		this.bufferSize = parsePositiveInt(props.getProperty("codegen.buffer_size"), 1024, "codegen.buffer_size");
	}

	private CompilerConfig(CompilerConfig base, List<Path> extraSearchPaths)
	{
		this.sourceExtension = base.sourceExtension;
		List<Path> paths = new ArrayList<>(base.searchPaths);
		paths.addAll(extraSearchPaths);
		this.searchPaths = Collections.unmodifiableList(paths);
		this.helperPrefix = base.helperPrefix;
		this.indentWidth = base.indentWidth;
		this.bufferSize = base.bufferSize;
	}

	/**
	 * Returns a copy of this configuration with additional import search paths appended.
	 */
	public CompilerConfig withSearchPaths(List<Path> extraSearchPaths)
	{
		return new CompilerConfig(this, extraSearchPaths);
	}

	private static List<Path> parseSearchPaths(String value)
	{
		List<Path> paths = new ArrayList<>();
		for (String part : value.split(File.pathSeparator))
		{
			if (!part.isBlank())
			{
				paths.add(Paths.get(part.trim()));
			}
		}
		return Collections.unmodifiableList(paths);
	}

	private static int parsePositiveInt(String value, int defaultValue, String key)
	{
		if (value == null || value.isBlank())
		{
			return defaultValue;
		}
		try
		{
			int parsed = Integer.parseInt(value.trim());
			if (parsed <= 0)
			{
				throw new IllegalArgumentException("'" + key + "' must be positive, got " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("'" + key + "' is not a number: " + value, e);
		}
	}

	public String getSourceExtension()
	{
		return sourceExtension;
	}

	public List<Path> getSearchPaths()
	{
		return searchPaths;
	}

	public String getHelperPrefix()
	{
		return helperPrefix;
	}

	public int getIndentWidth()
	{
		return indentWidth;
	}

	public int getBufferSize()
	{
		return bufferSize;
	}
}
