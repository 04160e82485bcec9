// File: src/main/java/org/lokray/thor/ThorCompiler.java

package org.lokray.thor;

import org.lokray.thor.ast.Program;
import org.lokray.thor.codegen.CGenerator;
import org.lokray.thor.codegen.CTranslationUnit;
import org.lokray.thor.parser.SourceFileParser;
import org.lokray.thor.resolver.ImportResolver;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.Diagnostic;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the whole pipeline for one entry file: parse, resolve imports, generate C.
 * <p>
 * Every diagnostic, fatal or not, ends up in the {@link ErrorReporter} passed in, so a caller can print
 * them after a failed compilation.
 */
public class ThorCompiler
{
	private static final Logger logger = LoggerFactory.getLogger(ThorCompiler.class);

	private final CompilerConfig config;
	private final ErrorReporter errorReporter;

	public ThorCompiler(CompilerConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
	}

	/**
	 * Compiles a source file and everything it imports.
	 *
	 * @throws CompilationException On the first fatal error of any stage.
	 */
	public CTranslationUnit compile(Path sourceFile)
	{
		String source;
		try
		{
			source = Files.readString(sourceFile, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			Diagnostic diagnostic = Diagnostic.error(ErrorKind.IO_ERROR, sourceFile.toString(), 0, 0,
					"Could not read source file: " + e.getMessage());
			errorReporter.add(diagnostic);
			throw new CompilationException(diagnostic);
		}
		return compile(source, sourceFile);
	}

	/**
	 * Compiles source text as if it were stored at {@code sourceFile}; imports are looked up next to that path.
	 */
	public CTranslationUnit compile(String source, Path sourceFile)
	{
		logger.info("Compiling {}", sourceFile);

		Program parsed = new SourceFileParser(errorReporter).parse(source, sourceFile.toString());
		logger.debug("Parsed {} top-level statement(s)", parsed.getStatements().size());

		Program merged = new ImportResolver(config, errorReporter).resolve(parsed, sourceFile);

		try
		{
			return new CGenerator(config).generate(merged);
		}
		catch (CompilationException e)
		{
			e.getDiagnostics().forEach(errorReporter::add);
			throw e;
		}
	}

	public CompilerConfig getConfig()
	{
		return config;
	}

	public ErrorReporter getErrorReporter()
	{
		return errorReporter;
	}
}
