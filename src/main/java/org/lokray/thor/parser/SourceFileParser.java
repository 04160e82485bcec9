package org.lokray.thor.parser;

import org.lokray.thor.ast.Program;
import org.lokray.thor.lexer.Lexer;
import org.lokray.thor.lexer.Token;
import org.lokray.thor.util.Diagnostic;
import org.lokray.thor.util.ErrorKind;
import org.lokray.thor.util.ErrorReporter;
import org.lokray.thor.util.CompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the lexer and then the parser over one source text, stopping after the first stage that reports errors.
 */
public class SourceFileParser
{
	private static final Logger logger = LoggerFactory.getLogger(SourceFileParser.class);

	private final ErrorReporter errorReporter;

	public SourceFileParser(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	/**
	 * Lexes and parses a source text.
	 *
	 * @param source     The Thor source code.
	 * @param sourceName The file name diagnostics are attributed to.
	 * @return The parsed program, never partial.
	 * @throws CompilationException With every error of the failing stage.
	 */
	public Program parse(String source, String sourceName)
	{
		String previousSource = errorReporter.enterSource(sourceName);
		try
		{
			int mark = errorReporter.size();
			List<Token> tokens = new Lexer(source, errorReporter).scanTokens();
			failOnErrors(mark, ErrorKind.LEX_ERROR);
			logger.debug("Scanned {} tokens from {}", tokens.size(), sourceName);

			Program program = new ThorParser(tokens, errorReporter).parse();
			failOnErrors(mark, ErrorKind.SYNTAX_ERROR);
			logger.debug("Parsed {} top-level statements from {}", program.getStatements().size(), sourceName);
			return program;
		}
		finally
		{
			errorReporter.enterSource(previousSource);
		}
	}

	private void failOnErrors(int mark, ErrorKind stageKind)
	{
		List<Diagnostic> errors = errorReporter.errorsSince(mark);
		if (!errors.isEmpty())
		{
			// A stage fails with its own kind unless every error is of one more specific kind
			ErrorKind kind = errors.stream().allMatch(d -> d.kind() == errors.get(0).kind()) ? errors.get(0).kind() : stageKind;
			throw new CompilationException(kind, errors);
		}
	}
}
