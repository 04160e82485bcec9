// File: src/main/java/org/lokray/thor/resolver/ImportResolver.java

package org.lokray.thor.resolver;

import org.lokray.thor.ast.ModuleSegment;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.statements.Statement;
import org.lokray.thor.parser.SourceFileParser;
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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merges a program and everything it transitively imports into one {@link Program}.
 * <p>
 * Modules are processed depth-first: a module's own imports are spliced in before its statements, so
 * every dependency precedes its dependents. Each source file is merged at most once; importing it again,
 * including through an import cycle, is reported as a duplicate import and skipped.
 */
public class ImportResolver
{
	private static final Logger logger = LoggerFactory.getLogger(ImportResolver.class);

	private final CompilerConfig config;
	private final ErrorReporter errorReporter;

	public ImportResolver(CompilerConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
	}

	/**
	 * State of one {@link #resolve} call. Never shared between calls.
	 */
	private static final class Resolution
	{
		private final Set<String> processed = new HashSet<>(); // Canonical paths, or "<builtin name>"
		private final List<ModuleSegment> segments = new ArrayList<>();
		private final Map<String, String> qualifierOwners = new HashMap<>(); // C qualifier -> processed key of the module using it
	}

	/**
	 * Resolves every import of the main program.
	 *
	 * @param mainProgram The parsed main file.
	 * @param mainFile    The path of the main file; relative imports are probed next to it.
	 * @return The merged program: dependencies first, then the main program's own statements.
	 * @throws CompilationException If a module cannot be found, read or parsed.
	 */
	public Program resolve(Program mainProgram, Path mainFile)
	{
		Path mainPath = canonicalize(mainFile);
		Resolution resolution = new Resolution();
		resolution.processed.add(mainPath.toString());

		resolveImports(importsOf(mainProgram), mainPath, resolution);

		resolution.segments.add(new ModuleSegment(moduleNameOf(mainPath), null, mainPath, false, true,
				stripDirectives(mainProgram.getStatements())));

		logger.info("Resolved {} imported module(s) for {}", resolution.segments.size() - 1, mainPath.getFileName());
		return Program.merged(mainProgram.getPackageDeclaration(), resolution.segments);
	}

	private void resolveImports(List<ImportDirective> imports, Path importer, Resolution resolution)
	{
		for (ImportDirective directive : imports)
		{
			String moduleName = directive.getModuleName();
			Optional<String> builtinName = BuiltinModules.canonicalName(moduleName);

			if (builtinName.isPresent())
			{
				String key = "<builtin " + builtinName.get() + ">";
				if (!resolution.processed.add(key))
				{
					reportDuplicate(directive, key, importer);
					continue;
				}
				Program module = BuiltinModules.load(builtinName.get());
				resolution.segments.add(new ModuleSegment(builtinName.get(), claimQualifier(builtinName.get(), key, module, resolution), null,
						true, false, stripDirectives(module.getStatements())));
				logger.info("Loaded built-in module: {}", builtinName.get());
				continue;
			}

			Path modulePath = locate(moduleName, importer)
					.orElseThrow(() -> moduleNotFound(directive, importer));
			if (!resolution.processed.add(modulePath.toString()))
			{
				reportDuplicate(directive, modulePath.toString(), importer);
				continue;
			}

			Program module = parseModule(modulePath, directive, importer);
			resolveImports(importsOf(module), modulePath, resolution);
			resolution.segments.add(new ModuleSegment(moduleName, claimQualifier(moduleName, modulePath.toString(), module, resolution), modulePath,
					false, false, stripDirectives(module.getStatements())));
			logger.info("Loaded module: {} from {}", moduleName, modulePath);
		}
	}

	/**
	 * Header imports plus imports written after the first statement.
	 */
	private static List<ImportDirective> importsOf(Program program)
	{
		List<ImportDirective> imports = new ArrayList<>(program.getImports());
		for (Statement statement : program.getStatements())
		{
			if (statement instanceof ImportDirective)
			{
				imports.add((ImportDirective) statement);
			}
		}
		return imports;
	}

	private static List<Statement> stripDirectives(List<Statement> statements)
	{
		return statements.stream()
				.filter(s -> !(s instanceof ImportDirective) && !(s instanceof PackageDeclaration))
				.collect(Collectors.toList());
	}

	private Program parseModule(Path modulePath, ImportDirective directive, Path importer)
	{
		String source;
		try
		{
			source = Files.readString(modulePath, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			throw fatal(ErrorKind.IO_ERROR, directive, importer,
					"Could not read module '" + directive.getModuleName() + "' from " + modulePath + ": " + e.getMessage());
		}
		return new SourceFileParser(errorReporter).parse(source, modulePath.toString());
	}

	// --- Module lookup ---

	/**
	 * Probes, in order: the importing file's directory, each configured search path,
	 * then a subdirectory named after the module under those same bases.
	 */
	Optional<Path> locate(String moduleName, Path importer)
	{
		List<Path> bases = new ArrayList<>();
		Path importerDir = importer.getParent();
		bases.add(importerDir != null ? importerDir : Path.of("."));
		bases.addAll(config.getSearchPaths());

		for (Path base : bases)
		{
			Optional<Path> found = probeFile(base, moduleName);
			if (found.isPresent())
			{
				return found;
			}
		}
		for (Path base : bases)
		{
			Optional<Path> found = probeDirectory(base, moduleName);
			if (found.isPresent())
			{
				return found;
			}
		}
		return Optional.empty();
	}

	private Optional<Path> probeFile(Path base, String moduleName)
	{
		String extension = config.getSourceExtension();
		for (String relative : spellings(moduleName))
		{
			for (Path candidate : List.of(base.resolve(relative + extension), base.resolve(relative)))
			{
				if (Files.isRegularFile(candidate))
				{
					return Optional.of(canonicalize(candidate));
				}
			}
		}
		return Optional.empty();
	}

	private Optional<Path> probeDirectory(Path base, String moduleName)
	{
		String extension = config.getSourceExtension();
		String lastSegment = moduleName.substring(moduleName.lastIndexOf('.') + 1);
		for (String relative : spellings(moduleName))
		{
			Path dir = base.resolve(relative);
			if (!Files.isDirectory(dir))
			{
				continue;
			}
			for (Path named : List.of(dir.resolve(relative.substring(relative.lastIndexOf('/') + 1) + extension), dir.resolve(lastSegment + extension)))
			{
				if (Files.isRegularFile(named))
				{
					return Optional.of(canonicalize(named));
				}
			}
			try (Stream<Path> files = Files.list(dir))
			{
				Optional<Path> first = files
						.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(extension))
						.sorted()
						.findFirst();
				if (first.isPresent())
				{
					return Optional.of(canonicalize(first.get()));
				}
			}
			catch (IOException e)
			{
				logger.warn("Could not list module directory {}: {}", dir, e.getMessage());
			}
		}
		return Optional.empty();
	}

	/**
	 * The module name as written, then with its dots read as directory separators.
	 */
	private static List<String> spellings(String moduleName)
	{
		String nested = moduleName.replace('.', '/');
		return nested.equals(moduleName) ? List.of(moduleName) : List.of(moduleName, nested);
	}

	// --- Naming ---

	/**
	 * The C prefix for a module's functions: its package name, else its module name, made a valid identifier.
	 * A package named {@code main} keeps its functions unqualified.
	 */
	static String qualifierFor(String moduleName, Program module)
	{
		String base = module.getPackageName().orElse(moduleName);
		return base.equals("main") ? null : sanitize(base);
	}

	/**
	 * Like {@link #qualifierFor}, but never hands out a prefix another module already uses. A module whose
	 * package name is taken falls back to its module name, then to a numbered variant of it.
	 */
	private static String claimQualifier(String moduleName, String moduleKey, Program module, Resolution resolution)
	{
		String qualifier = qualifierFor(moduleName, module);
		if (qualifier == null)
		{
			return null;
		}
		String owner = resolution.qualifierOwners.get(qualifier);
		if (owner != null && !owner.equals(moduleKey))
		{
			String fallback = sanitize(moduleName);
			String candidate = fallback;
			for (int n = 2; resolution.qualifierOwners.containsKey(candidate); n++)
			{
				candidate = fallback + "_" + n;
			}
			logger.info("Prefix '{}' is already used by {}; functions of {} use '{}'", qualifier, owner, moduleName, candidate);
			qualifier = candidate;
		}
		resolution.qualifierOwners.putIfAbsent(qualifier, moduleKey);
		return qualifier;
	}

	private static String sanitize(String name)
	{
		String sanitized = name.replaceAll("[^A-Za-z0-9_]", "_");
		return Character.isDigit(sanitized.charAt(0)) ? "_" + sanitized : sanitized;
	}

	private String moduleNameOf(Path file)
	{
		String fileName = file.getFileName().toString();
		String extension = config.getSourceExtension();
		return fileName.endsWith(extension) ? fileName.substring(0, fileName.length() - extension.length()) : fileName;
	}

	private static Path canonicalize(Path path)
	{
		try
		{
			return path.toRealPath();
		}
		catch (IOException e)
		{
			// Not on disk (e.g. an in-memory main program), fall back to the normalized absolute path
			return path.toAbsolutePath().normalize();
		}
	}

	// --- Diagnostics ---

	private void reportDuplicate(ImportDirective directive, String firstLoadedFrom, Path importer)
	{
		String previousSource = errorReporter.enterSource(importer.toString());
		errorReporter.warn(ErrorKind.DUPLICATE_IMPORT,
				directive.getLine(),
				directive.getImportKeyword().getColumn(),
				"Module '" + directive.getModuleName() + "' was already imported; this import is ignored.",
				List.of("module: " + directive.getModuleName(),
						"first loaded from: " + firstLoadedFrom,
						"re-imported by: " + importer));
		errorReporter.enterSource(previousSource);
		logger.debug("Skipped duplicate import of {} in {}", directive.getModuleName(), importer);
	}

	private CompilationException moduleNotFound(ImportDirective directive, Path importer)
	{
		return fatal(ErrorKind.MODULE_NOT_FOUND, directive, importer,
				"Cannot find module '" + directive.getModuleName() + "'.");
	}

	private CompilationException fatal(ErrorKind kind, ImportDirective directive, Path importer, String message)
	{
		Diagnostic diagnostic = Diagnostic.error(kind, importer.toString(), directive.getLine(),
				directive.getImportKeyword().getColumn(), message);
		errorReporter.add(diagnostic);
		return new CompilationException(diagnostic);
	}
}
