package org.lokray.thor.codegen;

import org.lokray.thor.ast.ModuleSegment;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.CallableDeclaration;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.statements.Statement;
import org.lokray.thor.resolver.BuiltinModules;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Every callable of a merged program, indexed by module, with the C name each one is emitted under.
 */
class FunctionTable
{
	/**
	 * A callable and where it lives.
	 *
	 * @param declaration The first declaration seen for this name in its module (a definition replaces a forward one).
	 * @param segment     The module the callable belongs to.
	 * @param cName       The name calls are emitted with.
	 * @param helper      The runtime helper backing a built-in function, or null.
	 */
	record Entry(CallableDeclaration declaration, ModuleSegment segment, String cName, RuntimeHelper helper)
	{
	}

	private final Map<ModuleSegment, Map<String, Entry>> byModule = new IdentityHashMap<>();
	private final Map<String, List<ModuleSegment>> modulesByKey = new LinkedHashMap<>();
	private final List<ModuleSegment> modules = new ArrayList<>();
	private final ModuleSegment mainModule;
	private final String helperPrefix;

	FunctionTable(List<ModuleSegment> segments, String helperPrefix)
	{
		this.helperPrefix = helperPrefix;
		ModuleSegment main = null;
		for (ModuleSegment segment : segments)
		{
			index(segment);
			if (segment.main())
			{
				main = segment;
			}
		}
		this.mainModule = main;

		// Built-in functions resolve even when std.io was never imported
		if (segments.stream().noneMatch(s -> s.builtin() && s.moduleName().equals(BuiltinModules.STD_IO)))
		{
			Program stdIo = BuiltinModules.load(BuiltinModules.STD_IO);
			index(new ModuleSegment(BuiltinModules.STD_IO, "std", null, true, false, stdIo.getStatements()));
		}
	}

	private void index(ModuleSegment segment)
	{
		modules.add(segment);
		Map<String, Entry> functions = new LinkedHashMap<>();
		for (Statement statement : segment.statements())
		{
			if (statement instanceof CallableDeclaration)
			{
				CallableDeclaration declaration = (CallableDeclaration) statement;
				Entry existing = functions.get(declaration.getName());
				boolean isDefinition = declaration instanceof FunctionDeclaration && ((FunctionDeclaration) declaration).hasBody();
				if (existing == null || isDefinition)
				{
					functions.put(declaration.getName(), entryFor(declaration, segment));
				}
			}
		}
		byModule.put(segment, functions);

		for (String key : keysOf(segment))
		{
			modulesByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(segment);
		}
	}

	private Entry entryFor(CallableDeclaration declaration, ModuleSegment segment)
	{
		String name = declaration.getName();
		if (segment.builtin())
		{
			RuntimeHelper helper = RuntimeHelper.forBuiltinFunction(name).orElse(null);
			return new Entry(declaration, segment, helper != null ? helper.cName(helperPrefix) : name, helper);
		}
		if (declaration instanceof ExternDeclaration || name.equals("main") || !segment.isQualified())
		{
			return new Entry(declaration, segment, name, null);
		}
		return new Entry(declaration, segment, segment.qualifier() + "_" + name, null);
	}

	/**
	 * Names a module can be referred to by in a qualified call.
	 */
	private static List<String> keysOf(ModuleSegment segment)
	{
		List<String> keys = new ArrayList<>();
		String moduleName = segment.moduleName().replace('/', '.');
		keys.add(moduleName);
		if (segment.qualifier() != null)
		{
			keys.add(segment.qualifier());
		}
		int lastDot = moduleName.lastIndexOf('.');
		if (lastDot >= 0)
		{
			keys.add(moduleName.substring(0, lastDot));
			keys.add(moduleName.substring(lastDot + 1));
		}
		return keys.stream().distinct().collect(Collectors.toList());
	}

	/**
	 * Resolves a qualified callee such as {@code math.add}, {@code math::add} or {@code util.math.add}.
	 *
	 * @param qualifier The module part in dotted form.
	 */
	Optional<Entry> resolveQualified(String qualifier, String name)
	{
		List<String> candidates = new ArrayList<>();
		candidates.add(qualifier);
		int lastDot = qualifier.lastIndexOf('.');
		if (lastDot >= 0)
		{
			candidates.add(qualifier.substring(lastDot + 1));
		}

		for (String key : candidates)
		{
			for (ModuleSegment segment : modulesByKey.getOrDefault(key, List.of()))
			{
				Entry entry = byModule.get(segment).get(name);
				if (entry != null)
				{
					return Optional.of(entry);
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Resolves an unqualified callee: the current module, then the main module, then a definition unique
	 * among user modules, then the built-ins.
	 */
	Optional<Entry> resolveBare(String name, ModuleSegment current)
	{
		if (current != null && byModule.containsKey(current))
		{
			Entry local = byModule.get(current).get(name);
			if (local != null)
			{
				return Optional.of(local);
			}
		}
		if (mainModule != null)
		{
			Entry inMain = byModule.get(mainModule).get(name);
			if (inMain != null)
			{
				return Optional.of(inMain);
			}
		}

		List<Entry> elsewhere = modules.stream()
				.filter(m -> !m.builtin())
				.map(m -> byModule.get(m).get(name))
				.filter(e -> e != null)
				.collect(Collectors.toList());
		if (elsewhere.size() == 1)
		{
			return Optional.of(elsewhere.get(0));
		}

		return modules.stream()
				.filter(ModuleSegment::builtin)
				.map(m -> byModule.get(m).get(name))
				.filter(e -> e != null)
				.findFirst();
	}

	/**
	 * The C name a declaration is emitted under, whether or not it is the entry kept for its name.
	 */
	String cNameOf(CallableDeclaration declaration, ModuleSegment segment)
	{
		return entryFor(declaration, segment).cName();
	}
}
