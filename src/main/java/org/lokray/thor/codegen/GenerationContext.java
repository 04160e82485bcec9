package org.lokray.thor.codegen;

import org.lokray.thor.ast.ModuleSegment;
import org.lokray.thor.ast.Parameter;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.ErrorKind;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one {@link CGenerator#generate} call.
 */
class GenerationContext
{
	private final CompilerConfig config;
	private final FunctionTable functions;
	private final TypeScope scope = new TypeScope();
	private final Set<RuntimeHelper> usedHelpers = EnumSet.noneOf(RuntimeHelper.class);
	private final CodeBuffer body;

	private ModuleSegment currentSegment;
	private FunctionDeclaration currentFunction;
	private final Map<String, Type> referenceParameters = new HashMap<>();
	private boolean inModuleInit;
	private boolean inVoidMain;

	GenerationContext(CompilerConfig config, FunctionTable functions)
	{
		this.config = config;
		this.functions = functions;
		this.body = new CodeBuffer(config.getIndentWidth());
	}

	FunctionTable getFunctions()
	{
		return functions;
	}

	TypeScope getScope()
	{
		return scope;
	}

	CodeBuffer getBody()
	{
		return body;
	}

	/**
	 * Records that the output needs a helper and returns its C name.
	 */
	String useHelper(RuntimeHelper helper)
	{
		usedHelpers.add(helper);
		return helper.cName(config.getHelperPrefix());
	}

	Set<RuntimeHelper> getUsedHelpers()
	{
		return usedHelpers;
	}

	ModuleSegment getCurrentSegment()
	{
		return currentSegment;
	}

	void setCurrentSegment(ModuleSegment currentSegment)
	{
		this.currentSegment = currentSegment;
	}

	FunctionDeclaration getCurrentFunction()
	{
		return currentFunction;
	}

	void enterFunction(FunctionDeclaration function, boolean voidMain)
	{
		this.currentFunction = function;
		this.inVoidMain = voidMain;
		referenceParameters.clear();
		for (Parameter parameter : function.getParameters())
		{
			if (parameter.isReference())
			{
				referenceParameters.put(parameter.getName(), parameter.getType());
			}
		}
	}

	void exitFunction()
	{
		this.currentFunction = null;
		this.inVoidMain = false;
		referenceParameters.clear();
	}

	/**
	 * True if the name refers to a {@code ref} parameter of the current function, i.e. it is not shadowed
	 * by a local declared in an inner scope.
	 */
	boolean isReferenceParameter(String name)
	{
		return referenceParameters.containsKey(name) && scope.lookup(name).isReference();
	}

	boolean isInModuleInit()
	{
		return inModuleInit;
	}

	void setInModuleInit(boolean inModuleInit)
	{
		this.inModuleInit = inModuleInit;
	}

	boolean isInVoidMain()
	{
		return inVoidMain;
	}

	/**
	 * Builds the fatal exception for a generation error in the current module.
	 */
	CompilationException error(ErrorKind kind, int line, String message)
	{
		String source = currentSegment != null ? currentSegment.describeSource() : null;
		return new CompilationException(kind, source, line, message);
	}
}
