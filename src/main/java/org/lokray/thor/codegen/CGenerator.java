// File: src/main/java/org/lokray/thor/codegen/CGenerator.java

package org.lokray.thor.codegen;

import org.lokray.thor.ast.ASTVisitor;
import org.lokray.thor.ast.ModuleSegment;
import org.lokray.thor.ast.Parameter;
import org.lokray.thor.ast.Program;
import org.lokray.thor.ast.declarations.CallableDeclaration;
import org.lokray.thor.ast.declarations.ExternDeclaration;
import org.lokray.thor.ast.declarations.FunctionDeclaration;
import org.lokray.thor.ast.declarations.ImportDirective;
import org.lokray.thor.ast.declarations.PackageDeclaration;
import org.lokray.thor.ast.expressions.*;
import org.lokray.thor.ast.statements.*;
import org.lokray.thor.lexer.TokenType;
import org.lokray.thor.semantics.ArrayType;
import org.lokray.thor.semantics.PrimitiveType;
import org.lokray.thor.semantics.ReferenceType;
import org.lokray.thor.semantics.Type;
import org.lokray.thor.util.CompilationException;
import org.lokray.thor.util.CompilerConfig;
import org.lokray.thor.util.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * CGenerator traverses a merged {@link Program} and produces C source code.
 * <p>
 * The output is laid out as: includes, the runtime helpers the program uses, prototypes for every
 * function, globals, the module initializer, and finally the function bodies. The body is generated
 * first so the set of helpers is known before the helpers are written.
 * <p>
 * An instance may be reused, but not from several threads at once.
 */
public class CGenerator implements ASTVisitor<String>
{
	private static final Logger logger = LoggerFactory.getLogger(CGenerator.class);

	private static final List<String> INCLUDES = List.of("stdio.h", "stdlib.h", "string.h", "stdbool.h", "stdarg.h");

	private final CompilerConfig config;

	// Per-call state, only set while generate() runs
	private GenerationContext context;
	private CallResolver calls;
	private ExpressionTyper typer;

	/**
	 * A top-level statement that runs in the module initializer.
	 *
	 * @param globalInitializer True if the statement is a global declaration whose value is assigned at start-up.
	 */
	private record InitItem(ModuleSegment segment, Statement statement, boolean globalInitializer)
	{
	}

	public CGenerator(CompilerConfig config)
	{
		this.config = config;
	}

	public CGenerator()
	{
		this(new CompilerConfig());
	}

	/**
	 * Generates C for a program.
	 *
	 * @param program A merged program, or a single parsed file without imports.
	 * @return The translation unit.
	 * @throws CompilationException On unknown types, format arity mismatches, or directives that should
	 *                              have been removed by import resolution.
	 */
	public CTranslationUnit generate(Program program)
	{
		List<ModuleSegment> segments = program.isMerged()
				? program.getSegments()
				: List.of(new ModuleSegment("main", null, null, false, true, program.getStatements()));

		context = new GenerationContext(config, new FunctionTable(segments, config.getHelperPrefix()));
		calls = new CallResolver(context);
		typer = new ExpressionTyper(context, calls);
		try
		{
			if (!program.getImports().isEmpty())
			{
				program.getImports().get(0).accept(this);
			}
			return emitTranslationUnit(segments);
		}
		finally
		{
			context = null;
			calls = null;
			typer = null;
		}
	}

	private CTranslationUnit emitTranslationUnit(List<ModuleSegment> segments)
	{
		CodeBuffer body = context.getBody();
		List<ModuleSegment> userSegments = segments.stream().filter(s -> !s.builtin()).collect(Collectors.toList());

		// Prototypes
		List<String> functionNames = new ArrayList<>();
		Set<String> declared = new HashSet<>();
		FunctionDeclaration userMain = null;
		for (ModuleSegment segment : userSegments)
		{
			context.setCurrentSegment(segment);
			for (Statement statement : segment.statements())
			{
				if (statement instanceof ImportDirective || statement instanceof PackageDeclaration)
				{
					statement.accept(this);
				}
				if (!(statement instanceof CallableDeclaration))
				{
					continue;
				}
				CallableDeclaration callable = (CallableDeclaration) statement;
				if (isMain(callable))
				{
					if (userMain == null && ((FunctionDeclaration) callable).hasBody())
					{
						userMain = (FunctionDeclaration) callable;
					}
					continue;
				}
				// One prototype per C name; a later declaration may spell its parameters differently
				String cName = context.getFunctions().cNameOf(callable, segment);
				if (declared.add(cName))
				{
					body.appendLine(prototypeOf(callable, segment) + ";");
					functionNames.add(cName);
				}
			}
		}
		if (!declared.isEmpty())
		{
			body.appendLine();
		}

		// Globals
		List<InitItem> initItems = new ArrayList<>();
		boolean anyGlobal = false;
		for (ModuleSegment segment : userSegments)
		{
			context.setCurrentSegment(segment);
			for (Statement statement : segment.statements())
			{
				if (statement instanceof VariableDeclarationStatement || statement instanceof ConstDeclarationStatement)
				{
					if (!emitGlobal(statement))
					{
						initItems.add(new InitItem(segment, statement, true));
					}
					anyGlobal = true;
				}
				else if (!(statement instanceof CallableDeclaration))
				{
					initItems.add(new InitItem(segment, statement, false));
				}
			}
		}
		if (anyGlobal)
		{
			body.appendLine();
		}

		// Module initializer
		String initName = config.getHelperPrefix() + "module_init";
		boolean hasInit = !initItems.isEmpty();
		if (hasInit)
		{
			emitModuleInit(initName, initItems);
		}

		// Function bodies
		for (ModuleSegment segment : userSegments)
		{
			context.setCurrentSegment(segment);
			for (Statement statement : segment.statements())
			{
				if (statement instanceof FunctionDeclaration && ((FunctionDeclaration) statement).hasBody())
				{
					FunctionDeclaration function = (FunctionDeclaration) statement;
					if (isMain(function) && function != userMain)
					{
						throw context.error(ErrorKind.SYNTAX_ERROR, function.getLine(), "Function 'main' is defined more than once.");
					}
					emitFunction(function, segment, hasInit ? initName : null);
				}
			}
		}

		if (userMain == null)
		{
			body.appendLine("int main(void) {");
			body.indent();
			if (hasInit)
			{
				body.appendLine(initName + "();");
			}
			body.appendLine("return 0;");
			body.dedent();
			body.appendLine("}");
		}
		functionNames.add("main");

		CodeBuffer out = new CodeBuffer(config.getIndentWidth());
		for (String include : INCLUDES)
		{
			out.appendLine("#include <" + include + ">");
		}
		out.appendLine();
		for (RuntimeHelper helper : context.getUsedHelpers())
		{
			helper.emit(out, helper.cName(config.getHelperPrefix()), config.getBufferSize());
			out.appendLine();
		}
		out.append(body);

		logger.info("Generated C for {} module(s): {} function(s), helpers {}", userSegments.size(), functionNames.size(), context.getUsedHelpers());
		return new CTranslationUnit(out.toString(), context.getUsedHelpers(), functionNames, hasInit);
	}

	private static boolean isMain(CallableDeclaration callable)
	{
		return callable instanceof FunctionDeclaration && callable.getName().equals("main");
	}

	// --- Declarations ---

	private String prototypeOf(CallableDeclaration callable, ModuleSegment segment)
	{
		String cName = context.getFunctions().cNameOf(callable, segment);
		String prototype = lower(callable.getReturnType(), callable.getLine()) + " " + cName + "(" + parameterList(callable) + ")";
		return callable instanceof ExternDeclaration ? "extern " + prototype : prototype;
	}

	private String parameterList(CallableDeclaration callable)
	{
		if (callable.getParameters().isEmpty())
		{
			return "void";
		}
		return callable.getParameters().stream()
				.map(p -> lower(p.getType(), p.getNameToken().getLine()) + " " + p.getName())
				.collect(Collectors.joining(", "));
	}

	private void emitFunction(FunctionDeclaration function, ModuleSegment segment, String initName)
	{
		boolean isMain = isMain(function);
		boolean voidMain = isMain && function.getReturnType().isVoid();
		String signature = isMain
				? "int main(" + parameterList(function) + ")"
				: prototypeOf(function, segment);
		logger.debug("Emitting function {} from module {}", signature, segment.moduleName());

		CodeBuffer body = context.getBody();
		body.appendLine(signature + " {");
		body.indent();
		context.getScope().push();
		context.enterFunction(function, voidMain);
		try
		{
			for (Parameter parameter : function.getParameters())
			{
				context.getScope().declare(parameter.getName(), parameter.getType());
			}
			if (isMain && initName != null)
			{
				body.appendLine(initName + "();");
			}
			List<Statement> statements = function.getBody().getStatements();
			for (Statement statement : statements)
			{
				statement.accept(this);
			}
			if (voidMain && (statements.isEmpty() || !(statements.get(statements.size() - 1) instanceof ReturnStatement)))
			{
				body.appendLine("return 0;");
			}
		}
		finally
		{
			context.exitFunction();
			context.getScope().pop();
			body.dedent();
		}
		body.appendLine("}");
		body.appendLine();
	}

	/**
	 * Emits a global declaration.
	 *
	 * @return False if the initializer is not a constant and has to be assigned by the module initializer.
	 */
	private boolean emitGlobal(Statement statement)
	{
		boolean isConst = statement instanceof ConstDeclarationStatement;
		String name = isConst ? ((ConstDeclarationStatement) statement).getName() : ((VariableDeclarationStatement) statement).getName();
		Type type = isConst ? ((ConstDeclarationStatement) statement).getType() : ((VariableDeclarationStatement) statement).getType();
		Expression initializer = isConst ? ((ConstDeclarationStatement) statement).getInitializer() : ((VariableDeclarationStatement) statement).getInitializer();
		int line = statement.getLine();
		CodeBuffer body = context.getBody();

		context.getScope().declareGlobal(name, type);

		if (initializer == null)
		{
			body.appendLine(lower(type, line) + " " + name + ";");
			return true;
		}

		boolean constant = isConstantExpression(initializer);
		if (initializer instanceof ArrayInitializerExpression && type.isArray())
		{
			ArrayInitializerExpression array = (ArrayInitializerExpression) initializer;
			Type element = ((ArrayType) type).getElementType();
			if (array.getElements().isEmpty())
			{
				body.appendLine(declarator(type, name, isConst, line) + " = NULL;");
				return true;
			}
			// The variable itself stays a plain pointer; the elements live in a static backing array.
			String storage = config.getHelperPrefix() + name + "_data";
			if (constant)
			{
				body.appendLine("static " + lower(element, line) + " " + storage + "[] = {" + elementList(array, element) + "};");
			}
			else
			{
				body.appendLine("static " + lower(element, line) + " " + storage + "[" + array.getElements().size() + "];");
			}
			body.appendLine(declarator(type, name, isConst, line) + " = " + storage + ";");
			return constant;
		}

		if (constant)
		{
			body.appendLine(declarator(type, name, isConst, line) + " = " + stripOuterParens(expression(initializer, type)) + ";");
			return true;
		}
		body.appendLine(lower(type, line) + " " + name + ";");
		return false;
	}

	private void emitModuleInit(String initName, List<InitItem> initItems)
	{
		CodeBuffer body = context.getBody();
		body.appendLine("static void " + initName + "(void) {");
		body.indent();
		context.getScope().push();
		context.setInModuleInit(true);
		try
		{
			for (InitItem item : initItems)
			{
				context.setCurrentSegment(item.segment());
				if (item.globalInitializer())
				{
					emitGlobalAssignment(item.statement());
				}
				else
				{
					item.statement().accept(this);
				}
			}
		}
		finally
		{
			context.setInModuleInit(false);
			context.getScope().pop();
			body.dedent();
		}
		body.appendLine("}");
		body.appendLine();
	}

	private void emitGlobalAssignment(Statement statement)
	{
		boolean isConst = statement instanceof ConstDeclarationStatement;
		String name = isConst ? ((ConstDeclarationStatement) statement).getName() : ((VariableDeclarationStatement) statement).getName();
		Type type = isConst ? ((ConstDeclarationStatement) statement).getType() : ((VariableDeclarationStatement) statement).getType();
		Expression initializer = isConst ? ((ConstDeclarationStatement) statement).getInitializer() : ((VariableDeclarationStatement) statement).getInitializer();

		if (initializer instanceof ArrayInitializerExpression && type.isArray())
		{
			Type element = ((ArrayType) type).getElementType();
			List<Expression> elements = ((ArrayInitializerExpression) initializer).getElements();
			for (int i = 0; i < elements.size(); i++)
			{
				context.getBody().appendLine(name + "[" + i + "] = " + stripOuterParens(expression(elements.get(i), element)) + ";");
			}
			return;
		}
		context.getBody().appendLine(name + " = " + stripOuterParens(expression(initializer, type)) + ";");
	}

	/**
	 * Whether C accepts the expression as a static initializer.
	 */
	private static boolean isConstantExpression(Expression expression)
	{
		if (expression instanceof LiteralExpression)
		{
			return true;
		}
		if (expression instanceof UnaryExpression)
		{
			return isConstantExpression(((UnaryExpression) expression).getRight());
		}
		if (expression instanceof BinaryExpression)
		{
			BinaryExpression binary = (BinaryExpression) expression;
			return !binary.isAssignment()
					&& !binary.getLeft().getType().isString() && !binary.getRight().getType().isString()
					&& isConstantExpression(binary.getLeft()) && isConstantExpression(binary.getRight());
		}
		if (expression instanceof ArrayInitializerExpression)
		{
			return ((ArrayInitializerExpression) expression).getElements().stream().allMatch(CGenerator::isConstantExpression);
		}
		return false;
	}

	@Override
	public String visitProgram(Program program)
	{
		if (context != null)
		{
			throw context.error(ErrorKind.INTERNAL_INVARIANT_VIOLATION, 0, "A program cannot be nested inside another program.");
		}
		return generate(program).getSource();
	}

	@Override
	public String visitPackageDeclaration(PackageDeclaration declaration)
	{
		throw context.error(ErrorKind.INTERNAL_INVARIANT_VIOLATION, declaration.getLine(),
				"Package declaration '" + declaration.getName() + "' reached code generation; import resolution must remove it.");
	}

	@Override
	public String visitImportDirective(ImportDirective directive)
	{
		throw context.error(ErrorKind.INTERNAL_INVARIANT_VIOLATION, directive.getLine(),
				"Import of '" + directive.getModuleName() + "' reached code generation; import resolution must remove it.");
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		throw context.error(ErrorKind.INTERNAL_INVARIANT_VIOLATION, declaration.getLine(),
				"Function '" + declaration.getName() + "' is not at top level.");
	}

	@Override
	public String visitExternDeclaration(ExternDeclaration declaration)
	{
		throw context.error(ErrorKind.INTERNAL_INVARIANT_VIOLATION, declaration.getLine(),
				"Extern '" + declaration.getName() + "' is not at top level.");
	}

	// --- Statements ---

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		Expression expression = statement.getExpression();
		String code;
		if (expression instanceof BinaryExpression && ((BinaryExpression) expression).isAssignment())
		{
			code = assignment((BinaryExpression) expression, false);
		}
		else
		{
			code = stripOuterParens(expression.accept(this));
		}
		context.getBody().appendLine(code + ";");
		return "";
	}

	@Override
	public String visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		emitLocal(statement.getName(), statement.getType(), statement.getInitializer(), false, statement.getLine());
		return "";
	}

	@Override
	public String visitConstDeclarationStatement(ConstDeclarationStatement statement)
	{
		emitLocal(statement.getName(), statement.getType(), statement.getInitializer(), true, statement.getLine());
		return "";
	}

	private void emitLocal(String name, Type type, Expression initializer, boolean isConst, int line)
	{
		CodeBuffer body = context.getBody();
		if (initializer != null)
		{
			body.appendLine(declarator(type, name, isConst, line) + " = " + stripOuterParens(expression(initializer, type)) + ";");
		}
		else
		{
			body.appendLine(lower(type, line) + " " + name + ";");
		}
		context.getScope().declare(name, type);
	}

	/**
	 * Arrays are always {@code T*} variables, so a constant array makes the pointer const, not the elements.
	 */
	private String declarator(Type type, String name, boolean isConst, int line)
	{
		if (!isConst)
		{
			return lower(type, line) + " " + name;
		}
		return type.isArray() ? lower(type, line) + " const " + name : "const " + lower(type, line) + " " + name;
	}

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		CodeBuffer body = context.getBody();
		body.appendLine("{");
		emitScoped(statement);
		body.appendLine("}");
		return "";
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		CodeBuffer body = context.getBody();
		body.appendLine("if (" + condition(statement.getCondition()) + ") {");
		emitScoped(statement.getThenBranch());

		Statement elseBranch = statement.getElseBranch();
		while (elseBranch instanceof IfStatement)
		{
			IfStatement elseIf = (IfStatement) elseBranch;
			body.appendLine("} else if (" + condition(elseIf.getCondition()) + ") {");
			emitScoped(elseIf.getThenBranch());
			elseBranch = elseIf.getElseBranch();
		}
		if (elseBranch != null)
		{
			body.appendLine("} else {");
			emitScoped(elseBranch);
		}
		body.appendLine("}");
		return "";
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		context.getBody().appendLine("while (" + condition(statement.getCondition()) + ") {");
		emitScoped(statement.getBody());
		context.getBody().appendLine("}");
		return "";
	}

	/**
	 * Emits the inside of a brace region: a block's statements, or a single statement.
	 */
	private void emitScoped(Statement statement)
	{
		CodeBuffer body = context.getBody();
		body.indent();
		context.getScope().push();
		try
		{
			if (statement instanceof BlockStatement)
			{
				for (Statement inner : ((BlockStatement) statement).getStatements())
				{
					inner.accept(this);
				}
			}
			else
			{
				statement.accept(this);
			}
		}
		finally
		{
			context.getScope().pop();
			body.dedent();
		}
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		CodeBuffer body = context.getBody();
		Expression value = statement.getValue();
		if (context.isInModuleInit())
		{
			if (value != null)
			{
				body.appendLine("(void)(" + stripOuterParens(value.accept(this)) + ");");
			}
			body.appendLine("return;");
		}
		else if (context.isInVoidMain())
		{
			body.appendLine("return 0;");
		}
		else if (value == null)
		{
			body.appendLine("return;");
		}
		else
		{
			Type returnType = context.getCurrentFunction() != null ? context.getCurrentFunction().getReturnType() : null;
			body.appendLine("return " + stripOuterParens(expression(value, returnType)) + ";");
		}
		return "";
	}

	// --- Expressions ---

	/**
	 * Generates an expression, giving array literals the element type the surrounding code expects.
	 */
	private String expression(Expression expression, Type expected)
	{
		if (expression instanceof ArrayInitializerExpression)
		{
			return compoundLiteral((ArrayInitializerExpression) expression, expected);
		}
		return expression.accept(this);
	}

	private String condition(Expression expression)
	{
		return stripOuterParens(expression.accept(this));
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		Object value = expression.getValue();
		if (value instanceof String)
		{
			return "\"" + escapeCString((String) value) + "\"";
		}
		if (value instanceof Boolean)
		{
			return (Boolean) value ? "true" : "false";
		}
		return expression.getLiteralToken().getLexeme();
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		if (expression.isQualified())
		{
			return calls.resolve(expression)
					.map(FunctionTable.Entry::cName)
					.orElseGet(() -> calls.fallbackName(expression));
		}
		String name = expression.getName();
		return context.isReferenceParameter(name) ? "(*" + name + ")" : name;
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		return "(" + expression.getOperator().getLexeme() + expression.getRight().accept(this) + ")";
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		if (expression.isAssignment())
		{
			return assignment(expression, true);
		}

		TokenType operator = expression.getOperator().getType();
		String left = expression.getLeft().accept(this);
		String right = expression.getRight().accept(this);

		if ((operator == TokenType.EQUAL_EQUAL || operator == TokenType.BANG_EQUAL)
				&& (typer.typeOf(expression.getLeft()).isString() || typer.typeOf(expression.getRight()).isString()))
		{
			String call = context.useHelper(RuntimeHelper.STRING_EQUALS) + "(" + stripOuterParens(left) + ", " + stripOuterParens(right) + ")";
			return operator == TokenType.EQUAL_EQUAL ? call : "(!" + call + ")";
		}

		return "(" + left + " " + expression.getOperator().getLexeme() + " " + right + ")";
	}

	private String assignment(BinaryExpression expression, boolean nested)
	{
		String target = expression.getLeft().accept(this);
		String value = stripOuterParens(expression(expression.getRight(), typer.typeOf(expression.getLeft())));
		String code = target + " = " + value;
		return nested ? "(" + code + ")" : code;
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		Expression callee = expression.getCallee();
		Optional<FunctionTable.Entry> entry = calls.resolve(callee);

		String name;
		List<Type> parameterTypes;
		if (entry.isPresent())
		{
			FunctionTable.Entry target = entry.get();
			if (target.helper() != null)
			{
				context.useHelper(target.helper());
			}
			name = target.cName();
			parameterTypes = target.declaration().getFunctionType().getParameterTypes();
		}
		else
		{
			String fallback = calls.fallbackName(callee);
			name = fallback != null ? fallback : callee.accept(this);
			parameterTypes = List.of();
		}

		List<String> arguments = new ArrayList<>();
		List<Expression> args = expression.getArguments();
		for (int i = 0; i < args.size(); i++)
		{
			Type parameterType = i < parameterTypes.size() ? parameterTypes.get(i) : null;
			if (parameterType != null && parameterType.isReference())
			{
				arguments.add(referenceArgument(args.get(i), (ReferenceType) parameterType));
			}
			else
			{
				arguments.add(stripOuterParens(expression(args.get(i), parameterType)));
			}
		}
		return name + "(" + String.join(", ", arguments) + ")";
	}

	/**
	 * A plain variable is passed by address; a variable that already is a reference parameter is passed on
	 * unchanged; anything else is materialized in a compound literal.
	 */
	private String referenceArgument(Expression argument, ReferenceType parameterType)
	{
		if (argument instanceof IdentifierExpression && !((IdentifierExpression) argument).isQualified())
		{
			String name = ((IdentifierExpression) argument).getName();
			return context.isReferenceParameter(name) ? name : "&" + name;
		}
		Type referent = parameterType.getReferent();
		String value = stripOuterParens(expression(argument, referent));
		return "&(" + lower(referent, argument.getFirstToken().getLine()) + "){" + value + "}";
	}

	@Override
	public String visitDotExpression(DotExpression expression)
	{
		Optional<FunctionTable.Entry> entry = calls.resolve(expression);
		if (entry.isPresent())
		{
			return entry.get().cName();
		}
		String fallback = calls.fallbackName(expression);
		return fallback != null ? fallback : expression.getObject().accept(this) + "_" + expression.getMemberName().getLexeme();
	}

	@Override
	public String visitArrayInitializerExpression(ArrayInitializerExpression expression)
	{
		return compoundLiteral(expression, null);
	}

	private String compoundLiteral(ArrayInitializerExpression array, Type expected)
	{
		Type element = null;
		if (expected != null && expected.dereference().isArray())
		{
			element = ((ArrayType) expected.dereference()).getElementType();
		}
		if (element == null)
		{
			Type inferred = typer.typeOf(array);
			if (inferred.isArray())
			{
				element = ((ArrayType) inferred).getElementType();
			}
		}
		int line = array.getFirstToken().getLine();
		if (element == null)
		{
			throw context.error(ErrorKind.UNKNOWN_TYPE, line, "Cannot determine the element type of this array literal.");
		}
		if (array.getElements().isEmpty())
		{
			return "NULL";
		}
		return "(" + lower(element, line) + "[]){" + elementList(array, element) + "}";
	}

	private String elementList(ArrayInitializerExpression array, Type element)
	{
		return array.getElements().stream()
				.map(e -> stripOuterParens(expression(e, element)))
				.collect(Collectors.joining(", "));
	}

	/**
	 * Lowers {@code "..." % [args]} to a call of the format helper, choosing a conversion per argument.
	 */
	@Override
	public String visitFormatStringExpression(FormatStringExpression expression)
	{
		String template = expression.getTemplate();
		List<Expression> args = expression.getArguments();
		int line = expression.getFirstToken().getLine();

		StringBuilder format = new StringBuilder();
		List<String> arguments = new ArrayList<>();
		int placeholder = 0;
		for (int i = 0; i < template.length(); i++)
		{
			char c = template.charAt(i);
			if (c != '%')
			{
				format.append(escapeCString(String.valueOf(c)));
				continue;
			}
			char next = i + 1 < template.length() ? template.charAt(i + 1) : '\0';
			if (next == 's')
			{
				i++;
				if (placeholder < args.size())
				{
					Expression argument = args.get(placeholder);
					Type type = typer.typeOf(argument);
					String value = stripOuterParens(argument.accept(this));
					if (type.isString())
					{
						format.append("%s");
						arguments.add(value);
					}
					else if (type.isBool())
					{
						format.append("%s");
						arguments.add("(" + value + " ? \"true\" : \"false\")");
					}
					else
					{
						format.append("%g");
						arguments.add("(double)(" + value + ")");
					}
				}
				placeholder++;
			}
			else if (next == '%')
			{
				i++;
				format.append("%%");
			}
			else
			{
				format.append("%%");
			}
		}

		if (placeholder != args.size())
		{
			throw context.error(ErrorKind.FORMAT_ARITY_MISMATCH, line,
					"Format string has " + placeholder + " placeholder(s) but " + args.size() + " argument(s) were given.");
		}

		StringBuilder call = new StringBuilder(context.useHelper(RuntimeHelper.FORMAT)).append("(\"").append(format).append('"');
		for (String argument : arguments)
		{
			call.append(", ").append(argument);
		}
		return call.append(')').toString();
	}

	// --- Helpers ---

	/**
	 * Maps a Thor type to its C spelling.
	 */
	private String lower(Type type, int line)
	{
		if (type == PrimitiveType.INT)
		{
			return "int";
		}
		if (type == PrimitiveType.FLOAT)
		{
			return "float";
		}
		if (type == PrimitiveType.STRING)
		{
			return "char*";
		}
		if (type == PrimitiveType.BOOL)
		{
			return "bool";
		}
		if (type == PrimitiveType.VOID)
		{
			return "void";
		}
		if (type instanceof ArrayType)
		{
			return lower(((ArrayType) type).getElementType(), line) + "*";
		}
		if (type instanceof ReferenceType)
		{
			return lower(((ReferenceType) type).getReferent(), line) + "*";
		}
		throw context.error(ErrorKind.UNKNOWN_TYPE, line, "Type '" + type.getName() + "' has no C representation.");
	}

	static String escapeCString(String raw)
	{
		StringBuilder escaped = new StringBuilder();
		for (char c : raw.toCharArray())
		{
			switch (c)
			{
				case '\\':
					escaped.append("\\\\");
					break;
				case '"':
					escaped.append("\\\"");
					break;
				case '\n':
					escaped.append("\\n");
					break;
				case '\t':
					escaped.append("\\t");
					break;
				case '\r':
					escaped.append("\\r");
					break;
				default:
					if (c < 0x20)
					{
						escaped.append(String.format("\\%03o", (int) c));
					}
					else
					{
						escaped.append(c);
					}
			}
		}
		return escaped.toString();
	}

	/**
	 * Removes one pair of parentheses that encloses the whole expression, e.g. {@code (a + b)} but not
	 * {@code (a) + (b)} or {@code (double)(x)}.
	 */
	static String stripOuterParens(String code)
	{
		if (code.length() < 2 || code.charAt(0) != '(' || code.charAt(code.length() - 1) != ')')
		{
			return code;
		}
		int depth = 0;
		boolean inString = false;
		for (int i = 0; i < code.length(); i++)
		{
			char c = code.charAt(i);
			if (inString)
			{
				if (c == '\\')
				{
					i++;
				}
				else if (c == '"')
				{
					inString = false;
				}
				continue;
			}
			if (c == '"')
			{
				inString = true;
			}
			else if (c == '(')
			{
				depth++;
			}
			else if (c == ')')
			{
				depth--;
				if (depth == 0 && i < code.length() - 1)
				{
					return code;
				}
			}
		}
		return code.substring(1, code.length() - 1);
	}
}
