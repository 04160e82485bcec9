package org.lokray.thor.codegen;

import java.util.Arrays;
import java.util.Optional;

/**
 * The C functions the generator may emit ahead of user code. Only the helpers a program actually
 * references end up in the output.
 */
public enum RuntimeHelper
{
	PRINTLN("println", "println")
			{
				@Override
				void emit(CodeBuffer out, String name, int bufferSize)
				{
					out.appendLine("void " + name + "(const char* message) {");
					out.indent();
					out.appendLine("printf(\"%s\\n\", message);");
					out.dedent();
					out.appendLine("}");
				}
			},
	PRINT("print", "print")
			{
				@Override
				void emit(CodeBuffer out, String name, int bufferSize)
				{
					out.appendLine("void " + name + "(const char* message) {");
					out.indent();
					out.appendLine("printf(\"%s\", message);");
					out.appendLine("fflush(stdout);");
					out.dedent();
					out.appendLine("}");
				}
			},
	STRING_EQUALS("string_equals", null)
			{
				@Override
				void emit(CodeBuffer out, String name, int bufferSize)
				{
					out.appendLine("bool " + name + "(const char* a, const char* b) {");
					out.indent();
					out.appendLine("return strcmp(a, b) == 0;");
					out.dedent();
					out.appendLine("}");
				}
			},
	INPUT("input", "input")
			{
				@Override
				void emit(CodeBuffer out, String name, int bufferSize)
				{
					out.appendLine("char* " + name + "(const char* prompt) {");
					out.indent();
					out.appendLine("printf(\"%s\", prompt);");
					out.appendLine("fflush(stdout);");
					out.appendLine("char* buffer = malloc(" + bufferSize + ");");
					out.appendLine("if (buffer == NULL) {");
					out.indent();
					out.appendLine("return NULL;");
					out.dedent();
					out.appendLine("}");
					out.appendLine("if (fgets(buffer, " + bufferSize + ", stdin) == NULL) {");
					out.indent();
					out.appendLine("buffer[0] = '\\0';");
					out.appendLine("return buffer;");
					out.dedent();
					out.appendLine("}");
					out.appendLine("size_t len = strlen(buffer);");
					out.appendLine("if (len > 0 && buffer[len - 1] == '\\n') {");
					out.indent();
					out.appendLine("buffer[len - 1] = '\\0';");
					out.dedent();
					out.appendLine("}");
					out.appendLine("return buffer;");
					out.dedent();
					out.appendLine("}");
				}
			},
	FORMAT("format", null)
			{
				@Override
				void emit(CodeBuffer out, String name, int bufferSize)
				{
					out.appendLine("char* " + name + "(const char* format, ...) {");
					out.indent();
					out.appendLine("char* buffer = malloc(" + bufferSize + ");");
					out.appendLine("if (buffer == NULL) {");
					out.indent();
					out.appendLine("return NULL;");
					out.dedent();
					out.appendLine("}");
					out.appendLine("va_list args;");
					out.appendLine("va_start(args, format);");
					out.appendLine("vsnprintf(buffer, " + bufferSize + ", format, args);");
					out.appendLine("va_end(args);");
					out.appendLine("return buffer;");
					out.dedent();
					out.appendLine("}");
				}
			};

	private final String suffix;
	private final String builtinFunction; // The std.io function this helper implements, if any

	RuntimeHelper(String suffix, String builtinFunction)
	{
		this.suffix = suffix;
		this.builtinFunction = builtinFunction;
	}

	/**
	 * @param prefix The configured helper prefix, e.g. {@code thor_}.
	 * @return The C name of this helper.
	 */
	public String cName(String prefix)
	{
		return prefix + suffix;
	}

	/**
	 * Finds the helper backing a built-in module function.
	 */
	public static Optional<RuntimeHelper> forBuiltinFunction(String functionName)
	{
		return Arrays.stream(values())
				.filter(h -> functionName.equals(h.builtinFunction))
				.findFirst();
	}

	abstract void emit(CodeBuffer out, String name, int bufferSize);
}
