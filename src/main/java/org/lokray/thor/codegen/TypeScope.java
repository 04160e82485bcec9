package org.lokray.thor.codegen;

import org.lokray.thor.semantics.Type;
import org.lokray.thor.semantics.UnknownType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Declared types of the variables visible at the current point of generation.
 * The outermost scope holds globals; each function body and block pushes one more.
 */
class TypeScope
{
	private final Deque<Map<String, Type>> scopes = new ArrayDeque<>();

	TypeScope()
	{
		scopes.push(new HashMap<>());
	}

	void push()
	{
		scopes.push(new HashMap<>());
	}

	void pop()
	{
		if (scopes.size() == 1)
		{
			throw new IllegalStateException("Cannot pop the global scope.");
		}
		scopes.pop();
	}

	void declare(String name, Type type)
	{
		scopes.peek().put(name, type);
	}

	void declareGlobal(String name, Type type)
	{
		scopes.peekLast().put(name, type);
	}

	/**
	 * @return The innermost declaration of the name, or {@link UnknownType} if none is visible.
	 */
	Type lookup(String name)
	{
		Iterator<Map<String, Type>> it = scopes.iterator();
		while (it.hasNext())
		{
			Type type = it.next().get(name);
			if (type != null)
			{
				return type;
			}
		}
		return UnknownType.INSTANCE;
	}
}
