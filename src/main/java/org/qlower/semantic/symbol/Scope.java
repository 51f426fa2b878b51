package org.qlower.semantic.symbol;

import org.qlower.semantic.value.FloatValue;
import org.qlower.semantic.value.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single flat namespace of one lowering pass. Re-defining a name replaces the previous
 * binding; there is no shadowing and no enclosing scope.
 */
public class Scope
{
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	/**
	 * Creates a scope holding only the built-in constants {@code pi} and {@code π}.
	 */
	public static Scope withBuiltins()
	{
		Scope scope = new Scope();
		Value pi = new FloatValue(Math.PI);
		scope.define(new VariableSymbol("pi", pi, VariableSymbol.Origin.BUILTIN));
		scope.define(new VariableSymbol("π", pi, VariableSymbol.Origin.BUILTIN));
		return scope;
	}

	public void define(Symbol sym)
	{
		symbols.put(sym.getName(), sym);
	}

	public Optional<Symbol> resolve(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public Optional<Value> resolveValue(String name)
	{
		return resolve(name).map(Symbol::getValue);
	}

	public boolean isDefined(String name)
	{
		return symbols.containsKey(name);
	}

	public Map<String, Symbol> getSymbols()
	{
		return symbols;
	}
}
