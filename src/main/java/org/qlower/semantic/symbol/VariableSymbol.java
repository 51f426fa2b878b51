package org.qlower.semantic.symbol;

import org.qlower.semantic.value.Value;

/**
 * A name bound in the {@link Scope}: a register, a constant, or one of the built-in constants.
 */
public class VariableSymbol implements Symbol
{
	public enum Origin
	{
		BUILTIN,
		QUBIT_REGISTER,
		BIT_REGISTER,
		CONSTANT
	}

	private final String name;
	private final Value value;
	private final Origin origin;

	public VariableSymbol(String name, Value value, Origin origin)
	{
		this.name = name;
		this.value = value;
		this.origin = origin;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public Value getValue()
	{
		return value;
	}

	public Origin getOrigin()
	{
		return origin;
	}

	public boolean isRegister()
	{
		return origin == Origin.QUBIT_REGISTER || origin == Origin.BIT_REGISTER;
	}

	@Override
	public String toString()
	{
		return name + " = " + value.describe() + " (" + origin.name().toLowerCase() + ")";
	}
}
