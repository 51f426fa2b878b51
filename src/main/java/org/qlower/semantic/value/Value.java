package org.qlower.semantic.value;

/**
 * A compile-time value produced while lowering a circuit.
 * The set of kinds is closed: {@link IntValue}, {@link FloatValue}, {@link QubitValue},
 * {@link BitValue} and {@link ArrayValue}. Values are immutable, so reading one out of a
 * scope never aliases later re-declarations.
 */
public abstract class Value
{
	Value()
	{
	}

	public abstract ValueKind getKind();

	public boolean isNumeric()
	{
		return false;
	}

	/**
	 * A short human readable form used in diagnostics, e.g. {@code int 3} or {@code qubit[2]}.
	 */
	public abstract String describe();

	@Override
	public String toString()
	{
		return describe();
	}
}
