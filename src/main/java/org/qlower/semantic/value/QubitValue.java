package org.qlower.semantic.value;

/**
 * A reference to one qubit of the circuit, by its allocated index.
 */
public final class QubitValue extends Value
{
	private final int index;

	public QubitValue(int index)
	{
		if (index < 0)
		{
			throw new IllegalArgumentException("Qubit index must be non-negative: " + index);
		}
		this.index = index;
	}

	public int getIndex()
	{
		return index;
	}

	@Override
	public ValueKind getKind()
	{
		return ValueKind.QUBIT;
	}

	@Override
	public String describe()
	{
		return "qubit #" + index;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		return o instanceof QubitValue other && other.index == index;
	}

	@Override
	public int hashCode()
	{
		return 31 * ValueKind.QUBIT.hashCode() + index;
	}
}
