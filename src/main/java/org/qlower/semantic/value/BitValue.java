package org.qlower.semantic.value;

/**
 * A reference to one classical bit. Bits are allocated from the same counter as qubits,
 * so the index alone does not say which kind of register it came from.
 */
public final class BitValue extends Value
{
	private final int index;

	public BitValue(int index)
	{
		if (index < 0)
		{
			throw new IllegalArgumentException("Bit index must be non-negative: " + index);
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
		return ValueKind.BIT;
	}

	@Override
	public String describe()
	{
		return "bit #" + index;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		return o instanceof BitValue other && other.index == index;
	}

	@Override
	public int hashCode()
	{
		return 31 * ValueKind.BIT.hashCode() + index;
	}
}
