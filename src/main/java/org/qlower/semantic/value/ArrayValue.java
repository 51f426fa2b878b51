package org.qlower.semantic.value;

import java.util.List;
import java.util.Objects;

/**
 * A fixed-length, immutable sequence of values. Registers are bound as arrays of
 * {@link QubitValue} or {@link BitValue}; nothing stops an element from being an array itself.
 */
public final class ArrayValue extends Value
{
	private final List<Value> elements;

	public ArrayValue(List<? extends Value> elements)
	{
		this.elements = List.copyOf(elements);
	}

	public int size()
	{
		return elements.size();
	}

	public Value get(int index)
	{
		return elements.get(index);
	}

	@Override
	public ValueKind getKind()
	{
		return ValueKind.ARRAY;
	}

	@Override
	public String describe()
	{
		if (elements.isEmpty())
		{
			return "array[0]";
		}
		// Registers are homogeneous, so the first element names the element kind
		return elements.get(0).getKind().getDisplayName() + "[" + elements.size() + "]";
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		return o instanceof ArrayValue other && elements.equals(other.elements);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(ValueKind.ARRAY, elements);
	}
}
