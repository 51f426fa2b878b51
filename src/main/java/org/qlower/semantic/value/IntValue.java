package org.qlower.semantic.value;

public final class IntValue extends Value
{
	private final long value;

	public IntValue(long value)
	{
		this.value = value;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public ValueKind getKind()
	{
		return ValueKind.INT;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public String describe()
	{
		return "int " + value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		return o instanceof IntValue other && other.value == value;
	}

	@Override
	public int hashCode()
	{
		return Long.hashCode(value);
	}
}
