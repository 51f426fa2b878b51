package org.qlower.semantic.value;

public final class FloatValue extends Value
{
	private final double value;

	public FloatValue(double value)
	{
		this.value = value;
	}

	public double getValue()
	{
		return value;
	}

	@Override
	public ValueKind getKind()
	{
		return ValueKind.FLOAT;
	}

	@Override
	public boolean isNumeric()
	{
		return true;
	}

	@Override
	public String describe()
	{
		return "float " + value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		// Bitwise comparison keeps equals consistent with hashCode for NaN and -0.0
		return o instanceof FloatValue other && Double.compare(other.value, value) == 0;
	}

	@Override
	public int hashCode()
	{
		return Double.hashCode(value);
	}
}
