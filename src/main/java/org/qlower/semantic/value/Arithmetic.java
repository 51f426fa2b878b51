package org.qlower.semantic.value;

import org.qlower.semantic.ErrorKind;
import org.qlower.semantic.LoweringException;

import java.util.function.LongSupplier;

/**
 * Compile-time arithmetic over {@link Value}s. This is the one place the promotion rules live:
 * <ul>
 *     <li>int op int stays int, except an inexact division which yields a float;</li>
 *     <li>any other numeric pairing of {@code + - * /} yields a float;</li>
 *     <li>{@code %} is only defined for int % int and float % float;</li>
 *     <li>qubits, bits and arrays are never operands.</li>
 * </ul>
 * Integer results that overflow 64 bits and any division or modulo by zero fail with
 * {@link ErrorKind#ARITHMETIC_ERROR}. Modulo is floored: the result has the sign of the divisor.
 */
public final class Arithmetic
{
	private Arithmetic()
	{
	}

	public static Value negate(Value operand)
	{
		if (operand instanceof IntValue i)
		{
			return new IntValue(exact(() -> Math.negateExact(i.getValue()), "-", operand, null));
		}
		if (operand instanceof FloatValue f)
		{
			return new FloatValue(-f.getValue());
		}
		throw new LoweringException(ErrorKind.TYPE_MISMATCH, "Operator '-' cannot be applied to " + operand.describe());
	}

	public static Value add(Value lhs, Value rhs)
	{
		requireNumeric("+", lhs, rhs);
		if (lhs instanceof IntValue a && rhs instanceof IntValue b)
		{
			return new IntValue(exact(() -> Math.addExact(a.getValue(), b.getValue()), "+", lhs, rhs));
		}
		return new FloatValue(toDouble(lhs) + toDouble(rhs));
	}

	public static Value subtract(Value lhs, Value rhs)
	{
		requireNumeric("-", lhs, rhs);
		if (lhs instanceof IntValue a && rhs instanceof IntValue b)
		{
			return new IntValue(exact(() -> Math.subtractExact(a.getValue(), b.getValue()), "-", lhs, rhs));
		}
		return new FloatValue(toDouble(lhs) - toDouble(rhs));
	}

	public static Value multiply(Value lhs, Value rhs)
	{
		requireNumeric("*", lhs, rhs);
		if (lhs instanceof IntValue a && rhs instanceof IntValue b)
		{
			return new IntValue(exact(() -> Math.multiplyExact(a.getValue(), b.getValue()), "*", lhs, rhs));
		}
		return new FloatValue(toDouble(lhs) * toDouble(rhs));
	}

	public static Value divide(Value lhs, Value rhs)
	{
		requireNumeric("/", lhs, rhs);
		requireNonZero("Division", rhs);
		if (lhs instanceof IntValue a && rhs instanceof IntValue b)
		{
			long dividend = a.getValue();
			long divisor = b.getValue();
			if (dividend % divisor == 0)
			{
				// Long.MIN_VALUE / -1 is the only exact quotient that does not fit
				if (dividend == Long.MIN_VALUE && divisor == -1)
				{
					throw overflow("/", lhs, rhs);
				}
				return new IntValue(dividend / divisor);
			}
			return new FloatValue((double) dividend / (double) divisor);
		}
		return new FloatValue(toDouble(lhs) / toDouble(rhs));
	}

	public static Value modulo(Value lhs, Value rhs)
	{
		requireNumeric("%", lhs, rhs);
		if (lhs instanceof IntValue a && rhs instanceof IntValue b)
		{
			requireNonZero("Modulo", rhs);
			return new IntValue(Math.floorMod(a.getValue(), b.getValue()));
		}
		if (lhs instanceof FloatValue a && rhs instanceof FloatValue b)
		{
			requireNonZero("Modulo", rhs);
			double divisor = b.getValue();
			double remainder = a.getValue() % divisor;
			if (remainder != 0 && (remainder < 0) != (divisor < 0))
			{
				remainder += divisor;
			}
			return new FloatValue(remainder);
		}
		throw new LoweringException(ErrorKind.TYPE_MISMATCH,
				"Operator '%' requires operands of the same kind, got " + lhs.describe() + " and " + rhs.describe());
	}

	/**
	 * Converts a numeric value to a double, as needed for gate angles.
	 */
	public static double toDouble(Value value)
	{
		if (value instanceof IntValue i)
		{
			return i.getValue();
		}
		if (value instanceof FloatValue f)
		{
			return f.getValue();
		}
		throw new LoweringException(ErrorKind.TYPE_MISMATCH, "Not a floating-point value: " + value.describe());
	}

	/**
	 * Extracts an integer, as needed for indices and register sizes. Floats are rejected even when integral.
	 */
	public static long toInteger(Value value)
	{
		if (value instanceof IntValue i)
		{
			return i.getValue();
		}
		throw new LoweringException(ErrorKind.TYPE_MISMATCH, "Not an integer value: " + value.describe());
	}

	private static void requireNumeric(String op, Value lhs, Value rhs)
	{
		if (!lhs.isNumeric() || !rhs.isNumeric())
		{
			throw new LoweringException(ErrorKind.TYPE_MISMATCH,
					"Operator '" + op + "' cannot be applied to " + lhs.describe() + " and " + rhs.describe());
		}
	}

	private static void requireNonZero(String operation, Value divisor)
	{
		boolean zero = divisor instanceof IntValue i ? i.getValue() == 0 : ((FloatValue) divisor).getValue() == 0.0;
		if (zero)
		{
			throw new LoweringException(ErrorKind.ARITHMETIC_ERROR, operation + " by zero");
		}
	}

	private static long exact(LongSupplier computation, String op, Value lhs, Value rhs)
	{
		try
		{
			return computation.getAsLong();
		}
		catch (ArithmeticException e)
		{
			throw overflow(op, lhs, rhs);
		}
	}

	private static LoweringException overflow(String op, Value lhs, Value rhs)
	{
		String operands = rhs == null ? lhs.describe() : lhs.describe() + " and " + rhs.describe();
		return new LoweringException(ErrorKind.ARITHMETIC_ERROR, "Integer overflow in '" + op + "' applied to " + operands);
	}
}
