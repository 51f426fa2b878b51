package org.qlower.circuit;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One gate of the flat circuit IR. Subclasses fix the operand layout; equality is structural
 * over kind, qubit operands and angles.
 */
public abstract class Instruction
{
	private final InstructionKind kind;

	protected Instruction(InstructionKind kind)
	{
		this.kind = kind;
	}

	public InstructionKind getKind()
	{
		return kind;
	}

	public String getName()
	{
		return kind.getGateName();
	}

	/**
	 * All qubit operands, in the order the gate is written in source.
	 */
	public abstract List<Integer> getQubits();

	public List<Double> getAngles()
	{
		return List.of();
	}

	/**
	 * Renders the instruction as a QASM gate call on a register named {@code q},
	 * e.g. {@code crz(1.0471975511965976) q[0], q[1];}.
	 */
	public String render()
	{
		StringBuilder sb = new StringBuilder(getName());
		List<Double> angles = getAngles();
		if (!angles.isEmpty())
		{
			sb.append(angles.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")")));
		}
		sb.append(' ');
		sb.append(getQubits().stream().map(q -> "q[" + q + "]").collect(Collectors.joining(", ")));
		sb.append(';');
		return sb.toString();
	}

	protected static int requireQubit(int index)
	{
		if (index < 0)
		{
			throw new IllegalArgumentException("Qubit index must be non-negative: " + index);
		}
		return index;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Instruction other))
		{
			return false;
		}
		return kind == other.kind && getQubits().equals(other.getQubits()) && getAngles().equals(other.getAngles());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, getQubits(), getAngles());
	}

	@Override
	public String toString()
	{
		return render();
	}
}
