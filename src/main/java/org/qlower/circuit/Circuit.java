package org.qlower.circuit;

import java.util.List;
import java.util.Objects;

/**
 * The output of a lowering pass: the number of allocated indices and the gates in source order.
 * Every qubit operand of every instruction lies in {@code [0, width)}.
 */
public final class Circuit
{
	private final int width;
	private final List<Instruction> instructions;

	public Circuit(int width, List<Instruction> instructions)
	{
		if (width < 0)
		{
			throw new IllegalArgumentException("Circuit width must be non-negative: " + width);
		}
		for (Instruction instruction : instructions)
		{
			for (int qubit : instruction.getQubits())
			{
				if (qubit >= width)
				{
					throw new IllegalArgumentException("Instruction '" + instruction.render() + "' addresses qubit " + qubit + " outside width " + width);
				}
			}
		}
		this.width = width;
		this.instructions = List.copyOf(instructions);
	}

	public int getWidth()
	{
		return width;
	}

	public List<Instruction> getInstructions()
	{
		return instructions;
	}

	/**
	 * A QASM-like listing: a width header followed by one instruction per line.
	 */
	public String render()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("// width ").append(width).append('\n');
		for (Instruction instruction : instructions)
		{
			sb.append(instruction.render()).append('\n');
		}
		return sb.toString();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		return o instanceof Circuit other && width == other.width && instructions.equals(other.instructions);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(width, instructions);
	}

	@Override
	public String toString()
	{
		return "Circuit(width=" + width + ", instructions=" + instructions.size() + ")";
	}
}
