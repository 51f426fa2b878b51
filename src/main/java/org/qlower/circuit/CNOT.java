package org.qlower.circuit;

import java.util.List;

public final class CNOT extends Instruction
{
	private final int control;
	private final int target;

	public CNOT(int control, int target)
	{
		super(InstructionKind.CX);
		this.control = requireQubit(control);
		this.target = requireQubit(target);
	}

	public int getControl()
	{
		return control;
	}

	public int getTarget()
	{
		return target;
	}

	@Override
	public List<Integer> getQubits()
	{
		return List.of(control, target);
	}
}
