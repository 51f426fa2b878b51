package org.qlower.circuit;

import java.util.List;

public final class Swap extends Instruction
{
	private final int first;
	private final int second;

	public Swap(int first, int second)
	{
		super(InstructionKind.SWAP);
		this.first = requireQubit(first);
		this.second = requireQubit(second);
	}

	public List<Integer> getTargets()
	{
		return List.of(first, second);
	}

	@Override
	public List<Integer> getQubits()
	{
		return getTargets();
	}
}
