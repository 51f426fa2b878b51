package org.qlower.circuit;

import java.util.List;

/**
 * Toffoli gate: flips {@code target} when both controls are set.
 */
public final class CCX extends Instruction
{
	private final int firstControl;
	private final int secondControl;
	private final int target;

	public CCX(int firstControl, int secondControl, int target)
	{
		super(InstructionKind.CCX);
		this.firstControl = requireQubit(firstControl);
		this.secondControl = requireQubit(secondControl);
		this.target = requireQubit(target);
	}

	public List<Integer> getControls()
	{
		return List.of(firstControl, secondControl);
	}

	public int getTarget()
	{
		return target;
	}

	@Override
	public List<Integer> getQubits()
	{
		return List.of(firstControl, secondControl, target);
	}
}
