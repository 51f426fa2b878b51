package org.qlower.circuit;

import java.util.List;

public final class ControlledRZ extends Instruction
{
	private final int control;
	private final int target;
	private final double angle;

	public ControlledRZ(int control, int target, double angle)
	{
		super(InstructionKind.CRZ);
		this.control = requireQubit(control);
		this.target = requireQubit(target);
		this.angle = angle;
	}

	public int getControl()
	{
		return control;
	}

	public int getTarget()
	{
		return target;
	}

	public double getAngle()
	{
		return angle;
	}

	@Override
	public List<Integer> getQubits()
	{
		return List.of(control, target);
	}

	@Override
	public List<Double> getAngles()
	{
		return List.of(angle);
	}
}
