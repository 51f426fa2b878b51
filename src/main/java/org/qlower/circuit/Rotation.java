package org.qlower.circuit;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A single-qubit rotation about the X, Y or Z axis by {@code angle} radians.
 */
public final class Rotation extends Instruction
{
	private static final Set<InstructionKind> KINDS = EnumSet.of(InstructionKind.RX, InstructionKind.RY, InstructionKind.RZ);

	private final int target;
	private final double angle;

	public Rotation(InstructionKind kind, int target, double angle)
	{
		super(kind);
		if (!KINDS.contains(kind))
		{
			throw new IllegalArgumentException("Not a rotation gate: " + kind);
		}
		this.target = requireQubit(target);
		this.angle = angle;
	}

	public static Rotation rx(int target, double angle)
	{
		return new Rotation(InstructionKind.RX, target, angle);
	}

	public static Rotation ry(int target, double angle)
	{
		return new Rotation(InstructionKind.RY, target, angle);
	}

	public static Rotation rz(int target, double angle)
	{
		return new Rotation(InstructionKind.RZ, target, angle);
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
		return List.of(target);
	}

	@Override
	public List<Double> getAngles()
	{
		return List.of(angle);
	}
}
