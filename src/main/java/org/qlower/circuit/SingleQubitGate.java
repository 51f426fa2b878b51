package org.qlower.circuit;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * The fixed single-qubit gates: H, S, X, Y and Z.
 */
public final class SingleQubitGate extends Instruction
{
	private static final Set<InstructionKind> KINDS = EnumSet.of(
			InstructionKind.H, InstructionKind.S, InstructionKind.X, InstructionKind.Y, InstructionKind.Z);

	private final int target;

	public SingleQubitGate(InstructionKind kind, int target)
	{
		super(kind);
		if (!KINDS.contains(kind))
		{
			throw new IllegalArgumentException("Not a single-qubit gate: " + kind);
		}
		this.target = requireQubit(target);
	}

	public static SingleQubitGate h(int target)
	{
		return new SingleQubitGate(InstructionKind.H, target);
	}

	public static SingleQubitGate s(int target)
	{
		return new SingleQubitGate(InstructionKind.S, target);
	}

	public static SingleQubitGate x(int target)
	{
		return new SingleQubitGate(InstructionKind.X, target);
	}

	public static SingleQubitGate y(int target)
	{
		return new SingleQubitGate(InstructionKind.Y, target);
	}

	public static SingleQubitGate z(int target)
	{
		return new SingleQubitGate(InstructionKind.Z, target);
	}

	public int getTarget()
	{
		return target;
	}

	@Override
	public List<Integer> getQubits()
	{
		return List.of(target);
	}
}
