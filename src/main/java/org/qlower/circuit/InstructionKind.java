package org.qlower.circuit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The closed instruction set of the IR, with each instruction's construction contract:
 * the gate name used in source, how many qubit operands it takes and how many angles.
 */
public enum InstructionKind
{
	CCX("ccx", 3, 0),
	CRZ("crz", 2, 1),
	CX("cx", 2, 0),
	SWAP("swap", 2, 0),
	H("h", 1, 0),
	S("s", 1, 0),
	X("x", 1, 0),
	Y("y", 1, 0),
	Z("z", 1, 0),
	RX("rx", 1, 1),
	RY("ry", 1, 1),
	RZ("rz", 1, 1);

	private static final Map<String, InstructionKind> BY_NAME;

	static
	{
		Map<String, InstructionKind> map = new LinkedHashMap<>();
		for (InstructionKind kind : values())
		{
			map.put(kind.gateName, kind);
		}
		BY_NAME = Collections.unmodifiableMap(map);
	}

	private final String gateName;
	private final int qubitArity;
	private final int angleArity;

	InstructionKind(String gateName, int qubitArity, int angleArity)
	{
		this.gateName = gateName;
		this.qubitArity = qubitArity;
		this.angleArity = angleArity;
	}

	public static Optional<InstructionKind> fromGateName(String name)
	{
		return Optional.ofNullable(BY_NAME.get(name));
	}

	public String getGateName()
	{
		return gateName;
	}

	public int getQubitArity()
	{
		return qubitArity;
	}

	public int getAngleArity()
	{
		return angleArity;
	}
}
