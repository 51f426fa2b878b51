package org.qlower.util;

import org.qlower.circuit.Circuit;
import org.qlower.circuit.Instruction;
import org.qlower.dto.CircuitDTO;
import org.qlower.dto.InstructionDTO;

public class CircuitDTOConverter
{
	public static CircuitDTO toDTO(Circuit circuit)
	{
		CircuitDTO dto = new CircuitDTO();
		dto.width = circuit.getWidth();
		circuit.getInstructions().forEach(instruction -> dto.instructions.add(toDTO(instruction)));
		return dto;
	}

	public static InstructionDTO toDTO(Instruction instruction)
	{
		InstructionDTO dto = new InstructionDTO();
		dto.name = instruction.getName();
		dto.qubits.addAll(instruction.getQubits());
		dto.angles.addAll(instruction.getAngles());
		return dto;
	}
}
