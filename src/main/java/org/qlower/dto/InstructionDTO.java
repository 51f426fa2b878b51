package org.qlower.dto;

import java.util.ArrayList;
import java.util.List;

public class InstructionDTO
{
	public String name;
	public List<Integer> qubits = new ArrayList<>();
	public List<Double> angles = new ArrayList<>();
}
