package org.qlower.dto;

import java.util.ArrayList;
import java.util.List;

public class CircuitDTO
{
	public int width;
	public List<InstructionDTO> instructions = new ArrayList<>();
}
