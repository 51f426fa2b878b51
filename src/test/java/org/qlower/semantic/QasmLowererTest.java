package org.qlower.semantic;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.qlower.circuit.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class QasmLowererTest
{
	private static final double EPSILON = 1e-12;

	private static final String ALL_INSTRUCTIONS = String.join("\n",
			"include \"qelib1.inc\";",
			"qreg q[3];",
			"ccx q[0], q[1], q[2];",
			"crz(pi/3) q[0], q[1];",
			"cx q[0], q[1];",
			"swap q[0], q[1];",
			"h q[0];",
			"s q[0];",
			"x q[0];",
			"y q[0];",
			"z q[0];",
			"rx(pi/4) q[0];",
			"ry(pi/4) q[0];",
			"rz(pi/4) q[0];",
			"");

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final QasmLowerer lowerer = new QasmLowerer();

	private LoweringException failureOf(String source)
	{
		return assertThrows(LoweringException.class, () -> lowerer.parseString(source));
	}

	@Test
	public void testParseSimpleCircuit()
	{
		Circuit circuit = lowerer.parseString("include \"qelib1.inc\";\nqreg q[1];\nrz(5*pi/4) q[0];\n");
		assertEquals(1, circuit.getWidth());
		assertEquals(1, circuit.getInstructions().size());
		Rotation rz = (Rotation) circuit.getInstructions().get(0);
		assertEquals(InstructionKind.RZ, rz.getKind());
		assertEquals(0, rz.getTarget());
		assertEquals(5 * Math.PI / 4, rz.getAngle(), EPSILON);
		assertEquals(3.9269908169872414, rz.getAngle(), EPSILON);
	}

	@Test
	public void testParseAllInstructions()
	{
		Circuit circuit = lowerer.parseString(ALL_INSTRUCTIONS);
		assertEquals(3, circuit.getWidth());
		assertEquals(12, circuit.getInstructions().size());
		Iterator<Instruction> iterator = circuit.getInstructions().iterator();

		CCX ccx = (CCX) iterator.next();
		assertEquals(2, ccx.getTarget());
		assertEquals(List.of(0, 1), ccx.getControls());

		ControlledRZ crz = (ControlledRZ) iterator.next();
		assertEquals(1, crz.getTarget());
		assertEquals(0, crz.getControl());
		assertEquals(Math.PI / 3, crz.getAngle(), EPSILON);

		CNOT cx = (CNOT) iterator.next();
		assertEquals(1, cx.getTarget());
		assertEquals(0, cx.getControl());

		Swap swap = (Swap) iterator.next();
		assertEquals(List.of(0, 1), swap.getTargets());

		for (InstructionKind kind : List.of(InstructionKind.H, InstructionKind.S, InstructionKind.X, InstructionKind.Y, InstructionKind.Z))
		{
			SingleQubitGate gate = (SingleQubitGate) iterator.next();
			assertEquals(kind, gate.getKind());
			assertEquals(0, gate.getTarget());
		}

		for (InstructionKind kind : List.of(InstructionKind.RX, InstructionKind.RY, InstructionKind.RZ))
		{
			Rotation rotation = (Rotation) iterator.next();
			assertEquals(kind, rotation.getKind());
			assertEquals(0, rotation.getTarget());
			assertEquals(Math.PI / 4, rotation.getAngle(), EPSILON);
		}

		assertFalse(iterator.hasNext());
	}

	@Test
	public void testLoweringIsIdempotent()
	{
		Circuit first = lowerer.parseString(ALL_INSTRUCTIONS);
		Circuit second = lowerer.parseString(ALL_INSTRUCTIONS);
		assertEquals(first, second);
		assertEquals(first.hashCode(), second.hashCode());
	}

	@Test
	public void testNoStateLeaksBetweenPasses()
	{
		lowerer.parseString("qreg q[5]; const int n = 2;");
		Circuit circuit = lowerer.parseString("qreg r[1]; h r[0];");
		assertEquals(1, circuit.getWidth());
		assertEquals(ErrorKind.UNDEFINED_NAME, failureOf("h q[0];").getKind());
		assertEquals(ErrorKind.UNDEFINED_NAME, failureOf("qreg r[n];").getKind());
	}

	@Test
	public void testUnicodePi()
	{
		Circuit circuit = lowerer.parseString("qubit a;\nrx(π/2) a;\n");
		assertEquals(Rotation.rx(0, Math.PI / 2), circuit.getInstructions().get(0));
	}

	@Test
	public void testOpenQasm3Declarations()
	{
		String source = String.join("\n",
				"OPENQASM 3.0;",
				"include \"stdgates.inc\";",
				"const int n = 2;",
				"const float theta = -pi / 8;",
				"qubit[n] q;",
				"qubit anc;",
				"crz(theta * 2) q[1], anc;",
				"cx anc, q[n - 2];",
				"");
		Circuit circuit = lowerer.parseString(source);
		assertEquals(3, circuit.getWidth());
		assertEquals(List.of(new ControlledRZ(1, 2, -Math.PI / 4), new CNOT(2, 0)), circuit.getInstructions());
	}

	@Test
	public void testMixedRegistersPinAllocationOrder()
	{
		Circuit circuit = lowerer.parseString("qreg a[2]; creg c[2]; qreg b[2]; cx a[1], b[0]; h b[1];");
		assertEquals(6, circuit.getWidth());
		assertEquals(List.of(new CNOT(1, 4), SingleQubitGate.h(5)), circuit.getInstructions());
	}

	@Test
	public void testStatementsWithoutInstructionsAreSkipped()
	{
		String source = String.join("\n",
				"OPENQASM 2.0;",
				"include \"qelib1.inc\";",
				"qreg q[2];",
				"creg c[2];",
				"h q[0];",
				"barrier q;",
				"barrier;",
				"measure q[0] -> c[0];",
				"measure q[1];",
				"reset q[1];",
				"");
		Circuit circuit = lowerer.parseString(source);
		assertEquals(4, circuit.getWidth());
		assertEquals(List.of(SingleQubitGate.h(0)), circuit.getInstructions());
	}

	@Test
	public void testNewStyleBitsDoNotWidenTheCircuit()
	{
		Circuit circuit = lowerer.parseString("qubit[2] q; bit[2] c; h q[0];");
		assertEquals(2, circuit.getWidth());
		assertEquals(List.of(SingleQubitGate.h(0)), circuit.getInstructions());
	}

	@Test
	public void testClassicalDeclarationWithInitializerIsSkipped()
	{
		Circuit circuit = lowerer.parseString("qubit[2] q; int n = 3; bit[2] c = measure q; float theta = pi / n; x q[1];");
		assertEquals(2, circuit.getWidth());
		assertEquals(List.of(SingleQubitGate.x(1)), circuit.getInstructions());
	}

	@Test
	public void testClassicalVariablesAreNotBound()
	{
		assertEquals(ErrorKind.UNDEFINED_NAME, failureOf("qubit q; int n = 1; rx(n) q;").getKind());
	}

	@Test
	public void testAssignmentIsSkipped()
	{
		String source = String.join("\n",
				"qubit[2] q;",
				"bit[2] c;",
				"c = measure q;",
				"c[0] = measure q[0];",
				"int k;",
				"k = 4 * 2;",
				"k += 1;",
				"cx q[0], q[1];",
				"");
		Circuit circuit = lowerer.parseString(source);
		assertEquals(2, circuit.getWidth());
		assertEquals(List.of(new CNOT(0, 1)), circuit.getInstructions());
	}

	@Test
	public void testGateDefinitionIsSkipped()
	{
		String source = String.join("\n",
				"qreg q[2];",
				"gate g a { h a; }",
				"gate bell(theta) a, b",
				"{",
				"    h a;",
				"    crz(theta) a, b;",
				"    cu1 a, b;",
				"}",
				"swap q[0], q[1];",
				"");
		Circuit circuit = lowerer.parseString(source);
		assertEquals(2, circuit.getWidth());
		assertEquals(List.of(new Swap(0, 1)), circuit.getInstructions());
	}

	@Test
	public void testIfStatementIsSkipped()
	{
		String source = String.join("\n",
				"qreg q[1];",
				"creg c[1];",
				"if(c==1) x q[0];",
				"if (c[0] != 0 && !(c >= 2)) { h q[0]; } else { z q[0]; }",
				"y q[0];",
				"");
		Circuit circuit = lowerer.parseString(source);
		assertEquals(2, circuit.getWidth());
		assertEquals(List.of(SingleQubitGate.y(0)), circuit.getInstructions());
	}

	@Test
	public void testSkippedStatementsAreNotResolved()
	{
		Circuit circuit = lowerer.parseString("qreg q[1]; measure nowhere[9] -> missing[3]; x q[0];");
		assertEquals(List.of(SingleQubitGate.x(0)), circuit.getInstructions());
	}

	@Test
	public void testBareScalarOperand()
	{
		Circuit circuit = lowerer.parseString("qreg a; qubit b; swap a, b;");
		assertEquals(List.of(new Swap(0, 1)), circuit.getInstructions());
	}

	@Test
	public void testEveryOperandIsWithinWidth()
	{
		Circuit circuit = lowerer.parseString("qreg q[2]; creg c[1]; qubit r; ccx q[0], q[1], r;");
		for (Instruction instruction : circuit.getInstructions())
		{
			for (int qubit : instruction.getQubits())
			{
				assertTrue(qubit >= 0 && qubit < circuit.getWidth());
			}
		}
	}

	@Test
	public void testOperandMustBeAQubit()
	{
		assertEquals(ErrorKind.TYPE_MISMATCH, failureOf("qreg q[2]; h q;").getKind());
		assertEquals(ErrorKind.TYPE_MISMATCH, failureOf("creg c[2]; h c[0];").getKind());
		assertEquals(ErrorKind.TYPE_MISMATCH, failureOf("const int k = 1; x k;").getKind());
		assertEquals(ErrorKind.TYPE_MISMATCH, failureOf("qubit a; h a[0];").getKind());
	}

	@Test
	public void testOperandIndexBounds()
	{
		LoweringException e = failureOf("qreg q[2];\nh q[2];\n");
		assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, e.getKind());
		assertNotNull(e.getSpan());
		assertEquals(2, e.getSpan().getLine());
		assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, failureOf("qreg q[2]; h q[-1];").getKind());
		assertEquals(1, lowerer.parseString("qreg q[2]; h q[1];").getInstructions().size());
	}

	@Test
	public void testAngleMustBeNumeric()
	{
		assertEquals(ErrorKind.TYPE_MISMATCH, failureOf("qreg q[1]; rz(q[0]) q[0];").getKind());
	}

	@Test
	public void testIntegerAnglesAreConverted()
	{
		Circuit circuit = lowerer.parseString("qreg q[1]; rx(2) q[0];");
		assertEquals(Rotation.rx(0, 2.0), circuit.getInstructions().get(0));
	}

	@Test
	public void testUnknownGate()
	{
		LoweringException e = failureOf("qreg q[1];\nt q[0];\n");
		assertEquals(ErrorKind.UNKNOWN_GATE, e.getKind());
		assertEquals(2, e.getSpan().getLine());
		assertTrue(e.getMessage().contains("t"));
	}

	@Test
	public void testGateArity()
	{
		assertEquals(ErrorKind.ARITY_MISMATCH, failureOf("qreg q[2]; cx q[0];").getKind());
		assertEquals(ErrorKind.ARITY_MISMATCH, failureOf("qreg q[2]; rz q[0];").getKind());
		assertEquals(ErrorKind.ARITY_MISMATCH, failureOf("qreg q[2]; h(pi) q[0];").getKind());
		assertEquals(ErrorKind.ARITY_MISMATCH, failureOf("qreg q[2]; crz(pi, pi) q[0], q[1];").getKind());
	}

	@Test
	public void testFirstErrorAbortsThePass()
	{
		LoweringException e = failureOf("qreg q[1];\nh q[3];\nfoo q[0];\n");
		assertEquals(ErrorKind.INDEX_OUT_OF_RANGE, e.getKind());
	}

	@Test
	public void testArithmeticErrorIsLocated()
	{
		LoweringException e = failureOf("qreg q[1];\nrz(pi / (2 - 2)) q[0];\n");
		assertEquals(ErrorKind.ARITHMETIC_ERROR, e.getKind());
		assertEquals(2, e.getSpan().getLine());
		assertEquals("pi / (2 - 2)", e.getSpan().getText());
	}

	@Test
	public void testSyntaxError()
	{
		LoweringException e = failureOf("qreg q[1]\nh q[0];\n");
		assertEquals(ErrorKind.SYNTAX_ERROR, e.getKind());
		assertNotNull(e.getSpan());
		assertEquals(2, e.getSpan().getLine());
		assertTrue(e.getMessage().contains(QasmLowerer.SOURCE_NAME));
	}

	@Test
	public void testParseStream() throws IOException
	{
		try (InputStream stream = new ByteArrayInputStream(ALL_INSTRUCTIONS.getBytes(StandardCharsets.UTF_8)))
		{
			assertEquals(lowerer.parseString(ALL_INSTRUCTIONS), lowerer.parseStream(stream));
		}
	}

	@Test
	public void testParseFile() throws IOException
	{
		Path file = folder.newFile("circuit.qasm").toPath();
		Files.writeString(file, "qreg q[2];\ncx q[1], q[0];\nrz(π) q[1];\n", StandardCharsets.UTF_8);
		Circuit circuit = lowerer.parseFile(file);
		assertEquals(List.of(new CNOT(1, 0), Rotation.rz(1, Math.PI)), circuit.getInstructions());
	}
}
