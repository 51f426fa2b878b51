package org.qlower.util;

import org.junit.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CompilerArgumentsTest
{
	@Test
	public void testNoArgumentsShowsHelp()
	{
		assertTrue(CompilerArguments.parse(new String[0]).isHelpFlag());
	}

	@Test
	public void testFlagsAndInputs()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"-v", "--json", "-k", "a.qasm", "b.qasm"});
		assertTrue(args.isVerboseFlag());
		assertTrue(args.isJsonOutput());
		assertTrue(args.isCheckOnly());
		assertFalse(args.isHelpFlag());
		assertNull(args.getOutputPath());
		assertEquals(List.of(Paths.get("a.qasm"), Paths.get("b.qasm")), args.getInputFiles());
	}

	@Test
	public void testOutputPath()
	{
		CompilerArguments args = CompilerArguments.parse(new String[]{"circuit.qasm", "-o", "out/circuit.txt"});
		assertEquals(Paths.get("out/circuit.txt"), args.getOutputPath());
		assertFalse(args.isHelpFlag());
	}

	@Test
	public void testVersionOverridesOtherArguments()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--version", "--bogus"}).isVersionFlag());
	}

	@Test
	public void testInvalidArgumentsFallBackToHelp()
	{
		assertTrue(CompilerArguments.parse(new String[]{"--bogus"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"a.qasm", "-o"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"-o", "out.txt", "a.qasm", "b.qasm"}).isHelpFlag());
	}
}
