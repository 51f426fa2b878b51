package org.qlower.semantic;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.qlower.circuit.Circuit;
import org.qlower.parser.QasmLexer;
import org.qlower.parser.QasmParser;
import org.qlower.util.Debug;
import org.qlower.util.SyntaxErrorListener;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Entry point of the lowering pass. Each call parses its input and lowers it with a fresh
 * scope and index counter, so one instance can be shared freely.
 */
public class QasmLowerer
{
	/**
	 * Source name reported for text passed to {@link #parseString(String)}.
	 */
	public static final String SOURCE_NAME = "<input>";

	/**
	 * Parses and lowers the circuit described by {@code source}.
	 */
	public Circuit parseString(String source)
	{
		return parse(CharStreams.fromString(source, SOURCE_NAME));
	}

	/**
	 * Parses and lowers the circuit read from {@code stream} as UTF-8. The stream is not closed.
	 */
	public Circuit parseStream(InputStream stream) throws IOException
	{
		return parse(CharStreams.fromStream(stream, StandardCharsets.UTF_8));
	}

	/**
	 * Parses and lowers the circuit in the given file.
	 */
	public Circuit parseFile(Path file) throws IOException
	{
		return parse(CharStreams.fromPath(file, StandardCharsets.UTF_8));
	}

	/**
	 * Parses {@code input} and lowers the resulting tree.
	 *
	 * @throws LoweringException {@link ErrorKind#SYNTAX_ERROR} if the text does not parse,
	 *                           or the first semantic failure met while lowering.
	 */
	public Circuit parse(CharStream input)
	{
		SyntaxErrorListener errors = new SyntaxErrorListener();

		QasmLexer lexer = new QasmLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errors);

		QasmParser parser = new QasmParser(new CommonTokenStream(lexer));
		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(errors);

		QasmParser.ProgramContext tree = parser.program();
		if (errors.hasErrors())
		{
			throw new LoweringException(ErrorKind.SYNTAX_ERROR,
					errors.getErrorCount() + " syntax error(s) in " + input.getSourceName() + ", first: " + errors.getFirstMessage(),
					errors.getFirstSpan());
		}
		return lower(tree);
	}

	/**
	 * Lowers an already parsed program.
	 */
	public Circuit lower(QasmParser.ProgramContext program)
	{
		CircuitVisitor visitor = new CircuitVisitor();
		visitor.visit(program);
		Circuit circuit = visitor.getCircuit();
		Debug.logDebug("Lowered circuit: width " + circuit.getWidth() + ", " + circuit.getInstructions().size() + " instruction(s)");
		return circuit;
	}
}
