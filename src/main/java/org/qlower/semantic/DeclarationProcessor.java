package org.qlower.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.qlower.parser.QasmParser;
import org.qlower.semantic.symbol.Scope;
import org.qlower.semantic.symbol.VariableSymbol;
import org.qlower.semantic.value.*;
import org.qlower.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Binds declared names in the scope and hands out register indices.
 * Qubit and bit registers ({@code qreg}, {@code creg}, {@code qubit}) draw from one shared
 * counter, so {@link #getWidth()} counts both.
 */
public class DeclarationProcessor
{
	private final Scope scope;
	private final ExpressionEvaluator evaluator;
	private int width = 0;

	public DeclarationProcessor(Scope scope, ExpressionEvaluator evaluator)
	{
		this.scope = scope;
		this.evaluator = evaluator;
	}

	/**
	 * {@code qreg name[size];} or {@code creg name[size];}
	 */
	public void declareOldStyle(QasmParser.OldStyleDeclarationStatementContext ctx)
	{
		ParseTree keyword = ctx.getChild(0);
		if (!(keyword instanceof TerminalNode terminal))
		{
			throw LoweringException.at(ctx, ErrorKind.MALFORMED_TREE, "Unknown declaration statement kind: " + keyword.getText());
		}

		switch (terminal.getSymbol().getType())
		{
			case QasmParser.QREG -> declareRegister(ctx, ctx.Identifier().getText(), ctx.designator(), QubitValue::new, VariableSymbol.Origin.QUBIT_REGISTER);
			case QasmParser.CREG -> declareRegister(ctx, ctx.Identifier().getText(), ctx.designator(), BitValue::new, VariableSymbol.Origin.BIT_REGISTER);
			default -> throw LoweringException.at(ctx, ErrorKind.MALFORMED_TREE, "Unknown declaration statement kind: " + terminal.getText());
		}
	}

	/**
	 * {@code qubit name;} or {@code qubit[size] name;}
	 */
	public void declareQubits(QasmParser.QuantumDeclarationStatementContext ctx)
	{
		declareRegister(ctx, ctx.Identifier().getText(), ctx.qubitType().designator(), QubitValue::new, VariableSymbol.Origin.QUBIT_REGISTER);
	}

	/**
	 * {@code const <type> name = expr;} The initializer is folded once and bound as is;
	 * constants take no register indices.
	 */
	public void declareConst(QasmParser.ConstDeclarationStatementContext ctx)
	{
		String name = ctx.Identifier().getText();
		Value value = evaluator.evaluate(ctx.declarationExpression());
		scope.define(new VariableSymbol(name, value, VariableSymbol.Origin.CONSTANT));
		Debug.logDebug("Bound constant '" + name + "' = " + value.describe());
	}

	public int getWidth()
	{
		return width;
	}

	private void declareRegister(ParserRuleContext ctx, String name, QasmParser.DesignatorContext designator, IntFunction<Value> element, VariableSymbol.Origin origin)
	{
		Value value;
		int first = width;
		if (designator != null)
		{
			int size = evaluateSize(name, designator);
			List<Value> elements = new ArrayList<>(size);
			for (int i = 0; i < size; i++)
			{
				elements.add(element.apply(first + i));
			}
			value = new ArrayValue(elements);
			width += size;
		}
		else
		{
			value = element.apply(first);
			width += 1;
		}

		scope.define(new VariableSymbol(name, value, origin));
		Debug.logDebug("Declared '" + name + "' as " + value.describe() + " at indices [" + first + ", " + width + ")");
	}

	private int evaluateSize(String name, QasmParser.DesignatorContext designator)
	{
		long size;
		try
		{
			size = Arithmetic.toInteger(evaluator.evaluate(designator.expression()));
		}
		catch (LoweringException e)
		{
			throw e.at(designator);
		}

		if (size <= 0)
		{
			throw LoweringException.at(designator, ErrorKind.INDEX_OUT_OF_RANGE, "Register '" + name + "' must have a positive size, got " + size);
		}
		if (size > Integer.MAX_VALUE - width)
		{
			throw LoweringException.at(designator, ErrorKind.INDEX_OUT_OF_RANGE, "Register '" + name + "' of size " + size + " exceeds the addressable index space");
		}
		return (int) size;
	}
}
