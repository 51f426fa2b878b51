package org.qlower.semantic;

import org.qlower.circuit.Circuit;
import org.qlower.circuit.Instruction;
import org.qlower.parser.QasmParser;
import org.qlower.parser.QasmParserBaseVisitor;
import org.qlower.semantic.symbol.Scope;
import org.qlower.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks the top-level statements once, in source order, routing declarations to the
 * {@link DeclarationProcessor} and gate calls to {@link GateLowering}.
 * <p>
 * Every other statement (the version header, {@code include}, classical declarations such as
 * {@code bit[2] c;} or {@code int n = 3;}, assignments, {@code measure}, {@code barrier},
 * {@code reset}, gate definitions and {@code if}) has no counterpart in the instruction set and
 * is skipped without looking inside it.
 * <p>
 * A visitor instance holds the state of one pass and must not be reused.
 */
public class CircuitVisitor extends QasmParserBaseVisitor<Void>
{
	private final Scope scope;
	private final DeclarationProcessor declarations;
	private final GateLowering gates;
	private final List<Instruction> instructions = new ArrayList<>();

	public CircuitVisitor()
	{
		this.scope = Scope.withBuiltins();
		ExpressionEvaluator evaluator = new ExpressionEvaluator(scope);
		this.declarations = new DeclarationProcessor(scope, evaluator);
		this.gates = new GateLowering(evaluator);
	}

	public Circuit getCircuit()
	{
		return new Circuit(declarations.getWidth(), instructions);
	}

	public Scope getScope()
	{
		return scope;
	}

	@Override
	public Void visitProgram(QasmParser.ProgramContext ctx)
	{
		if (ctx.version() != null)
		{
			visit(ctx.version());
		}
		for (QasmParser.StatementContext statement : ctx.statement())
		{
			visit(statement);
		}
		return null;
	}

	@Override
	public Void visitOldStyleDeclarationStatement(QasmParser.OldStyleDeclarationStatementContext ctx)
	{
		declarations.declareOldStyle(ctx);
		return null;
	}

	@Override
	public Void visitQuantumDeclarationStatement(QasmParser.QuantumDeclarationStatementContext ctx)
	{
		declarations.declareQubits(ctx);
		return null;
	}

	@Override
	public Void visitClassicalDeclarationStatement(QasmParser.ClassicalDeclarationStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitConstDeclarationStatement(QasmParser.ConstDeclarationStatementContext ctx)
	{
		declarations.declareConst(ctx);
		return null;
	}

	@Override
	public Void visitGateCallStatement(QasmParser.GateCallStatementContext ctx)
	{
		Instruction instruction = gates.lower(ctx);
		instructions.add(instruction);
		Debug.logDebug("Lowered '" + ctx.getText() + "' to " + instruction.render());
		return null;
	}

	@Override
	public Void visitVersion(QasmParser.VersionContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitIncludeStatement(QasmParser.IncludeStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitMeasureStatement(QasmParser.MeasureStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitBarrierStatement(QasmParser.BarrierStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitResetStatement(QasmParser.ResetStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitAssignmentStatement(QasmParser.AssignmentStatementContext ctx)
	{
		return skip(ctx.getText());
	}

	@Override
	public Void visitGateStatement(QasmParser.GateStatementContext ctx)
	{
		return skip("gate " + ctx.Identifier().getText());
	}

	@Override
	public Void visitIfStatement(QasmParser.IfStatementContext ctx)
	{
		return skip("if (" + ctx.expression().getText() + ")");
	}

	private Void skip(String statement)
	{
		Debug.logDebug("Skipping statement without an IR counterpart: " + statement);
		return null;
	}
}
