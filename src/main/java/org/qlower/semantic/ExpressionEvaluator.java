package org.qlower.semantic;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.qlower.parser.QasmParser;
import org.qlower.parser.QasmParserBaseVisitor;
import org.qlower.semantic.symbol.Scope;
import org.qlower.semantic.value.*;

import java.util.List;

/**
 * Folds a constant expression subtree into a single {@link Value}.
 * Operands are evaluated left to right; names are looked up in the scope of the current pass.
 */
public class ExpressionEvaluator extends QasmParserBaseVisitor<Value>
{
	private final Scope scope;

	public ExpressionEvaluator(Scope scope)
	{
		this.scope = scope;
	}

	/**
	 * Evaluates {@code ctx}, failing with {@link ErrorKind#UNPARSEABLE_EXPRESSION} if the node
	 * is not an expression shape this evaluator knows.
	 */
	public Value evaluate(ParserRuleContext ctx)
	{
		Value value = ctx.accept(this);
		if (value == null)
		{
			throw LoweringException.at(ctx, ErrorKind.UNPARSEABLE_EXPRESSION, "Cannot evaluate expression: " + ctx.getText());
		}
		return value;
	}

	@Override
	protected Value defaultResult()
	{
		return null;
	}

	@Override
	public Value visitDeclarationExpression(QasmParser.DeclarationExpressionContext ctx)
	{
		return evaluate(ctx.expression());
	}

	@Override
	public Value visitParenthesisExpression(QasmParser.ParenthesisExpressionContext ctx)
	{
		return evaluate(ctx.expression());
	}

	@Override
	public Value visitUnaryExpression(QasmParser.UnaryExpressionContext ctx)
	{
		Value operand = evaluate(ctx.expression());
		try
		{
			return Arithmetic.negate(operand);
		}
		catch (LoweringException e)
		{
			throw e.at(ctx);
		}
	}

	@Override
	public Value visitAdditiveExpression(QasmParser.AdditiveExpressionContext ctx)
	{
		return evaluateBinary(ctx, ctx.expression(0), ctx.op, ctx.expression(1));
	}

	@Override
	public Value visitMultiplicativeExpression(QasmParser.MultiplicativeExpressionContext ctx)
	{
		return evaluateBinary(ctx, ctx.expression(0), ctx.op, ctx.expression(1));
	}

	@Override
	public Value visitLogicalNotExpression(QasmParser.LogicalNotExpressionContext ctx)
	{
		return notFoldable(ctx);
	}

	@Override
	public Value visitComparisonExpression(QasmParser.ComparisonExpressionContext ctx)
	{
		return notFoldable(ctx);
	}

	@Override
	public Value visitEqualityExpression(QasmParser.EqualityExpressionContext ctx)
	{
		return notFoldable(ctx);
	}

	@Override
	public Value visitLogicalAndExpression(QasmParser.LogicalAndExpressionContext ctx)
	{
		return notFoldable(ctx);
	}

	@Override
	public Value visitLogicalOrExpression(QasmParser.LogicalOrExpressionContext ctx)
	{
		return notFoldable(ctx);
	}

	@Override
	public Value visitLiteralExpression(QasmParser.LiteralExpressionContext ctx)
	{
		if (ctx.DecimalIntegerLiteral() != null)
		{
			return parseInteger(ctx, ctx.DecimalIntegerLiteral());
		}
		if (ctx.FloatLiteral() != null)
		{
			return new FloatValue(Double.parseDouble(stripSeparators(ctx.FloatLiteral().getText())));
		}
		if (ctx.Identifier() != null)
		{
			String name = ctx.Identifier().getText();
			return scope.resolveValue(name)
					.orElseThrow(() -> LoweringException.at(ctx, ErrorKind.UNDEFINED_NAME, "Name '" + name + "' is not defined"));
		}
		throw LoweringException.at(ctx, ErrorKind.UNPARSEABLE_EXPRESSION, "Unknown literal: " + ctx.getText());
	}

	@Override
	public Value visitIndexExpression(QasmParser.IndexExpressionContext ctx)
	{
		return resolveIndexed(ctx, ctx.Identifier().getText(), ctx.indexOperator());
	}

	/**
	 * Looks up {@code name} and applies each index operator in turn. Every intermediate value
	 * must be an array and every index an in-range integer.
	 *
	 * @param ctx       The node to blame in diagnostics.
	 * @param name      The base identifier.
	 * @param operators The index operators, outermost first; may be empty.
	 * @return The selected element, or the bound value itself when there are no operators.
	 */
	public Value resolveIndexed(ParserRuleContext ctx, String name, List<QasmParser.IndexOperatorContext> operators)
	{
		Value value = scope.resolveValue(name)
				.orElseThrow(() -> LoweringException.at(ctx, ErrorKind.UNDEFINED_NAME, "Name '" + name + "' is not defined"));

		for (QasmParser.IndexOperatorContext operator : operators)
		{
			if (!(value instanceof ArrayValue array))
			{
				throw LoweringException.at(ctx, ErrorKind.TYPE_MISMATCH, "Array expected: '" + name + "' is " + value.describe());
			}

			long index;
			try
			{
				index = Arithmetic.toInteger(evaluate(operator.expression()));
			}
			catch (LoweringException e)
			{
				throw e.at(operator);
			}

			if (index < 0)
			{
				throw LoweringException.at(operator, ErrorKind.INDEX_OUT_OF_RANGE, "Negative index " + index + " into '" + name + "'");
			}
			if (index >= array.size())
			{
				throw LoweringException.at(operator, ErrorKind.INDEX_OUT_OF_RANGE,
						"Index " + index + " out of bounds: '" + name + "' has length " + array.size());
			}
			value = array.get((int) index);
		}
		return value;
	}

	private Value evaluateBinary(ParserRuleContext ctx, QasmParser.ExpressionContext lhsCtx, Token op, QasmParser.ExpressionContext rhsCtx)
	{
		Value lhs = evaluate(lhsCtx);
		Value rhs = evaluate(rhsCtx);
		try
		{
			switch (op.getType())
			{
				case QasmParser.PLUS:
					return Arithmetic.add(lhs, rhs);
				case QasmParser.MINUS:
					return Arithmetic.subtract(lhs, rhs);
				case QasmParser.ASTERISK:
					return Arithmetic.multiply(lhs, rhs);
				case QasmParser.SLASH:
					return Arithmetic.divide(lhs, rhs);
				case QasmParser.PERCENT:
					return Arithmetic.modulo(lhs, rhs);
				default:
					throw new LoweringException(ErrorKind.UNKNOWN_OPERATOR, "Unknown operator: " + op.getText());
			}
		}
		catch (LoweringException e)
		{
			throw e.at(ctx);
		}
	}

	// Conditions only appear in skipped statements; as an angle or index they have no numeric value.
	private Value notFoldable(ParserRuleContext ctx)
	{
		throw LoweringException.at(ctx, ErrorKind.UNPARSEABLE_EXPRESSION, "Cannot fold condition into a numeric value: " + ctx.getText());
	}

	private IntValue parseInteger(ParserRuleContext ctx, TerminalNode literal)
	{
		String digits = stripSeparators(literal.getText());
		try
		{
			return new IntValue(Long.parseLong(digits));
		}
		catch (NumberFormatException e)
		{
			throw new LoweringException(ErrorKind.ARITHMETIC_ERROR, "Integer literal does not fit in 64 bits: " + literal.getText(), SourceSpan.of(ctx), e);
		}
	}

	private static String stripSeparators(String literal)
	{
		return literal.replace("_", "");
	}
}
