package org.qlower.semantic;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

import java.util.Objects;

/**
 * Where in the source a diagnostic points: 1-based line and column of the first token,
 * plus the original text of the node (whitespace included).
 */
public final class SourceSpan
{
	private final int line;
	private final int column;
	private final String text;

	public SourceSpan(int line, int column, String text)
	{
		this.line = line;
		this.column = column;
		this.text = text;
	}

	public static SourceSpan of(ParserRuleContext ctx)
	{
		Token start = ctx.getStart();
		Token stop = ctx.getStop();
		String text = ctx.getText();
		CharStream input = start.getInputStream();
		if (input != null && stop != null && stop.getStopIndex() >= start.getStartIndex())
		{
			text = input.getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
		}
		return new SourceSpan(start.getLine(), start.getCharPositionInLine() + 1, text);
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getText()
	{
		return text;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SourceSpan other))
		{
			return false;
		}
		return line == other.line && column == other.column && Objects.equals(text, other.text);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, column, text);
	}

	@Override
	public String toString()
	{
		return String.format("line %d:%d '%s'", line, column, text);
	}
}
