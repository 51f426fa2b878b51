package org.qlower.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.qlower.semantic.SourceSpan;

/**
 * A custom error listener for the ANTLR lexer and parser that routes syntax errors
 * through Debug.logError and remembers the first one for the caller to report.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private int errorCount = 0;
	private String firstMessage;
	private SourceSpan firstSpan;

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		String err = String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg);
		Debug.logError(err);

		if (errorCount == 0)
		{
			String text = offendingSymbol instanceof Token token ? token.getText() : "";
			firstMessage = msg;
			firstSpan = new SourceSpan(line, charPositionInLine + 1, text);
		}
		errorCount++;
	}

	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	public String getFirstMessage()
	{
		return firstMessage;
	}

	public SourceSpan getFirstSpan()
	{
		return firstSpan;
	}
}
