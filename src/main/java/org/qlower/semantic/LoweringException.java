package org.qlower.semantic;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Aborts a lowering pass. Carries the failure kind and, once known, the source span of the
 * node that caused it. Pure helpers such as {@link org.qlower.semantic.value.Arithmetic}
 * throw it without a span; the visitor that called them attaches one with {@link #at}.
 */
public class LoweringException extends RuntimeException
{
	private final ErrorKind kind;
	private final SourceSpan span;

	public LoweringException(ErrorKind kind, String message)
	{
		this(kind, message, null, null);
	}

	public LoweringException(ErrorKind kind, String message, SourceSpan span)
	{
		this(kind, message, span, null);
	}

	public LoweringException(ErrorKind kind, String message, SourceSpan span, Throwable cause)
	{
		super(message, cause);
		this.kind = kind;
		this.span = span;
	}

	public static LoweringException at(ParserRuleContext ctx, ErrorKind kind, String message)
	{
		return new LoweringException(kind, message, SourceSpan.of(ctx));
	}

	/**
	 * Returns this exception if it already has a span, otherwise a copy located at {@code ctx}.
	 */
	public LoweringException at(ParserRuleContext ctx)
	{
		if (span != null || ctx == null)
		{
			return this;
		}
		LoweringException located = new LoweringException(kind, getMessage(), SourceSpan.of(ctx), getCause());
		located.setStackTrace(getStackTrace());
		return located;
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public SourceSpan getSpan()
	{
		return span;
	}

	/**
	 * The message prefixed with the kind and, when present, the position.
	 */
	public String describe()
	{
		if (span == null)
		{
			return kind + ": " + getMessage();
		}
		return String.format("line %d:%d - %s: %s", span.getLine(), span.getColumn(), kind, getMessage());
	}
}
