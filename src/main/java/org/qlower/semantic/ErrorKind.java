package org.qlower.semantic;

/**
 * Every way a lowering pass can fail. The last four are internal-consistency or front-end
 * failures rather than problems in the lowered program's semantics.
 */
public enum ErrorKind
{
	UNDEFINED_NAME,
	TYPE_MISMATCH,
	INDEX_OUT_OF_RANGE,
	ARITHMETIC_ERROR,
	UNKNOWN_GATE,
	ARITY_MISMATCH,
	UNKNOWN_OPERATOR,
	UNPARSEABLE_EXPRESSION,
	MALFORMED_TREE,
	SYNTAX_ERROR
}
