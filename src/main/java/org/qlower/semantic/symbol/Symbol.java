package org.qlower.semantic.symbol;

import org.qlower.semantic.value.Value;

public interface Symbol
{
	String getName();

	Value getValue();
}
