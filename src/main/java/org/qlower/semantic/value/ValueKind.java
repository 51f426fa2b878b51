package org.qlower.semantic.value;

public enum ValueKind
{
	INT("int"),
	FLOAT("float"),
	QUBIT("qubit"),
	BIT("bit"),
	ARRAY("array");

	private final String displayName;

	ValueKind(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}
}
