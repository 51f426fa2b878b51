package org.qlower.util;

import org.qlower.semantic.LoweringException;
import org.qlower.semantic.SourceSpan;

import java.nio.file.Path;

public class ErrorHandler
{
	private int errorCount = 0;

	/**
	 * Prints a failed lowering pass as {@code [Lowering Error] file - line L:C - KIND: message}.
	 */
	public void logError(Path file, LoweringException e)
	{
		Debug.logError(format(file, e));
		SourceSpan span = e.getSpan();
		if (span != null && span.getText() != null && !span.getText().isEmpty())
		{
			Debug.logError("    at: " + span.getText());
		}
		errorCount++;
	}

	public static String format(Path file, LoweringException e)
	{
		String fileName = file != null ? file.toString() : "<input>";
		return String.format("[Lowering Error] %s - %s", fileName, e.describe());
	}

	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
