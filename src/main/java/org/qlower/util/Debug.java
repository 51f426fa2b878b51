package org.qlower.util;

import java.io.PrintStream;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v / --verbose; DEBUG logs are dropped otherwise.
	public static boolean ENABLE_DEBUG = false;

	// Set while stdout carries machine-readable output; non-error logs then go to stderr.
	public static boolean LOG_TO_STDERR = false;

	public static void logInfo(String log)
	{
		stream().println(ANSI_GREEN + log + ANSI_RESET);
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			stream().println(log);
		}
	}

	public static void logWarning(String log)
	{
		stream().println(ANSI_YELLOW + log + ANSI_RESET);
	}

	public static void logError(String log)
	{
		System.err.println(ANSI_RED + log + ANSI_RESET);
	}

	private static PrintStream stream()
	{
		return LOG_TO_STDERR ? System.err : System.out;
	}
}
