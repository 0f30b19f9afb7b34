package com.jeffdisher.stash.utils;


/**
 * Assertion helpers which can't be disabled at runtime.
 * These are for states which the code statically believes impossible:  they surface as AssertionError so they can
 * never be confused with an ordinary "not found" or I/O failure result.
 */
public class Assert
{
	/**
	 * Called when an exception was not expected (a missing JDK algorithm, for example).
	 * 
	 * @param e The unexpected exception.
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unexpected(Exception e)
	{
		throw new AssertionError("Unexpected exception", e);
	}

	/**
	 * States that something must be true, failing if it isn't.
	 * 
	 * @param flag The statement which must be true.
	 */
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Expected true");
		}
	}
}
