package com.jeffdisher.stash.types;


/**
 * Thrown when a command was given arguments which parsed but can't be acted upon (a missing file, a negative number,
 * an unknown hash format, etc).
 */
public class UsageException extends StashException
{
	private static final long serialVersionUID = 1L;

	public UsageException(String message)
	{
		super(message);
	}
}
