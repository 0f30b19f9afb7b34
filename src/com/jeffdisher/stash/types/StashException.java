package com.jeffdisher.stash.types;


/**
 * Superclass of all Stash's checked exceptions.
 */
public class StashException extends Exception
{
	private static final long serialVersionUID = 1L;

	public StashException(String message)
	{
		super(message);
	}

	public StashException(String message, Exception cause)
	{
		super(message, cause);
	}
}
