package com.jeffdisher.stash.types;


/**
 * Thrown when a JSON document on disk parsed as JSON but didn't have the shape of the type we were trying to decode
 * (missing fields, wrong value types, etc).
 */
public class FailedDeserializationException extends StashException
{
	private static final long serialVersionUID = 1L;

	public FailedDeserializationException(Class<?> expectedType, String detail)
	{
		super("Data could not be deserialized as " + expectedType.getSimpleName() + ": " + detail);
	}
}
