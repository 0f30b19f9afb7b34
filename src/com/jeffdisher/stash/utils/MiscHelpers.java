package com.jeffdisher.stash.utils;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.format.DateTimeParseException;


/**
 * Basic utilities for miscellaneous uses.
 */
public class MiscHelpers
{
	private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();
	private static final int SHA256_BYTES = 32;

	/**
	 * Computes the SHA-256 digest of the given bytes, as lower-case hex.
	 * 
	 * @param data The bytes to hash.
	 * @return The 64-character hex digest.
	 */
	public static String sha256Hex(byte[] data)
	{
		MessageDigest digest;
		try
		{
			digest = MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e)
		{
			// Every JDK is required to provide SHA-256.
			throw Assert.unexpected(e);
		}
		byte[] raw = digest.digest(data);
		char[] hex = new char[raw.length * 2];
		for (int i = 0; i < raw.length; ++i)
		{
			int value = raw[i] & 0xFF;
			hex[2 * i] = HEX_DIGITS[value >>> 4];
			hex[2 * i + 1] = HEX_DIGITS[value & 0x0F];
		}
		return new String(hex);
	}

	/**
	 * @param candidate A string which may be a payload hash (can be null).
	 * @return True if it is the shape of a sha256Hex() result:  64 lower-case hex digits.
	 */
	public static boolean isPayloadHash(String candidate)
	{
		boolean isHash = (null != candidate) && (2 * SHA256_BYTES == candidate.length());
		for (int i = 0; isHash && (i < candidate.length()); ++i)
		{
			char c = candidate.charAt(i);
			isHash = ((c >= '0') && (c <= '9')) || ((c >= 'a') && (c <= 'f'));
		}
		return isHash;
	}

	/**
	 * @param millis Milliseconds since the epoch.
	 * @return The ISO-8601 UTC representation used in all on-disk documents.
	 */
	public static String isoTimestamp(long millis)
	{
		return Instant.ofEpochMilli(millis).toString();
	}

	/**
	 * @param timestamp An ISO-8601 UTC timestamp.
	 * @return The timestamp as milliseconds since the epoch, or -1 if it couldn't be parsed.
	 */
	public static long parseIsoTimestamp(String timestamp)
	{
		try
		{
			return Instant.parse(timestamp).toEpochMilli();
		}
		catch (DateTimeParseException e)
		{
			return -1L;
		}
	}

	/**
	 * Creates a named daemon thread running the given runnable.  The thread is not started.
	 * 
	 * @param runnable The body of the thread.
	 * @param name The name, for debugging.
	 * @return The new, unstarted, thread.
	 */
	public static Thread createThread(Runnable runnable, String name)
	{
		Thread thread = new Thread(runnable, name);
		// Background ticks must never keep the JVM alive on their own.
		thread.setDaemon(true);
		return thread;
	}
}
