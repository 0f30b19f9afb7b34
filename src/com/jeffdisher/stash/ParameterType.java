package com.jeffdisher.stash;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

import com.jeffdisher.stash.types.UsageException;
import com.jeffdisher.stash.utils.MiscHelpers;


public enum ParameterType
{
	INT("int"
			, (String arg) -> {
				try
				{
					int result = Integer.parseInt(arg);
					if (result < 0)
					{
						throw new UsageException("Value cannot be negative: \"" + result + "\"");
					}
					return result;
				}
				catch (NumberFormatException e)
				{
					throw new UsageException("Not a number: \"" + arg + "\"");
				}
			}
	),
	LONG_BYTES("bytes"
			, (String arg) -> {
				/*
				 * Parses the given number as a long, but also allows for a binary magnitude suffix of "k"/"K" (KiB),
				 * "m"/"M" (MiB), "g"/"G" (GiB), matching how sizes are reported.
				 */
				if (arg.isEmpty())
				{
					throw new UsageException("Not a number: \"\"");
				}
				long magnitude = 1L;
				char lastChar = arg.charAt(arg.length() - 1);
				switch (lastChar)
				{
					case 'k':
					case 'K':
						magnitude = 1024L;
						break;
					case 'm':
					case 'M':
						magnitude = 1024L * 1024L;
						break;
					case 'g':
					case 'G':
						magnitude = 1024L * 1024L * 1024L;
						break;
				}
				String toParse = (1L == magnitude)
						? arg
						: arg.substring(0, arg.length() - 1)
				;
				long result;
				try
				{
					result = Long.parseLong(toParse) * magnitude;
				}
				catch (NumberFormatException e)
				{
					throw new UsageException("Not a number: \"" + arg + "\"");
				}
				if (result < 0L)
				{
					throw new UsageException("Value cannot be negative: \"" + result + "\"");
				}
				return result;
			}
	),
	LONG_MILLIS("millis"
			, (String arg) -> {
				try
				{
					long result = Long.parseLong(arg);
					if (result < 0L)
					{
						throw new UsageException("Value cannot be negative: \"" + result + "\"");
					}
					return result;
				}
				catch (NumberFormatException e)
				{
					throw new UsageException("Not a number: \"" + arg + "\"");
				}
			}
	),
	STRING("string"
			, (String arg) -> arg
	),
	HASH("hash"
			, (String arg) -> {
				if (!MiscHelpers.isPayloadHash(arg))
				{
					throw new UsageException("Not a valid payload hash: \"" + arg + "\"");
				}
				return arg;
			}
	),
	HASH_LIST("hash,hash,..."
			, (String arg) -> {
				String[] hashes = arg.isEmpty()
						? new String[0]
						: arg.split(",")
				;
				for (String hash : hashes)
				{
					if (!MiscHelpers.isPayloadHash(hash))
					{
						throw new UsageException("Not a valid payload hash: \"" + hash + "\"");
					}
				}
				return hashes;
			}
	),
	FILE("file_path"
			, (String arg) -> {
				Path file = _path(arg);
				if (!Files.exists(file))
				{
					throw new UsageException("File does not exist: \"" + arg + "\"");
				}
				if (!Files.isRegularFile(file))
				{
					throw new UsageException("File exists but is not a regular file: \"" + arg + "\"");
				}
				return file;
			}
	),
	PATH("path"
			, (String arg) -> _path(arg)
	),
	;

	private static Path _path(String arg) throws UsageException
	{
		try
		{
			return Path.of(arg).toAbsolutePath();
		}
		catch (InvalidPathException e)
		{
			throw new UsageException("Invalid path: \"" + arg + "\"");
		}
	}


	public final String shortDescription;
	private final Parser<?> _parser;

	private ParameterType(String shortDescription, Parser<?> parser)
	{
		this.shortDescription = shortDescription;
		_parser = parser;
	}

	public <T> T parse(Class<T> clazz, String arg) throws UsageException
	{
		return clazz.cast(_parser.parse(arg));
	}


	private interface Parser<R>
	{
		R parse(String arg) throws UsageException;
	}
}
