package com.jeffdisher.stash.logic;

import java.nio.file.Path;

import com.jeffdisher.stash.utils.Assert;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * Owns every path the cache uses, relative to the configured root.  No component derives paths on its own.
 * <pre>
 * root/
 *   hash-registry.json
 *   offline-cache/
 *     cache-index.json
 *     {hash}.json
 *   processed/
 *   temp/
 * </pre>
 */
public record CacheLayout(Path root)
{
	public static final String PAYLOAD_DIRECTORY_NAME = "offline-cache";
	public static final String PROCESSED_DIRECTORY_NAME = "processed";
	public static final String TEMP_DIRECTORY_NAME = "temp";
	public static final String INDEX_FILE_NAME = "cache-index.json";
	public static final String REGISTRY_FILE_NAME = "hash-registry.json";
	public static final String PAYLOAD_FILE_EXTENSION = ".json";

	/**
	 * The managed sub-directories of the root.
	 */
	public enum Directory
	{
		PAYLOADS(PAYLOAD_DIRECTORY_NAME),
		PROCESSED(PROCESSED_DIRECTORY_NAME),
		TEMP(TEMP_DIRECTORY_NAME),
		;
		public final String directoryName;
		private Directory(String directoryName)
		{
			this.directoryName = directoryName;
		}
	}

	public CacheLayout
	{
		Assert.assertTrue(null != root);
	}

	public Path directory(Directory directory)
	{
		return root.resolve(directory.directoryName);
	}

	public Path payloadDirectory()
	{
		return directory(Directory.PAYLOADS);
	}

	public Path processedDirectory()
	{
		return directory(Directory.PROCESSED);
	}

	public Path tempDirectory()
	{
		return directory(Directory.TEMP);
	}

	public Path indexFile()
	{
		return payloadDirectory().resolve(INDEX_FILE_NAME);
	}

	public Path registryFile()
	{
		return root.resolve(REGISTRY_FILE_NAME);
	}

	/**
	 * @param hash A payload hash.
	 * @return The file where the payload with this hash is stored.
	 */
	public Path payloadFile(String hash)
	{
		// Callers screen untrusted hashes with isPayloadHash() first so no name can reach the index or leave this directory.
		Assert.assertTrue(MiscHelpers.isPayloadHash(hash));
		return payloadDirectory().resolve(hash + PAYLOAD_FILE_EXTENSION);
	}
}
