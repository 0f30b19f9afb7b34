package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.data.CachedPayload;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.types.ILogger;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * Content-addressed storage of individual payloads, one "{hash}.json" file each, in the payload directory.
 * This knows nothing about the index:  callers are responsible for registering what they save.
 * No public method throws for I/O problems:  they are reported through the result or as a sentinel.
 * A hash which isn't 64 lower-case hex digits can't name a stored payload so it is treated as not stored.
 */
public class PayloadStore
{
	/**
	 * Hashes the canonical form of the content:  a JSON string hashes as its raw text, anything else as its compact
	 * JSON serialization.
	 * 
	 * @param content The content to hash.
	 * @return The lower-case hex SHA-256 of the canonical form.
	 */
	public static String hash(JsonValue content)
	{
		String canonical = content.isString()
				? content.asString()
				: content.toString()
		;
		return hash(canonical);
	}

	/**
	 * @param content Text content.
	 * @return The lower-case hex SHA-256 of the UTF-8 bytes of the text.
	 */
	public static String hash(String content)
	{
		return MiscHelpers.sha256Hex(content.getBytes(StandardCharsets.UTF_8));
	}


	private final CacheLayout _layout;
	private final IStorageFileSystem _fileSystem;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	public PayloadStore(CacheLayout layout, IStorageFileSystem fileSystem, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_layout = layout;
		_fileSystem = fileSystem;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
	}

	/**
	 * Stores the payload unless a payload with the same content hash is already stored, in which case the existing
	 * file is left untouched (including its source, type, and cachedAt).
	 * 
	 * @param data The content to store.
	 * @param source Where the content came from.
	 * @param type The kind of content.
	 * @param metadata Optional additional data (can be null).
	 * @return The result, which always carries the hash and target file.
	 */
	public SaveResult save(JsonValue data, String source, String type, JsonObject metadata)
	{
		String hash = hash(data);
		Path file = _layout.payloadFile(hash);
		SaveResult result;
		if (_fileSystem.exists(file))
		{
			_logger.logVerbose("Payload already stored: " + hash);
			result = new SaveResult(true, hash, file, null);
		}
		else
		{
			CachedPayload payload = new CachedPayload(hash, data, source, type, _currentTimeMillisGenerator.getAsLong(), metadata);
			try
			{
				_fileSystem.writeFile(file, JsonDocuments.encode(payload.toJson()));
				_logger.logVerbose("Stored payload " + hash + " (" + source + "/" + type + ")");
				result = new SaveResult(true, hash, file, null);
			}
			catch (IOException e)
			{
				String message = "Failed to write payload " + hash + ": " + e.getLocalizedMessage();
				_logger.logError(message);
				result = new SaveResult(false, hash, file, message);
			}
		}
		return result;
	}

	/**
	 * @param hash The payload hash.
	 * @return The loaded payload, or a failed result if it isn't stored or can't be decoded.
	 */
	public LoadResult load(String hash)
	{
		LoadResult result;
		try
		{
			byte[] raw = MiscHelpers.isPayloadHash(hash)
					? _fileSystem.readFile(_layout.payloadFile(hash))
					: null
			;
			if (null == raw)
			{
				result = new LoadResult(false, null, "Payload not found: " + hash);
			}
			else
			{
				JsonObject json = JsonDocuments.decodeObject(raw);
				if (null == json)
				{
					result = new LoadResult(false, null, "Payload is not valid JSON: " + hash);
				}
				else
				{
					result = new LoadResult(true, CachedPayload.fromJson(json), null);
				}
			}
		}
		catch (FailedDeserializationException e)
		{
			result = new LoadResult(false, null, "Payload is malformed: " + hash + ": " + e.getLocalizedMessage());
		}
		catch (IOException e)
		{
			String message = "Failed to read payload " + hash + ": " + e.getLocalizedMessage();
			_logger.logError(message);
			result = new LoadResult(false, null, message);
		}
		return result;
	}

	/**
	 * @param hash The payload hash.
	 * @return True if the payload file was deleted, false if it didn't exist or couldn't be deleted.
	 */
	public boolean delete(String hash)
	{
		boolean didDelete;
		try
		{
			didDelete = deleteIfPresent(hash);
		}
		catch (IOException e)
		{
			_logger.logError("Failed to delete payload " + hash + ": " + e.getLocalizedMessage());
			didDelete = false;
		}
		return didDelete;
	}

	public boolean exists(String hash)
	{
		return MiscHelpers.isPayloadHash(hash)
				&& _fileSystem.exists(_layout.payloadFile(hash))
		;
	}

	/**
	 * @param hash The payload hash.
	 * @return The size of the payload file in bytes, or -1 if it isn't stored or can't be inspected.
	 */
	public long size(String hash)
	{
		long size;
		try
		{
			size = MiscHelpers.isPayloadHash(hash)
					? _fileSystem.fileSize(_layout.payloadFile(hash))
					: -1L
			;
		}
		catch (IOException e)
		{
			_logger.logWarning("Failed to read size of payload " + hash + ": " + e.getLocalizedMessage());
			size = -1L;
		}
		return size;
	}

	/**
	 * @return The hashes of every payload file currently on disk (empty if the directory can't be listed).
	 */
	public List<String> listAll()
	{
		List<String> hashes = new ArrayList<>();
		try
		{
			for (Path file : _fileSystem.listFiles(_layout.payloadDirectory()))
			{
				String name = file.getFileName().toString();
				if (name.endsWith(CacheLayout.PAYLOAD_FILE_EXTENSION))
				{
					String hash = name.substring(0, name.length() - CacheLayout.PAYLOAD_FILE_EXTENSION.length());
					// This also skips the index, which shares the directory.
					if (MiscHelpers.isPayloadHash(hash))
					{
						hashes.add(hash);
					}
				}
			}
		}
		catch (IOException e)
		{
			_logger.logWarning("Cannot list payload directory: " + e.getLocalizedMessage());
		}
		return hashes;
	}

	// Used by the eviction paths, which need to distinguish "already gone" from a real failure.
	boolean deleteIfPresent(String hash) throws IOException
	{
		return MiscHelpers.isPayloadHash(hash)
				&& _fileSystem.deleteFile(_layout.payloadFile(hash))
		;
	}


	/**
	 * The outcome of a save.  error is only non-null on failure.
	 */
	public static record SaveResult(boolean success, String hash, Path filePath, String error)
	{
	}

	/**
	 * The outcome of a load.  payload is only non-null on success, error only on failure.
	 */
	public static record LoadResult(boolean success, CachedPayload payload, String error)
	{
	}
}
