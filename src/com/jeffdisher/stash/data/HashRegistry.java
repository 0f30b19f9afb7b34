package com.jeffdisher.stash.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * The in-memory form of "hash-registry.json":  the tracked source files, unique by path, in registration order.
 */
public class HashRegistry
{
	public static final String CURRENT_VERSION = "1.0.0";

	public static HashRegistry empty(long nowMillis)
	{
		return new HashRegistry(CURRENT_VERSION, nowMillis);
	}

	public static HashRegistry fromJson(JsonObject json) throws FailedDeserializationException
	{
		String version = JsonFields.requireString(json, "version", HashRegistry.class);
		long updatedAtMillis = JsonFields.requireTimestamp(json, "updatedAt", HashRegistry.class);
		HashRegistry registry = new HashRegistry(version, updatedAtMillis);
		for (JsonValue element : JsonFields.requireArray(json, "files", HashRegistry.class))
		{
			FileHashRecord record = FileHashRecord.fromJson(JsonFields.requireObjectElement(element, HashRegistry.class));
			registry._files.put(record.filePath(), record);
		}
		return registry;
	}


	private final String _version;
	private long _updatedAtMillis;
	private final Map<String, FileHashRecord> _files;

	private HashRegistry(String version, long updatedAtMillis)
	{
		_version = version;
		_updatedAtMillis = updatedAtMillis;
		_files = new LinkedHashMap<>();
	}

	public String getVersion()
	{
		return _version;
	}

	public long getUpdatedAtMillis()
	{
		return _updatedAtMillis;
	}

	public void markUpdated(long nowMillis)
	{
		_updatedAtMillis = nowMillis;
	}

	public List<FileHashRecord> getFiles()
	{
		return new ArrayList<>(_files.values());
	}

	public FileHashRecord getFile(String filePath)
	{
		return _files.get(filePath);
	}

	/**
	 * Inserts the record or replaces the existing record for the same path (in place).
	 */
	public void putFile(FileHashRecord record)
	{
		_files.put(record.filePath(), record);
	}

	public FileHashRecord removeFile(String filePath)
	{
		return _files.remove(filePath);
	}

	public JsonObject toJson()
	{
		JsonArray files = new JsonArray();
		for (FileHashRecord record : _files.values())
		{
			files.add(record.toJson());
		}
		return new JsonObject()
			.add("version", _version)
			.add("updatedAt", MiscHelpers.isoTimestamp(_updatedAtMillis))
			.add("files", files)
		;
	}
}
