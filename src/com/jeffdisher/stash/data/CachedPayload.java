package com.jeffdisher.stash.data;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.Assert;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * A single stored payload, as written to "{hash}.json" in the payload directory.
 * Instances are immutable once written and are identified by their hash, which is derived from data alone (source,
 * type and metadata don't contribute to it).
 * metadata may be null.
 */
public record CachedPayload(String hash
		, JsonValue data
		, String source
		, String type
		, long cachedAtMillis
		, JsonObject metadata
)
{
	public CachedPayload
	{
		Assert.assertTrue(null != hash);
		Assert.assertTrue(null != data);
		Assert.assertTrue(null != source);
		Assert.assertTrue(null != type);
	}

	/**
	 * Creates an instance from its JSON representation, as loaded from disk.
	 * 
	 * @param json The JSON object.
	 * @return The new CachedPayload instance.
	 * @throws FailedDeserializationException The object is missing required fields or has the wrong value types.
	 */
	public static CachedPayload fromJson(JsonObject json) throws FailedDeserializationException
	{
		String hash = JsonFields.requireString(json, "hash", CachedPayload.class);
		JsonValue data = json.get("data");
		if (null == data)
		{
			throw new FailedDeserializationException(CachedPayload.class, "missing \"data\"");
		}
		String source = JsonFields.requireString(json, "source", CachedPayload.class);
		String type = JsonFields.requireString(json, "type", CachedPayload.class);
		long cachedAtMillis = JsonFields.requireTimestamp(json, "cachedAt", CachedPayload.class);
		JsonObject metadata = JsonFields.optionalObject(json, "metadata", CachedPayload.class);
		return new CachedPayload(hash, data, source, type, cachedAtMillis, metadata);
	}

	/**
	 * @return The receiver, encoded as a JSON object (metadata is omitted when null).
	 */
	public JsonObject toJson()
	{
		JsonObject json = new JsonObject()
			.add("hash", hash)
			.add("data", data)
			.add("source", source)
			.add("type", type)
			.add("cachedAt", MiscHelpers.isoTimestamp(cachedAtMillis))
		;
		if (null != metadata)
		{
			json.add("metadata", metadata);
		}
		return json;
	}
}
