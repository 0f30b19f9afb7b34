package com.jeffdisher.stash.data;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.Assert;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * The index's record of one stored payload.
 * lastAccessedMillis is 0 for an item which was never accessed after being indexed.  metadata may be null.
 */
public record IndexItem(String hash
		, String source
		, String type
		, long cachedAtMillis
		, long lastAccessedMillis
		, long sizeBytes
		, int accessCount
		, JsonObject metadata
)
{
	public IndexItem
	{
		Assert.assertTrue(null != hash);
		Assert.assertTrue(null != source);
		Assert.assertTrue(null != type);
		Assert.assertTrue(lastAccessedMillis >= 0L);
	}

	/**
	 * Creates the initial index record for a payload which was just stored.
	 * 
	 * @param payload The stored payload.
	 * @param sizeBytes The size of its file on disk.
	 * @return The new record (accessed once, at store time, but never touched since).
	 */
	public static IndexItem forPayload(CachedPayload payload, long sizeBytes)
	{
		return forPayload(payload, sizeBytes, 0L);
	}

	/**
	 * Creates the index record for a payload which is being registered again.
	 * 
	 * @param payload The stored payload.
	 * @param sizeBytes The size of its file on disk.
	 * @param lastAccessedMillis When it was registered again (0 if this is the first registration).
	 * @return The new record, with an access count of 1.
	 */
	public static IndexItem forPayload(CachedPayload payload, long sizeBytes, long lastAccessedMillis)
	{
		return new IndexItem(payload.hash(), payload.source(), payload.type(), payload.cachedAtMillis(), lastAccessedMillis, sizeBytes, 1, payload.metadata());
	}

	public static IndexItem fromJson(JsonObject json) throws FailedDeserializationException
	{
		String hash = JsonFields.requireString(json, "hash", IndexItem.class);
		String source = JsonFields.requireString(json, "source", IndexItem.class);
		String type = JsonFields.requireString(json, "type", IndexItem.class);
		long cachedAtMillis = JsonFields.requireTimestamp(json, "cachedAt", IndexItem.class);
		long lastAccessedMillis = JsonFields.optionalTimestamp(json, "lastAccessedAt", IndexItem.class);
		long sizeBytes = JsonFields.requireLong(json, "sizeBytes", IndexItem.class);
		int accessCount = (int) JsonFields.requireLong(json, "accessCount", IndexItem.class);
		JsonObject metadata = JsonFields.optionalObject(json, "metadata", IndexItem.class);
		return new IndexItem(hash, source, type, cachedAtMillis, lastAccessedMillis, sizeBytes, accessCount, metadata);
	}

	public JsonObject toJson()
	{
		JsonObject json = new JsonObject()
			.add("hash", hash)
			.add("source", source)
			.add("type", type)
			.add("cachedAt", MiscHelpers.isoTimestamp(cachedAtMillis))
		;
		if (wasAccessed())
		{
			json.add("lastAccessedAt", MiscHelpers.isoTimestamp(lastAccessedMillis));
		}
		json.add("sizeBytes", sizeBytes);
		json.add("accessCount", accessCount);
		if (null != metadata)
		{
			json.add("metadata", metadata);
		}
		return json;
	}

	/**
	 * @return True if the item was touched at least once since it was indexed.
	 */
	public boolean wasAccessed()
	{
		return (lastAccessedMillis > 0L);
	}

	/**
	 * @return The last time the item was used:  its last access or, if it was never accessed, when it was cached.
	 */
	public long lastUsedMillis()
	{
		return wasAccessed() ? lastAccessedMillis : cachedAtMillis;
	}

	/**
	 * @param nowMillis The access time.
	 * @return A copy of the receiver recording one more access, at nowMillis.
	 */
	public IndexItem touched(long nowMillis)
	{
		return new IndexItem(hash, source, type, cachedAtMillis, nowMillis, sizeBytes, accessCount + 1, metadata);
	}

	/**
	 * @param newSizeBytes The corrected size.
	 * @return A copy of the receiver with the given size.
	 */
	public IndexItem withSize(long newSizeBytes)
	{
		return new IndexItem(hash, source, type, cachedAtMillis, lastAccessedMillis, newSizeBytes, accessCount, metadata);
	}
}
