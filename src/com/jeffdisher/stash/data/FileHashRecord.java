package com.jeffdisher.stash.data;

import java.util.List;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.Assert;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * "This source file, when last observed, had this content hash, and these cache entries were derived from it."
 * relatedCacheHashes can be empty and is never null.
 */
public record FileHashRecord(String filePath
		, String hash
		, long computedAtMillis
		, List<String> relatedCacheHashes
)
{
	public FileHashRecord
	{
		Assert.assertTrue(null != filePath);
		Assert.assertTrue(null != hash);
		relatedCacheHashes = List.copyOf(relatedCacheHashes);
	}

	public static FileHashRecord fromJson(JsonObject json) throws FailedDeserializationException
	{
		String filePath = JsonFields.requireString(json, "filePath", FileHashRecord.class);
		String hash = JsonFields.requireString(json, "hash", FileHashRecord.class);
		long computedAtMillis = JsonFields.requireTimestamp(json, "computedAt", FileHashRecord.class);
		List<String> related = JsonFields.requireStringList(json, "relatedCacheHashes", FileHashRecord.class);
		return new FileHashRecord(filePath, hash, computedAtMillis, related);
	}

	public JsonObject toJson()
	{
		JsonArray related = new JsonArray();
		for (String cacheHash : relatedCacheHashes)
		{
			related.add(cacheHash);
		}
		return new JsonObject()
			.add("filePath", filePath)
			.add("hash", hash)
			.add("computedAt", MiscHelpers.isoTimestamp(computedAtMillis))
			.add("relatedCacheHashes", related)
		;
	}

	/**
	 * @param newHash The hash observed now.
	 * @param nowMillis The time it was computed.
	 * @return A copy of the receiver with the new hash, keeping the same related entries.
	 */
	public FileHashRecord rehashed(String newHash, long nowMillis)
	{
		return new FileHashRecord(filePath, newHash, nowMillis, relatedCacheHashes);
	}
}
