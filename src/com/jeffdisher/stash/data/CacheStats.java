package com.jeffdisher.stash.data;

import java.util.Map;


/**
 * Aggregate statistics derived purely from the index (never from scanning the payload directory).
 * The oldest/newest timestamps are 0 when the index is empty.
 */
public record CacheStats(int totalItems
		, long totalSizeBytes
		, long oldestCachedAtMillis
		, long newestCachedAtMillis
		, Map<String, Integer> bySource
		, Map<String, Integer> byType
)
{
	public CacheStats
	{
		bySource = Map.copyOf(bySource);
		byType = Map.copyOf(byType);
	}
}
