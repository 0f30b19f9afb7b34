package com.jeffdisher.stash.data;


/**
 * Field filters for searching the index.  Every non-null field must match for an item to be returned:  source and
 * type are exact matches, the time and size bounds are inclusive.  A filter with all fields null matches everything.
 */
public record SearchFilter(String source
		, String type
		, Long cachedAfterMillis
		, Long cachedBeforeMillis
		, Long minSizeBytes
		, Long maxSizeBytes
)
{
	public static final SearchFilter ALL = new SearchFilter(null, null, null, null, null, null);

	public SearchFilter withSource(String newSource)
	{
		return new SearchFilter(newSource, type, cachedAfterMillis, cachedBeforeMillis, minSizeBytes, maxSizeBytes);
	}

	public SearchFilter withType(String newType)
	{
		return new SearchFilter(source, newType, cachedAfterMillis, cachedBeforeMillis, minSizeBytes, maxSizeBytes);
	}

	public SearchFilter withCachedBetween(Long afterMillis, Long beforeMillis)
	{
		return new SearchFilter(source, type, afterMillis, beforeMillis, minSizeBytes, maxSizeBytes);
	}

	public SearchFilter withSizeBetween(Long minBytes, Long maxBytes)
	{
		return new SearchFilter(source, type, cachedAfterMillis, cachedBeforeMillis, minBytes, maxBytes);
	}

	public boolean matches(IndexItem item)
	{
		return ((null == source) || source.equals(item.source()))
				&& ((null == type) || type.equals(item.type()))
				&& ((null == cachedAfterMillis) || (item.cachedAtMillis() >= cachedAfterMillis))
				&& ((null == cachedBeforeMillis) || (item.cachedAtMillis() <= cachedBeforeMillis))
				&& ((null == minSizeBytes) || (item.sizeBytes() >= minSizeBytes))
				&& ((null == maxSizeBytes) || (item.sizeBytes() <= maxSizeBytes))
		;
	}
}
