package com.jeffdisher.stash.data;


/**
 * Size accounting from the index.  largestItemHash is null when the index is empty.
 */
public record CacheSizeInfo(long totalBytes
		, int itemCount
		, String largestItemHash
		, long largestItemBytes
		, long averageItemSize
)
{
}
