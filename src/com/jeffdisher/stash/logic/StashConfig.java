package com.jeffdisher.stash.logic;

import java.nio.file.Path;

import com.jeffdisher.stash.utils.Assert;


/**
 * The explicit configuration of a cache instance.  Nothing is resolved from ambient state:  the root path and every
 * policy window come from here.
 */
public record StashConfig(Path rootPath
		, long retentionMillis
		, long sizeThresholdBytes
		, int minItemsToKeep
		, long stalenessMillis
		, long changeDetectionIntervalMillis
		, long tempMaxAgeMillis
)
{
	public static final long MILLIS_PER_MINUTE = 60_000L;
	public static final long MILLIS_PER_HOUR = 60L * MILLIS_PER_MINUTE;
	public static final long MILLIS_PER_DAY = 24L * MILLIS_PER_HOUR;

	public static final long DEFAULT_CHANGE_DETECTION_INTERVAL_MILLIS = 5L * MILLIS_PER_MINUTE;
	public static final long DEFAULT_TEMP_MAX_AGE_MILLIS = MILLIS_PER_DAY;

	public StashConfig
	{
		Assert.assertTrue(null != rootPath);
		Assert.assertTrue(retentionMillis >= 0L);
		Assert.assertTrue(sizeThresholdBytes >= 0L);
		Assert.assertTrue(minItemsToKeep >= 0);
		Assert.assertTrue(stalenessMillis >= 0L);
		Assert.assertTrue(changeDetectionIntervalMillis > 0L);
		Assert.assertTrue(tempMaxAgeMillis >= 0L);
	}

	public static StashConfig defaults(Path rootPath)
	{
		return new StashConfig(rootPath
				, RetentionPolicy.DEFAULT_RETENTION_MILLIS
				, SizePruner.DEFAULT_SIZE_THRESHOLD_BYTES
				, SizePruner.DEFAULT_MIN_ITEMS_TO_KEEP
				, StalenessRefresher.DEFAULT_STALENESS_MILLIS
				, DEFAULT_CHANGE_DETECTION_INTERVAL_MILLIS
				, DEFAULT_TEMP_MAX_AGE_MILLIS
		);
	}
}
