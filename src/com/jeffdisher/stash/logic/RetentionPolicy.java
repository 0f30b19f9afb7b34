package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.types.ILogger;


/**
 * Age-based expiry:  entries cached more than a fixed window ago are evicted, regardless of size or use.
 */
public class RetentionPolicy
{
	public static final long DEFAULT_RETENTION_MILLIS = 7L * StashConfig.MILLIS_PER_DAY;

	/**
	 * @param item The item.
	 * @param nowMillis The current time.
	 * @return How long ago the item was cached.
	 */
	public static long calculateAge(IndexItem item, long nowMillis)
	{
		return nowMillis - item.cachedAtMillis();
	}

	/**
	 * Describes a duration in the largest whole unit which applies:  "3 days", "1 hour", "0 minutes".
	 * 
	 * @param millis The duration.
	 * @return The human-readable description.
	 */
	public static String formatAge(long millis)
	{
		long days = millis / StashConfig.MILLIS_PER_DAY;
		long hours = millis / StashConfig.MILLIS_PER_HOUR;
		long minutes = millis / StashConfig.MILLIS_PER_MINUTE;
		String text;
		if (days > 0L)
		{
			text = _plural(days, "day");
		}
		else if (hours > 0L)
		{
			text = _plural(hours, "hour");
		}
		else
		{
			text = _plural(minutes, "minute");
		}
		return text;
	}

	private static String _plural(long count, String unit)
	{
		return count + " " + unit + ((1L == count) ? "" : "s");
	}


	private final CacheIndexStore _indexStore;
	private final Evictor _evictor;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	public RetentionPolicy(PayloadStore payloadStore, CacheIndexStore indexStore, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_indexStore = indexStore;
		_evictor = new Evictor(payloadStore, indexStore);
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
	}

	/**
	 * @param maxAgeMillis The retention window.
	 * @return The indexed items cached more than maxAgeMillis ago.
	 */
	public List<IndexItem> getExpiredItems(long maxAgeMillis)
	{
		long now = _currentTimeMillisGenerator.getAsLong();
		List<IndexItem> expired = new ArrayList<>();
		for (IndexItem item : _indexStore.search(SearchFilter.ALL))
		{
			if (calculateAge(item, now) > maxAgeMillis)
			{
				expired.add(item);
			}
		}
		return expired;
	}

	/**
	 * Evicts every expired item.  A failure on one item is recorded and the sweep continues with the next.
	 * 
	 * @param maxAgeMillis The retention window.
	 * @return The result (success only if no item failed).
	 */
	public Result applyRetentionPolicy(long maxAgeMillis)
	{
		ILogger log = _logger.logStart("Applying retention of " + formatAge(maxAgeMillis));
		List<String> errors = new ArrayList<>();
		int removedCount = 0;
		long bytesFreed = 0L;
		long now = _currentTimeMillisGenerator.getAsLong();
		for (IndexItem item : getExpiredItems(maxAgeMillis))
		{
			try
			{
				_evictor.evict(item.hash());
				removedCount += 1;
				bytesFreed += item.sizeBytes();
				log.logVerbose("Expired " + item.hash() + " (" + formatAge(calculateAge(item, now)) + " old)");
			}
			catch (IOException e)
			{
				String message = "Failed to remove " + item.hash() + ": " + e.getLocalizedMessage();
				log.logError(message);
				errors.add(message);
			}
		}
		log.logFinish("Retention removed " + removedCount + " item(s), " + SizePruner.formatBytes(bytesFreed) + " freed");
		return new Result(errors.isEmpty(), removedCount, bytesFreed, errors);
	}


	public static record Result(boolean success, int removedCount, long bytesFreed, List<String> errors)
	{
		public Result
		{
			errors = List.copyOf(errors);
		}
	}
}
