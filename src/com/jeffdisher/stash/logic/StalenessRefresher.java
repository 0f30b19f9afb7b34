package com.jeffdisher.stash.logic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.types.ILogger;


/**
 * Decides which cached items are worth proactively refreshing and in what order, handing each one to a
 * caller-supplied refresh function.
 * The priority score is the sum of 3 terms:
 * -usage:  10 per access
 * -age:  100, minus 10 for each day the item is past the staleness threshold (floor of 0)
 * -size:  50, minus 5 for each MiB of the item (floor of 0)
 * So small, hot items come first and very old, large, cold items come last.
 */
public class StalenessRefresher
{
	public static final long DEFAULT_STALENESS_MILLIS = 24L * StashConfig.MILLIS_PER_HOUR;

	private static final double ACCESS_WEIGHT = 10.0;
	private static final double AGE_BASE = 100.0;
	private static final double AGE_PENALTY_PER_DAY = 10.0;
	private static final double SIZE_BASE = 50.0;
	private static final double SIZE_PENALTY_PER_MIB = 5.0;
	private static final double BYTES_PER_MIB = 1024.0 * 1024.0;

	/**
	 * @param item The item.
	 * @param thresholdMillis The staleness threshold.
	 * @param nowMillis The current time.
	 * @return True if the item was cached more than thresholdMillis ago.
	 */
	public static boolean isStale(IndexItem item, long thresholdMillis, long nowMillis)
	{
		return (nowMillis - item.cachedAtMillis()) > thresholdMillis;
	}

	/**
	 * @param item The item.
	 * @param thresholdMillis The staleness threshold (age up to this point costs nothing).
	 * @param nowMillis The current time.
	 * @return The refresh priority score (higher is more urgent).
	 */
	public static double calculateRefreshPriority(IndexItem item, long thresholdMillis, long nowMillis)
	{
		long ageMillis = nowMillis - item.cachedAtMillis();
		double daysBeyondThreshold = (double) Math.max(0L, ageMillis - thresholdMillis) / (double) StashConfig.MILLIS_PER_DAY;
		double sizeMib = (double) item.sizeBytes() / BYTES_PER_MIB;
		double usage = ACCESS_WEIGHT * item.accessCount();
		double age = Math.max(0.0, AGE_BASE - (AGE_PENALTY_PER_DAY * daysBeyondThreshold));
		double size = Math.max(0.0, SIZE_BASE - (SIZE_PENALTY_PER_MIB * sizeMib));
		return usage + age + size;
	}


	private final CacheIndexStore _indexStore;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	public StalenessRefresher(CacheIndexStore indexStore, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_indexStore = indexStore;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
	}

	/**
	 * @param item The item.
	 * @return The refresh priority of the item now, against the default staleness threshold.
	 */
	public double calculateRefreshPriority(IndexItem item)
	{
		return calculateRefreshPriority(item, DEFAULT_STALENESS_MILLIS, _currentTimeMillisGenerator.getAsLong());
	}

	/**
	 * @param thresholdMillis The staleness threshold.
	 * @return The indexed items which are stale now.
	 */
	public List<IndexItem> getStaleItems(long thresholdMillis)
	{
		long now = _currentTimeMillisGenerator.getAsLong();
		List<IndexItem> stale = new ArrayList<>();
		for (IndexItem item : _indexStore.search(SearchFilter.ALL))
		{
			if (isStale(item, thresholdMillis, now))
			{
				stale.add(item);
			}
		}
		return stale;
	}

	/**
	 * Sorts the items by descending priority.  Items with equal scores keep their relative order.
	 * 
	 * @param items The items to sort (not modified).
	 * @param thresholdMillis The staleness threshold used for the age term.
	 * @return A new list, highest priority first.
	 */
	public List<IndexItem> sortByRefreshPriority(List<IndexItem> items, long thresholdMillis)
	{
		// Score everything against the same "now" so the ordering is consistent.
		long now = _currentTimeMillisGenerator.getAsLong();
		Map<String, Double> scores = new HashMap<>();
		for (IndexItem item : items)
		{
			scores.put(item.hash(), calculateRefreshPriority(item, thresholdMillis, now));
		}
		List<IndexItem> sorted = new ArrayList<>(items);
		sorted.sort((IndexItem arg0, IndexItem arg1) -> Double.compare(scores.get(arg1.hash()), scores.get(arg0.hash())));
		return sorted;
	}

	public List<IndexItem> sortByRefreshPriority(List<IndexItem> items)
	{
		return sortByRefreshPriority(items, DEFAULT_STALENESS_MILLIS);
	}

	/**
	 * Hands every stale item, highest priority first, to the refresh function.  A failure (exception or null result)
	 * is recorded for that item and the batch continues.  Each successfully refreshed item is touched in the index.
	 * The new data is only returned:  storing it (under its new hash) is up to the caller.
	 * 
	 * @param thresholdMillis The staleness threshold.
	 * @param refreshFunction The caller's refresh logic.
	 * @return One outcome per stale item, in the order they were refreshed.
	 */
	public List<Outcome> refreshStaleItems(long thresholdMillis, IRefreshFunction refreshFunction)
	{
		List<IndexItem> stale = sortByRefreshPriority(getStaleItems(thresholdMillis), thresholdMillis);
		ILogger log = _logger.logStart("Refreshing " + stale.size() + " stale item(s)");
		List<Outcome> outcomes = new ArrayList<>();
		int failures = 0;
		for (IndexItem item : stale)
		{
			Outcome outcome;
			try
			{
				JsonValue data = refreshFunction.refresh(item);
				if (null != data)
				{
					_indexStore.touch(item.hash());
					outcome = new Outcome(item.hash(), true, data, null);
				}
				else
				{
					outcome = new Outcome(item.hash(), false, null, "Refresh produced no data");
				}
			}
			catch (Exception e)
			{
				// The callback is foreign code:  any failure is reported against this item only.
				outcome = new Outcome(item.hash(), false, null, String.valueOf(e.getLocalizedMessage()));
			}
			if (!outcome.success())
			{
				log.logWarning("Refresh failed for " + item.hash() + ": " + outcome.error());
				failures += 1;
			}
			outcomes.add(outcome);
		}
		log.logFinish("Refreshed " + (outcomes.size() - failures) + " item(s), " + failures + " failure(s)");
		return outcomes;
	}


	/**
	 * The outcome of refreshing one item.  data is only non-null on success, error only on failure.
	 */
	public static record Outcome(String hash, boolean success, JsonValue data, String error)
	{
	}
}
