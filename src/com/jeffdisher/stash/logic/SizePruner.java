package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.jeffdisher.stash.data.CacheSizeInfo;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.types.ILogger;


/**
 * Size-based eviction:  the least-recently-used items are evicted until the total indexed size is under a
 * threshold.  The most-recently-used minKeep items are never candidates, even if the threshold can't be reached
 * without them.
 */
public class SizePruner
{
	public static final long DEFAULT_SIZE_THRESHOLD_BYTES = 100L * 1024L * 1024L;
	public static final int DEFAULT_MIN_ITEMS_TO_KEEP = 10;

	private static final String[] UNITS = new String[] { "B", "KB", "MB", "GB", "TB" };

	/**
	 * Ascending by the time each item was last used (an item never accessed was last used when it was cached), with
	 * ties broken by cachedAt.
	 */
	public static final Comparator<IndexItem> LEAST_RECENTLY_USED_FIRST = new Comparator<>() {
		@Override
		public int compare(IndexItem arg0, IndexItem arg1)
		{
			int compare = Long.compare(arg0.lastUsedMillis(), arg1.lastUsedMillis());
			if (0 == compare)
			{
				compare = Long.compare(arg0.cachedAtMillis(), arg1.cachedAtMillis());
			}
			return compare;
		}
	};

	/**
	 * Formats a byte count with 1024-based units, with at most 2 decimal places:  "0 B", "512 B", "1 KB", "1.5 MB".
	 * 
	 * @param bytes The byte count.
	 * @return The human-readable size.
	 */
	public static String formatBytes(long bytes)
	{
		int unit = 0;
		BigDecimal divisor = BigDecimal.ONE;
		BigDecimal step = BigDecimal.valueOf(1024L);
		while ((unit < (UNITS.length - 1)) && (bytes >= divisor.multiply(step).longValue()))
		{
			divisor = divisor.multiply(step);
			unit += 1;
		}
		BigDecimal value = BigDecimal.valueOf(bytes).divide(divisor, 2, RoundingMode.HALF_UP).stripTrailingZeros();
		return value.toPlainString() + " " + UNITS[unit];
	}


	private final CacheIndexStore _indexStore;
	private final Evictor _evictor;
	private final ILogger _logger;

	public SizePruner(PayloadStore payloadStore, CacheIndexStore indexStore, ILogger logger)
	{
		_indexStore = indexStore;
		_evictor = new Evictor(payloadStore, indexStore);
		_logger = logger;
	}

	/**
	 * @return The size accounting, from the index.
	 */
	public CacheSizeInfo getCacheSizeInfo()
	{
		return _sizeInfo(_indexStore.search(SearchFilter.ALL));
	}

	/**
	 * @param minKeep The number of most-recently-used items which are never candidates.
	 * @return The eviction candidates, least-recently-used first.
	 */
	public List<IndexItem> getPruneableItems(int minKeep)
	{
		List<IndexItem> items = _indexStore.search(SearchFilter.ALL);
		items.sort(LEAST_RECENTLY_USED_FIRST);
		int candidateCount = Math.max(0, items.size() - minKeep);
		return new ArrayList<>(items.subList(0, candidateCount));
	}

	/**
	 * Evicts candidates, least-recently-used first, until the indexed total is at or under the threshold or there
	 * are no candidates left.  Running out of candidates is not an error.
	 * An index entry whose payload file is already gone is still evicted and counted.
	 * 
	 * @param thresholdBytes The target total size.
	 * @param minKeep The number of most-recently-used items to keep.
	 * @return The result (success only if no eviction failed).
	 */
	public Result pruneCacheLRU(long thresholdBytes, int minKeep)
	{
		long currentSize = getCacheSizeInfo().totalBytes();
		List<String> errors = new ArrayList<>();
		int removedCount = 0;
		long bytesFreed = 0L;
		if (currentSize > thresholdBytes)
		{
			ILogger log = _logger.logStart("Pruning " + formatBytes(currentSize) + " down to " + formatBytes(thresholdBytes));
			for (IndexItem item : getPruneableItems(minKeep))
			{
				if (currentSize <= thresholdBytes)
				{
					break;
				}
				try
				{
					_evictor.evict(item.hash());
					removedCount += 1;
					bytesFreed += item.sizeBytes();
					currentSize -= item.sizeBytes();
					log.logVerbose("Pruned " + item.hash() + " (" + formatBytes(item.sizeBytes()) + ")");
				}
				catch (IOException e)
				{
					String message = "Failed to prune " + item.hash() + ": " + e.getLocalizedMessage();
					log.logError(message);
					errors.add(message);
				}
			}
			if (currentSize > thresholdBytes)
			{
				log.logWarning("Threshold not reached while keeping " + minKeep + " item(s)");
			}
			log.logFinish("Pruned " + removedCount + " item(s), " + formatBytes(bytesFreed) + " freed, now " + formatBytes(currentSize));
		}
		return new Result(errors.isEmpty(), removedCount, bytesFreed, currentSize, thresholdBytes, errors);
	}


	private static CacheSizeInfo _sizeInfo(List<IndexItem> items)
	{
		long total = 0L;
		IndexItem largest = null;
		for (IndexItem item : items)
		{
			total += item.sizeBytes();
			if ((null == largest) || (item.sizeBytes() > largest.sizeBytes()))
			{
				largest = item;
			}
		}
		long average = items.isEmpty() ? 0L : (total / items.size());
		return (null != largest)
				? new CacheSizeInfo(total, items.size(), largest.hash(), largest.sizeBytes(), average)
				: new CacheSizeInfo(0L, 0, null, 0L, 0L)
		;
	}


	/**
	 * The outcome of a prune.  currentSizeBytes is the indexed total after the prune.
	 */
	public static record Result(boolean success, int removedCount, long bytesFreed, long currentSizeBytes, long thresholdBytes, List<String> errors)
	{
		public Result
		{
			errors = List.copyOf(errors);
		}
	}
}
