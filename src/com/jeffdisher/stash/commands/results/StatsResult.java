package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;
import java.util.Map;
import java.util.TreeMap;

import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.data.CacheSizeInfo;
import com.jeffdisher.stash.data.CacheStats;
import com.jeffdisher.stash.logic.SizePruner;
import com.jeffdisher.stash.utils.MiscHelpers;


public record StatsResult(CacheStats stats, CacheSizeInfo sizeInfo) implements ICommand.Result
{
	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println("Items: " + this.stats.totalItems() + " (" + SizePruner.formatBytes(this.stats.totalSizeBytes()) + ")");
		if (this.stats.totalItems() > 0)
		{
			output.println("Oldest: " + MiscHelpers.isoTimestamp(this.stats.oldestCachedAtMillis()));
			output.println("Newest: " + MiscHelpers.isoTimestamp(this.stats.newestCachedAtMillis()));
			output.println("Largest: " + this.sizeInfo.largestItemHash() + " (" + SizePruner.formatBytes(this.sizeInfo.largestItemBytes()) + ")");
			output.println("Average: " + SizePruner.formatBytes(this.sizeInfo.averageItemSize()));
		}
		_writeCounts(output, "By source", this.stats.bySource());
		_writeCounts(output, "By type", this.stats.byType());
	}

	private static void _writeCounts(PrintStream output, String title, Map<String, Integer> counts)
	{
		output.println(title + ":");
		// Sorted for stable output.
		for (Map.Entry<String, Integer> entry : new TreeMap<>(counts).entrySet())
		{
			output.println("\t" + entry.getKey() + ": " + entry.getValue());
		}
	}
}
