package com.jeffdisher.stash.commands;

import java.util.List;

import com.jeffdisher.stash.commands.results.ItemList;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.logic.StalenessRefresher;


/**
 * Lists the stale items in the order they should be refreshed.  Nothing is refreshed since that needs the
 * application which produced them.
 */
public record ListStaleCommand(long thresholdMillis) implements ICommand<ItemList>
{
	@Override
	public ItemList runInContext(Context context)
	{
		StalenessRefresher refresher = context.engine.getStalenessRefresher();
		List<IndexItem> stale = refresher.sortByRefreshPriority(refresher.getStaleItems(thresholdMillis), thresholdMillis);
		return new ItemList("Stale", context.currentTimeMillisGenerator.getAsLong(), stale);
	}
}
