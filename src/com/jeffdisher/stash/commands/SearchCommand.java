package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.ItemList;
import com.jeffdisher.stash.data.SearchFilter;


public record SearchCommand(SearchFilter filter) implements ICommand<ItemList>
{
	@Override
	public ItemList runInContext(Context context)
	{
		return new ItemList("Match", context.currentTimeMillisGenerator.getAsLong(), context.engine.getIndexStore().search(filter));
	}
}
