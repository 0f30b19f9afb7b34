package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.StatsResult;


public record StatsCommand() implements ICommand<StatsResult>
{
	@Override
	public StatsResult runInContext(Context context)
	{
		return new StatsResult(context.engine.getIndexStore().stats(), context.engine.getSizePruner().getCacheSizeInfo());
	}
}
