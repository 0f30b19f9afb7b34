package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.None;


public record DeleteCommand(String hash) implements ICommand<None>
{
	@Override
	public None runInContext(Context context)
	{
		if (context.engine.deleteAndUnindex(hash))
		{
			context.logger.logOperation("Deleted " + hash);
		}
		else
		{
			context.logger.logOperation("Not cached: " + hash);
		}
		return None.NONE;
	}
}
