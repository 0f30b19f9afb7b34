package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.None;
import com.jeffdisher.stash.logic.StructureManager;
import com.jeffdisher.stash.types.StashException;


/**
 * Creates the cache directories and the empty index.  Safe to run on an existing cache.
 */
public record InitCommand() implements ICommand<None>
{
	@Override
	public None runInContext(Context context) throws StashException
	{
		StructureManager.Result result = context.engine.getStructureManager().initializeStructure();
		if (!result.success())
		{
			throw new StashException("Failed to initialize cache at " + result.layout().root() + " (" + result.errors().size() + " error(s))");
		}
		context.logger.logOperation("Cache ready at " + result.layout().root());
		return None.NONE;
	}
}
