package com.jeffdisher.stash.commands;

import java.nio.file.Path;
import java.util.List;

import com.jeffdisher.stash.commands.results.None;
import com.jeffdisher.stash.types.StashException;


public record RegisterFileCommand(Path file, List<String> relatedCacheHashes) implements ICommand<None>
{
	@Override
	public None runInContext(Context context) throws StashException
	{
		if (!context.engine.getChangeDetector().registerFile(file, relatedCacheHashes))
		{
			throw new StashException("Failed to track " + file);
		}
		context.logger.logOperation("Tracking " + file);
		return None.NONE;
	}
}
