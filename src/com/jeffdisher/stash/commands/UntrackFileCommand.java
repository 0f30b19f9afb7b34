package com.jeffdisher.stash.commands;

import java.nio.file.Path;

import com.jeffdisher.stash.commands.results.None;


public record UntrackFileCommand(Path file) implements ICommand<None>
{
	@Override
	public None runInContext(Context context)
	{
		if (context.engine.getChangeDetector().untrackFile(file))
		{
			context.logger.logOperation("No longer tracking " + file);
		}
		else
		{
			context.logger.logOperation("Not tracked: " + file);
		}
		return None.NONE;
	}
}
