package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.TrackedFiles;


public record ListTrackedCommand() implements ICommand<TrackedFiles>
{
	@Override
	public TrackedFiles runInContext(Context context)
	{
		return new TrackedFiles(context.engine.getChangeDetector().getTrackedFiles());
	}
}
