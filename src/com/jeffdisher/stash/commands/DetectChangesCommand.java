package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.SweepResult;
import com.jeffdisher.stash.logic.ChangeDetector;


public record DetectChangesCommand() implements ICommand<SweepResult>
{
	@Override
	public SweepResult runInContext(Context context)
	{
		ChangeDetector.Result result = context.engine.getChangeDetector().detectAndInvalidateChanges();
		return new SweepResult("Scanned " + result.filesScanned() + " file(s):  " + result.filesChanged() + " changed, "
				+ result.cacheEntriesInvalidated() + " cache entries invalidated"
				, result.errors()
		);
	}
}
