package com.jeffdisher.stash.commands;

import java.util.List;

import com.jeffdisher.stash.commands.results.SweepResult;
import com.jeffdisher.stash.logic.RetentionPolicy;


public record CleanTempCommand(long maxAgeMillis) implements ICommand<SweepResult>
{
	@Override
	public SweepResult runInContext(Context context)
	{
		int deleted = context.engine.getStructureManager().cleanupTempFiles(maxAgeMillis);
		return new SweepResult("Deleted " + deleted + " temp file(s) older than " + RetentionPolicy.formatAge(maxAgeMillis), List.of());
	}
}
