package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.SweepResult;
import com.jeffdisher.stash.logic.RetentionPolicy;
import com.jeffdisher.stash.logic.SizePruner;


public record ApplyRetentionCommand(long maxAgeMillis) implements ICommand<SweepResult>
{
	@Override
	public SweepResult runInContext(Context context)
	{
		RetentionPolicy.Result result = context.engine.getRetentionPolicy().applyRetentionPolicy(maxAgeMillis);
		return new SweepResult("Removed " + result.removedCount() + " item(s) older than " + RetentionPolicy.formatAge(maxAgeMillis)
				+ ", freeing " + SizePruner.formatBytes(result.bytesFreed())
				, result.errors()
		);
	}
}
