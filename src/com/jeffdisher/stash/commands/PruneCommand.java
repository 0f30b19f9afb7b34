package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.SweepResult;
import com.jeffdisher.stash.logic.SizePruner;


public record PruneCommand(long thresholdBytes, int minKeep) implements ICommand<SweepResult>
{
	@Override
	public SweepResult runInContext(Context context)
	{
		SizePruner.Result result = context.engine.getSizePruner().pruneCacheLRU(thresholdBytes, minKeep);
		return new SweepResult("Pruned " + result.removedCount() + " item(s), freeing " + SizePruner.formatBytes(result.bytesFreed())
				+ ":  now " + SizePruner.formatBytes(result.currentSizeBytes()) + " of " + SizePruner.formatBytes(result.thresholdBytes())
				, result.errors()
		);
	}
}
