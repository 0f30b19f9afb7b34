package com.jeffdisher.stash.commands;

import java.util.List;

import com.jeffdisher.stash.commands.results.SweepResult;
import com.jeffdisher.stash.logic.CacheIndexStore;


public record RepairCommand() implements ICommand<SweepResult>
{
	@Override
	public SweepResult runInContext(Context context)
	{
		CacheIndexStore.ReconcileResult result = context.engine.reconcile();
		List<String> errors = result.success()
				? List.of()
				: List.of("Failed to write repaired index")
		;
		return new SweepResult("Repaired index:  " + result.orphanedEntriesRemoved() + " orphaned entries removed, "
				+ result.unindexedPayloadsAdded() + " payloads indexed, " + result.sizesCorrected() + " sizes corrected"
				, errors
		);
	}
}
