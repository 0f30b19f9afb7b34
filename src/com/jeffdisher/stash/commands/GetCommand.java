package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.PayloadResult;
import com.jeffdisher.stash.logic.PayloadStore;


/**
 * Loads a payload, counting the read as an access in the index.
 */
public record GetCommand(String hash) implements ICommand<PayloadResult>
{
	@Override
	public PayloadResult runInContext(Context context)
	{
		PayloadStore.LoadResult loaded = context.engine.getPayloadStore().load(hash);
		PayloadResult result;
		if (loaded.success())
		{
			context.engine.getIndexStore().touch(hash);
			result = new PayloadResult(hash, loaded.payload());
		}
		else
		{
			context.logger.logVerbose(loaded.error());
			result = new PayloadResult(hash, null);
		}
		return result;
	}
}
