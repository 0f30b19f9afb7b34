package com.jeffdisher.stash.commands;

import com.jeffdisher.stash.commands.results.None;
import com.jeffdisher.stash.scheduler.IScheduledTask;
import com.jeffdisher.stash.utils.Assert;


/**
 * Runs change detection immediately and then every intervalMillis, for durationMillis, before stopping.
 */
public record WatchChangesCommand(long intervalMillis, long durationMillis) implements ICommand<None>
{
	@Override
	public None runInContext(Context context)
	{
		IScheduledTask task = context.engine.getChangeDetector().scheduleChangeDetection(intervalMillis);
		try
		{
			Thread.sleep(durationMillis);
		}
		catch (InterruptedException e)
		{
			// We don't use interruption on the command thread.
			throw Assert.unexpected(e);
		}
		finally
		{
			task.stop();
		}
		return None.NONE;
	}
}
