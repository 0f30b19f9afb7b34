package com.jeffdisher.stash.scheduler;


/**
 * The handle to a repeating task started by an IIntervalScheduler.
 */
public interface IScheduledTask
{
	/**
	 * Prevents any further ticks.  A tick already running is allowed to finish (when called from another thread, this
	 * waits for it).  Calling this more than once has no additional effect.
	 */
	void stop();
}
