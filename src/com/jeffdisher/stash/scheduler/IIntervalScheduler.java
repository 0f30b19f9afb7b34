package com.jeffdisher.stash.scheduler;


/**
 * Runs a tick at a fixed interval until stopped.  Exists so that the interval behaviour can be driven by a virtual
 * clock in tests instead of by real waits.
 */
public interface IIntervalScheduler
{
	/**
	 * Starts calling tick every intervalMillis.  The first tick happens one interval from now, not immediately.
	 * 
	 * @param intervalMillis The interval between ticks (must be positive).
	 * @param tick The work to run on each tick.
	 * @return The handle used to stop the ticks.
	 */
	IScheduledTask start(long intervalMillis, Runnable tick);
}
