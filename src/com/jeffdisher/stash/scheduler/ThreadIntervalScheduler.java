package com.jeffdisher.stash.scheduler;

import java.util.function.LongSupplier;

import com.jeffdisher.stash.types.ILogger;
import com.jeffdisher.stash.utils.Assert;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * The real scheduler:  each started task gets its own background thread which waits on the task's monitor between
 * ticks.  Ticks of one task never overlap since they all run on that one thread.
 * A tick which throws a RuntimeException is logged as an error and the task keeps ticking.  An Error ends the task's
 * thread, after which stop() still returns normally.
 */
public class ThreadIntervalScheduler implements IIntervalScheduler
{
	private final LongSupplier _currentTimeMillisGenerator;
	private final ILogger _logger;

	public ThreadIntervalScheduler(LongSupplier currentTimeMillisGenerator, ILogger logger)
	{
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_logger = logger;
	}

	@Override
	public IScheduledTask start(long intervalMillis, Runnable tick)
	{
		Assert.assertTrue(intervalMillis > 0L);
		Assert.assertTrue(null != tick);
		
		_Task task = new _Task(intervalMillis, tick);
		task.begin();
		return task;
	}


	private class _Task implements IScheduledTask
	{
		// Instance variables which are never written after construction (safe everywhere).
		private final long _intervalMillis;
		private final Runnable _tick;
		private final Thread _background;

		// Instance variables which are shared between caller thread and background thread (can only be touched on monitor).
		private boolean _handoff_keepRunning;

		public _Task(long intervalMillis, Runnable tick)
		{
			_intervalMillis = intervalMillis;
			_tick = tick;
			_background = MiscHelpers.createThread(() -> {
				try
				{
					while (_background_waitForNextTick())
					{
						_background_runTick();
					}
				}
				finally
				{
					_background_markStopped();
				}
			}, "Interval Scheduler");
		}

		public void begin()
		{
			_handoff_keepRunning = true;
			_background.start();
		}

		@Override
		public void stop()
		{
			synchronized (this)
			{
				_handoff_keepRunning = false;
				this.notifyAll();
			}
			// A tick may call stop() on its own task so we can only join from outside.
			if (Thread.currentThread() != _background)
			{
				try
				{
					_background.join();
				}
				catch (InterruptedException e)
				{
					// We don't use interruption on these threads.
					throw Assert.unexpected(e);
				}
			}
		}

		private void _background_runTick()
		{
			try
			{
				_tick.run();
			}
			catch (RuntimeException e)
			{
				_logger.logError("Scheduled task failed: " + e.getLocalizedMessage());
			}
		}

		private synchronized void _background_markStopped()
		{
			_handoff_keepRunning = false;
		}

		private synchronized boolean _background_waitForNextTick()
		{
			long nextTickMillis = _currentTimeMillisGenerator.getAsLong() + _intervalMillis;
			long remainingMillis = _intervalMillis;
			while (_handoff_keepRunning && (remainingMillis > 0L))
			{
				try
				{
					this.wait(remainingMillis);
				}
				catch (InterruptedException e)
				{
					// We don't use interruption on these threads.
					throw Assert.unexpected(e);
				}
				remainingMillis = nextTickMillis - _currentTimeMillisGenerator.getAsLong();
			}
			return _handoff_keepRunning;
		}
	}
}
