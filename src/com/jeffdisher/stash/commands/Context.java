package com.jeffdisher.stash.commands;

import java.util.function.LongSupplier;

import com.jeffdisher.stash.logic.CacheEngine;
import com.jeffdisher.stash.types.ILogger;


/**
 * A container of resources which can be used by a command.
 */
public class Context
{
	public final CacheEngine engine;
	public final ILogger logger;
	public final LongSupplier currentTimeMillisGenerator;

	public Context(CacheEngine engine
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
	)
	{
		this.engine = engine;
		this.logger = logger;
		this.currentTimeMillisGenerator = currentTimeMillisGenerator;
	}
}
