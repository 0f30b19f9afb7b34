package com.jeffdisher.stash;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.function.LongSupplier;

import com.jeffdisher.stash.commands.Context;
import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.commands.InitCommand;
import com.jeffdisher.stash.logic.CacheEngine;
import com.jeffdisher.stash.logic.RealStorageFileSystem;
import com.jeffdisher.stash.logic.StashConfig;
import com.jeffdisher.stash.scheduler.ThreadIntervalScheduler;
import com.jeffdisher.stash.types.StashException;
import com.jeffdisher.stash.types.UsageException;
import com.jeffdisher.stash.utils.StandardLogger;


public class Stash
{
	/**
	 * Static errors are those which prevent the program from starting:  bad arguments or an uninitialized cache.
	 */
	public static final int EXIT_STATIC_ERROR = 1;
	/**
	 * Safe errors are those which allowed the command to complete but which logged an error (some item in a sweep
	 * which couldn't be removed, for example).
	 */
	public static final int EXIT_SAFE_ERROR = 2;
	/**
	 * Complete errors are those which prevented the command from completing.
	 */
	public static final int EXIT_COMPLETE_ERROR = 3;

	private static final String DEFAULT_STORAGE_DIRECTORY_NAME = ".stash";

	/**
	 * The main entry-point for running the system.  Run without arguments to see the usage string.
	 * 
	 * @param args The command-line arguments.
	 */
	public static void main(String[] args)
	{
		if (args.length > 0)
		{
			ICommand<?> command = null;
			try
			{
				command = CommandParser.parseArgs(args, System.err);
			}
			catch (UsageException e)
			{
				System.err.println("Usage error in parsing command: " + e.getLocalizedMessage());
				System.exit(EXIT_STATIC_ERROR);
			}
			if (null != command)
			{
				boolean verbose = (null != System.getenv(EnvVars.ENV_VAR_STASH_VERBOSE));
				StandardLogger logger = StandardLogger.topLogger(System.out, verbose);
				LongSupplier currentTimeMillisGenerator = () -> System.currentTimeMillis();
				StashConfig config = StashConfig.defaults(_storageRoot());
				CacheEngine engine = new CacheEngine(config
						, new RealStorageFileSystem()
						, logger
						, currentTimeMillisGenerator
						, new ThreadIntervalScheduler(currentTimeMillisGenerator, logger)
				);
				
				// Everything but initialization needs the layout to already be in place.
				if (!(command instanceof InitCommand) && !engine.getStructureManager().isStructureValid())
				{
					System.err.println("No usable cache at " + config.rootPath() + ":  run --init first");
					System.exit(EXIT_STATIC_ERROR);
				}
				
				Context context = new Context(engine, logger, currentTimeMillisGenerator);
				try
				{
					ICommand.Result result = command.runInContext(context);
					result.writeHumanReadable(System.out);
				}
				catch (UsageException e)
				{
					System.err.println("Usage error in running command: " + e.getLocalizedMessage());
					System.exit(EXIT_STATIC_ERROR);
				}
				catch (StashException e)
				{
					System.err.println("Exception encountered while running command: " + e.getLocalizedMessage());
					e.printStackTrace();
					System.exit(EXIT_COMPLETE_ERROR);
				}
				if (logger.didErrorOccur())
				{
					// This is a "safe" error, meaning that the command completed but something it tried along the way failed, and was logged.
					System.exit(EXIT_SAFE_ERROR);
				}
			}
			else if ((1 == args.length) && "--help".equals(args[0]))
			{
				// We handle "--help" as a special-case where we provide more than basic usage data.
				_commonUsage(System.out);
				CommandParser.printHelp(System.out);
			}
			else
			{
				errorStart();
			}
		}
		else
		{
			errorStart();
		}
	}


	private static Path _storageRoot()
	{
		String override = System.getenv(EnvVars.ENV_VAR_STASH_STORAGE);
		return (null != override)
				? Path.of(override).toAbsolutePath()
				: Path.of(System.getProperty("user.home"), DEFAULT_STORAGE_DIRECTORY_NAME)
		;
	}

	private static void errorStart()
	{
		_commonUsage(System.err);
		CommandParser.printUsage(System.err);
		System.err.println("More detailed usage can be seen with --help");
		System.exit(EXIT_STATIC_ERROR);
	}

	private static void _commonUsage(PrintStream stream)
	{
		stream.println("Usage:  Stash <command>");
		stream.println("\tCache directory defaults to ~/" + DEFAULT_STORAGE_DIRECTORY_NAME + " unless overridden with " + EnvVars.ENV_VAR_STASH_STORAGE + " env var");
	}
}
