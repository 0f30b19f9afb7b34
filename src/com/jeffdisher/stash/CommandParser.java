package com.jeffdisher.stash;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import com.jeffdisher.stash.commands.ApplyRetentionCommand;
import com.jeffdisher.stash.commands.CleanTempCommand;
import com.jeffdisher.stash.commands.DeleteCommand;
import com.jeffdisher.stash.commands.DetectChangesCommand;
import com.jeffdisher.stash.commands.GetCommand;
import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.commands.InitCommand;
import com.jeffdisher.stash.commands.ListStaleCommand;
import com.jeffdisher.stash.commands.ListTrackedCommand;
import com.jeffdisher.stash.commands.PruneCommand;
import com.jeffdisher.stash.commands.PutCommand;
import com.jeffdisher.stash.commands.RegisterFileCommand;
import com.jeffdisher.stash.commands.RepairCommand;
import com.jeffdisher.stash.commands.SearchCommand;
import com.jeffdisher.stash.commands.StatsCommand;
import com.jeffdisher.stash.commands.UntrackFileCommand;
import com.jeffdisher.stash.commands.WatchChangesCommand;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.logic.RetentionPolicy;
import com.jeffdisher.stash.logic.SizePruner;
import com.jeffdisher.stash.logic.StalenessRefresher;
import com.jeffdisher.stash.logic.StashConfig;
import com.jeffdisher.stash.types.UsageException;
import com.jeffdisher.stash.utils.Assert;


public class CommandParser
{
	private static record PreParse(ParameterType type, String pre) {
		<T> T parse(Class<T> clazz) throws UsageException
		{
			return this.type.parse(clazz, this.pre);
		}
	};
	@java.lang.FunctionalInterface
	private static interface IParseFunction
	{
		public ICommand<?> apply(PreParse[] required, PreParse[] optional) throws UsageException;
	}
	private static enum ArgPattern
	{
		INIT("--init"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Creates the cache directories and an empty index.  Required before running any other command."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new InitCommand();
		}),
		
		// Payload access.
		PUT("--put"
				, new ArgParameter[] { ArgParameter.required("--file", ParameterType.FILE, "The JSON file to store")
					, ArgParameter.required("--source", ParameterType.STRING, "Where the content came from")
					, ArgParameter.required("--type", ParameterType.STRING, "The kind of content")
				}
				, new ArgParameter[0]
				, "Stores the JSON content of the file in the cache and indexes it, printing its hash."
				, (PreParse[] required, PreParse[] optional) ->
		{
			Path file = required[0].parse(Path.class);
			String source = required[1].parse(String.class);
			String type = required[2].parse(String.class);
			return new PutCommand(file, source, type);
		}),
		GET("--get"
				, new ArgParameter[] { ArgParameter.required("--hash", ParameterType.HASH, "The payload hash") }
				, new ArgParameter[0]
				, "Prints the cached payload with the given hash, recording the access."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new GetCommand(required[0].parse(String.class));
		}),
		DELETE("--delete"
				, new ArgParameter[] { ArgParameter.required("--hash", ParameterType.HASH, "The payload hash") }
				, new ArgParameter[0]
				, "Deletes the cached payload with the given hash and removes it from the index."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new DeleteCommand(required[0].parse(String.class));
		}),
		
		// Index queries.
		SEARCH("--search"
				, new ArgParameter[0]
				, new ArgParameter[] { ArgParameter.optional("--source", ParameterType.STRING, "Only items from this source", null)
					, ArgParameter.optional("--type", ParameterType.STRING, "Only items of this type", null)
					, ArgParameter.optional("--minSize", ParameterType.LONG_BYTES, "Only items at least this large", null)
					, ArgParameter.optional("--maxSize", ParameterType.LONG_BYTES, "Only items at most this large", null)
				}
				, "Lists the indexed items matching every filter given (all items, if none are given)."
				, (PreParse[] required, PreParse[] optional) ->
		{
			SearchFilter filter = SearchFilter.ALL
					.withSource(_optionalString(optional[0]))
					.withType(_optionalString(optional[1]))
					.withSizeBetween(_optionalLong(optional[2]), _optionalLong(optional[3]))
			;
			return new SearchCommand(filter);
		}),
		STATS("--stats"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Prints statistics about the cache, from the index."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new StatsCommand();
		}),
		
		// Maintenance policies.
		APPLY_RETENTION("--applyRetention"
				, new ArgParameter[0]
				, new ArgParameter[] { ArgParameter.optional("--maxAgeMillis", ParameterType.LONG_MILLIS
					, "Items cached longer ago than this are removed"
					, RetentionPolicy.formatAge(RetentionPolicy.DEFAULT_RETENTION_MILLIS)
				) }
				, "Removes every item older than the retention window."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new ApplyRetentionCommand(_optionalLong(optional[0], RetentionPolicy.DEFAULT_RETENTION_MILLIS));
		}),
		PRUNE("--prune"
				, new ArgParameter[0]
				, new ArgParameter[] { ArgParameter.optional("--thresholdBytes", ParameterType.LONG_BYTES
						, "The size the cache should be reduced to"
						, SizePruner.formatBytes(SizePruner.DEFAULT_SIZE_THRESHOLD_BYTES)
					)
					, ArgParameter.optional("--minKeep", ParameterType.INT
						, "The number of most-recently-used items never removed"
						, Integer.toString(SizePruner.DEFAULT_MIN_ITEMS_TO_KEEP)
					)
				}
				, "Removes least-recently-used items until the cache is under the size threshold."
				, (PreParse[] required, PreParse[] optional) ->
		{
			long thresholdBytes = _optionalLong(optional[0], SizePruner.DEFAULT_SIZE_THRESHOLD_BYTES);
			int minKeep = _optionalInt(optional[1], SizePruner.DEFAULT_MIN_ITEMS_TO_KEEP);
			return new PruneCommand(thresholdBytes, minKeep);
		}),
		LIST_STALE("--listStale"
				, new ArgParameter[0]
				, new ArgParameter[] { ArgParameter.optional("--thresholdMillis", ParameterType.LONG_MILLIS
					, "Items cached longer ago than this are stale"
					, RetentionPolicy.formatAge(StalenessRefresher.DEFAULT_STALENESS_MILLIS)
				) }
				, "Lists the stale items, most urgent to refresh first."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new ListStaleCommand(_optionalLong(optional[0], StalenessRefresher.DEFAULT_STALENESS_MILLIS));
		}),
		CLEAN_TEMP("--cleanTemp"
				, new ArgParameter[0]
				, new ArgParameter[] { ArgParameter.optional("--maxAgeMillis", ParameterType.LONG_MILLIS
					, "Temp files last modified longer ago than this are deleted"
					, RetentionPolicy.formatAge(StashConfig.DEFAULT_TEMP_MAX_AGE_MILLIS)
				) }
				, "Deletes old files from the cache's temp directory."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new CleanTempCommand(_optionalLong(optional[0], StashConfig.DEFAULT_TEMP_MAX_AGE_MILLIS));
		}),
		REPAIR("--repair"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Rebuilds the index from the payload files:  drops entries with no file, indexes files with no entry, fixes sizes."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new RepairCommand();
		}),
		
		// Change detection.
		REGISTER_FILE("--registerFile"
				, new ArgParameter[] { ArgParameter.required("--file", ParameterType.FILE, "The source file to track") }
				, new ArgParameter[] { ArgParameter.optional("--related", ParameterType.HASH_LIST
					, "The cache hashes derived from this file, comma-separated"
					, "none"
				) }
				, "Starts tracking the file so that its related cache entries are invalidated when it changes."
				, (PreParse[] required, PreParse[] optional) ->
		{
			Path file = required[0].parse(Path.class);
			String[] related = (null != optional[0])
					? optional[0].parse(String[].class)
					: new String[0]
			;
			return new RegisterFileCommand(file, List.of(related));
		}),
		UNTRACK_FILE("--untrackFile"
				, new ArgParameter[] { ArgParameter.required("--file", ParameterType.PATH, "The tracked file (which may no longer exist)") }
				, new ArgParameter[0]
				, "Stops tracking the file."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new UntrackFileCommand(required[0].parse(Path.class));
		}),
		LIST_TRACKED("--listTracked"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Lists the tracked files and their related cache entries."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new ListTrackedCommand();
		}),
		DETECT_CHANGES("--detectChanges"
				, new ArgParameter[0]
				, new ArgParameter[0]
				, "Checks every tracked file once, invalidating the cache entries of those which changed or disappeared."
				, (PreParse[] required, PreParse[] optional) ->
		{
			return new DetectChangesCommand();
		}),
		WATCH_CHANGES("--watchChanges"
				, new ArgParameter[] { ArgParameter.required("--durationMillis", ParameterType.LONG_MILLIS, "How long to keep watching") }
				, new ArgParameter[] { ArgParameter.optional("--intervalMillis", ParameterType.LONG_MILLIS
					, "The time between checks"
					, RetentionPolicy.formatAge(StashConfig.DEFAULT_CHANGE_DETECTION_INTERVAL_MILLIS)
				) }
				, "Runs change detection now and then repeatedly, on an interval, until the duration expires."
				, (PreParse[] required, PreParse[] optional) ->
		{
			long durationMillis = required[0].parse(Long.class);
			long intervalMillis = _optionalLong(optional[0], StashConfig.DEFAULT_CHANGE_DETECTION_INTERVAL_MILLIS);
			if (0L == intervalMillis)
			{
				throw new UsageException("Interval must be positive");
			}
			return new WatchChangesCommand(intervalMillis, durationMillis);
		}),
		;
		
		private static String _optionalString(PreParse pre) throws UsageException
		{
			return (null != pre)
					? pre.parse(String.class)
					: null
			;
		}
		
		private static Long _optionalLong(PreParse pre) throws UsageException
		{
			return (null != pre)
					? pre.parse(Long.class)
					: null
			;
		}
		
		private static long _optionalLong(PreParse pre, long ifNull) throws UsageException
		{
			return (null != pre)
					? pre.parse(Long.class)
					: ifNull
			;
		}
		
		private static int _optionalInt(PreParse pre, int ifNull) throws UsageException
		{
			return (null != pre)
					? pre.parse(Integer.class)
					: ifNull
			;
		}
		
		
		private final String _name;
		private final ArgParameter _params[];
		private final ArgParameter _optionalParams[];
		private final String _description;
		private final IParseFunction _factory;
		
		private ArgPattern(String name
				, ArgParameter params[]
				, ArgParameter optionalParams[]
				, String description
				, IParseFunction factory)
		{
			_name = name;
			_params = params;
			_optionalParams = optionalParams;
			_description = description;
			_factory = factory;
		}
		
		private boolean isValid(String arg)
		{
			return arg.equals(_name);
		}
		
		private ICommand<?> parse(String[] args, int[] startIndex) throws UsageException
		{
			// We need to convert the entire input to a command, update the startIndex in/out parameter once we have processed all of our known options.
			// We can return null if we fail at any point, and the top-level will fail.
			int scanIndex = startIndex[0];
			Assert.assertTrue(args[scanIndex].equals(_name));
			scanIndex += 1;
			
			PreParse[] required = new PreParse[_params.length];
			PreParse[] optional = new PreParse[_optionalParams.length];
			
			boolean keepRunning = true;
			while (keepRunning && ((scanIndex + 1) < args.length))
			{
				String next = args[scanIndex];
				String value = args[scanIndex + 1];
				// We keep running only while each name matches one of our parameters.
				keepRunning = _match(_params, required, next, value) || _match(_optionalParams, optional, next, value);
				if (keepRunning)
				{
					scanIndex += 2;
				}
			}
			startIndex[0] = scanIndex;
			
			boolean hasAllRequired = true;
			for (PreParse pre : required)
			{
				hasAllRequired &= (null != pre);
			}
			return hasAllRequired
					? _factory.apply(required, optional)
					: null
			;
		}
		
		private static boolean _match(ArgParameter[] params, PreParse[] out, String name, String value)
		{
			boolean didMatch = false;
			for (int i = 0; i < params.length; ++i)
			{
				if (params[i].isNamedBy(name))
				{
					// If the parameter is repeated, the last value wins.
					out[i] = new PreParse(params[i].type(), value);
					didMatch = true;
					break;
				}
			}
			return didMatch;
		}
		
		private void printUsage(PrintStream stream)
		{
			stream.print(_name + " ");
			for(ArgParameter param : _params)
			{
				stream.print(param.shortDescription() + " ");
			}
			for(ArgParameter param : _optionalParams)
			{
				stream.print("[" + param.shortDescription() + "] ");
			}
		}
	}

	/**
	 * Parses the command-line into a command.
	 * 
	 * @param args The command-line arguments (must not be empty).
	 * @param errorStream Where to describe why the line couldn't be parsed.
	 * @return The command, or null if the line didn't describe a command.
	 * @throws UsageException A parameter value was invalid.
	 */
	public static ICommand<?> parseArgs(String[] args, PrintStream errorStream) throws UsageException
	{
		// We assume that we only get this far is we have args.
		Assert.assertTrue(args.length > 0);
		
		ICommand<?> matched = null;
		for (ArgPattern pattern : ArgPattern.values())
		{
			if (pattern.isValid(args[0]))
			{
				// We use index as in/out parameter here, hence the array.
				int[] index = {0};
				matched = pattern.parse(args, index);
				// We are at the top-level, here, so we need to make sure that the input was completely consumed.
				if (args.length != index[0])
				{
					String unhandledArgs = "Unhandled args:";
					for (int i = index[0]; i < args.length; ++i)
					{
						unhandledArgs += " " + args[i];
					}
					errorStream.println(unhandledArgs);
					matched = null;
				}
				else if (null == matched)
				{
					// This is a valid pattern, but didn't parse, meaning sub-args were missing.
					errorStream.println("Missing command sub-arguments.");
				}
				break;
			}
		}
		return matched;
	}

	public static void printUsage(PrintStream stream)
	{
		stream.println("Commands:");
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.print("\t");
			pattern.printUsage(stream);
			stream.println();
		}
	}

	public static void printHelp(PrintStream stream)
	{
		for (ArgPattern pattern : ArgPattern.values())
		{
			stream.println();
			stream.println(pattern._name);
			stream.println("\tDescription: " + pattern._description);
			stream.println("\tRequired parameters:");
			_describeParameterList(stream, "\t\t", pattern._params);
			stream.println("\tOptional parameters:");
			_describeParameterList(stream, "\t\t", pattern._optionalParams);
		}
	}


	private static void _describeParameterList(PrintStream stream, String prefix, ArgParameter[] list)
	{
		if (0 == list.length)
		{
			stream.println(prefix + "(none)");
		}
		else
		{
			for (int i = 0; i < list.length; ++i)
			{
				stream.println(prefix + list[i].longDescription());
			}
		}
	}
}
