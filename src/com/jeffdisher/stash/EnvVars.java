package com.jeffdisher.stash;


/**
 * Just contains the environment variables the system checks.
 */
public class EnvVars
{
	/**
	 * If set, this directory path will be used as the root of the cache.  Defaults to "~/.stash" if not set.
	 */
	public static final String ENV_VAR_STASH_STORAGE = "STASH_STORAGE";

	/**
	 * Enables verbose console logging.  If not set, verbose logs will not be written to the console.
	 */
	public static final String ENV_VAR_STASH_VERBOSE = "STASH_VERBOSE";
}
