package com.jeffdisher.stash.commands;

import java.io.PrintStream;

import com.jeffdisher.stash.types.StashException;


/**
 * An interface for commands which can be run in a generalized fashion.
 *
 * @param <T> The result type returned from the invocation.
 */
public interface ICommand<T extends ICommand.Result>
{
	/**
	 * Runs the command in the given context.
	 * 
	 * @param context Resources available to the command.
	 * @return Extra information about the result (cannot be null).
	 * @throws StashException Something went wrong which prevented success (success, or safe error, always returns).
	 */
	T runInContext(Context context) throws StashException;

	/**
	 * The common interface of all result types.
	 */
	public interface Result
	{
		/**
		 * Asks the result to write a description of itself to the given output.
		 * 
		 * @param output The stream for output.
		 */
		void writeHumanReadable(PrintStream output);
	}
}
