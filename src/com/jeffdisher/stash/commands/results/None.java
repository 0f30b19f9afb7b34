package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;

import com.jeffdisher.stash.commands.ICommand;


/**
 * An implementation of the result type which contains no actual information.
 */
public class None implements ICommand.Result
{
	/**
	 * There is no information within this type so we only ever use a shared instance.
	 */
	public static final None NONE = new None();

	private None()
	{
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		// Do nothing.
	}
}
