package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;
import java.util.List;

import com.jeffdisher.stash.commands.ICommand;


/**
 * The summary of a maintenance sweep:  one line describing what it did and any per-item errors it recorded (these
 * were also logged as errors, as they happened).
 */
public record SweepResult(String summary, List<String> errors) implements ICommand.Result
{
	public SweepResult
	{
		errors = List.copyOf(errors);
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println(this.summary);
		if (!this.errors.isEmpty())
		{
			output.println(this.errors.size() + " error(s):");
			for (String error : this.errors)
			{
				output.println("\t" + error);
			}
		}
	}
}
