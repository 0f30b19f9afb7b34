package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;
import java.nio.file.Path;

import com.jeffdisher.stash.commands.ICommand;


public record StoredResult(String hash, Path filePath) implements ICommand.Result
{
	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println("Stored " + this.hash + " at " + this.filePath);
	}
}
