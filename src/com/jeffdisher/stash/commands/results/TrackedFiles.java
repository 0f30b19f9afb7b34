package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;
import java.util.List;

import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.data.FileHashRecord;
import com.jeffdisher.stash.utils.MiscHelpers;


public record TrackedFiles(List<FileHashRecord> files) implements ICommand.Result
{
	public TrackedFiles
	{
		files = List.copyOf(files);
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println(this.files.size() + " tracked files:");
		for (FileHashRecord record : this.files)
		{
			output.println("\tFile: " + record.filePath());
			output.println("\t\tHash: " + record.hash() + " (computed " + MiscHelpers.isoTimestamp(record.computedAtMillis()) + ")");
			for (String cacheHash : record.relatedCacheHashes())
			{
				output.println("\t\tRelated: " + cacheHash);
			}
		}
	}
}
