package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;

import com.eclipsesource.json.WriterConfig;
import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.data.CachedPayload;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * The payload found for a hash, or null if there wasn't one.
 */
public record PayloadResult(String hash, CachedPayload payload) implements ICommand.Result
{
	@Override
	public void writeHumanReadable(PrintStream output)
	{
		if (null != this.payload)
		{
			output.println("Payload " + this.hash + " (" + this.payload.source() + "/" + this.payload.type() + ", cached " + MiscHelpers.isoTimestamp(this.payload.cachedAtMillis()) + "):");
			output.println(this.payload.data().toString(WriterConfig.PRETTY_PRINT));
		}
		else
		{
			output.println("Not cached: " + this.hash);
		}
	}
}
