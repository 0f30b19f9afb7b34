package com.jeffdisher.stash.commands;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.jeffdisher.stash.commands.results.StoredResult;
import com.jeffdisher.stash.logic.PayloadStore;
import com.jeffdisher.stash.types.StashException;
import com.jeffdisher.stash.types.UsageException;


public record PutCommand(Path file, String source, String type) implements ICommand<StoredResult>
{
	@Override
	public StoredResult runInContext(Context context) throws StashException
	{
		JsonValue data;
		try
		{
			data = Json.parse(Files.readString(file, StandardCharsets.UTF_8));
		}
		catch (ParseException e)
		{
			throw new UsageException("File is not valid JSON: " + file + " (" + e.getLocalizedMessage() + ")");
		}
		catch (IOException e)
		{
			throw new StashException("Failed to read " + file, e);
		}
		
		PayloadStore.SaveResult result = context.engine.cacheAndIndex(data, source, type, null);
		if (!result.success())
		{
			throw new StashException(result.error());
		}
		return new StoredResult(result.hash(), result.filePath());
	}
}
