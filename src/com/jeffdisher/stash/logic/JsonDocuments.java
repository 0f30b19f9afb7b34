package com.jeffdisher.stash.logic;

import java.nio.charset.StandardCharsets;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.eclipsesource.json.ParseException;
import com.eclipsesource.json.WriterConfig;


/**
 * The encoding shared by every JSON document we write:  pretty-printed UTF-8.
 */
class JsonDocuments
{
	static byte[] encode(JsonValue value)
	{
		return value.toString(WriterConfig.PRETTY_PRINT).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * @param data The raw file contents.
	 * @return The top-level object or null if the data isn't a JSON object.
	 */
	static JsonObject decodeObject(byte[] data)
	{
		JsonObject object = null;
		try
		{
			JsonValue value = Json.parse(new String(data, StandardCharsets.UTF_8));
			if (value.isObject())
			{
				object = value.asObject();
			}
		}
		catch (ParseException e)
		{
			// Not JSON:  the caller treats this the same way as the wrong shape.
			object = null;
		}
		return object;
	}
}
