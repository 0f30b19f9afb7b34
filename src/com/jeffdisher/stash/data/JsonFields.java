package com.jeffdisher.stash.data;

import java.util.ArrayList;
import java.util.List;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * Field accessors shared by the fromJson() factories of the on-disk documents.
 * Each one fails with FailedDeserializationException, naming the type being decoded, instead of the
 * UnsupportedOperationException minimal-json throws on a type mismatch.
 */
class JsonFields
{
	static String requireString(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		JsonValue value = json.get(key);
		if ((null == value) || !value.isString())
		{
			throw new FailedDeserializationException(owner, "missing string \"" + key + "\"");
		}
		return value.asString();
	}

	static long requireLong(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		JsonValue value = json.get(key);
		if ((null == value) || !value.isNumber())
		{
			throw new FailedDeserializationException(owner, "missing number \"" + key + "\"");
		}
		return (long) value.asDouble();
	}

	static long requireTimestamp(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		long millis = MiscHelpers.parseIsoTimestamp(requireString(json, key, owner));
		if (millis < 0L)
		{
			throw new FailedDeserializationException(owner, "malformed timestamp \"" + key + "\"");
		}
		return millis;
	}

	/**
	 * @return The timestamp in milliseconds or 0 if the key is absent or null.
	 */
	static long optionalTimestamp(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		JsonValue value = json.get(key);
		return ((null == value) || value.isNull())
				? 0L
				: requireTimestamp(json, key, owner)
		;
	}

	static JsonObject optionalObject(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		JsonValue value = json.get(key);
		JsonObject object = null;
		if ((null != value) && !value.isNull())
		{
			if (!value.isObject())
			{
				throw new FailedDeserializationException(owner, "\"" + key + "\" is not an object");
			}
			object = value.asObject();
		}
		return object;
	}

	static JsonArray requireArray(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		JsonValue value = json.get(key);
		if ((null == value) || !value.isArray())
		{
			throw new FailedDeserializationException(owner, "missing array \"" + key + "\"");
		}
		return value.asArray();
	}

	static JsonObject requireObjectElement(JsonValue element, Class<?> owner) throws FailedDeserializationException
	{
		if (!element.isObject())
		{
			throw new FailedDeserializationException(owner, "array element is not an object");
		}
		return element.asObject();
	}

	static List<String> requireStringList(JsonObject json, String key, Class<?> owner) throws FailedDeserializationException
	{
		List<String> strings = new ArrayList<>();
		for (JsonValue element : requireArray(json, key, owner))
		{
			if (!element.isString())
			{
				throw new FailedDeserializationException(owner, "\"" + key + "\" contains a non-string");
			}
			strings.add(element.asString());
		}
		return strings;
	}
}
