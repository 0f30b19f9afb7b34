package com.jeffdisher.stash.data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.eclipsesource.json.JsonArray;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * The in-memory form of "cache-index.json":  the catalog of every indexed payload.
 * Items are unique by hash and kept in insertion order.  The totals written to disk are always derived from the
 * items, so the stored values in a loaded document are not trusted.
 * This is a mutable structure which is only ever touched by the CacheIndexStore which loaded it (or by tests).
 */
public class CacheIndex
{
	public static final String CURRENT_VERSION = "1.0.0";

	/**
	 * @param nowMillis The creation time.
	 * @return A new, empty, index.
	 */
	public static CacheIndex empty(long nowMillis)
	{
		return new CacheIndex(CURRENT_VERSION, nowMillis, nowMillis);
	}

	public static CacheIndex fromJson(JsonObject json) throws FailedDeserializationException
	{
		String version = JsonFields.requireString(json, "version", CacheIndex.class);
		long createdAtMillis = JsonFields.requireTimestamp(json, "createdAt", CacheIndex.class);
		long updatedAtMillis = JsonFields.requireTimestamp(json, "updatedAt", CacheIndex.class);
		CacheIndex index = new CacheIndex(version, createdAtMillis, updatedAtMillis);
		for (JsonValue element : JsonFields.requireArray(json, "items", CacheIndex.class))
		{
			IndexItem item = IndexItem.fromJson(JsonFields.requireObjectElement(element, CacheIndex.class));
			// If the file somehow has duplicates, the last one wins (same as a replacing put).
			index._items.put(item.hash(), item);
		}
		return index;
	}


	private final String _version;
	private final long _createdAtMillis;
	private long _updatedAtMillis;
	private final Map<String, IndexItem> _items;

	private CacheIndex(String version, long createdAtMillis, long updatedAtMillis)
	{
		_version = version;
		_createdAtMillis = createdAtMillis;
		_updatedAtMillis = updatedAtMillis;
		_items = new LinkedHashMap<>();
	}

	public String getVersion()
	{
		return _version;
	}

	public long getCreatedAtMillis()
	{
		return _createdAtMillis;
	}

	public long getUpdatedAtMillis()
	{
		return _updatedAtMillis;
	}

	/**
	 * Called by the store just before serializing.
	 * 
	 * @param nowMillis The write time.
	 */
	public void markUpdated(long nowMillis)
	{
		_updatedAtMillis = nowMillis;
	}

	public int getTotalItems()
	{
		return _items.size();
	}

	public long getTotalSizeBytes()
	{
		long total = 0L;
		for (IndexItem item : _items.values())
		{
			total += item.sizeBytes();
		}
		return total;
	}

	/**
	 * @return A copy of the items, in insertion order.
	 */
	public List<IndexItem> getItems()
	{
		return new ArrayList<>(_items.values());
	}

	/**
	 * @param hash The payload hash.
	 * @return The item or null if there isn't one with this hash.
	 */
	public IndexItem getItem(String hash)
	{
		return _items.get(hash);
	}

	/**
	 * Adds the item, replacing any existing item with the same hash (the replacement keeps its original position).
	 * 
	 * @param item The item to store.
	 */
	public void putItem(IndexItem item)
	{
		_items.put(item.hash(), item);
	}

	/**
	 * @param hash The payload hash.
	 * @return The removed item or null if there wasn't one.
	 */
	public IndexItem removeItem(String hash)
	{
		return _items.remove(hash);
	}

	public JsonObject toJson()
	{
		JsonArray items = new JsonArray();
		for (IndexItem item : _items.values())
		{
			items.add(item.toJson());
		}
		return new JsonObject()
			.add("version", _version)
			.add("createdAt", MiscHelpers.isoTimestamp(_createdAtMillis))
			.add("updatedAt", MiscHelpers.isoTimestamp(_updatedAtMillis))
			.add("totalItems", getTotalItems())
			.add("totalSizeBytes", getTotalSizeBytes())
			.add("items", items)
		;
	}
}
