package com.jeffdisher.stash.data;

import java.util.List;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.types.FailedDeserializationException;


public class TestCacheIndex
{
	private static final long NOW = 1_700_000_000_000L;

	@Test
	public void emptyIndex() throws Throwable
	{
		CacheIndex index = CacheIndex.empty(NOW);
		Assert.assertEquals(CacheIndex.CURRENT_VERSION, index.getVersion());
		Assert.assertEquals(0, index.getTotalItems());
		Assert.assertEquals(0L, index.getTotalSizeBytes());
		
		CacheIndex read = CacheIndex.fromJson(Json.parse(index.toJson().toString()).asObject());
		Assert.assertEquals(NOW, read.getCreatedAtMillis());
		Assert.assertEquals(NOW, read.getUpdatedAtMillis());
		Assert.assertTrue(read.getItems().isEmpty());
	}

	@Test
	public void totalsAreDerived() throws Throwable
	{
		CacheIndex index = CacheIndex.empty(NOW);
		index.putItem(_item("a", 100L));
		index.putItem(_item("b", 250L));
		JsonObject json = index.toJson();
		Assert.assertEquals(2, json.get("totalItems").asInt());
		Assert.assertEquals(350L, json.get("totalSizeBytes").asLong());
		
		// Stored totals which disagree with the items are ignored.
		json.set("totalItems", 99);
		json.set("totalSizeBytes", 1);
		CacheIndex read = CacheIndex.fromJson(json);
		Assert.assertEquals(2, read.getTotalItems());
		Assert.assertEquals(350L, read.getTotalSizeBytes());
	}

	@Test
	public void replaceKeepsPositionAndUniqueness() throws Throwable
	{
		CacheIndex index = CacheIndex.empty(NOW);
		index.putItem(_item("a", 1L));
		index.putItem(_item("b", 2L));
		index.putItem(_item("a", 5L));
		Assert.assertEquals(2, index.getTotalItems());
		Assert.assertEquals("a", index.getItems().get(0).hash());
		Assert.assertEquals(5L, index.getItem("a").sizeBytes());
		Assert.assertNotNull(index.removeItem("a"));
		Assert.assertNull(index.removeItem("a"));
		Assert.assertNull(index.getItem("a"));
	}

	@Test
	public void accessFields() throws Throwable
	{
		IndexItem item = _item("a", 10L);
		Assert.assertFalse(item.wasAccessed());
		Assert.assertFalse(item.toJson().names().contains("lastAccessedAt"));
		
		IndexItem touched = item.touched(NOW + 5L);
		Assert.assertTrue(touched.wasAccessed());
		Assert.assertEquals(2, touched.accessCount());
		IndexItem read = IndexItem.fromJson(Json.parse(touched.toJson().toString()).asObject());
		Assert.assertEquals(touched, read);
	}

	@Test
	public void metadataSurvives() throws Throwable
	{
		JsonObject metadata = new JsonObject().add("origin", "unit");
		IndexItem item = new IndexItem("a", "src", "type", NOW, 0L, 10L, 1, metadata);
		IndexItem read = IndexItem.fromJson(Json.parse(item.toJson().toString()).asObject());
		Assert.assertEquals(metadata, read.metadata());
	}

	@Test(expected = FailedDeserializationException.class)
	public void missingItems() throws Throwable
	{
		JsonObject json = CacheIndex.empty(NOW).toJson();
		json.remove("items");
		CacheIndex.fromJson(json);
	}

	@Test(expected = FailedDeserializationException.class)
	public void badTimestamp() throws Throwable
	{
		JsonObject json = _item("a", 1L).toJson();
		json.set("cachedAt", "yesterday");
		IndexItem.fromJson(json);
	}

	@Test(expected = FailedDeserializationException.class)
	public void wrongItemShape() throws Throwable
	{
		JsonObject json = CacheIndex.empty(NOW).toJson();
		json.set("items", Json.array().add(JsonValue.valueOf(5)));
		CacheIndex.fromJson(json);
	}

	@Test
	public void registryRoundTrip() throws Throwable
	{
		HashRegistry registry = HashRegistry.empty(NOW);
		registry.putFile(new FileHashRecord("/src/a.txt", "aaaa", NOW, List.of("h1", "h2")));
		registry.putFile(new FileHashRecord("/src/b.txt", "bbbb", NOW, List.of()));
		registry.putFile(new FileHashRecord("/src/a.txt", "cccc", NOW, List.of("h1")));
		HashRegistry read = HashRegistry.fromJson(Json.parse(registry.toJson().toString()).asObject());
		Assert.assertEquals(2, read.getFiles().size());
		Assert.assertEquals("cccc", read.getFile("/src/a.txt").hash());
		Assert.assertEquals(registry.getFiles(), read.getFiles());
	}


	private static IndexItem _item(String hash, long size)
	{
		return new IndexItem(hash, "source", "type", NOW, 0L, size, 1, null);
	}
}
