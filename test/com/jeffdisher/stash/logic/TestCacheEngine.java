package com.jeffdisher.stash.logic;

import java.nio.file.Path;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.Json;
import com.eclipsesource.json.JsonObject;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.testutils.ManualScheduler;
import com.jeffdisher.stash.testutils.MemoryStorageFileSystem;
import com.jeffdisher.stash.testutils.MockTimeGenerator;
import com.jeffdisher.stash.testutils.SilentLogger;


public class TestCacheEngine
{
	private static final Path ROOT = Path.of("/cache");

	@Test
	public void cacheAndIndex() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = new MemoryStorageFileSystem(time);
		CacheEngine engine = _engine(time, fileSystem, new SilentLogger());
		JsonObject metadata = new JsonObject().add("url", "https://example.com/items");
		
		PayloadStore.SaveResult saved = engine.cacheAndIndex(Json.parse("{\"items\":[1,2]}"), "api", "items", metadata);
		Assert.assertTrue(saved.success());
		Assert.assertEquals(engine.getLayout().payloadFile(saved.hash()), saved.filePath());
		IndexItem item = engine.getIndexStore().getItem(saved.hash());
		Assert.assertEquals("api", item.source());
		Assert.assertEquals("items", item.type());
		Assert.assertEquals(metadata, item.metadata());
		Assert.assertEquals(fileSystem.fileSize(saved.filePath()), item.sizeBytes());
		Assert.assertEquals(1, item.accessCount());
		Assert.assertFalse(item.wasAccessed());
	}

	@Test
	public void duplicateKeepsOriginalPayload() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		CacheEngine engine = _engine(time, new MemoryStorageFileSystem(time), new SilentLogger());
		String hash = engine.cacheAndIndex(Json.value(7), "first", "number", null).hash();
		Assert.assertTrue(engine.getIndexStore().touch(hash));
		time.advance(1000L);
		
		// The same content from elsewhere is deduplicated and re-registered, with the stored payload's fields.
		PayloadStore.SaveResult again = engine.cacheAndIndex(Json.value(7), "second", "other", null);
		Assert.assertTrue(again.success());
		Assert.assertEquals(hash, again.hash());
		IndexItem item = engine.getIndexStore().getItem(hash);
		Assert.assertEquals("first", item.source());
		Assert.assertEquals(MockTimeGenerator.START_MILLIS, item.cachedAtMillis());
		Assert.assertEquals(1, item.accessCount());
		Assert.assertEquals(time.currentTimeMillis, item.lastUsedMillis());
		Assert.assertEquals(1, engine.getIndexStore().search(SearchFilter.ALL).size());
	}

	@Test
	public void indexFailureIsReported() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = new MemoryStorageFileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger);
		// A directory in place of the index lets the payload be written but not the index.
		Path indexFile = engine.getLayout().indexFile();
		Assert.assertTrue(fileSystem.deleteFile(indexFile));
		fileSystem.createDirectories(indexFile);
		
		PayloadStore.SaveResult result = engine.cacheAndIndex(Json.value("x"), "s", "t", null);
		Assert.assertFalse(result.success());
		Assert.assertEquals(PayloadStore.hash("x"), result.hash());
		Assert.assertNotNull(result.error());
		Assert.assertTrue(logger.didErrorOccur());
		Assert.assertTrue(engine.getPayloadStore().exists(result.hash()));
	}

	@Test
	public void deleteAndUnindex() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		CacheEngine engine = _engine(time, new MemoryStorageFileSystem(time), new SilentLogger());
		String hash = engine.cacheAndIndex(Json.value("gone soon"), "s", "t", null).hash();
		
		Assert.assertTrue(engine.deleteAndUnindex(hash));
		Assert.assertFalse(engine.getPayloadStore().exists(hash));
		Assert.assertNull(engine.getIndexStore().getItem(hash));
		Assert.assertFalse(engine.deleteAndUnindex(hash));
		
		// Either half alone still counts.
		String fileOnly = engine.getPayloadStore().save(Json.value("file only"), "s", "t", null).hash();
		Assert.assertTrue(engine.deleteAndUnindex(fileOnly));
		
		// A name which isn't a payload hash can't reach the index file.
		String kept = engine.cacheAndIndex(Json.value("kept"), "s", "t", null).hash();
		Assert.assertFalse(engine.deleteAndUnindex("cache-index"));
		Assert.assertFalse(engine.deleteAndUnindex("../hash-registry"));
		Assert.assertNotNull(engine.getIndexStore().getItem(kept));
	}

	@Test
	public void reconcileRepairsDrift() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		CacheEngine engine = _engine(time, new MemoryStorageFileSystem(time), new SilentLogger());
		String indexed = engine.cacheAndIndex(Json.value("indexed"), "s", "t", null).hash();
		Assert.assertTrue(engine.getPayloadStore().delete(indexed));
		String loose = engine.getPayloadStore().save(Json.value("loose"), "s", "t", null).hash();
		
		CacheIndexStore.ReconcileResult result = engine.reconcile();
		Assert.assertTrue(result.success());
		Assert.assertEquals(1, result.orphanedEntriesRemoved());
		Assert.assertEquals(1, result.unindexedPayloadsAdded());
		Assert.assertNull(engine.getIndexStore().getItem(indexed));
		Assert.assertNotNull(engine.getIndexStore().getItem(loose));
	}

	@Test
	public void configDefaults() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		CacheEngine engine = _engine(time, new MemoryStorageFileSystem(time), new SilentLogger());
		StashConfig config = engine.getConfig();
		Assert.assertEquals(ROOT, config.rootPath());
		Assert.assertEquals(RetentionPolicy.DEFAULT_RETENTION_MILLIS, config.retentionMillis());
		Assert.assertEquals(SizePruner.DEFAULT_SIZE_THRESHOLD_BYTES, config.sizeThresholdBytes());
		Assert.assertEquals(SizePruner.DEFAULT_MIN_ITEMS_TO_KEEP, config.minItemsToKeep());
		Assert.assertEquals(StalenessRefresher.DEFAULT_STALENESS_MILLIS, config.stalenessMillis());
		Assert.assertEquals(ROOT.resolve("offline-cache"), engine.getLayout().payloadDirectory());
	}


	private static CacheEngine _engine(MockTimeGenerator time, MemoryStorageFileSystem fileSystem, SilentLogger logger)
	{
		CacheEngine engine = new CacheEngine(StashConfig.defaults(ROOT), fileSystem, logger, time, new ManualScheduler());
		Assert.assertTrue(engine.getStructureManager().initializeStructure().success());
		return engine;
	}
}
