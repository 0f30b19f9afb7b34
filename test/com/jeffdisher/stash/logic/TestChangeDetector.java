package com.jeffdisher.stash.logic;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Assert;
import org.junit.Test;

import com.eclipsesource.json.Json;
import com.jeffdisher.stash.data.FileHashRecord;
import com.jeffdisher.stash.data.HashRegistry;
import com.jeffdisher.stash.scheduler.IScheduledTask;
import com.jeffdisher.stash.testutils.ManualScheduler;
import com.jeffdisher.stash.testutils.MemoryStorageFileSystem;
import com.jeffdisher.stash.testutils.MockTimeGenerator;
import com.jeffdisher.stash.testutils.SilentLogger;
import com.jeffdisher.stash.utils.MiscHelpers;


public class TestChangeDetector
{
	private static final Path SOURCES = Path.of("/sources");
	private static final Path FILE = SOURCES.resolve("input.txt");
	private static final Path OTHER = SOURCES.resolve("other.txt");
	private static final String H1 = PayloadStore.hash("one");
	private static final String H2 = PayloadStore.hash("two");
	private static final String H3 = PayloadStore.hash("three");

	@Test
	public void fileHash() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		ChangeDetector detector = _engine(time, fileSystem, new SilentLogger(), new ManualScheduler()).getChangeDetector();
		_write(fileSystem, FILE, "abc");
		Assert.assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", detector.computeFileHash(FILE));
		Assert.assertNull(detector.computeFileHash(OTHER));
		fileSystem.failReads(FILE);
		Assert.assertNull(detector.computeFileHash(FILE));
	}

	@Test
	public void registerAndUntrack() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		_write(fileSystem, FILE, "first");
		Assert.assertTrue(detector.getTrackedFiles().isEmpty());
		
		Assert.assertTrue(detector.registerFile(FILE, List.of(H1, H2, H1)));
		List<FileHashRecord> tracked = detector.getTrackedFiles();
		Assert.assertEquals(1, tracked.size());
		FileHashRecord record = tracked.get(0);
		Assert.assertEquals(FILE.toString(), record.filePath());
		Assert.assertEquals(MiscHelpers.sha256Hex("first".getBytes(StandardCharsets.UTF_8)), record.hash());
		Assert.assertEquals(List.of(H1, H2), record.relatedCacheHashes());
		Assert.assertTrue(fileSystem.exists(engine.getLayout().registryFile()));
		
		// Re-registering replaces the record.
		time.advance(1000L);
		Assert.assertTrue(detector.registerFile(FILE, List.of(H3)));
		tracked = detector.getTrackedFiles();
		Assert.assertEquals(1, tracked.size());
		Assert.assertEquals(List.of(H3), tracked.get(0).relatedCacheHashes());
		Assert.assertEquals(time.currentTimeMillis, tracked.get(0).computedAtMillis());
		
		// A file which doesn't exist can't be tracked.
		Assert.assertFalse(detector.registerFile(OTHER, List.of(H1)));
		Assert.assertEquals(1, logger.getWarningCount());
		Assert.assertEquals(1, detector.getTrackedFiles().size());
		
		Assert.assertTrue(detector.untrackFile(FILE));
		Assert.assertTrue(detector.getTrackedFiles().isEmpty());
		Assert.assertFalse(detector.untrackFile(FILE));
	}

	@Test
	public void relatedHashesMustBePayloadHashes() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		_write(fileSystem, FILE, "content");
		
		// The name of the index (or anything else which isn't 64 lower-case hex digits) is refused.
		Assert.assertFalse(detector.registerFile(FILE, List.of(H1, "cache-index")));
		Assert.assertFalse(detector.registerFile(FILE, List.of("a/b")));
		Assert.assertFalse(detector.registerFile(FILE, List.of(H1.toUpperCase())));
		Assert.assertFalse(detector.registerFile(FILE, List.of("")));
		Assert.assertEquals(4, logger.getWarningCount());
		Assert.assertTrue(detector.getTrackedFiles().isEmpty());
	}

	@Test
	public void malformedRegistryHashesAreErrors() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		String derived = _store(engine, "derived");
		String unrelated = _store(engine, "unrelated");
		_write(fileSystem, FILE, "version 2");
		// A registry edited by hand, recording an older version of the file.
		HashRegistry registry = HashRegistry.empty(time.getAsLong());
		registry.putFile(new FileHashRecord(FILE.toString(), PayloadStore.hash("version 1"), time.getAsLong(), List.of("cache-index", derived, "a/b")));
		Assert.assertTrue(detector.saveRegistry(registry));
		
		ChangeDetector.Result result = detector.detectAndInvalidateChanges();
		Assert.assertFalse(result.success());
		Assert.assertEquals(1, result.filesChanged());
		Assert.assertEquals(1, result.cacheEntriesInvalidated());
		Assert.assertEquals(2, result.errors().size());
		Assert.assertTrue(logger.didErrorOccur());
		// Only the real entry was invalidated:  the index survived.
		Assert.assertTrue(fileSystem.exists(engine.getLayout().indexFile()));
		Assert.assertNull(engine.getIndexStore().getItem(derived));
		Assert.assertNotNull(engine.getIndexStore().getItem(unrelated));
		// The new file hash was still recorded.
		Assert.assertEquals(MiscHelpers.sha256Hex("version 2".getBytes(StandardCharsets.UTF_8)), detector.getTrackedFiles().get(0).hash());
	}

	@Test
	public void changedFileInvalidates() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		CacheEngine engine = _engine(time, fileSystem, new SilentLogger(), new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		String derived = _store(engine, "derived");
		String unrelated = _store(engine, "unrelated");
		_write(fileSystem, FILE, "version 1");
		Assert.assertTrue(detector.registerFile(FILE, List.of(derived)));
		
		// Nothing changed yet.
		ChangeDetector.Result quiet = detector.detectAndInvalidateChanges();
		Assert.assertEquals(new ChangeDetector.Result(true, 1, 0, 0, List.of()), quiet);
		Assert.assertTrue(engine.getPayloadStore().exists(derived));
		
		_write(fileSystem, FILE, "version 2");
		time.advance(1000L);
		ChangeDetector.Result result = detector.detectAndInvalidateChanges();
		Assert.assertTrue(result.success());
		Assert.assertEquals(1, result.filesScanned());
		Assert.assertEquals(1, result.filesChanged());
		Assert.assertEquals(1, result.cacheEntriesInvalidated());
		Assert.assertFalse(engine.getPayloadStore().load(derived).success());
		Assert.assertNull(engine.getIndexStore().getItem(derived));
		Assert.assertNotNull(engine.getIndexStore().getItem(unrelated));
		
		// The new hash was recorded so the next pass is quiet.
		FileHashRecord record = detector.getTrackedFiles().get(0);
		Assert.assertEquals(MiscHelpers.sha256Hex("version 2".getBytes(StandardCharsets.UTF_8)), record.hash());
		Assert.assertEquals(time.currentTimeMillis, record.computedAtMillis());
		Assert.assertEquals(0, detector.detectAndInvalidateChanges().filesChanged());
	}

	@Test
	public void missingFileInvalidates() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		String derived = _store(engine, "derived");
		_write(fileSystem, FILE, "content");
		Assert.assertTrue(detector.registerFile(FILE, List.of(derived)));
		String originalHash = detector.getTrackedFiles().get(0).hash();
		
		Assert.assertTrue(fileSystem.deleteFile(FILE));
		ChangeDetector.Result result = detector.detectAndInvalidateChanges();
		Assert.assertTrue(result.success());
		Assert.assertEquals(1, result.filesChanged());
		Assert.assertEquals(1, result.cacheEntriesInvalidated());
		Assert.assertFalse(engine.getPayloadStore().exists(derived));
		Assert.assertNull(engine.getIndexStore().getItem(derived));
		Assert.assertEquals(1, logger.getWarningCount());
		
		// The record stays, with its old hash, until untracked.
		List<FileHashRecord> tracked = detector.getTrackedFiles();
		Assert.assertEquals(1, tracked.size());
		Assert.assertEquals(originalHash, tracked.get(0).hash());
	}

	@Test
	public void unreadableFileIsAnError() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		String first = _store(engine, "first");
		String second = _store(engine, "second");
		_write(fileSystem, FILE, "one");
		_write(fileSystem, OTHER, "two");
		Assert.assertTrue(detector.registerFile(FILE, List.of(first)));
		Assert.assertTrue(detector.registerFile(OTHER, List.of(second)));
		
		fileSystem.failReads(FILE);
		_write(fileSystem, OTHER, "changed");
		ChangeDetector.Result result = detector.detectAndInvalidateChanges();
		Assert.assertFalse(result.success());
		Assert.assertEquals(2, result.filesScanned());
		Assert.assertEquals(1, result.filesChanged());
		Assert.assertEquals(1, result.cacheEntriesInvalidated());
		Assert.assertEquals(1, result.errors().size());
		Assert.assertTrue(logger.didErrorOccur());
		// The unreadable file's entries are untouched while the other file was still processed.
		Assert.assertTrue(engine.getPayloadStore().exists(first));
		Assert.assertFalse(engine.getPayloadStore().exists(second));
	}

	@Test
	public void evictionFailureKeepsProgress() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		CacheEngine engine = _engine(time, fileSystem, new SilentLogger(), new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		String stuck = _store(engine, "stuck");
		String loose = _store(engine, "loose");
		_write(fileSystem, FILE, "before");
		Assert.assertTrue(detector.registerFile(FILE, List.of(stuck, loose)));
		fileSystem.failDeletes(engine.getLayout().payloadFile(stuck));
		
		_write(fileSystem, FILE, "after");
		ChangeDetector.Result result = detector.detectAndInvalidateChanges();
		Assert.assertFalse(result.success());
		Assert.assertEquals(1, result.filesChanged());
		Assert.assertEquals(1, result.cacheEntriesInvalidated());
		Assert.assertEquals(1, result.errors().size());
		Assert.assertNotNull(engine.getIndexStore().getItem(stuck));
		Assert.assertNull(engine.getIndexStore().getItem(loose));
		// The new hash is still recorded.
		Assert.assertEquals(MiscHelpers.sha256Hex("after".getBytes(StandardCharsets.UTF_8)), detector.getTrackedFiles().get(0).hash());
	}

	@Test
	public void corruptRegistry() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		SilentLogger logger = new SilentLogger();
		CacheEngine engine = _engine(time, fileSystem, logger, new ManualScheduler());
		ChangeDetector detector = engine.getChangeDetector();
		fileSystem.writeFile(engine.getLayout().registryFile(), "not json".getBytes(StandardCharsets.UTF_8));
		
		Assert.assertTrue(detector.getTrackedFiles().isEmpty());
		Assert.assertEquals(new ChangeDetector.Result(true, 0, 0, 0, List.of()), detector.detectAndInvalidateChanges());
		Assert.assertTrue(logger.getWarningCount() >= 2);
		Assert.assertFalse(logger.didErrorOccur());
		
		// Registering replaces the broken document.
		_write(fileSystem, FILE, "data");
		Assert.assertTrue(detector.registerFile(FILE, List.of()));
		Assert.assertEquals(1, detector.getTrackedFiles().size());
	}

	@Test
	public void scheduledDetection() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		ManualScheduler scheduler = new ManualScheduler();
		CacheEngine engine = _engine(time, fileSystem, new SilentLogger(), scheduler);
		ChangeDetector detector = engine.getChangeDetector();
		String derived = _store(engine, "derived");
		_write(fileSystem, FILE, "version 1");
		Assert.assertTrue(detector.registerFile(FILE, List.of(derived)));
		
		// The first pass runs immediately.
		_write(fileSystem, FILE, "version 2");
		IScheduledTask task = detector.scheduleChangeDetection(1000L);
		Assert.assertFalse(engine.getPayloadStore().exists(derived));
		Assert.assertEquals(1, scheduler.activeTaskCount());
		
		// Later passes run on the interval.
		String next = _store(engine, "next");
		Assert.assertTrue(detector.registerFile(FILE, List.of(next)));
		_write(fileSystem, FILE, "version 3");
		scheduler.advance(999L);
		Assert.assertTrue(engine.getPayloadStore().exists(next));
		scheduler.advance(1L);
		Assert.assertFalse(engine.getPayloadStore().exists(next));
		
		// Nothing runs after stop.
		task.stop();
		Assert.assertEquals(0, scheduler.activeTaskCount());
		String last = _store(engine, "last");
		Assert.assertTrue(detector.registerFile(FILE, List.of(last)));
		_write(fileSystem, FILE, "version 4");
		scheduler.advance(10_000L);
		Assert.assertTrue(engine.getPayloadStore().exists(last));
	}

	@Test
	public void overlappingTickIsSkipped() throws Throwable
	{
		MockTimeGenerator time = new MockTimeGenerator();
		MemoryStorageFileSystem fileSystem = _fileSystem(time);
		ManualScheduler scheduler = new ManualScheduler();
		CacheEngine engine = _engine(time, fileSystem, new SilentLogger(), scheduler);
		ChangeDetector detector = engine.getChangeDetector();
		_write(fileSystem, FILE, "content");
		Assert.assertTrue(detector.registerFile(FILE, List.of()));
		
		// Every registry read (one per pass) fires the timer again, as if the pass were slow.
		Path registry = engine.getLayout().registryFile();
		AtomicInteger passes = new AtomicInteger(0);
		fileSystem.setReadHook((Path path) -> {
			if (path.equals(registry))
			{
				passes.incrementAndGet();
				scheduler.fireAll();
			}
		});
		IScheduledTask task = detector.scheduleChangeDetection(1000L);
		Assert.assertEquals(1, passes.get());
		scheduler.advance(1000L);
		// The tick ran its pass but the re-entrant firing during it was skipped.
		Assert.assertEquals(2, passes.get());
		task.stop();
		
		// The guard was released so direct passes still run.
		fileSystem.setReadHook(null);
		Assert.assertEquals(new ChangeDetector.Result(true, 1, 0, 0, List.of()), detector.detectAndInvalidateChanges());
	}


	private static MemoryStorageFileSystem _fileSystem(MockTimeGenerator time) throws Exception
	{
		MemoryStorageFileSystem fileSystem = new MemoryStorageFileSystem(time);
		fileSystem.createDirectories(SOURCES);
		return fileSystem;
	}

	private static CacheEngine _engine(MockTimeGenerator time, MemoryStorageFileSystem fileSystem, SilentLogger logger, ManualScheduler scheduler)
	{
		CacheEngine engine = new CacheEngine(StashConfig.defaults(Path.of("/cache")), fileSystem, logger, time, scheduler);
		Assert.assertTrue(engine.getStructureManager().initializeStructure().success());
		return engine;
	}

	private static String _store(CacheEngine engine, String content)
	{
		PayloadStore.SaveResult saved = engine.cacheAndIndex(Json.value(content), "source", "type", null);
		Assert.assertTrue(saved.success());
		return saved.hash();
	}

	private static void _write(MemoryStorageFileSystem fileSystem, Path file, String content) throws Exception
	{
		fileSystem.writeFile(file, content.getBytes(StandardCharsets.UTF_8));
	}
}
