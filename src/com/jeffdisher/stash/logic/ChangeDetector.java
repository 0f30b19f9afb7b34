package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.stash.data.FileHashRecord;
import com.jeffdisher.stash.data.HashRegistry;
import com.jeffdisher.stash.scheduler.IIntervalScheduler;
import com.jeffdisher.stash.scheduler.IScheduledTask;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.types.ILogger;
import com.jeffdisher.stash.utils.MiscHelpers;


/**
 * Tracks the content hashes of source files in "hash-registry.json" and invalidates the cache entries derived from a
 * file when that file changes or disappears.
 * Per tracked file, a detection pass either finds it unchanged (nothing happens) or changed/missing, in which case
 * every related cache hash is evicted.  A changed file then gets its new hash recorded.  A missing file keeps its
 * old record until it is explicitly untracked.
 * Registry read-modify-write cycles are serialized on this object's monitor since detection can run on a
 * background thread.
 */
public class ChangeDetector
{
	private final CacheLayout _layout;
	private final IStorageFileSystem _fileSystem;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;
	private final Evictor _evictor;
	private final IIntervalScheduler _scheduler;
	// Set while a scheduled pass is running so that a tick arriving during it is skipped instead of queued.
	private final AtomicBoolean _passInFlight;

	public ChangeDetector(CacheLayout layout
			, IStorageFileSystem fileSystem
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, PayloadStore payloadStore
			, CacheIndexStore indexStore
			, IIntervalScheduler scheduler
	)
	{
		_layout = layout;
		_fileSystem = fileSystem;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_evictor = new Evictor(payloadStore, indexStore);
		_scheduler = scheduler;
		_passInFlight = new AtomicBoolean(false);
	}

	/**
	 * @param file The file to hash.
	 * @return The lower-case hex SHA-256 of the file's bytes, or null if it doesn't exist or can't be read.
	 */
	public String computeFileHash(Path file)
	{
		String hash;
		try
		{
			byte[] data = _fileSystem.readFile(file);
			hash = (null != data)
					? MiscHelpers.sha256Hex(data)
					: null
			;
		}
		catch (IOException e)
		{
			_logger.logVerbose("Cannot read " + file + ": " + e.getLocalizedMessage());
			hash = null;
		}
		return hash;
	}

	/**
	 * Loads the registry, returning an empty one if the file is absent, unreadable, or corrupt (the last 2 cases are
	 * logged as warnings).
	 * 
	 * @return The registry (never null).
	 */
	public synchronized HashRegistry loadRegistry()
	{
		Path file = _layout.registryFile();
		HashRegistry registry = null;
		try
		{
			byte[] raw = _fileSystem.readFile(file);
			if (null != raw)
			{
				JsonObject json = JsonDocuments.decodeObject(raw);
				if (null != json)
				{
					registry = HashRegistry.fromJson(json);
				}
				else
				{
					_logger.logWarning("Hash registry is not valid JSON, starting fresh");
				}
			}
		}
		catch (FailedDeserializationException e)
		{
			_logger.logWarning("Hash registry is malformed, starting fresh: " + e.getLocalizedMessage());
		}
		catch (IOException e)
		{
			_logger.logWarning("Cannot read hash registry, starting fresh: " + e.getLocalizedMessage());
		}
		return (null != registry)
				? registry
				: HashRegistry.empty(_currentTimeMillisGenerator.getAsLong())
		;
	}

	/**
	 * @param registry The registry to write (its updatedAt is set to now).
	 * @return True if it was written.
	 */
	public synchronized boolean saveRegistry(HashRegistry registry)
	{
		boolean didSave;
		try
		{
			registry.markUpdated(_currentTimeMillisGenerator.getAsLong());
			_fileSystem.writeFile(_layout.registryFile(), JsonDocuments.encode(registry.toJson()));
			didSave = true;
		}
		catch (IOException e)
		{
			_logger.logError("Failed to write hash registry: " + e.getLocalizedMessage());
			didSave = false;
		}
		return didSave;
	}

	/**
	 * Starts tracking the file (or re-registers it), recording its current hash and the cache entries derived from it.
	 * Duplicate related hashes are collapsed, keeping the first occurrence.
	 * 
	 * @param file The source file.
	 * @param relatedCacheHashes The cache hashes derived from it (can be empty).
	 * @return False if a related hash isn't a payload hash, the file couldn't be hashed, or the registry couldn't be
	 * written.
	 */
	public synchronized boolean registerFile(Path file, List<String> relatedCacheHashes)
	{
		String invalid = _firstInvalidHash(relatedCacheHashes);
		String hash = (null == invalid)
				? computeFileHash(file)
				: null
		;
		boolean didRegister = false;
		if (null != invalid)
		{
			_logger.logWarning("Cannot track " + file + ": not a payload hash: \"" + invalid + "\"");
		}
		else if (null != hash)
		{
			HashRegistry registry = loadRegistry();
			List<String> related = new ArrayList<>(new LinkedHashSet<>(relatedCacheHashes));
			registry.putFile(new FileHashRecord(file.toString(), hash, _currentTimeMillisGenerator.getAsLong(), related));
			didRegister = saveRegistry(registry);
			if (didRegister)
			{
				_logger.logVerbose("Tracking " + file + " -> " + related.size() + " cache entr" + ((1 == related.size()) ? "y" : "ies"));
			}
		}
		else
		{
			_logger.logWarning("Cannot track " + file + ": file can't be read");
		}
		return didRegister;
	}

	/**
	 * @return The tracked files, in registration order.
	 */
	public List<FileHashRecord> getTrackedFiles()
	{
		return loadRegistry().getFiles();
	}

	/**
	 * @param file The source file.
	 * @return True if the file was tracked and the registry was written without it.
	 */
	public synchronized boolean untrackFile(Path file)
	{
		HashRegistry registry = loadRegistry();
		boolean didUntrack = false;
		if (null != registry.removeFile(file.toString()))
		{
			didUntrack = saveRegistry(registry);
		}
		return didUntrack;
	}

	/**
	 * Scans every tracked file, evicting the related cache entries of each one which changed or went missing.
	 * Failures are recorded per file or per entry and the scan continues.  The registry is written once, at the end,
	 * if any file changed, so partial progress is kept even when there were errors.
	 * 
	 * @return The result (success only if there were no errors).
	 */
	public synchronized Result detectAndInvalidateChanges()
	{
		ILogger log = _logger.logStart("Detecting changes in tracked files");
		HashRegistry registry = loadRegistry();
		List<String> errors = new ArrayList<>();
		int filesScanned = 0;
		int filesChanged = 0;
		int invalidated = 0;
		for (FileHashRecord record : registry.getFiles())
		{
			filesScanned += 1;
			Path file = Path.of(record.filePath());
			boolean isChanged;
			if (!_fileSystem.exists(file))
			{
				log.logWarning("Tracked file missing: " + file);
				isChanged = true;
			}
			else
			{
				String currentHash = computeFileHash(file);
				if (null == currentHash)
				{
					String message = "Failed to compute hash for " + file;
					log.logError(message);
					errors.add(message);
					isChanged = false;
				}
				else if (!currentHash.equals(record.hash()))
				{
					log.logOperation("File changed: " + file);
					registry.putFile(record.rehashed(currentHash, _currentTimeMillisGenerator.getAsLong()));
					isChanged = true;
				}
				else
				{
					isChanged = false;
				}
			}
			
			if (isChanged)
			{
				filesChanged += 1;
				for (String cacheHash : record.relatedCacheHashes())
				{
					String message = null;
					if (!MiscHelpers.isPayloadHash(cacheHash))
					{
						message = "Not a payload hash, related to " + file + ": \"" + cacheHash + "\"";
					}
					else
					{
						try
						{
							_evictor.evict(cacheHash);
							invalidated += 1;
						}
						catch (IOException e)
						{
							message = "Failed to invalidate cache " + cacheHash + ": " + e.getLocalizedMessage();
						}
					}
					if (null != message)
					{
						log.logError(message);
						errors.add(message);
					}
				}
			}
		}
		
		if ((filesChanged > 0) && !saveRegistry(registry))
		{
			errors.add("Failed to write hash registry");
		}
		log.logFinish("Change detection: " + filesScanned + " scanned, " + filesChanged + " changed, " + invalidated + " cache entries invalidated, " + errors.size() + " error(s)");
		return new Result(errors.isEmpty(), filesScanned, filesChanged, invalidated, errors);
	}

	/**
	 * Runs one detection pass now, on the calling thread, then asks the scheduler to run further passes every
	 * intervalMillis until the returned handle is stopped.  A tick which arrives while a pass is still running is
	 * skipped.
	 * 
	 * @param intervalMillis The interval between passes.
	 * @return The handle to stop the repeating detection.
	 */
	public IScheduledTask scheduleChangeDetection(long intervalMillis)
	{
		_runGuardedPass();
		return _scheduler.start(intervalMillis, () -> _runGuardedPass());
	}


	private static String _firstInvalidHash(List<String> hashes)
	{
		String invalid = null;
		for (String hash : hashes)
		{
			if (!MiscHelpers.isPayloadHash(hash))
			{
				invalid = hash;
				break;
			}
		}
		return invalid;
	}

	private void _runGuardedPass()
	{
		if (_passInFlight.compareAndSet(false, true))
		{
			try
			{
				detectAndInvalidateChanges();
			}
			finally
			{
				_passInFlight.set(false);
			}
		}
		else
		{
			_logger.logVerbose("Skipping change detection tick:  previous pass still running");
		}
	}


	/**
	 * The outcome of a detection pass.
	 */
	public static record Result(boolean success, int filesScanned, int filesChanged, int cacheEntriesInvalidated, List<String> errors)
	{
		public Result
		{
			errors = List.copyOf(errors);
		}
	}
}
