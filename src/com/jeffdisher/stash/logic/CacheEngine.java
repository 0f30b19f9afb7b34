package com.jeffdisher.stash.logic;

import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.scheduler.IIntervalScheduler;
import com.jeffdisher.stash.types.ILogger;


/**
 * The explicit value which owns one cache instance:  its configuration, layout, filesystem, logger, clock, and every
 * component built over them.  Callers (including the command-line) only ever need this object.
 * All components share the same CacheIndexStore so that its monitor serializes every index update in the process.
 */
public class CacheEngine
{
	private final StashConfig _config;
	private final CacheLayout _layout;
	private final ILogger _logger;
	private final StructureManager _structureManager;
	private final PayloadStore _payloadStore;
	private final CacheIndexStore _indexStore;
	private final RetentionPolicy _retentionPolicy;
	private final SizePruner _sizePruner;
	private final StalenessRefresher _stalenessRefresher;
	private final ChangeDetector _changeDetector;

	public CacheEngine(StashConfig config
			, IStorageFileSystem fileSystem
			, ILogger logger
			, LongSupplier currentTimeMillisGenerator
			, IIntervalScheduler scheduler
	)
	{
		_config = config;
		_layout = new CacheLayout(config.rootPath());
		_logger = logger;
		_structureManager = new StructureManager(_layout, fileSystem, logger, currentTimeMillisGenerator);
		_payloadStore = new PayloadStore(_layout, fileSystem, logger, currentTimeMillisGenerator);
		_indexStore = new CacheIndexStore(_layout, fileSystem, logger, currentTimeMillisGenerator);
		_retentionPolicy = new RetentionPolicy(_payloadStore, _indexStore, logger, currentTimeMillisGenerator);
		_sizePruner = new SizePruner(_payloadStore, _indexStore, logger);
		_stalenessRefresher = new StalenessRefresher(_indexStore, logger, currentTimeMillisGenerator);
		_changeDetector = new ChangeDetector(_layout, fileSystem, logger, currentTimeMillisGenerator, _payloadStore, _indexStore, scheduler);
	}

	public StashConfig getConfig()
	{
		return _config;
	}

	public CacheLayout getLayout()
	{
		return _layout;
	}

	public StructureManager getStructureManager()
	{
		return _structureManager;
	}

	public PayloadStore getPayloadStore()
	{
		return _payloadStore;
	}

	public CacheIndexStore getIndexStore()
	{
		return _indexStore;
	}

	public RetentionPolicy getRetentionPolicy()
	{
		return _retentionPolicy;
	}

	public SizePruner getSizePruner()
	{
		return _sizePruner;
	}

	public StalenessRefresher getStalenessRefresher()
	{
		return _stalenessRefresher;
	}

	public ChangeDetector getChangeDetector()
	{
		return _changeDetector;
	}

	/**
	 * Saves the payload and registers it in the index with its on-disk size.
	 * If the content was already stored, the existing payload is re-registered (which resets its access statistics).
	 * 
	 * @param data The content.
	 * @param source Where it came from.
	 * @param type The kind of content.
	 * @param metadata Optional additional data (can be null).
	 * @return The save result (a failure to register in the index is reported as a failure, with the hash and path
	 * of the stored file).
	 */
	public PayloadStore.SaveResult cacheAndIndex(JsonValue data, String source, String type, JsonObject metadata)
	{
		PayloadStore.SaveResult saved = _payloadStore.save(data, source, type, metadata);
		PayloadStore.SaveResult result = saved;
		if (saved.success())
		{
			// Load back what is on disk:  for a deduplicated save, that is the original payload, with its own cachedAt.
			PayloadStore.LoadResult loaded = _payloadStore.load(saved.hash());
			String error = null;
			if (!loaded.success())
			{
				error = loaded.error();
			}
			else if (!_indexStore.add(loaded.payload(), _payloadStore.size(saved.hash())))
			{
				error = "Failed to register payload in index: " + saved.hash();
			}
			if (null != error)
			{
				_logger.logError(error);
				result = new PayloadStore.SaveResult(false, saved.hash(), saved.filePath(), error);
			}
		}
		return result;
	}

	/**
	 * Deletes the payload file and removes its index entry.
	 * 
	 * @param hash The payload hash.
	 * @return True if either the file or the entry existed and was removed.
	 */
	public boolean deleteAndUnindex(String hash)
	{
		boolean hadFile = _payloadStore.delete(hash);
		boolean hadEntry = _indexStore.remove(hash);
		return hadFile || hadEntry;
	}

	/**
	 * Runs the index repair pass against the payload directory.
	 * 
	 * @return What was changed.
	 */
	public CacheIndexStore.ReconcileResult reconcile()
	{
		return _indexStore.reconcile(_payloadStore);
	}
}
