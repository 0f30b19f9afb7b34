package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.LongSupplier;

import com.eclipsesource.json.JsonObject;
import com.jeffdisher.stash.data.CacheIndex;
import com.jeffdisher.stash.data.CacheStats;
import com.jeffdisher.stash.data.CachedPayload;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.data.SearchFilter;
import com.jeffdisher.stash.types.FailedDeserializationException;
import com.jeffdisher.stash.types.ILogger;


/**
 * The owner of "cache-index.json".
 * Every operation loads the document, applies its change, and writes it back.  All of these read-modify-write cycles
 * run under this object's monitor so, within one process, updates can't be lost as long as everything goes through
 * the same instance.  The write itself is atomic, so a crash leaves either the old or the new document.
 * A corrupt document is never an exception:  it is logged and treated as an empty index.
 */
public class CacheIndexStore
{
	private final CacheLayout _layout;
	private final IStorageFileSystem _fileSystem;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	public CacheIndexStore(CacheLayout layout, IStorageFileSystem fileSystem, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_layout = layout;
		_fileSystem = fileSystem;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
	}

	/**
	 * Loads the index.  If there is no index file, a fresh one is created and written.  If the file can't be read or
	 * decoded, a fresh index is returned but the broken file is left in place until the next save replaces it.
	 * 
	 * @return The index (never null).
	 */
	public synchronized CacheIndex load()
	{
		return _loadIndex();
	}

	/**
	 * Writes the whole index, setting its updatedAt to now.
	 * 
	 * @param index The index to write.
	 * @return True if it was written.
	 */
	public synchronized boolean save(CacheIndex index)
	{
		boolean didSave;
		try
		{
			_writeIndex(index);
			didSave = true;
		}
		catch (IOException e)
		{
			_logger.logError("Failed to write index: " + e.getLocalizedMessage());
			didSave = false;
		}
		return didSave;
	}

	/**
	 * Registers a stored payload.  An existing item with the same hash is replaced by a fresh one with an access count
	 * of 1, which was last accessed now (registering it again is a use).
	 * 
	 * @param payload The payload which was saved.
	 * @param sizeBytes The size of its file.
	 * @return True if the index was written.
	 */
	public synchronized boolean add(CachedPayload payload, long sizeBytes)
	{
		CacheIndex index = _loadIndex();
		long lastAccessedMillis = (null != index.getItem(payload.hash()))
				? _currentTimeMillisGenerator.getAsLong()
				: 0L
		;
		index.putItem(IndexItem.forPayload(payload, sizeBytes, lastAccessedMillis));
		return save(index);
	}

	/**
	 * @param hash The payload hash.
	 * @return True if the item existed and the index was written without it.
	 */
	public synchronized boolean remove(String hash)
	{
		boolean didRemove;
		try
		{
			didRemove = (null != removeOrThrow(hash));
		}
		catch (IOException e)
		{
			_logger.logError("Failed to write index: " + e.getLocalizedMessage());
			didRemove = false;
		}
		return didRemove;
	}

	/**
	 * @param filter The field filters (SearchFilter.ALL matches everything).
	 * @return The matching items, in index order.
	 */
	public synchronized List<IndexItem> search(SearchFilter filter)
	{
		List<IndexItem> matches = new ArrayList<>();
		for (IndexItem item : _loadIndex().getItems())
		{
			if (filter.matches(item))
			{
				matches.add(item);
			}
		}
		return matches;
	}

	/**
	 * @param hash The payload hash.
	 * @return The item or null if it isn't indexed.
	 */
	public synchronized IndexItem getItem(String hash)
	{
		return _loadIndex().getItem(hash);
	}

	/**
	 * Records an access:  lastAccessedAt becomes now and the access count is incremented.
	 * 
	 * @param hash The payload hash.
	 * @return False if the item isn't indexed or the index couldn't be written.
	 */
	public synchronized boolean touch(String hash)
	{
		CacheIndex index = _loadIndex();
		IndexItem item = index.getItem(hash);
		boolean didTouch = false;
		if (null != item)
		{
			index.putItem(item.touched(_currentTimeMillisGenerator.getAsLong()));
			didTouch = save(index);
		}
		return didTouch;
	}

	/**
	 * Statistics derived from the index alone.  These can be stale relative to the payload directory:  see
	 * reconcile() for the repair pass.
	 * 
	 * @return The aggregate statistics.
	 */
	public synchronized CacheStats stats()
	{
		CacheIndex index = _loadIndex();
		Map<String, Integer> bySource = new HashMap<>();
		Map<String, Integer> byType = new HashMap<>();
		long oldest = 0L;
		long newest = 0L;
		boolean isFirst = true;
		for (IndexItem item : index.getItems())
		{
			bySource.merge(item.source(), 1, Integer::sum);
			byType.merge(item.type(), 1, Integer::sum);
			if (isFirst || (item.cachedAtMillis() < oldest))
			{
				oldest = item.cachedAtMillis();
			}
			if (isFirst || (item.cachedAtMillis() > newest))
			{
				newest = item.cachedAtMillis();
			}
			isFirst = false;
		}
		return new CacheStats(index.getTotalItems(), index.getTotalSizeBytes(), oldest, newest, bySource, byType);
	}

	/**
	 * The explicit repair pass, recomputing the index from what is actually in the payload directory:  entries whose
	 * payload file is gone are dropped, payload files with no entry are indexed (if they can be decoded), and sizes
	 * which don't match the file are corrected.
	 * 
	 * @param store The payload store over the same layout.
	 * @return What was changed.
	 */
	public synchronized ReconcileResult reconcile(PayloadStore store)
	{
		ILogger log = _logger.logStart("Reconciling index with payload directory");
		CacheIndex index = _loadIndex();
		Set<String> onDisk = new HashSet<>(store.listAll());
		int orphaned = 0;
		int corrected = 0;
		for (IndexItem item : index.getItems())
		{
			if (!onDisk.contains(item.hash()))
			{
				log.logVerbose("Dropping orphaned entry: " + item.hash());
				index.removeItem(item.hash());
				orphaned += 1;
			}
			else
			{
				long size = store.size(item.hash());
				if ((size >= 0L) && (size != item.sizeBytes()))
				{
					index.putItem(item.withSize(size));
					corrected += 1;
				}
			}
		}
		int added = 0;
		for (String hash : onDisk)
		{
			if (null == index.getItem(hash))
			{
				PayloadStore.LoadResult loaded = store.load(hash);
				if (loaded.success())
				{
					index.putItem(IndexItem.forPayload(loaded.payload(), store.size(hash)));
					added += 1;
				}
				else
				{
					log.logWarning("Cannot index payload file: " + loaded.error());
				}
			}
		}
		
		boolean success = true;
		if ((orphaned > 0) || (added > 0) || (corrected > 0))
		{
			success = save(index);
		}
		log.logFinish("Reconcile: " + orphaned + " orphaned, " + added + " added, " + corrected + " corrected");
		return new ReconcileResult(success, orphaned, added, corrected);
	}

	// Used by the eviction paths:  returns the removed item, null if it wasn't indexed, throwing if the write failed.
	synchronized IndexItem removeOrThrow(String hash) throws IOException
	{
		CacheIndex index = _loadIndex();
		IndexItem removed = index.removeItem(hash);
		if (null != removed)
		{
			_writeIndex(index);
		}
		return removed;
	}


	private CacheIndex _loadIndex()
	{
		CacheIndex index = null;
		byte[] raw;
		try
		{
			raw = _fileSystem.readFile(_layout.indexFile());
		}
		catch (IOException e)
		{
			_logger.logWarning("Cannot read index, starting fresh: " + e.getLocalizedMessage());
			raw = null;
			index = CacheIndex.empty(_currentTimeMillisGenerator.getAsLong());
		}
		
		if (null == index)
		{
			if (null == raw)
			{
				index = CacheIndex.empty(_currentTimeMillisGenerator.getAsLong());
				// Bootstrap the file so the next load sees the same creation time.
				try
				{
					_writeIndex(index);
				}
				catch (IOException e)
				{
					_logger.logWarning("Cannot create index file: " + e.getLocalizedMessage());
				}
			}
			else
			{
				index = _decode(raw);
			}
		}
		return index;
	}

	private CacheIndex _decode(byte[] raw)
	{
		CacheIndex index = null;
		JsonObject json = JsonDocuments.decodeObject(raw);
		if (null != json)
		{
			try
			{
				index = CacheIndex.fromJson(json);
			}
			catch (FailedDeserializationException e)
			{
				_logger.logWarning("Index is malformed, starting fresh: " + e.getLocalizedMessage());
			}
		}
		else
		{
			_logger.logWarning("Index is not valid JSON, starting fresh");
		}
		return (null != index)
				? index
				: CacheIndex.empty(_currentTimeMillisGenerator.getAsLong())
		;
	}

	private void _writeIndex(CacheIndex index) throws IOException
	{
		index.markUpdated(_currentTimeMillisGenerator.getAsLong());
		_fileSystem.writeFile(_layout.indexFile(), JsonDocuments.encode(index.toJson()));
	}


	/**
	 * The outcome of the repair pass.  success is false only if the repaired index couldn't be written.
	 */
	public static record ReconcileResult(boolean success, int orphanedEntriesRemoved, int unindexedPayloadsAdded, int sizesCorrected)
	{
	}
}
