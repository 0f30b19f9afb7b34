package com.jeffdisher.stash.logic;

import java.io.IOException;


/**
 * The execute half of every eviction path:  the policies decide what to evict by reading the index, then each chosen
 * hash is evicted here by deleting the payload file and then removing the index entry.
 * A payload file or index entry which is already gone is not a failure (index and store are only eventually
 * consistent), so only real I/O failures are thrown.
 */
class Evictor
{
	private final PayloadStore _payloadStore;
	private final CacheIndexStore _indexStore;

	Evictor(PayloadStore payloadStore, CacheIndexStore indexStore)
	{
		_payloadStore = payloadStore;
		_indexStore = indexStore;
	}

	/**
	 * @param hash The hash to evict.
	 * @return True if either the payload file or the index entry existed.
	 * @throws IOException Deleting the file or writing the index failed.
	 */
	boolean evict(String hash) throws IOException
	{
		boolean hadFile = _payloadStore.deleteIfPresent(hash);
		boolean hadEntry = (null != _indexStore.removeOrThrow(hash));
		return hadFile || hadEntry;
	}
}
