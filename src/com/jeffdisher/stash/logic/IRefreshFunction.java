package com.jeffdisher.stash.logic;

import com.eclipsesource.json.JsonValue;
import com.jeffdisher.stash.data.IndexItem;


/**
 * Supplied by the caller to the staleness refresher:  produces the new content for a stale item (re-fetching it
 * from wherever it originally came from).  The refresher never fetches anything itself.
 */
public interface IRefreshFunction
{
	/**
	 * @param item The stale item.
	 * @return The fresh content (null is treated as a failure).
	 * @throws Exception Any failure, which is recorded for this item only.
	 */
	JsonValue refresh(IndexItem item) throws Exception;
}
