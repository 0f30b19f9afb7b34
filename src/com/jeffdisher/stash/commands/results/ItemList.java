package com.jeffdisher.stash.commands.results;

import java.io.PrintStream;
import java.util.List;

import com.jeffdisher.stash.commands.ICommand;
import com.jeffdisher.stash.data.IndexItem;
import com.jeffdisher.stash.logic.RetentionPolicy;
import com.jeffdisher.stash.logic.SizePruner;
import com.jeffdisher.stash.utils.Assert;


/**
 * An implementation of the result type for the cases where a list of index items is returned.
 */
public class ItemList implements ICommand.Result
{
	private final String _elementDescription;
	private final long _nowMillis;
	public final List<IndexItem> items;

	/**
	 * @param elementDescription The human-readable description of what the items represent.
	 * @param nowMillis The current time, used to describe item ages.
	 * @param items The items, in the order they should be shown.
	 */
	public ItemList(String elementDescription, long nowMillis, List<IndexItem> items)
	{
		Assert.assertTrue(null != elementDescription);
		Assert.assertTrue(null != items);
		_elementDescription = elementDescription;
		_nowMillis = nowMillis;
		this.items = List.copyOf(items);
	}

	@Override
	public void writeHumanReadable(PrintStream output)
	{
		output.println(this.items.size() + " items in list:");
		for (IndexItem item : this.items)
		{
			output.println("\t" + _elementDescription + ": " + item.hash());
			output.println("\t\tSource: " + item.source() + ", Type: " + item.type());
			output.println("\t\tSize: " + SizePruner.formatBytes(item.sizeBytes()) + ", Age: " + RetentionPolicy.formatAge(RetentionPolicy.calculateAge(item, _nowMillis)) + ", Accesses: " + item.accessCount());
		}
	}
}
