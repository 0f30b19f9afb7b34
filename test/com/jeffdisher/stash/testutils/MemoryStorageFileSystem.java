package com.jeffdisher.stash.testutils;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.LongSupplier;

import com.jeffdisher.stash.logic.IStorageFileSystem;


/**
 * An in-memory filesystem for tests.  Directories must exist before files can be written into them.
 * Failures can be injected:  read-only directories (no creation, writes, or deletes inside them), paths whose reads
 * (or listings) fail, and paths whose deletes fail.
 * Modification times come from the given clock but can also be set directly.
 */
public class MemoryStorageFileSystem implements IStorageFileSystem
{
	private final LongSupplier _currentTimeMillisGenerator;
	private final Set<Path> _directories;
	private final Map<Path, byte[]> _files;
	private final Map<Path, Long> _modifiedMillis;
	private final Set<Path> _readOnlyDirectories;
	private final Set<Path> _failingReads;
	private final Set<Path> _failingDeletes;
	private Consumer<Path> _readHook;

	public MemoryStorageFileSystem(LongSupplier currentTimeMillisGenerator)
	{
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
		_directories = new HashSet<>();
		_files = new HashMap<>();
		_modifiedMillis = new HashMap<>();
		_readOnlyDirectories = new HashSet<>();
		_failingReads = new HashSet<>();
		_failingDeletes = new HashSet<>();
	}

	@Override
	public synchronized boolean exists(Path path)
	{
		return _directories.contains(path) || _files.containsKey(path);
	}

	@Override
	public synchronized boolean isDirectory(Path path)
	{
		return _directories.contains(path);
	}

	@Override
	public synchronized void createDirectories(Path directory) throws IOException
	{
		if (_files.containsKey(directory))
		{
			throw new IOException("Not a directory: " + directory);
		}
		if (!_directories.contains(directory))
		{
			Path parent = directory.getParent();
			if (null != parent)
			{
				createDirectories(parent);
				if (_readOnlyDirectories.contains(parent))
				{
					throw new IOException("Read-only: " + parent);
				}
			}
			_directories.add(directory);
		}
	}

	@Override
	public synchronized boolean isWritable(Path directory)
	{
		return _directories.contains(directory) && !_readOnlyDirectories.contains(directory);
	}

	@Override
	public byte[] readFile(Path file) throws IOException
	{
		Consumer<Path> hook;
		synchronized (this)
		{
			hook = _readHook;
		}
		// The hook runs outside of our monitor so that it can call back into the system.
		if (null != hook)
		{
			hook.accept(file);
		}
		synchronized (this)
		{
			if (_failingReads.contains(file))
			{
				throw new IOException("Injected read failure: " + file);
			}
			byte[] data = _files.get(file);
			return (null != data)
					? data.clone()
					: null
			;
		}
	}

	@Override
	public synchronized void writeFile(Path file, byte[] data) throws IOException
	{
		_checkWritableParent(file);
		if (_directories.contains(file))
		{
			throw new IOException("Is a directory: " + file);
		}
		_files.put(file, data.clone());
		_modifiedMillis.put(file, _currentTimeMillisGenerator.getAsLong());
	}

	@Override
	public synchronized boolean deleteFile(Path file) throws IOException
	{
		boolean didDelete = false;
		if (_files.containsKey(file))
		{
			_checkWritableParent(file);
			if (_failingDeletes.contains(file))
			{
				throw new IOException("Injected delete failure: " + file);
			}
			_files.remove(file);
			_modifiedMillis.remove(file);
			didDelete = true;
		}
		return didDelete;
	}

	@Override
	public synchronized List<Path> listFiles(Path directory) throws IOException
	{
		if (!_directories.contains(directory))
		{
			throw new NoSuchFileException(directory.toString());
		}
		if (_failingReads.contains(directory))
		{
			throw new IOException("Injected listing failure: " + directory);
		}
		List<Path> files = new ArrayList<>();
		for (Path file : _files.keySet())
		{
			if (directory.equals(file.getParent()))
			{
				files.add(file);
			}
		}
		return files;
	}

	@Override
	public synchronized long fileSize(Path file) throws IOException
	{
		byte[] data = _files.get(file);
		return (null != data)
				? data.length
				: -1L
		;
	}

	@Override
	public synchronized long lastModifiedMillis(Path file) throws IOException
	{
		Long millis = _modifiedMillis.get(file);
		if (null == millis)
		{
			throw new NoSuchFileException(file.toString());
		}
		return millis;
	}

	public synchronized void setReadOnly(Path directory)
	{
		_readOnlyDirectories.add(directory);
	}

	public synchronized void failReads(Path path)
	{
		_failingReads.add(path);
	}

	public synchronized void failDeletes(Path file)
	{
		_failingDeletes.add(file);
	}

	public synchronized void setModifiedMillis(Path file, long millis)
	{
		_modifiedMillis.put(file, millis);
	}

	/**
	 * Installs a callback invoked at the start of every readFile() call (null to remove).
	 */
	public synchronized void setReadHook(Consumer<Path> hook)
	{
		_readHook = hook;
	}


	private void _checkWritableParent(Path file) throws IOException
	{
		Path parent = file.getParent();
		if (!_directories.contains(parent))
		{
			throw new NoSuchFileException(String.valueOf(parent));
		}
		if (_readOnlyDirectories.contains(parent))
		{
			throw new IOException("Read-only: " + parent);
		}
	}
}
