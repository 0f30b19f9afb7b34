package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

import com.jeffdisher.stash.data.CacheIndex;
import com.jeffdisher.stash.types.ILogger;


/**
 * Creates and validates the on-disk layout of the cache and bootstraps an empty index when there isn't one.
 * Every step is attempted independently:  a directory which can't be created is recorded and the others are still
 * attempted.
 */
public class StructureManager
{
	private final CacheLayout _layout;
	private final IStorageFileSystem _fileSystem;
	private final ILogger _logger;
	private final LongSupplier _currentTimeMillisGenerator;

	public StructureManager(CacheLayout layout, IStorageFileSystem fileSystem, ILogger logger, LongSupplier currentTimeMillisGenerator)
	{
		_layout = layout;
		_fileSystem = fileSystem;
		_logger = logger;
		_currentTimeMillisGenerator = currentTimeMillisGenerator;
	}

	/**
	 * Creates any missing directories and writes an empty index if none exists.  Running this on an initialized cache
	 * changes nothing and still reports success.
	 * 
	 * @return The result (success only if there were no errors).
	 */
	public Result initializeStructure()
	{
		List<String> errors = new ArrayList<>();
		for (Path directory : _requiredDirectories())
		{
			try
			{
				_fileSystem.createDirectories(directory);
			}
			catch (IOException e)
			{
				String message = "Failed to create directory " + directory + ": " + e.getLocalizedMessage();
				_logger.logError(message);
				errors.add(message);
			}
		}
		
		Path indexFile = _layout.indexFile();
		if (_fileSystem.isDirectory(_layout.payloadDirectory()) && !_fileSystem.exists(indexFile))
		{
			try
			{
				_fileSystem.writeFile(indexFile, JsonDocuments.encode(CacheIndex.empty(_currentTimeMillisGenerator.getAsLong()).toJson()));
				_logger.logVerbose("Created empty index: " + indexFile);
			}
			catch (IOException e)
			{
				String message = "Failed to create index " + indexFile + ": " + e.getLocalizedMessage();
				_logger.logError(message);
				errors.add(message);
			}
		}
		return new Result(errors.isEmpty(), _layout, errors);
	}

	/**
	 * @return True if every required directory exists and can actually be written.
	 */
	public boolean isStructureValid()
	{
		boolean isValid = true;
		for (Path directory : _requiredDirectories())
		{
			if (!_fileSystem.isDirectory(directory) || !_fileSystem.isWritable(directory))
			{
				_logger.logVerbose("Invalid cache directory: " + directory);
				isValid = false;
				break;
			}
		}
		return isValid;
	}

	/**
	 * Deletes the files in the temp directory which were last modified more than maxAgeMillis ago.
	 * A directory which can't be listed yields 0 and a file which can't be deleted is skipped.
	 * 
	 * @param maxAgeMillis The age after which a temp file is removed.
	 * @return The number of files deleted.
	 */
	public int cleanupTempFiles(long maxAgeMillis)
	{
		Path tempDirectory = _layout.tempDirectory();
		List<Path> files;
		try
		{
			files = _fileSystem.listFiles(tempDirectory);
		}
		catch (IOException e)
		{
			_logger.logWarning("Cannot list temp directory " + tempDirectory + ": " + e.getLocalizedMessage());
			files = List.of();
		}
		
		long now = _currentTimeMillisGenerator.getAsLong();
		int deleted = 0;
		for (Path file : files)
		{
			try
			{
				long ageMillis = now - _fileSystem.lastModifiedMillis(file);
				if ((ageMillis > maxAgeMillis) && _fileSystem.deleteFile(file))
				{
					deleted += 1;
				}
			}
			catch (IOException e)
			{
				_logger.logWarning("Skipping temp file " + file + ": " + e.getLocalizedMessage());
			}
		}
		if (deleted > 0)
		{
			_logger.logOperation("Removed " + deleted + " old temp file(s)");
		}
		return deleted;
	}

	/**
	 * @param directory One of the managed directories.
	 * @param fileName A file name inside it.
	 * @return The path of that file.
	 */
	public Path getCachePath(CacheLayout.Directory directory, String fileName)
	{
		return _layout.directory(directory).resolve(fileName);
	}


	private List<Path> _requiredDirectories()
	{
		return List.of(_layout.root()
				, _layout.payloadDirectory()
				, _layout.processedDirectory()
				, _layout.tempDirectory()
		);
	}


	/**
	 * The outcome of initialization.  The layout is always returned, even on failure, so callers can report the
	 * paths involved.
	 */
	public static record Result(boolean success, CacheLayout layout, List<String> errors)
	{
		public Result
		{
			errors = List.copyOf(errors);
		}
	}
}
