package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;


/**
 * The on-disk implementation of the storage abstraction, over java.nio.file.
 * Writes use the typical atomic write trick:  write to a temp file beside the target and rename it over the original.
 * Where the filesystem doesn't support an atomic rename, we fall back to a replacing move, which means that a crash
 * can leave the temp file behind.  The read side cleans up such a broken write when it observes one.
 */
public class RealStorageFileSystem implements IStorageFileSystem
{
	public static final String TEMP_FILE_SUFFIX = ".stash-tmp";
	private static final String CHECK_FILE_PREFIX = ".stash-check";

	@Override
	public boolean exists(Path path)
	{
		return Files.exists(path);
	}

	@Override
	public boolean isDirectory(Path path)
	{
		return Files.isDirectory(path);
	}

	@Override
	public void createDirectories(Path directory) throws IOException
	{
		Files.createDirectories(directory);
	}

	@Override
	public boolean isWritable(Path directory)
	{
		boolean writable;
		try
		{
			Path check = Files.createTempFile(directory, CHECK_FILE_PREFIX, TEMP_FILE_SUFFIX);
			Files.delete(check);
			writable = true;
		}
		catch (IOException e)
		{
			// Any failure to create or remove the check file means we can't rely on writing here.
			writable = false;
		}
		return writable;
	}

	@Override
	public byte[] readFile(Path file) throws IOException
	{
		byte[] data;
		try
		{
			data = Files.readAllBytes(file);
		}
		catch (NoSuchFileException e)
		{
			data = null;
		}
		return data;
	}

	@Override
	public void writeFile(Path file, byte[] data) throws IOException
	{
		// A temp file left over from a write which never completed is truncated and reused.
		Path temp = _tempFile(file);
		Files.write(temp, data);
		try
		{
			Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e)
		{
			Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public boolean deleteFile(Path file) throws IOException
	{
		return Files.deleteIfExists(file);
	}

	@Override
	public List<Path> listFiles(Path directory) throws IOException
	{
		List<Path> files = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory))
		{
			for (Path path : stream)
			{
				if (Files.isRegularFile(path) && !path.getFileName().toString().endsWith(TEMP_FILE_SUFFIX))
				{
					files.add(path);
				}
			}
		}
		return files;
	}

	@Override
	public long fileSize(Path file) throws IOException
	{
		long size;
		try
		{
			size = Files.size(file);
		}
		catch (NoSuchFileException e)
		{
			size = -1L;
		}
		return size;
	}

	@Override
	public long lastModifiedMillis(Path file) throws IOException
	{
		return Files.getLastModifiedTime(file).toMillis();
	}


	private static Path _tempFile(Path file)
	{
		return file.resolveSibling(file.getFileName().toString() + TEMP_FILE_SUFFIX);
	}
}
