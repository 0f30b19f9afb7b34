package com.jeffdisher.stash.logic;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;


/**
 * An abstract interface over the local filesystem for everything the cache stores on disk.
 * The entire reason why this exists is to allow test coverage of the cache logic without requiring a real disk (and
 * to allow failures like read-only directories to be simulated).
 * "Not found" is never an exception:  it is reported as null, false, or -1, depending on the call.  IOException is
 * only thrown for real failures.
 */
public interface IStorageFileSystem
{
	/**
	 * @param path A file or directory.
	 * @return True if anything exists at this path.
	 */
	boolean exists(Path path);

	/**
	 * @param path A path.
	 * @return True if the path exists and is a directory.
	 */
	boolean isDirectory(Path path);

	/**
	 * Creates the directory and any missing parents.  Succeeds without change if it already exists.
	 * 
	 * @param directory The directory to create.
	 * @throws IOException The directory couldn't be created.
	 */
	void createDirectories(Path directory) throws IOException;

	/**
	 * Checks that the directory can actually be written by creating and then removing a scratch file.  Permission bits
	 * alone aren't trusted.
	 * 
	 * @param directory The directory to check.
	 * @return True if a file could be created in the directory.
	 */
	boolean isWritable(Path directory);

	/**
	 * Reads and returns all the data in the file.
	 * This assumes that the file was written using our atomic pattern so it will never see a partial write.
	 * 
	 * @param file The file to read.
	 * @return The contents of the file, null if it doesn't exist.
	 * @throws IOException The file exists but couldn't be read.
	 */
	byte[] readFile(Path file) throws IOException;

	/**
	 * Writes the given data to the file, atomically replacing anything which was there before.
	 * 
	 * @param file The file to write.
	 * @param data The data to write to the file (cannot be null).
	 * @throws IOException The write failed (the previous contents, if any, are unchanged).
	 */
	void writeFile(Path file, byte[] data) throws IOException;

	/**
	 * @param file The file to delete.
	 * @return True if the file was deleted, false if it didn't exist.
	 * @throws IOException The file exists but couldn't be deleted.
	 */
	boolean deleteFile(Path file) throws IOException;

	/**
	 * Lists the regular files directly inside the directory (not recursive, no directories, no in-progress atomic
	 * writes).
	 * 
	 * @param directory The directory to list.
	 * @return The files, in no particular order.
	 * @throws IOException The directory doesn't exist or can't be read.
	 */
	List<Path> listFiles(Path directory) throws IOException;

	/**
	 * @param file The file.
	 * @return The size of the file, in bytes, or -1 if it doesn't exist.
	 * @throws IOException The file exists but its size couldn't be read.
	 */
	long fileSize(Path file) throws IOException;

	/**
	 * @param file The file.
	 * @return The last modification time of the file, in milliseconds since the epoch.
	 * @throws IOException The file doesn't exist or couldn't be inspected.
	 */
	long lastModifiedMillis(Path file) throws IOException;
}
