package com.jeffdisher.stash.types;


/**
 * The interface for the logging context of a specific operation.
 * Maintenance sweeps open a nested context per run so that the lines they produce can be read as a group.
 */
public interface ILogger
{
	/**
	 * Starts a nested logging context.
	 * 
	 * @param openingMessage The opening message to log.
	 * @return The logging context for a nested operation.
	 */
	ILogger logStart(String openingMessage);
	/**
	 * Logs a specific part of the operation.
	 * 
	 * @param message The message.
	 */
	void logOperation(String message);
	/**
	 * Closes the logging context at the end of the operation.  Any error recorded in this context is also recorded in
	 * the parent.
	 * 
	 * @param finishMessage The final message to close the log.
	 */
	void logFinish(String finishMessage);
	/**
	 * Log an operation-related message as verbose, meaning some implementations or configurations may suppress it.
	 * 
	 * @param message The message.
	 */
	void logVerbose(String message);
	/**
	 * Logs a recoverable problem (a corrupt document replaced with an empty one, a tracked file which went missing).
	 * This does NOT set the error state.
	 * 
	 * @param message The message.
	 */
	void logWarning(String message);
	/**
	 * Logs an error message and sets that an error has occurred, in the logger state.
	 * 
	 * @param message The message to log.
	 */
	void logError(String message);
	/**
	 * @return True if logError() was called on this logger or one of its finished children.
	 */
	boolean didErrorOccur();
}
