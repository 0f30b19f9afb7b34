package com.jeffdisher.stash.utils;

import java.io.PrintStream;

import com.jeffdisher.stash.types.ILogger;


/**
 * The console logger used by the command-line tool.
 * Lines are prefixed by the nesting context:  ">N>" opens, "=N=" is an operation, "*N*" is verbose, "!N!" is a
 * warning, and "<N<" closes.  Errors are written to System.err.
 */
public class StandardLogger implements ILogger
{
	public static StandardLogger topLogger(PrintStream stream, boolean verbose)
	{
		return new StandardLogger(null, stream, "", verbose);
	}


	// We keep the parent so we can write-back error state after a sub-logger finishes.
	private final StandardLogger _parent;
	private final PrintStream _stream;
	private final String _prefix;
	private final boolean _verbose;
	private int _nextOperationCounter;
	private boolean _errorOccurred;

	private StandardLogger(StandardLogger parent
			, PrintStream stream
			, String prefix
			, boolean verbose
	)
	{
		_parent = parent;
		_stream = stream;
		_prefix = prefix;
		_verbose = verbose;
		_nextOperationCounter = 0;
	}

	@Override
	public synchronized ILogger logStart(String openingMessage)
	{
		_nextOperationCounter += 1;
		// Nested contexts show their full path ("2.1") so interleaved background output can still be attributed.
		String prefix = _prefix.isEmpty()
				? Integer.toString(_nextOperationCounter)
				: (_prefix + "." + _nextOperationCounter)
		;
		_stream.println(">" + prefix + "> " + openingMessage);
		return new StandardLogger(this, _stream, prefix, _verbose);
	}

	@Override
	public void logOperation(String message)
	{
		_stream.println("=" + _prefix + "= " + message);
	}

	@Override
	public void logFinish(String finishMessage)
	{
		// Saturate to error in the parent.
		if (_errorOccurred && (null != _parent))
		{
			_parent._setError();
		}
		_stream.println("<" + _prefix + "< " + finishMessage);
	}

	@Override
	public void logVerbose(String message)
	{
		if (_verbose)
		{
			_stream.println("*" + _prefix + "* " + message);
		}
	}

	@Override
	public void logWarning(String message)
	{
		_stream.println("!" + _prefix + "! " + message);
	}

	@Override
	public void logError(String message)
	{
		System.err.println("ERROR " + _prefix + ": " + message);
		_setError();
	}

	@Override
	public synchronized boolean didErrorOccur()
	{
		return _errorOccurred;
	}


	private synchronized void _setError()
	{
		_errorOccurred = true;
	}
}
