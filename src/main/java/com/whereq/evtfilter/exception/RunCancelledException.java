package com.whereq.evtfilter.exception;

/**
 * Exception thrown when a run is cancelled before its output is in place
 */
public class RunCancelledException extends RuntimeException {
    public RunCancelledException(String message) {
        super(message);
    }

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
