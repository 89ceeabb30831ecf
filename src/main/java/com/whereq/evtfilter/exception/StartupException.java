package com.whereq.evtfilter.exception;

/**
 * Exception thrown when a run cannot start: bad arguments, missing input directory, no event logs
 */
public class StartupException extends RuntimeException {
    public StartupException(String message) {
        super(message);
    }

    public StartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
