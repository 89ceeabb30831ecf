package com.whereq.evtfilter.exception;

/**
 * Exception thrown when an EventID list contains a token that is not an integer
 */
public class FilterSpecException extends StartupException {
    public FilterSpecException(String message) {
        super(message);
    }

    public FilterSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
