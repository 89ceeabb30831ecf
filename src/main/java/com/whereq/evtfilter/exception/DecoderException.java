package com.whereq.evtfilter.exception;

/**
 * Exception thrown when a Log Parser process cannot be run to completion
 */
public class DecoderException extends RuntimeException {
    public DecoderException(String message) {
        super(message);
    }

    public DecoderException(String message, Throwable cause) {
        super(message, cause);
    }
}
