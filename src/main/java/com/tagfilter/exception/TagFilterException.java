package com.tagfilter.exception;

/**
 * Base exception for the tag filter library.
 */
public class TagFilterException extends RuntimeException {

    public TagFilterException(String message) {
        super(message);
    }

    public TagFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
