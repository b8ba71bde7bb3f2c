package com.tagfilter.exception;

/**
 * Thrown when a boolean expression tree is used against its contract,
 * e.g. a node type is assigned twice or a placeholder is matched.
 * Indicates a bug in the calling code, not bad input.
 */
public class ExpressionStateException extends TagFilterException {

    public ExpressionStateException(String message) {
        super(message);
    }
}
