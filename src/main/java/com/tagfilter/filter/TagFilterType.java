package com.tagfilter.filter;

/**
 * Supported tag tests.
 */
public enum TagFilterType {
    // Key
    HAS_KEY,
    NOT_HAS_KEY,

    // Value
    HAS_TAG,
    NOT_HAS_TAG,
    HAS_TAG_VALUE_LIKE,
    NOT_HAS_TAG_VALUE_LIKE,

    // Numeric
    GREATER_THAN,
    GREATER_THAN_OR_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUALS
}
