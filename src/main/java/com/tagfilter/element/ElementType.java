package com.tagfilter.element;

import java.util.Locale;

/**
 * Types of map elements.
 */
public enum ElementType {
    NODE,
    WAY,
    RELATION;

    /**
     * Parse an element type name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static ElementType fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
