package com.tagfilter.element;

import java.util.Map;
import java.util.Optional;

/**
 * A map element: a node, way or relation carrying key/value tags.
 * Immutable after creation.
 */
public interface Element {

    ElementType getType();

    long getId();

    /**
     * Get all tags.
     */
    Map<String, String> getTags();

    /**
     * Get the value of a tag.
     *
     * @param key Tag key
     * @return Tag value, or empty if the element has no such tag
     */
    default Optional<String> getTag(String key) {
        return Optional.ofNullable(getTags().get(key));
    }

    /**
     * Create a new builder.
     */
    static Builder builder() {
        return new DefaultElement.Builder();
    }

    /**
     * Builder for Element.
     */
    interface Builder {
        Builder type(ElementType type);
        Builder id(long id);
        Builder tag(String key, String value);
        Builder tags(Map<String, String> tags);
        Element build();
    }
}
