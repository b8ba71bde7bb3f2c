package com.tagfilter.filter.impl;

import com.tagfilter.element.Element;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;

import java.util.Objects;

import static com.tagfilter.filter.TagFilters.quoteIfNecessary;

/**
 * Filter that checks if an element has no tag with the given key.
 */
public class NotHasKey implements TagFilter {

    private final String key;

    public NotHasKey(String key) {
        this.key = Objects.requireNonNull(key, "key");
    }

    @Override
    public boolean matches(Element element) {
        return !element.getTags().containsKey(key);
    }

    @Override
    public TagFilterType getType() {
        return TagFilterType.NOT_HAS_KEY;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return "!" + quoteIfNecessary(key);
    }
}
