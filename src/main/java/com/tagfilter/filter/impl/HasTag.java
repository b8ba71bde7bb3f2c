package com.tagfilter.filter.impl;

import com.tagfilter.element.Element;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;

import java.util.Objects;

import static com.tagfilter.filter.TagFilters.quoteIfNecessary;

/**
 * Filter that checks if a tag has exactly the given value.
 */
public class HasTag implements TagFilter {

    private final String key;
    private final String value;

    public HasTag(String key, String value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean matches(Element element) {
        return element.getTag(key)
                .map(value::equals)
                .orElse(false); // Missing tag = no match
    }

    @Override
    public TagFilterType getType() {
        return TagFilterType.HAS_TAG;
    }

    @Override
    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return quoteIfNecessary(key) + "=" + quoteIfNecessary(value);
    }
}
