package com.tagfilter.filter.impl;

import com.tagfilter.element.Element;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;

import java.util.Objects;
import java.util.regex.Pattern;

import static com.tagfilter.filter.TagFilters.quoteIfNecessary;

/**
 * Filter that checks if a tag is absent or its value does not match a regular expression.
 */
public class NotHasTagValueLike implements TagFilter {

    private final String key;
    private final Pattern pattern;

    /**
     * @throws java.util.regex.PatternSyntaxException if the regex is invalid
     */
    public NotHasTagValueLike(String key, String regex) {
        this.key = Objects.requireNonNull(key, "key");
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"));
    }

    @Override
    public boolean matches(Element element) {
        return element.getTag(key)
                .map(value -> !pattern.matcher(value).matches())
                .orElse(true);
    }

    @Override
    public TagFilterType getType() {
        return TagFilterType.NOT_HAS_TAG_VALUE_LIKE;
    }

    @Override
    public String getKey() {
        return key;
    }

    public String getRegex() {
        return pattern.pattern();
    }

    @Override
    public String toString() {
        return quoteIfNecessary(key) + "!~" + quoteIfNecessary(pattern.pattern());
    }
}
