package com.tagfilter.filter.impl;

import com.tagfilter.element.Element;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;

import java.util.Objects;
import java.util.regex.Pattern;

import static com.tagfilter.filter.TagFilters.quoteIfNecessary;

/**
 * Filter that checks if a tag value matches a regular expression.
 * The whole value must match, not only a part of it.
 */
public class HasTagValueLike implements TagFilter {

    private final String key;
    private final Pattern pattern;

    /**
     * @throws java.util.regex.PatternSyntaxException if the regex is invalid
     */
    public HasTagValueLike(String key, String regex) {
        this.key = Objects.requireNonNull(key, "key");
        this.pattern = Pattern.compile(Objects.requireNonNull(regex, "regex"));
    }

    @Override
    public boolean matches(Element element) {
        return element.getTag(key)
                .map(value -> pattern.matcher(value).matches())
                .orElse(false);
    }

    @Override
    public TagFilterType getType() {
        return TagFilterType.HAS_TAG_VALUE_LIKE;
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
        return quoteIfNecessary(key) + "~" + quoteIfNecessary(pattern.pattern());
    }
}
