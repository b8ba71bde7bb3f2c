package com.tagfilter.filter;

import com.tagfilter.filter.impl.HasKey;
import com.tagfilter.filter.impl.HasTag;
import com.tagfilter.filter.impl.HasTagValueLike;
import com.tagfilter.filter.impl.NotHasKey;
import com.tagfilter.filter.impl.NotHasTag;
import com.tagfilter.filter.impl.NotHasTagValueLike;
import com.tagfilter.filter.impl.TagComparison;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Factory methods for tag filters, plus the quoting rules used when rendering them.
 */
public final class TagFilters {

    private static final Pattern PLAIN_WORD = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_:.\\-]*");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");
    private static final Set<String> RESERVED = Set.of("AND", "OR", "WITH");

    private TagFilters() {
    }

    public static TagFilter hasKey(String key) {
        return new HasKey(key);
    }

    public static TagFilter notHasKey(String key) {
        return new NotHasKey(key);
    }

    public static TagFilter hasTag(String key, String value) {
        return new HasTag(key, value);
    }

    public static TagFilter notHasTag(String key, String value) {
        return new NotHasTag(key, value);
    }

    public static TagFilter hasTagValueLike(String key, String regex) {
        return new HasTagValueLike(key, regex);
    }

    public static TagFilter notHasTagValueLike(String key, String regex) {
        return new NotHasTagValueLike(key, regex);
    }

    public static TagFilter greaterThan(String key, double threshold) {
        return new TagComparison(key, threshold, TagFilterType.GREATER_THAN);
    }

    public static TagFilter greaterThanOrEquals(String key, double threshold) {
        return new TagComparison(key, threshold, TagFilterType.GREATER_THAN_OR_EQUALS);
    }

    public static TagFilter lessThan(String key, double threshold) {
        return new TagComparison(key, threshold, TagFilterType.LESS_THAN);
    }

    public static TagFilter lessThanOrEquals(String key, double threshold) {
        return new TagComparison(key, threshold, TagFilterType.LESS_THAN_OR_EQUALS);
    }

    /**
     * Render a key or value so that the filter parser reads it back as the same text.
     * Plain words and numbers stay as they are, anything else is double-quoted.
     */
    public static String quoteIfNecessary(String text) {
        if (PLAIN_NUMBER.matcher(text).matches()) {
            return text;
        }
        if (PLAIN_WORD.matcher(text).matches() && !RESERVED.contains(text.toUpperCase(Locale.ROOT))) {
            return text;
        }
        return '"' + text.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
