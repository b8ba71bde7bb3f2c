package com.tagfilter.filter.impl;

import com.tagfilter.element.Element;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.tagfilter.filter.TagFilters.quoteIfNecessary;

/**
 * Numeric comparison of a tag value (>, >=, <, <=).
 * A tag value that is not a number never matches.
 */
public class TagComparison implements TagFilter {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    // larger whole numbers are not exact as long
    private static final double MAX_LONG_RENDERED = 1e15;

    private final String key;
    private final double threshold;
    private final TagFilterType type;

    public TagComparison(String key, double threshold, TagFilterType type) {
        this.key = Objects.requireNonNull(key, "key");
        this.threshold = threshold;
        this.type = switch (type) {
            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS -> type;
            default -> throw new IllegalArgumentException("Not a comparison type: " + type);
        };
    }

    @Override
    public boolean matches(Element element) {
        Optional<Double> actual = element.getTag(key).flatMap(TagComparison::parseNumber);
        if (actual.isEmpty()) {
            return false; // Missing or non-numeric tag = no match
        }

        double actualValue = actual.get();
        return switch (type) {
            case GREATER_THAN -> actualValue > threshold;
            case GREATER_THAN_OR_EQUALS -> actualValue >= threshold;
            case LESS_THAN -> actualValue < threshold;
            case LESS_THAN_OR_EQUALS -> actualValue <= threshold;
            default -> throw new IllegalStateException("Invalid comparison type: " + type);
        };
    }

    private static Optional<Double> parseNumber(String value) {
        String trimmed = value.trim();
        if (!NUMBER.matcher(trimmed).matches()) {
            return Optional.empty();
        }
        return Optional.of(Double.parseDouble(trimmed));
    }

    @Override
    public TagFilterType getType() {
        return type;
    }

    @Override
    public String getKey() {
        return key;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        String op = switch (type) {
            case GREATER_THAN -> ">";
            case GREATER_THAN_OR_EQUALS -> ">=";
            case LESS_THAN -> "<";
            case LESS_THAN_OR_EQUALS -> "<=";
            default -> "?";
        };
        return quoteIfNecessary(key) + op + formatNumber(threshold);
    }

    private static String formatNumber(double number) {
        if (number == Math.rint(number) && Math.abs(number) < MAX_LONG_RENDERED) {
            return Long.toString((long) number);
        }
        return Double.toString(number);
    }
}
