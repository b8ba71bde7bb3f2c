package com.tagfilter.filter;

import com.tagfilter.element.Element;
import com.tagfilter.element.ElementType;
import com.tagfilter.expression.BooleanExpression;
import com.tagfilter.expression.Normalization;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed filter: the element types it applies to and an optional tag expression,
 * e.g. {@code nodes, ways with highway=residential and (name or ref)}.
 */
public final class ElementFilterExpression {

    private final Set<ElementType> elementTypes;
    private final BooleanExpression<TagFilter, Element> tagExpression;

    /**
     * @param elementTypes  Element types the filter applies to, must not be empty
     * @param tagExpression Root of the tag expression, or null to accept any tags
     */
    public ElementFilterExpression(Set<ElementType> elementTypes,
                                   BooleanExpression<TagFilter, Element> tagExpression) {
        if (elementTypes == null || elementTypes.isEmpty()) {
            throw new IllegalArgumentException("At least one element type is required");
        }
        if (tagExpression != null && !tagExpression.isRoot()) {
            throw new IllegalArgumentException("Tag expression must be a root node");
        }
        this.elementTypes = Collections.unmodifiableSet(EnumSet.copyOf(elementTypes));
        this.tagExpression = tagExpression;
    }

    /**
     * Check if an element is of one of the filtered types and matches the tag expression.
     */
    public boolean matches(Element element) {
        if (!elementTypes.contains(element.getType())) {
            return false;
        }
        return tagExpression == null || tagExpression.matches(element);
    }

    public Set<ElementType> getElementTypes() {
        return elementTypes;
    }

    public Optional<BooleanExpression<TagFilter, Element>> getTagExpression() {
        return Optional.ofNullable(tagExpression);
    }

    /**
     * Get a copy of this filter with the tag expression rewritten.
     * This filter is left unchanged.
     */
    public ElementFilterExpression normalized(Normalization normalization) {
        if (tagExpression == null) {
            return this;
        }
        BooleanExpression<TagFilter, Element> copy = tagExpression.copy();
        normalization.apply(copy);
        return new ElementFilterExpression(elementTypes, copy);
    }

    @Override
    public String toString() {
        String types = elementTypes.stream()
                .map(type -> type.name().toLowerCase(Locale.US) + "s")
                .collect(Collectors.joining(", "));
        if (tagExpression == null) {
            return types;
        }
        return types + " with " + tagExpression;
    }
}
