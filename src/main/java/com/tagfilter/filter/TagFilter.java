package com.tagfilter.filter;

import com.tagfilter.element.Element;
import com.tagfilter.expression.BooleanExpressionValue;

/**
 * A test on the tags of an element; the leaf of a tag filter expression.
 * Implementations are immutable and render themselves in filter syntax.
 */
public interface TagFilter extends BooleanExpressionValue<Element> {

    /**
     * Get the kind of test.
     */
    TagFilterType getType();

    /**
     * Get the tag key this filter tests.
     */
    String getKey();
}
