package com.tagfilter.config;

import com.tagfilter.expression.Normalization;
import com.tagfilter.filter.ElementFilterExpression;

/**
 * Configuration for a named filter.
 *
 * @param name          Filter name, unique within a configuration
 * @param filter        Parsed filter expression
 * @param normalization Rewrite applied before the filter is evaluated
 */
public record FilterConfig(
        String name,
        ElementFilterExpression filter,
        Normalization normalization
) {
    /**
     * Parse an expression into a flattened filter configuration.
     */
    public static FilterConfig of(String name, String expression) {
        return new FilterConfig(name, FilterExpressionParser.parse(expression), Normalization.FLATTEN);
    }
}
