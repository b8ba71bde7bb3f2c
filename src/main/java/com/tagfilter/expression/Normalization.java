package com.tagfilter.expression;

import java.util.Locale;

/**
 * Rewrite applied to an expression tree after it has been built.
 */
public enum Normalization {

    /**
     * Keep the tree as built.
     */
    NONE,

    /**
     * Remove bracket placeholders and merge nested nodes of the same operator.
     */
    FLATTEN,

    /**
     * Flatten, then distribute AND over OR so the tree is an OR of ANDs of leaves.
     */
    EXPAND;

    /**
     * Apply this rewrite in place.
     */
    public <T extends BooleanExpressionValue<S>, S> void apply(BooleanExpression<T, S> expression) {
        if (this == FLATTEN) {
            expression.flatten();
        } else if (this == EXPAND) {
            expression.expand();
        }
    }

    /**
     * Parse a normalization name, ignoring case and accepting '-' for '_'.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Normalization fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT).replace("-", "_"));
    }
}
