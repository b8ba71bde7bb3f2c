package com.tagfilter.expression;

/**
 * A leaf predicate of a {@link BooleanExpression}.
 * Implementations must be immutable, they are shared between copies of a tree.
 *
 * @param <S> Type of the subject the predicate is tested against
 */
public interface BooleanExpressionValue<S> {

    /**
     * Test this predicate against the given subject.
     *
     * @param subject Subject to test
     * @return true if the subject satisfies the predicate
     */
    boolean matches(S subject);
}
