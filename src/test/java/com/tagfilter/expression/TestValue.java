package com.tagfilter.expression;

import java.util.Set;

/**
 * Leaf value for tests: matches a subject (a set of names) that contains its name.
 */
record TestValue(String name) implements BooleanExpressionValue<Set<String>> {

    @Override
    public boolean matches(Set<String> subject) {
        return subject.contains(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
