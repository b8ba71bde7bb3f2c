package com.tagfilter.expression;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Helpers to build and inspect expression trees in tests.
 */
final class TestExpressions {

    private TestExpressions() {
    }

    /**
     * Build a tree from space separated tokens, e.g. "( a or b ) and c", driving the builder
     * the way a parser does.
     */
    static BooleanExpression<TestValue, Set<String>> build(String tokens) {
        return build(List.of(tokens.trim().split("\\s+")));
    }

    static BooleanExpression<TestValue, Set<String>> build(List<String> tokens) {
        BooleanExpression<TestValue, Set<String>> root = BooleanExpression.root();
        BooleanExpression<TestValue, Set<String>> current = root;
        Deque<BooleanExpression<TestValue, Set<String>>> brackets = new ArrayDeque<>();

        for (String token : tokens) {
            switch (token) {
                case "(" -> {
                    brackets.push(current);
                    current = current.addOpenBracket();
                }
                case ")" -> current = brackets.pop();
                case "and" -> current = current.addAnd();
                case "or" -> current = current.addOr();
                default -> current = current.addValue(new TestValue(token));
            }
        }
        return root;
    }

    /**
     * Render the structure of a tree, e.g. "ROOT(OR(AND(a,b),c))". Placeholders are "?".
     */
    static String shape(BooleanExpression<TestValue, Set<String>> node) {
        if (node.isValue()) {
            return node.getValue().name();
        }
        String type = node.getType().map(Enum::name).orElse("?");
        return type + node.getChildren().stream()
                .map(TestExpressions::shape)
                .collect(Collectors.joining(",", "(", ")"));
    }

    /**
     * All subsets of the given names.
     */
    static List<Set<String>> allSubjects(List<String> names) {
        List<Set<String>> subjects = new ArrayList<>();
        for (int mask = 0; mask < (1 << names.size()); mask++) {
            Set<String> subject = new HashSet<>();
            for (int i = 0; i < names.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    subject.add(names.get(i));
                }
            }
            subjects.add(subject);
        }
        return subjects;
    }
}
