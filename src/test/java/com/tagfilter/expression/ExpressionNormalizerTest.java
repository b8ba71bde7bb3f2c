package com.tagfilter.expression;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.function.Predicate;

import static com.tagfilter.expression.TestExpressions.allSubjects;
import static com.tagfilter.expression.TestExpressions.build;
import static com.tagfilter.expression.TestExpressions.shape;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for flatten and expand.
 */
class ExpressionNormalizerTest {

    private static final List<String> NAMES = List.of("a", "b", "c", "d");

    private Random random;

    @BeforeEach
    void setUp() {
        random = new Random(20240917L);
    }

    // =====================================================================
    // Flatten
    // =====================================================================

    @ParameterizedTest
    @DisplayName("Flatten removes bracket placeholders and merges same operators")
    @CsvSource(delimiter = '|', value = {
            "( ( a ) )                      | ROOT(a)",
            "( a ) and b                    | ROOT(AND(a,b))",
            "a and ( b and c )              | ROOT(AND(a,b,c))",
            "( a or b ) or c                | ROOT(OR(a,b,c))",
            "( a or ( b or c ) ) or d       | ROOT(OR(a,b,c,d))",
            "a and ( b or c )               | ROOT(AND(a,OR(b,c)))",
            "( ( a and b ) ) and ( c )      | ROOT(AND(a,b,c))",
            "( a and ( b or c ) or d )      | ROOT(OR(AND(a,OR(b,c)),d))",
            "a or ( ( b and c ) and d )     | ROOT(OR(a,AND(b,c,d)))"
    })
    void flattens(String tokens, String expectedShape) {
        BooleanExpression<TestValue, Set<String>> root = build(tokens);
        root.flatten();

        assertEquals(expectedShape, shape(root));
    }

    @Test
    @DisplayName("Bracket scenario renders with brackets after flatten")
    void bracketScenarioAfterFlatten() {
        BooleanExpression<TestValue, Set<String>> root = build("( a or b ) and c");
        root.flatten();

        assertEquals("ROOT(AND(OR(a,b),c))", shape(root));
        assertEquals("(a or b) and c", root.toString());
    }

    @Test
    @DisplayName("Flatten is idempotent")
    void flattenIsIdempotent() {
        BooleanExpression<TestValue, Set<String>> root = build("( a or ( b ) ) and ( ( c and d ) )");
        root.flatten();
        String once = shape(root);
        root.flatten();

        assertEquals(once, shape(root));
        assertEquals("ROOT(AND(OR(a,b),c,d))", once);
    }

    @Test
    @DisplayName("Merging keeps parent links of spliced children")
    void mergeReparentsChildren() {
        BooleanExpression<TestValue, Set<String>> root = build("a and ( b and c )");
        root.flatten();

        BooleanExpression<TestValue, Set<String>> and = root.getFirstChild().orElseThrow();
        for (BooleanExpression<TestValue, Set<String>> child : and.getChildren()) {
            assertSame(and, child.getParent().orElseThrow());
        }
    }

    // =====================================================================
    // Expand
    // =====================================================================

    @Test
    @DisplayName("Bracket scenario expands to an OR of ANDs")
    void bracketScenarioExpands() {
        BooleanExpression<TestValue, Set<String>> root = build("( a or b ) and c");
        root.expand();

        assertEquals("ROOT(OR(AND(a,c),AND(b,c)))", shape(root));
        assertEquals("a and c or b and c", root.toString());
    }

    @Test
    @DisplayName("Alternatives follow the order of the distributed OR")
    void expandKeepsAlternativeOrder() {
        BooleanExpression<TestValue, Set<String>> root = build("a and ( b or c ) and d");
        root.expand();

        assertEquals("ROOT(OR(AND(a,b,d),AND(a,c,d)))", shape(root));
    }

    @ParameterizedTest
    @DisplayName("Expand distributes AND over OR")
    @CsvSource(delimiter = '|', value = {
            "a and b                                | ROOT(AND(a,b))",
            "a or b                                 | ROOT(OR(a,b))",
            "a or b and c                           | ROOT(OR(a,AND(b,c)))",
            "( a or b ) and ( c or d )              | ROOT(OR(AND(a,c),AND(a,d),AND(b,c),AND(b,d)))",
            "a and ( b or c and ( d or a ) )        | ROOT(OR(AND(a,b),AND(a,c,d),AND(a,c,a)))",
            "( a or b ) and c or d                  | ROOT(OR(AND(a,c),AND(b,c),d))",
            "a and ( b or ( c or d ) )              | ROOT(OR(AND(a,b),AND(a,c),AND(a,d)))",
            "( a or b )                             | ROOT(OR(a,b))"
    })
    void expands(String tokens, String expectedShape) {
        BooleanExpression<TestValue, Set<String>> root = build(tokens);
        root.expand();

        assertEquals(expectedShape, shape(root));
    }

    @Test
    @DisplayName("Expanded copies do not share nodes")
    void expandedCopiesAreDistinct() {
        BooleanExpression<TestValue, Set<String>> root = build("a and ( b or c )");
        root.expand();

        BooleanExpression<TestValue, Set<String>> or = root.getFirstChild().orElseThrow();
        BooleanExpression<TestValue, Set<String>> first = or.getChildren().get(0);
        BooleanExpression<TestValue, Set<String>> second = or.getChildren().get(1);

        assertNotSame(first.getChildren().get(0), second.getChildren().get(0));
        assertSame(first, first.getChildren().get(0).getParent().orElseThrow());
        assertSame(second, second.getChildren().get(0).getParent().orElseThrow());
        assertSame(or, first.getParent().orElseThrow());
    }

    // =====================================================================
    // Properties over generated expressions
    // =====================================================================

    @Test
    @DisplayName("Flatten and expand preserve semantics and reach their normal forms")
    void normalizationPreservesSemantics() {
        List<Set<String>> subjects = allSubjects(NAMES);

        for (int i = 0; i < 300; i++) {
            List<String> tokens = new ArrayList<>();
            Predicate<Set<String>> reference = generateOr(2, tokens);

            BooleanExpression<TestValue, Set<String>> built = build(tokens);
            BooleanExpression<TestValue, Set<String>> flattened = built.copy();
            flattened.flatten();
            BooleanExpression<TestValue, Set<String>> expanded = built.copy();
            expanded.expand();

            String description = String.join(" ", tokens);
            for (Set<String> subject : subjects) {
                boolean expected = reference.test(subject);
                assertEquals(expected, built.matches(subject), () -> "built: " + description);
                assertEquals(expected, flattened.matches(subject), () -> "flattened: " + description);
                assertEquals(expected, expanded.matches(subject), () -> "expanded: " + description);
            }

            assertFlat(flattened, description);
            assertFlat(expanded, description);
            assertAndsOnlyHaveLeaves(expanded, description);

            String flatShape = shape(flattened);
            flattened.flatten();
            assertEquals(flatShape, shape(flattened), () -> "flatten not idempotent: " + description);
        }
    }

    private Predicate<Set<String>> generateOr(int depth, List<String> tokens) {
        int terms = 1 + random.nextInt(3);
        Predicate<Set<String>> result = null;
        for (int i = 0; i < terms; i++) {
            if (i > 0) {
                tokens.add("or");
            }
            Predicate<Set<String>> term = generateAnd(depth, tokens);
            result = result == null ? term : result.or(term);
        }
        return result;
    }

    private Predicate<Set<String>> generateAnd(int depth, List<String> tokens) {
        int factors = 1 + random.nextInt(3);
        Predicate<Set<String>> result = null;
        for (int i = 0; i < factors; i++) {
            if (i > 0) {
                tokens.add("and");
            }
            Predicate<Set<String>> factor = generateOperand(depth, tokens);
            result = result == null ? factor : result.and(factor);
        }
        return result;
    }

    private Predicate<Set<String>> generateOperand(int depth, List<String> tokens) {
        if (depth > 0 && random.nextInt(3) == 0) {
            tokens.add("(");
            Predicate<Set<String>> inner = generateOr(depth - 1, tokens);
            tokens.add(")");
            return inner;
        }
        String name = NAMES.get(random.nextInt(NAMES.size()));
        tokens.add(name);
        return subject -> subject.contains(name);
    }

    private static void assertFlat(BooleanExpression<TestValue, Set<String>> node, String description) {
        assertFalse(node.isPending(), () -> "placeholder left in " + description);
        for (BooleanExpression<TestValue, Set<String>> child : node.getChildren()) {
            if (!node.isRoot()) {
                assertNotEquals(node.getType(), child.getType(),
                        () -> "same operator nested in " + description);
            }
            assertSame(node, child.getParent().orElseThrow());
            assertFlat(child, description);
        }
    }

    private static void assertAndsOnlyHaveLeaves(BooleanExpression<TestValue, Set<String>> node, String description) {
        for (BooleanExpression<TestValue, Set<String>> child : node.getChildren()) {
            if (node.isAnd()) {
                assertTrue(child.isValue(), () -> "AND with non-leaf child in " + description);
            }
            assertAndsOnlyHaveLeaves(child, description);
        }
    }
}
