package com.tagfilter.config;

import com.tagfilter.config.expression.ExpressionParser;
import com.tagfilter.config.expression.ExpressionTokenizer;
import com.tagfilter.config.expression.Token;
import com.tagfilter.exception.ConfigurationException;
import com.tagfilter.expression.Normalization;
import com.tagfilter.filter.ElementFilterExpression;

import java.util.List;

/**
 * Facade for parsing filter expressions such as
 * {@code nodes, ways with highway = residential and (name or ref)}.
 * <p>
 * Supports:
 * <ul>
 *   <li>Element types: nodes, ways, relations</li>
 *   <li>Logical operators: and, or</li>
 *   <li>Key tests: key, !key</li>
 *   <li>Value tests: =, !=, ~ (regex), !~ (regex)</li>
 *   <li>Numeric tests: >, >=, <, <=</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * Precedence: AND > OR (parentheses override)
 */
public final class FilterExpressionParser {

    private FilterExpressionParser() {
    }

    /**
     * Parse a filter expression. The tag expression is flattened.
     *
     * @param expression Expression string
     * @return Parsed filter
     * @throws ConfigurationException if the expression is invalid
     */
    public static ElementFilterExpression parse(String expression) {
        return parse(expression, Normalization.FLATTEN);
    }

    /**
     * Parse a filter expression and normalize its tag expression.
     *
     * @param expression    Expression string
     * @param normalization Rewrite to apply to the tag expression
     * @return Parsed filter
     * @throws ConfigurationException if the expression is invalid
     */
    public static ElementFilterExpression parse(String expression, Normalization normalization) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Filter expression cannot be empty");
        }

        // Tokenize
        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        // Parse
        ExpressionParser parser = new ExpressionParser(expression, tokens);
        ElementFilterExpression filter = parser.parse();
        filter.getTagExpression().ifPresent(tags -> normalization.apply(tags));
        return filter;
    }
}
