package com.tagfilter.config.expression;

import com.tagfilter.element.Element;
import com.tagfilter.element.ElementType;
import com.tagfilter.exception.ConfigurationException;
import com.tagfilter.expression.BooleanExpression;
import com.tagfilter.filter.ElementFilterExpression;
import com.tagfilter.filter.TagFilter;
import com.tagfilter.filter.TagFilterType;
import com.tagfilter.filter.impl.HasKey;
import com.tagfilter.filter.impl.HasTag;
import com.tagfilter.filter.impl.HasTagValueLike;
import com.tagfilter.filter.impl.NotHasKey;
import com.tagfilter.filter.impl.NotHasTag;
import com.tagfilter.filter.impl.NotHasTagValueLike;
import com.tagfilter.filter.impl.TagComparison;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.PatternSyntaxException;

import static com.tagfilter.config.expression.ExpressionConfig.ELEMENT_TYPES;

/**
 * Parser for filter expressions.
 * <p>
 * Grammar (precedence: AND > OR):
 * <pre>
 * filter       := elementTypes ('with' tags)?
 * elementTypes := type (',' type)*
 * tags         := operand (('and' | 'or') operand)*
 * operand      := '('* tag ')'*
 * tag          := '!' key | key (operator value)?
 * </pre>
 * The tag expression is built in a single left-to-right pass: every token is handed to the
 * {@link BooleanExpression} builder, which keeps the tree correctly precedenced. Brackets are
 * tracked here with a stack of saved cursors.
 */
public final class ExpressionParser {

    private final String input;
    private final List<Token> tokens;
    private int index;

    public ExpressionParser(String input, List<Token> tokens) {
        this.input = input;
        this.tokens = tokens;
        this.index = 0;
    }

    /**
     * Parse the token stream into a filter. The tag expression is returned as built,
     * not normalized.
     *
     * @return Parsed filter
     */
    public ElementFilterExpression parse() {
        Set<ElementType> elementTypes = parseElementTypes();

        BooleanExpression<TagFilter, Element> tags = null;
        if (match(TokenType.WITH)) {
            tags = parseTags();
        }

        expect(TokenType.EOF);
        return new ElementFilterExpression(elementTypes, tags);
    }

    private Set<ElementType> parseElementTypes() {
        Set<ElementType> result = EnumSet.noneOf(ElementType.class);
        do {
            Token token = consume(TokenType.IDENT, "Expected element type (nodes, ways, relations)");
            ElementType type = ELEMENT_TYPES.get(token.text().toUpperCase(Locale.ROOT));
            if (type == null) {
                throw error("Unknown element type '" + token.text() + "'", token.position());
            }
            if (!result.add(type)) {
                throw error("Duplicate element type '" + token.text() + "'", token.position());
            }
        } while (match(TokenType.COMMA));
        return result;
    }

    private BooleanExpression<TagFilter, Element> parseTags() {
        BooleanExpression<TagFilter, Element> root = BooleanExpression.root();
        BooleanExpression<TagFilter, Element> current = root;
        Deque<BooleanExpression<TagFilter, Element>> brackets = new ArrayDeque<>();

        while (true) {
            while (match(TokenType.LPAREN)) {
                brackets.push(current);
                current = current.addOpenBracket();
            }

            current = current.addValue(parseTag());

            while (check(TokenType.RPAREN)) {
                if (brackets.isEmpty()) {
                    throw error("Unmatched closing bracket");
                }
                advance();
                current = brackets.pop();
            }

            if (match(TokenType.AND)) {
                current = current.addAnd();
            } else if (match(TokenType.OR)) {
                current = current.addOr();
            } else {
                break;
            }
        }

        if (!brackets.isEmpty()) {
            throw error("Missing closing bracket");
        }
        return root;
    }

    private TagFilter parseTag() {
        if (match(TokenType.BANG)) {
            return new NotHasKey(parseKey());
        }

        String key = parseKey();

        if (match(TokenType.EQ)) {
            return new HasTag(key, parseValue());
        }
        if (match(TokenType.NE)) {
            return new NotHasTag(key, parseValue());
        }
        if (match(TokenType.LIKE)) {
            int position = peek().position();
            String regex = parseValue();
            try {
                return new HasTagValueLike(key, regex);
            } catch (PatternSyntaxException e) {
                throw error("Invalid regular expression '" + regex + "'", position, e);
            }
        }
        if (match(TokenType.NOT_LIKE)) {
            int position = peek().position();
            String regex = parseValue();
            try {
                return new NotHasTagValueLike(key, regex);
            } catch (PatternSyntaxException e) {
                throw error("Invalid regular expression '" + regex + "'", position, e);
            }
        }
        if (match(TokenType.GTE)) {
            return new TagComparison(key, parseNumber(">= requires a numeric value"), TagFilterType.GREATER_THAN_OR_EQUALS);
        }
        if (match(TokenType.GT)) {
            return new TagComparison(key, parseNumber("> requires a numeric value"), TagFilterType.GREATER_THAN);
        }
        if (match(TokenType.LTE)) {
            return new TagComparison(key, parseNumber("<= requires a numeric value"), TagFilterType.LESS_THAN_OR_EQUALS);
        }
        if (match(TokenType.LT)) {
            return new TagComparison(key, parseNumber("< requires a numeric value"), TagFilterType.LESS_THAN);
        }

        return new HasKey(key);
    }

    private String parseKey() {
        if (match(TokenType.IDENT, TokenType.STRING)) {
            return previous().literal().toString();
        }
        throw error("Expected tag key");
    }

    private String parseValue() {
        if (match(TokenType.IDENT, TokenType.STRING)) {
            return previous().literal().toString();
        }
        if (match(TokenType.NUMBER)) {
            return previous().text();
        }
        throw error("Expected value");
    }

    private double parseNumber(String message) {
        if (match(TokenType.NUMBER)) {
            return ((Number) previous().literal()).doubleValue();
        }
        throw error(message);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(message);
    }

    private void expect(TokenType type) {
        if (!check(type)) {
            throw error("Expected " + type + " but found " + peek().type());
        }
        advance();
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) {
            index++;
        }
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token previous() {
        return tokens.get(index - 1);
    }

    private ConfigurationException error(String message) {
        return error(message, peek().position());
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException(errorMessage(message, position));
    }

    private ConfigurationException error(String message, int position, Throwable cause) {
        return new ConfigurationException(errorMessage(message, position), cause);
    }

    private String errorMessage(String message, int position) {
        return "Invalid filter expression at position " + position + ": " + message + " in '" + input + "'";
    }
}
