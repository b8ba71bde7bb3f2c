package com.tagfilter.config.expression;

import com.tagfilter.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.tagfilter.config.expression.ExpressionConfig.*;

/**
 * Splits a filter expression into tokens.
 * <p>
 * Quoted strings accept the escapes {@code \n}, {@code \t}, {@code \r}; any other escaped
 * character stands for itself, so {@code \"}, {@code \'} and {@code \\} work as expected.
 */
public final class ExpressionTokenizer {

    private final String input;
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * Tokenize the whole input.
     *
     * @return Tokens, the last one being EOF
     * @throws ConfigurationException on an unexpected character or an unterminated string
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        skipWhitespace();
        while (pos < input.length()) {
            tokens.add(nextToken());
            skipWhitespace();
        }
        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private Token nextToken() {
        int start = pos;
        char c = input.charAt(pos);

        switch (c) {
            case Operators.LEFT_PAREN:
                return symbol(TokenType.LPAREN, 1);
            case Operators.RIGHT_PAREN:
                return symbol(TokenType.RPAREN, 1);
            case Operators.COMMA:
                return symbol(TokenType.COMMA, 1);
            case Operators.EQUALS:
                return symbol(TokenType.EQ, 1);
            case Operators.TILDE:
                return symbol(TokenType.LIKE, 1);
            case Operators.BANG:
                if (nextIs(Operators.EQUALS)) {
                    return symbol(TokenType.NE, 2);
                }
                if (nextIs(Operators.TILDE)) {
                    return symbol(TokenType.NOT_LIKE, 2);
                }
                return symbol(TokenType.BANG, 1);
            case Operators.GREATER:
                return nextIs(Operators.EQUALS) ? symbol(TokenType.GTE, 2) : symbol(TokenType.GT, 1);
            case Operators.LESS:
                return nextIs(Operators.EQUALS) ? symbol(TokenType.LTE, 2) : symbol(TokenType.LT, 1);
            case Operators.QUOTE_DOUBLE:
            case Operators.QUOTE_SINGLE:
                return quoted();
            default:
                break;
        }

        if (isWordStart(c)) {
            return word(start);
        }
        if (Character.isDigit(c) || c == Operators.MINUS) {
            return numberOrWord();
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private Token symbol(TokenType type, int width) {
        int start = pos;
        pos += width;
        return new Token(type, input.substring(start, pos), null, start);
    }

    /**
     * Read a word; keywords are recognized regardless of case.
     */
    private Token word(int start) {
        skipWordChars();
        String text = input.substring(start, pos);
        TokenType keyword = KEYWORDS.get(text.toUpperCase(Locale.ROOT));
        return keyword != null
                ? new Token(keyword, text, null, start)
                : new Token(TokenType.IDENT, text, text, start);
    }

    private Token numberOrWord() {
        int start = pos;
        boolean signed = input.charAt(pos) == Operators.MINUS;
        if (signed) {
            pos++;
        }
        int digitsStart = pos;
        skipDigits();
        boolean decimal = pos < input.length() && input.charAt(pos) == Operators.DOT;
        if (decimal) {
            pos++;
            skipDigits();
        }

        // 30mph, 1A
        if (pos > digitsStart && pos < input.length() && isWordChar(input.charAt(pos))) {
            return word(start);
        }

        String text = input.substring(start, pos);
        try {
            Object value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            return new Token(TokenType.NUMBER, text, value, start);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private Token quoted() {
        int start = pos;
        char quote = input.charAt(pos++);
        StringBuilder text = new StringBuilder();

        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, text.toString(), text.toString(), start);
            }
            if (c == Operators.BACKSLASH && pos < input.length()) {
                text.append(unescape(input.charAt(pos++)));
            } else {
                text.append(c);
            }
        }
        throw error("Unterminated string", start);
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    private boolean nextIs(char expected) {
        return pos + 1 < input.length() && input.charAt(pos + 1) == expected;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }

    private void skipDigits() {
        while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
            pos++;
        }
    }

    private void skipWordChars() {
        while (pos < input.length() && isWordChar(input.charAt(pos))) {
            pos++;
        }
    }

    private static boolean isWordStart(char c) {
        return Character.isLetter(c) || c == Operators.UNDERSCORE;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c)
                || c == Operators.UNDERSCORE
                || c == Operators.COLON
                || c == Operators.DOT
                || c == Operators.MINUS;
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid filter expression at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
