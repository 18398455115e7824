package com.copilot.config.expression;

import com.copilot.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.copilot.config.expression.ExpressionConfig.*;

/**
 * Splits a {@code condition-expr} string into tokens.
 * <p>
 * Names may contain dots and hyphens, so {@code skills.advanced} and {@code related-to}
 * are single identifiers. A leading '-' followed by a digit starts a number.
 */
public final class ExpressionTokenizer {

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;

    public ExpressionTokenizer(String input) {
        this.input = input;
    }

    /**
     * @return tokens in input order, ending with an EOF token
     */
    public List<Token> tokenize() {
        while (skipWhitespace()) {
            char c = input.charAt(pos);
            if (c == SINGLE_QUOTE || c == DOUBLE_QUOTE) {
                readString(c);
            } else if (Character.isDigit(c) || (c == '-' && nextIsDigit())) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else if (!readSymbol()) {
                throw error("Unexpected character '" + c + "'", pos);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", null, pos));
        return tokens;
    }

    private boolean skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return pos < input.length();
    }

    private boolean readSymbol() {
        for (Map.Entry<String, TokenType> symbol : SYMBOLS.entrySet()) {
            if (input.startsWith(symbol.getKey(), pos)) {
                tokens.add(new Token(symbol.getValue(), symbol.getKey(), null, pos));
                pos += symbol.getKey().length();
                return true;
            }
        }
        return false;
    }

    private void readName() {
        int start = pos;
        while (pos < input.length() && isNamePart(input.charAt(pos))) {
            pos++;
        }
        String text = input.substring(start, pos);
        String upper = text.toUpperCase(Locale.ROOT);

        TokenType keyword = KEYWORDS.get(upper);
        if (keyword == TokenType.BOOLEAN) {
            tokens.add(new Token(keyword, text, Boolean.valueOf(upper.equals("TRUE")), start));
        } else if (keyword != null) {
            tokens.add(new Token(keyword, text, null, start));
        } else if (FUNCTIONS.contains(text.toLowerCase(Locale.ROOT)) && openParenFollows()) {
            tokens.add(new Token(TokenType.FUNCTION, text, text.toLowerCase(Locale.ROOT), start));
        } else {
            tokens.add(new Token(TokenType.IDENT, text, text, start));
        }
    }

    private void readNumber() {
        int start = pos;
        if (input.charAt(pos) == '-') {
            pos++;
        }
        boolean decimal = false;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '.' && !decimal) {
                decimal = true;
            } else if (!Character.isDigit(c)) {
                break;
            }
            pos++;
        }
        String text = input.substring(start, pos);
        try {
            Object value = decimal ? (Object) Double.parseDouble(text) : (Object) Long.parseLong(text);
            tokens.add(new Token(TokenType.NUMBER, text, value, start));
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + text + "'", start);
        }
    }

    private void readString(char quote) {
        int start = pos++;
        StringBuilder value = new StringBuilder();
        while (pos < input.length() && input.charAt(pos) != quote) {
            char c = input.charAt(pos++);
            if (c == ESCAPE && pos < input.length()) {
                c = input.charAt(pos++);
            }
            value.append(c);
        }
        if (pos >= input.length()) {
            throw error("Unterminated string", start);
        }
        pos++;
        tokens.add(new Token(TokenType.STRING, input.substring(start, pos), value.toString(), start));
    }

    private boolean openParenFollows() {
        int i = pos;
        while (i < input.length() && Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        return i < input.length() && input.charAt(i) == '(';
    }

    private boolean nextIsDigit() {
        return pos + 1 < input.length() && Character.isDigit(input.charAt(pos + 1));
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
    }

    private ConfigurationException error(String message, int position) {
        return new ConfigurationException("Invalid condition-expr at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
