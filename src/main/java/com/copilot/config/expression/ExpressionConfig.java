package com.copilot.config.expression;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Vocabulary of the rule expression language: keywords, graph functions and symbols.
 */
public final class ExpressionConfig {

    private ExpressionConfig() {
    }

    public static final Map<String, TokenType> KEYWORDS = Map.of(
            "AND", TokenType.AND,
            "OR", TokenType.OR,
            "NOT", TokenType.NOT,
            "IN", TokenType.IN,
            "TRUE", TokenType.BOOLEAN,
            "FALSE", TokenType.BOOLEAN
    );

    /**
     * Graph predicates, written as calls. A name is only a function when '(' follows it,
     * so features may still be called {@code connected} or {@code attribute}.
     */
    public static final String CONNECTED = "connected";
    public static final String PATH_EXISTS = "path_exists";
    public static final String ATTRIBUTE = "attribute";

    public static final Set<String> FUNCTIONS = Set.of(CONNECTED, PATH_EXISTS, ATTRIBUTE);

    /**
     * Operator and delimiter symbols, two-character forms first so the longest one wins.
     */
    public static final Map<String, TokenType> SYMBOLS = symbols();

    public static final char SINGLE_QUOTE = '\'';
    public static final char DOUBLE_QUOTE = '"';
    public static final char ESCAPE = '\\';

    private static Map<String, TokenType> symbols() {
        Map<String, TokenType> symbols = new LinkedHashMap<>();
        symbols.put(">=", TokenType.GTE);
        symbols.put("<=", TokenType.LTE);
        symbols.put("!=", TokenType.NE);
        symbols.put("<>", TokenType.NE);
        symbols.put("==", TokenType.EQ);
        symbols.put("=", TokenType.EQ);
        symbols.put(">", TokenType.GT);
        symbols.put("<", TokenType.LT);
        symbols.put("(", TokenType.LPAREN);
        symbols.put(")", TokenType.RPAREN);
        symbols.put("[", TokenType.LBRACKET);
        symbols.put("]", TokenType.RBRACKET);
        symbols.put(",", TokenType.COMMA);
        return symbols;
    }
}
