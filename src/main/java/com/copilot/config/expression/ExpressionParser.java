package com.copilot.config.expression;

import com.copilot.condition.ComparisonOperator;
import com.copilot.condition.ConditionConfig;
import com.copilot.condition.GraphSelector;
import com.copilot.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

import static com.copilot.config.expression.ExpressionConfig.*;

/**
 * Parser for rule condition expressions.
 * Converts tokens into a ConditionConfig tree using recursive descent parsing.
 * <p>
 * Grammar (precedence: NOT > AND > OR):
 * <pre>
 * expression := or
 * or         := and ('OR' and)*
 * and        := not ('AND' not)*
 * not        := 'NOT' not | primary
 * primary    := '(' expression ')' | BOOLEAN | graph | comparison
 * graph      := 'connected' '(' label ',' label [',' label] ')'
 *             | 'path_exists' '(' label ',' NUMBER ')'
 *             | 'attribute' '(' label ',' label [',' label [',' label]] ')' operator
 * comparison := IDENT operator
 * operator   := ('=' | '!=' | '<' | '<=' | '>' | '>=') value | ['NOT'] 'IN' list
 * </pre>
 * Labels are identifiers or quoted strings. The optional third and fourth arguments of
 * {@code attribute} are the neighbor direction and node type.
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
     * Parse the token stream into a ConditionConfig tree.
     *
     * @return Root condition configuration
     */
    public ConditionConfig parse() {
        ConditionConfig result = parseExpression();
        expect(TokenType.EOF);
        return result;
    }

    private ConditionConfig parseExpression() {
        return parseOr();
    }

    private ConditionConfig parseOr() {
        ConditionConfig left = parseAnd();
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.OR)) {
            conditions.add(parseAnd());
        }

        return conditions.size() == 1 ? left : ConditionConfig.or(conditions);
    }

    private ConditionConfig parseAnd() {
        ConditionConfig left = parseNot();
        List<ConditionConfig> conditions = new ArrayList<>();
        conditions.add(left);

        while (match(TokenType.AND)) {
            conditions.add(parseNot());
        }

        return conditions.size() == 1 ? left : ConditionConfig.and(conditions);
    }

    private ConditionConfig parseNot() {
        if (match(TokenType.NOT)) {
            return ConditionConfig.not(parseNot());
        }
        return parsePrimary();
    }

    private ConditionConfig parsePrimary() {
        if (match(TokenType.LPAREN)) {
            ConditionConfig expr = parseExpression();
            expect(TokenType.RPAREN);
            return expr;
        }

        if (match(TokenType.BOOLEAN)) {
            boolean value = (boolean) previous().literal();
            return value ? ConditionConfig.alwaysTrue() : ConditionConfig.not(ConditionConfig.alwaysTrue());
        }

        if (check(TokenType.FUNCTION)) {
            return parseGraphPredicate();
        }

        return parseComparison();
    }

    private ConditionConfig parseGraphPredicate() {
        String function = (String) advance().literal();
        expect(TokenType.LPAREN);

        switch (function) {
            case CONNECTED -> {
                String relation = parseLabel("Expected relation");
                expect(TokenType.COMMA);
                String targetType = parseLabel("Expected node type");
                String direction = match(TokenType.COMMA) ? parseLabel("Expected direction") : null;
                expect(TokenType.RPAREN);
                return ConditionConfig.connected(relation, targetType, direction);
            }
            case PATH_EXISTS -> {
                String targetId = parseLabel("Expected target node id");
                expect(TokenType.COMMA);
                Object hops = parseNumericValue("path_exists requires a numeric hop limit");
                expect(TokenType.RPAREN);
                if (hops instanceof Double) {
                    throw error("path_exists hop limit must be a whole number");
                }
                long limit = (Long) hops;
                if (limit < Integer.MIN_VALUE || limit > Integer.MAX_VALUE) {
                    throw error("path_exists hop limit out of range");
                }
                return ConditionConfig.pathExists(targetId, (int) limit);
            }
            case ATTRIBUTE -> {
                String nodeRef = parseLabel("Expected 'subject' or relation");
                expect(TokenType.COMMA);
                String name = parseLabel("Expected attribute name");
                String direction = match(TokenType.COMMA) ? parseLabel("Expected direction") : null;
                String targetType = match(TokenType.COMMA) ? parseLabel("Expected node type") : null;
                expect(TokenType.RPAREN);
                GraphSelector selector = GraphSelector.SUBJECT.equalsIgnoreCase(nodeRef)
                        ? GraphSelector.subject()
                        : GraphSelector.neighbors(nodeRef, direction, targetType);
                return parseOperatorAndValue(selector, name);
            }
            default -> throw error("Unknown graph predicate '" + function + "'");
        }
    }

    private ConditionConfig parseComparison() {
        Token fieldToken = consume(TokenType.IDENT, "Expected feature name");
        return parseOperatorAndValue(null, fieldToken.text());
    }

    /**
     * Parse the operator part of a feature predicate (selector == null) or an attribute predicate.
     */
    private ConditionConfig parseOperatorAndValue(GraphSelector selector, String field) {
        if (match(TokenType.NOT)) {
            if (match(TokenType.IN)) {
                return ConditionConfig.not(membership(selector, field, parseList()));
            }
            throw error("Expected IN after NOT");
        }
        if (match(TokenType.IN)) {
            return membership(selector, field, parseList());
        }

        ComparisonOperator operator;
        Object value;
        if (match(TokenType.EQ)) {
            operator = ComparisonOperator.EQ;
            value = parseValue();
        } else if (match(TokenType.NE)) {
            operator = ComparisonOperator.NE;
            value = parseValue();
        } else if (match(TokenType.GTE)) {
            operator = ComparisonOperator.GE;
            value = parseNumericValue(">= requires a numeric value");
        } else if (match(TokenType.GT)) {
            operator = ComparisonOperator.GT;
            value = parseNumericValue("> requires a numeric value");
        } else if (match(TokenType.LTE)) {
            operator = ComparisonOperator.LE;
            value = parseNumericValue("<= requires a numeric value");
        } else if (match(TokenType.LT)) {
            operator = ComparisonOperator.LT;
            value = parseNumericValue("< requires a numeric value");
        } else {
            throw error("Expected operator after '" + field + "'");
        }

        return selector == null
                ? ConditionConfig.feature(field, operator.symbol(), value)
                : ConditionConfig.attribute(selector, field, operator.symbol(), value);
    }

    private ConditionConfig membership(GraphSelector selector, String field, List<Object> values) {
        return selector == null
                ? ConditionConfig.featureIn(field, values)
                : ConditionConfig.attributeIn(selector, field, values);
    }

    private List<Object> parseList() {
        boolean bracket = match(TokenType.LBRACKET);
        if (!bracket) {
            expect(TokenType.LPAREN);
        }

        List<Object> values = new ArrayList<>();
        if (!check(bracket ? TokenType.RBRACKET : TokenType.RPAREN)) {
            values.add(parseValue());
            while (match(TokenType.COMMA)) {
                values.add(parseValue());
            }
        }

        expect(bracket ? TokenType.RBRACKET : TokenType.RPAREN);
        return values;
    }

    private Object parseValue() {
        if (match(TokenType.STRING, TokenType.NUMBER, TokenType.BOOLEAN, TokenType.IDENT)) {
            return previous().literal();
        }
        throw error("Expected value");
    }

    private Object parseNumericValue(String message) {
        if (match(TokenType.NUMBER)) {
            return previous().literal();
        }
        throw error(message);
    }

    private String parseLabel(String message) {
        if (match(TokenType.STRING, TokenType.IDENT)) {
            return previous().literal().toString();
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
            throw error("Expected " + type);
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
        int position = peek().position();
        return new ConfigurationException("Invalid condition-expr at position "
                + position + ": " + message + " in '" + input + "'");
    }
}
