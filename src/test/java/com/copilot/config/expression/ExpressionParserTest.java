package com.copilot.config.expression;

import com.copilot.condition.ConditionConfig;
import com.copilot.condition.ConditionType;
import com.copilot.config.ConditionExpressionParser;
import com.copilot.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the condition expression tokenizer and parser.
 */
class ExpressionParserTest {

    @Test
    @DisplayName("Tokenize comparison with quoted string")
    void tokenizeComparison() {
        List<Token> tokens = new ExpressionTokenizer("engagement = 'low'").tokenize();

        assertEquals(4, tokens.size());
        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals(TokenType.EQ, tokens.get(1).type());
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals("low", tokens.get(2).literal());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @ParameterizedTest
    @DisplayName("Operators tokenize to their types")
    @CsvSource({
            "'==', EQ",
            "'!=', NE",
            "'<>', NE",
            "'>=', GTE",
            "'<=', LTE",
            "'>', GT",
            "'<', LT"
    })
    void tokenizeOperators(String operator, TokenType expected) {
        List<Token> tokens = new ExpressionTokenizer("x " + operator + " 1").tokenize();
        assertEquals(expected, tokens.get(1).type());
    }

    @Test
    @DisplayName("Numbers keep integer or decimal form")
    void tokenizeNumbers() {
        List<Token> tokens = new ExpressionTokenizer("a > -3 AND b < 2.5").tokenize();

        assertEquals(-3L, tokens.get(2).literal());
        assertEquals(2.5, tokens.get(6).literal());
    }

    @Test
    @DisplayName("Graph function names only count as functions before '('")
    void tokenizeFunctions() {
        List<Token> call = new ExpressionTokenizer("connected (related-to, Cohort)").tokenize();
        List<Token> feature = new ExpressionTokenizer("connected = skills.advanced").tokenize();

        assertEquals(TokenType.FUNCTION, call.get(0).type());
        assertEquals("connected", call.get(0).literal());
        assertEquals("related-to", call.get(2).literal());
        assertEquals(TokenType.IDENT, feature.get(0).type());
        assertEquals("skills.advanced", feature.get(2).literal());
    }

    @ParameterizedTest
    @DisplayName("Malformed input is rejected by the tokenizer")
    @ValueSource(strings = {"a = 'open", "a ! 1", "a = 1.2.3", "a = - 1"})
    void tokenizeErrors(String expression) {
        assertThrows(ConfigurationException.class, () -> new ExpressionTokenizer(expression).tokenize());
    }

    @Test
    @DisplayName("Simple feature comparison")
    void parseFeatureComparison() {
        ConditionConfig config = ConditionExpressionParser.parse("tenure_years >= 3");

        assertEquals(ConditionType.FEATURE, config.type());
        assertEquals("tenure_years", config.field());
        assertEquals(">=", config.operator());
        assertEquals(3L, config.value());
    }

    @Test
    @DisplayName("AND binds tighter than OR")
    void precedence() {
        ConditionConfig config = ConditionExpressionParser.parse("a = 1 OR b = 2 AND c = 3");

        assertEquals(ConditionType.OR, config.type());
        assertEquals(2, config.conditions().size());
        assertEquals(ConditionType.FEATURE, config.conditions().get(0).type());
        assertEquals(ConditionType.AND, config.conditions().get(1).type());
    }

    @Test
    @DisplayName("Parentheses override precedence")
    void parentheses() {
        ConditionConfig config = ConditionExpressionParser.parse(
                "engagement = 'low' AND (tenure_years >= 3 OR connected(belongs_to, Cohort))");

        assertEquals(ConditionType.AND, config.type());
        ConditionConfig or = config.conditions().get(1);
        assertEquals(ConditionType.OR, or.type());
        ConditionConfig connected = or.conditions().get(1);
        assertEquals(ConditionType.CONNECTED, connected.type());
        assertEquals("belongs_to", connected.graph().relation());
        assertEquals("Cohort", connected.graph().targetType());
    }

    @Test
    @DisplayName("IN and NOT IN lists")
    void membership() {
        ConditionConfig in = ConditionExpressionParser.parse("level IN ('Senior', 'Manager')");
        assertEquals("IN", in.operator());
        assertEquals(List.of("Senior", "Manager"), in.values());

        ConditionConfig notIn = ConditionExpressionParser.parse("level NOT IN [1, 2]");
        assertEquals(ConditionType.NOT, notIn.type());
        assertEquals(List.of(1L, 2L), notIn.conditions().get(0).values());
    }

    @Test
    @DisplayName("Graph predicates")
    void graphPredicates() {
        ConditionConfig path = ConditionExpressionParser.parse("path_exists('T1', 2)");
        assertEquals(ConditionType.PATH_EXISTS, path.type());
        assertEquals("T1", path.graph().targetId());
        assertEquals(2, path.graph().maxHops().intValue());

        ConditionConfig subject = ConditionExpressionParser.parse("attribute(subject, level) = 'Senior'");
        assertEquals(ConditionType.ATTRIBUTE, subject.type());
        assertTrue(subject.graph().isSubject());
        assertEquals("level", subject.field());

        ConditionConfig neighbor = ConditionExpressionParser.parse("attribute(has_role, title, out, Cohort) != 'Manager'");
        assertEquals("has_role", neighbor.graph().relation());
        assertEquals("out", neighbor.graph().direction());
        assertEquals("Cohort", neighbor.graph().targetType());
        assertEquals("!=", neighbor.operator());

        ConditionConfig incoming = ConditionExpressionParser.parse("connected(reports_to, Subject, in)");
        assertEquals("in", incoming.graph().direction());
    }

    @Test
    @DisplayName("NOT, TRUE and FALSE")
    void notAndBooleans() {
        ConditionConfig not = ConditionExpressionParser.parse("NOT x < 2");
        assertEquals(ConditionType.NOT, not.type());
        assertEquals(ConditionType.FEATURE, not.conditions().get(0).type());

        assertEquals(ConditionType.ALWAYS_TRUE, ConditionExpressionParser.parse("TRUE").type());
        assertEquals(ConditionType.NOT, ConditionExpressionParser.parse("false").type());
        assertEquals(ConditionType.ALWAYS_TRUE, ConditionExpressionParser.parse("  ").type());
    }

    @Test
    @DisplayName("A feature may share its name with a graph predicate")
    void predicateNameAsFeature() {
        ConditionConfig config = ConditionExpressionParser.parse("connected = true");
        assertEquals(ConditionType.FEATURE, config.type());
        assertEquals("connected", config.field());
        assertEquals(true, config.value());
    }

    @ParameterizedTest
    @DisplayName("Malformed expressions are rejected")
    @ValueSource(strings = {
            "a >",
            "a > 'x'",
            "(a = 1",
            "a = 1 b = 2",
            "a ! 1",
            "'unterminated",
            "path_exists('T1', 1.5)",
            "path_exists('T1', 99999999999)",
            "unknown_fn = ",
            "a NOT 3",
            "= 3"
    })
    void malformed(String expression) {
        assertThrows(ConfigurationException.class, () -> ConditionExpressionParser.parse(expression));
    }
}
