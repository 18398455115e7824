package com.copilot.config;

import com.copilot.condition.ConditionConfig;
import com.copilot.config.expression.ExpressionParser;
import com.copilot.config.expression.ExpressionTokenizer;
import com.copilot.config.expression.Token;

import java.util.List;

/**
 * Facade for parsing rule condition expressions into ConditionConfig trees.
 * <p>
 * Supports:
 * <ul>
 *   <li>Logical operators: AND, OR, NOT</li>
 *   <li>Feature comparisons: ==, =, !=, &lt;&gt;, &gt;, &gt;=, &lt;, &lt;=</li>
 *   <li>Set membership: IN, NOT IN</li>
 *   <li>Graph predicates: connected(relation, Type), path_exists(target, hops),
 *       attribute(subject|relation, name) &lt;op&gt; value</li>
 *   <li>Parentheses for grouping</li>
 * </ul>
 * <p>
 * Precedence: NOT > AND > OR (parentheses override)
 */
public final class ConditionExpressionParser {

    private ConditionExpressionParser() {
    }

    /**
     * Parse a condition expression into a ConditionConfig tree.
     *
     * @param expression Expression string
     * @return Parsed condition configuration; ALWAYS_TRUE for a blank expression
     */
    public static ConditionConfig parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return ConditionConfig.alwaysTrue();
        }

        ExpressionTokenizer tokenizer = new ExpressionTokenizer(expression);
        List<Token> tokens = tokenizer.tokenize();

        ExpressionParser parser = new ExpressionParser(expression, tokens);
        return parser.parse();
    }
}
