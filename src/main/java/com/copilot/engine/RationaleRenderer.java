package com.copilot.engine;

import com.copilot.condition.MatchTrace;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills {placeholder}s of an explanation template.
 * <p>
 * Built-ins: {@code {subject}}, {@code {rule}}, {@code {action}} and {@code {score}}
 * (two decimals). Every other name is looked up in the match trace. Placeholders
 * with no value are left as written.
 */
public class RationaleRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.\\-]+)}");

    public String render(String template, String subjectId, String ruleId, String actionId,
                         double score, MatchTrace trace) {
        if (template == null || template.isEmpty()) {
            return "";
        }

        Map<String, String> values = new HashMap<>(trace.bindings());
        values.put("subject", subjectId);
        values.put("rule", ruleId);
        values.put("action", actionId);
        values.put("score", formatScore(score));

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }
}
