package io.echoprompt.core.engine;

import io.echoprompt.core.error.OperatorConfigurationException;
import io.echoprompt.core.spi.AiJudge;
import io.echoprompt.core.spi.OperatorDefinition;
import io.echoprompt.core.spi.OperatorHandler;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.DoublePredicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The built-in operator table. Comparisons are forgiving: type mismatches,
 * non-numeric operands and invalid patterns evaluate to {@code false} rather
 * than failing.
 */
public final class BuiltinOperators {

    static final String AI_GATE = "ai_gate";
    static final String AI_JUDGE = "ai_judge";

    private BuiltinOperators() {}

    /**
     * Builds the built-in table.
     *
     * @param aiJudge predicate behind {@code ai_gate}/{@code ai_judge}; when {@code null} both fail
     *                with a configuration error on use
     */
    public static Map<String, OperatorDefinition> create(AiJudge aiJudge) {
        Map<String, OperatorDefinition> table = new LinkedHashMap<>();
        table.put(
                "equals",
                OperatorDefinition.comparison(
                        "Exact equality check", "{{genre}} #equals(Horror)", BuiltinOperators::equalsValue));
        table.put(
                "contains",
                OperatorDefinition.comparison(
                        "Check if string or array contains value",
                        "{{companions}} #contains(Shimon)",
                        BuiltinOperators::containsValue));
        table.put(
                "exists",
                OperatorDefinition.unary(
                        "Check if variable is defined and not empty",
                        "{{user.preferences}} #exists",
                        value -> !Values.isEmpty(value)));
        table.put(
                "matches",
                OperatorDefinition.comparison(
                        "Regex pattern matching", "{{email}} #matches(.*@.*)", BuiltinOperators::matchesPattern));

        OperatorDefinition gt = numeric("Greater than comparison", "{{age}} #greater_than(18)", d -> d > 0);
        OperatorDefinition gte =
                numeric("Greater than or equal comparison", "{{age}} #greater_than_or_equal(18)", d -> d >= 0);
        OperatorDefinition lt = numeric("Less than comparison", "{{count}} #less_than(10)", d -> d < 0);
        OperatorDefinition lte =
                numeric("Less than or equal comparison", "{{count}} #less_than_or_equal(10)", d -> d <= 0);
        table.put("greater_than", gt);
        table.put("greater_than_or_equal", gte);
        table.put("less_than", lt);
        table.put("less_than_or_equal", lte);

        OperatorDefinition oneOf = OperatorDefinition.comparison(
                "Check if value is one of the given options",
                "{{status}} #one_of(active,pending,completed)",
                BuiltinOperators::oneOf);
        table.put("one_of", oneOf);

        OperatorDefinition aiGate = OperatorDefinition.async(
                "LLM-evaluated boolean condition",
                "{{content}} #ai_gate(Is this appropriate for children?)",
                aiGateHandler(aiJudge));
        table.put(AI_GATE, aiGate);
        table.put(AI_JUDGE, aiGate);

        table.put("gt", gt);
        table.put("gte", gte);
        table.put("lt", lt);
        table.put("lte", lte);
        table.put("in", oneOf);
        return table;
    }

    static boolean equalsValue(Object value, Object argument) {
        if (value instanceof String text && argument instanceof String expected) {
            return text.equalsIgnoreCase(expected);
        }
        if (value instanceof Number number && argument instanceof Number expected) {
            return number.doubleValue() == expected.doubleValue();
        }
        return Objects.equals(value, argument);
    }

    static boolean containsValue(Object value, Object argument) {
        if (value instanceof String text && argument instanceof String needle) {
            return text.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
        }
        List<Object> items = Values.asList(value);
        if (items == null) {
            return false;
        }
        return items.stream().anyMatch(item -> equalsValue(item, argument));
    }

    static boolean matchesPattern(Object value, Object pattern) {
        if (!(value instanceof String text) || !(pattern instanceof String regex)) {
            return false;
        }
        try {
            return Pattern.compile(regex).matcher(text).find();
        } catch (PatternSyntaxException e) {
            return false;
        }
    }

    static boolean oneOf(Object value, Object options) {
        List<?> items;
        if (options instanceof List<?> list) {
            items = list;
        } else if (options instanceof String text) {
            items = Arrays.stream(text.split(",", -1)).map(String::trim).toList();
        } else {
            return false;
        }
        String candidate = Values.displayString(value);
        return items.stream().anyMatch(item -> Values.displayString(item).equalsIgnoreCase(candidate));
    }

    private static OperatorDefinition numeric(String description, String example, DoublePredicate test) {
        return OperatorDefinition.comparison(description, example, (value, threshold) -> {
            double left = Values.toNumber(value);
            double right = Values.toNumber(threshold);
            if (Double.isNaN(left) || Double.isNaN(right)) {
                return false;
            }
            return test.test(Double.compare(left, right));
        });
    }

    private static OperatorHandler aiGateHandler(AiJudge aiJudge) {
        if (aiJudge == null) {
            return (value, question) -> CompletableFuture.failedFuture(new OperatorConfigurationException(
                    "AI gate not configured. Set an AiJudge in EchoConfig.", AI_GATE));
        }
        return (value, question) -> aiJudge.judge(value, question == null ? "" : Values.displayString(question));
    }
}
