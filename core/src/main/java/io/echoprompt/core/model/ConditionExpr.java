package io.echoprompt.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The condition of an {@code [#IF]} or {@code [ELSE IF]} block.
 *
 * @param variable the variable path being tested
 * @param operator operator name without the leading {@code #}
 * @param argument classified argument: a {@link Double}, a {@code List<String>}, a {@link String},
 *                 or {@code null} when the operator takes none
 * @param async    {@code true} when the operator is asynchronous and takes part in pre-evaluation
 */
public record ConditionExpr(String variable, String operator, Object argument, boolean async) {

    public ConditionExpr {
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(operator, "operator must not be null");
        if (argument instanceof List<?> list) {
            argument = List.copyOf(list);
        }
    }

    @Override
    public String toString() {
        return "{{" + variable + "}} #" + operator + (argument != null ? "(" + argument + ")" : "");
    }
}
