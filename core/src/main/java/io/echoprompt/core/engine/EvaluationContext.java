package io.echoprompt.core.engine;

import io.echoprompt.core.model.Node;
import io.echoprompt.core.spi.OperatorDefinition;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-render evaluation state: variable bindings, strictness, the operator
 * snapshot, collected sections and the pre-evaluated async results. Created
 * fresh for every evaluation and never shared between renders.
 */
public final class EvaluationContext {

    /** Identity of an async condition for de-duplication: the same triple is judged once. */
    record AsyncKey(String variable, Object value, Object argument) {}

    private final Map<String, ?> variables;
    private final boolean strict;
    private final Map<String, OperatorDefinition> operators;
    private final Map<String, List<Node>> sections = new LinkedHashMap<>();
    private final Map<AsyncKey, Boolean> asyncResults = new ConcurrentHashMap<>();

    public EvaluationContext(Map<String, ?> variables, boolean strict, Map<String, OperatorDefinition> operators) {
        this.variables = variables != null ? variables : Map.of();
        this.strict = strict;
        this.operators = Map.copyOf(operators);
    }

    public Map<String, ?> variables() {
        return variables;
    }

    public boolean strict() {
        return strict;
    }

    public Optional<OperatorDefinition> operator(String name) {
        return Optional.ofNullable(operators.get(name));
    }

    Map<String, List<Node>> sections() {
        return sections;
    }

    Map<AsyncKey, Boolean> asyncResults() {
        return asyncResults;
    }

    Object resolve(String path) {
        return VariableResolver.resolve(path, variables, strict);
    }
}
