package io.echoprompt.core.spi;

import java.util.concurrent.CompletionStage;

/**
 * Externally implemented yes/no predicate behind the {@code ai_gate} operator,
 * typically an LLM call. The core applies no timeout; a judge that never
 * completes stalls the render, so implementations should bound their own
 * latency.
 */
@FunctionalInterface
public interface AiJudge {

    /**
     * @param value    the resolved variable value
     * @param question the yes/no question from the operator argument
     */
    CompletionStage<Boolean> judge(Object value, String question);
}
