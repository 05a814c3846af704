package io.echoprompt.core.spi;

/** How an operator is evaluated; callers branch on this tag once instead of inspecting handlers. */
public enum OperatorKind {
    /** Compares the variable value with the operator argument. */
    COMPARISON,
    /** Tests the variable value alone; any argument is ignored. */
    UNARY,
    /**
     * Completes asynchronously (typically an LLM call). Conditions using an
     * async operator are pre-evaluated concurrently before the tree walk.
     */
    ASYNC
}
