package io.echoprompt.core.error;

/** Thrown in strict mode when a condition names an operator that is neither built in nor registered. */
public final class UnknownOperatorException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public UnknownOperatorException(String operator) {
        super("Unknown operator: #" + operator, operator);
    }
}
