package io.echoprompt.core.error;

/** Thrown in strict mode when an operator handler fails. The handler's exception is the cause. */
public final class OperatorEvaluationException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public OperatorEvaluationException(String operator, Throwable cause) {
        super("Operator #" + operator + " failed: " + cause.getMessage(), cause, operator);
    }
}
