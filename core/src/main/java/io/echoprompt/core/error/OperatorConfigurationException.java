package io.echoprompt.core.error;

/**
 * Thrown by an operator whose external collaborator has not been configured,
 * e.g. {@code #ai_gate} without an {@code AiJudge}.
 */
public final class OperatorConfigurationException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public OperatorConfigurationException(String message, String operator) {
        super(message, operator);
    }
}
