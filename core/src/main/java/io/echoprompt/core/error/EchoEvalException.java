package io.echoprompt.core.error;

/**
 * Abstract parent for errors raised while resolving conditionals, variable
 * paths and includes. Only thrown in strict mode; lenient evaluation recovers
 * locally. Carries the offending {@code subject} (variable path, operator name
 * or section name).
 */
public abstract class EchoEvalException extends EchoException {

    private static final long serialVersionUID = 1L;

    private final String subject;

    protected EchoEvalException(String message, String subject) {
        super(message, Phase.EVALUATION);
        this.subject = subject;
    }

    protected EchoEvalException(String message, Throwable cause, String subject) {
        super(message, cause, Phase.EVALUATION);
        this.subject = subject;
    }

    /** The variable path, operator name or section name the error refers to. */
    public String subject() {
        return subject;
    }
}
