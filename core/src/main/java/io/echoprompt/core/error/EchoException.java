package io.echoprompt.core.error;

/**
 * Abstract base for all Echo exceptions. Never thrown directly; use the
 * concrete subclasses under {@link EchoLoadException},
 * {@link EchoEvalException} or {@link EchoRenderException}.
 */
public abstract class EchoException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EVALUATION,
        RENDER
    }

    private final Phase phase;

    protected EchoException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected EchoException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
