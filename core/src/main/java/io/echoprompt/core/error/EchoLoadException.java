package io.echoprompt.core.error;

/**
 * Abstract parent for errors raised before any template is evaluated: template
 * syntax errors, plugin registration failures and configuration problems.
 * Carries a {@code source} field identifying the template, plugin or file that
 * caused the error.
 */
public abstract class EchoLoadException extends EchoException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected EchoLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected EchoLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The template, plugin name or file path that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
