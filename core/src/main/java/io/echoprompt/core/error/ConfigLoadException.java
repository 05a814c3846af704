package io.echoprompt.core.error;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or
 * unknown keys. Provides a descriptive message suitable for startup error
 * output.
 */
public final class ConfigLoadException extends EchoLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
