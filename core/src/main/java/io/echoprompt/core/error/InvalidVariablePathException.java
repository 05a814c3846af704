package io.echoprompt.core.error;

/**
 * Thrown in strict mode when a variable path has malformed bracket syntax
 * (empty, non-numeric or negative index, unbalanced brackets) or indexes into a
 * value that is not a list.
 */
public final class InvalidVariablePathException extends EchoEvalException {

    private static final long serialVersionUID = 1L;

    public InvalidVariablePathException(String message, String path) {
        super(message, path);
    }
}
