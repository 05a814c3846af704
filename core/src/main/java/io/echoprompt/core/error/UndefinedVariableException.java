package io.echoprompt.core.error;

/** Thrown in strict mode when a variable without a default resolves to nothing. */
public final class UndefinedVariableException extends EchoRenderException {

    private static final long serialVersionUID = 1L;

    public UndefinedVariableException(String path) {
        super("Undefined variable: " + path, path);
    }
}
