package io.echoprompt.core.error;

/**
 * Abstract parent for errors raised while stringifying an evaluated tree. Only
 * thrown in strict mode.
 */
public abstract class EchoRenderException extends EchoException {

    private static final long serialVersionUID = 1L;

    private final String subject;

    protected EchoRenderException(String message, String subject) {
        super(message, Phase.RENDER);
        this.subject = subject;
    }

    /** The variable path or directive target the error refers to. */
    public String subject() {
        return subject;
    }
}
