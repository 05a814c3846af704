package io.echoprompt.core.error;

/**
 * Thrown in strict mode when an import, include or context reference reaches
 * the renderer without having been resolved.
 */
public final class UnresolvedReferenceException extends EchoRenderException {

    private static final long serialVersionUID = 1L;

    /** Kind of directive that was left unresolved. */
    public enum Kind {
        IMPORT("import"),
        INCLUDE("include"),
        CONTEXT("context");

        private final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;

    public UnresolvedReferenceException(Kind kind, String target) {
        super("Unresolved " + kind.label + ": " + target, target);
        this.kind = kind;
    }

    /** The kind of directive that was left unresolved. */
    public Kind kind() {
        return kind;
    }
}
