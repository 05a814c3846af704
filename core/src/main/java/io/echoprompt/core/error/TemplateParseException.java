package io.echoprompt.core.error;

import io.echoprompt.core.model.EchoDiagnostic;
import java.util.List;

/**
 * Thrown by the render entry points when a template fails to lex or parse. The
 * structured diagnostics are kept so callers can report every error, not only
 * the first.
 */
public final class TemplateParseException extends EchoLoadException {

    private static final long serialVersionUID = 1L;

    private final transient List<EchoDiagnostic> diagnostics;

    public TemplateParseException(String message, List<EchoDiagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /** All lex and parse diagnostics reported for the template. */
    public List<EchoDiagnostic> diagnostics() {
        return diagnostics;
    }
}
