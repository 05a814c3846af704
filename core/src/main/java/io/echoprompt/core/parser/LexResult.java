package io.echoprompt.core.parser;

import io.echoprompt.core.model.EchoDiagnostic;
import java.util.List;

/** Tokens and lex errors for one template. Any error makes the result unusable for parsing. */
public record LexResult(List<Token> tokens, List<EchoDiagnostic> errors) {

    public LexResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
