package io.echoprompt.core.model;

import java.util.List;

/**
 * Outcome of parsing a template. A result with any error carries no AST.
 *
 * @param success {@code true} when no lex or parse error was reported
 * @param ast     top-level nodes, or {@code null} when parsing failed
 * @param errors  every diagnostic reported, in source order
 */
public record ParseResult(boolean success, List<Node> ast, List<EchoDiagnostic> errors) {

    public ParseResult {
        ast = ast != null ? List.copyOf(ast) : null;
        errors = List.copyOf(errors);
    }

    public static ParseResult ok(List<Node> ast) {
        return new ParseResult(true, ast, List.of());
    }

    public static ParseResult failed(List<EchoDiagnostic> errors) {
        return new ParseResult(false, null, errors);
    }
}
