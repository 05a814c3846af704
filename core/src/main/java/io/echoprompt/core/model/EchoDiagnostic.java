package io.echoprompt.core.model;

import java.util.Objects;

/**
 * A structured error or warning about a template, reported by the lexer, the
 * parser or the validator.
 *
 * @param code     stable machine-readable code, e.g. {@code UNKNOWN_OPERATOR}
 * @param message  human-readable description
 * @param location where in the source the problem was found, may be null
 */
public record EchoDiagnostic(String code, String message, SourceLocation location) {

    public static final String UNTERMINATED_VARIABLE = "UNTERMINATED_VARIABLE";
    public static final String UNTERMINATED_DIRECTIVE = "UNTERMINATED_DIRECTIVE";
    public static final String UNTERMINATED_ARGUMENT = "UNTERMINATED_ARGUMENT";
    public static final String UNTERMINATED_STRING = "UNTERMINATED_STRING";
    public static final String UNEXPECTED_CHARACTER = "UNEXPECTED_CHARACTER";
    public static final String UNEXPECTED_TOKEN = "UNEXPECTED_TOKEN";
    public static final String UNCLOSED_BLOCK = "UNCLOSED_BLOCK";
    public static final String UNKNOWN_OPERATOR = "UNKNOWN_OPERATOR";
    public static final String UNKNOWN_SECTION = "UNKNOWN_SECTION";
    public static final String IMPORT_NOT_RESOLVED = "IMPORT_NOT_RESOLVED";
    public static final String DEPRECATED_OPERATOR = "DEPRECATED_OPERATOR";
    public static final String INVALID_CONTEXT_PATH = "INVALID_CONTEXT_PATH";

    public EchoDiagnostic {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return location != null ? code + " at " + location + ": " + message : code + ": " + message;
    }
}
