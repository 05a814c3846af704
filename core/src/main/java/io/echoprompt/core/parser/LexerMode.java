package io.echoprompt.core.parser;

/** Lexing modes kept on the lexer's mode stack. */
enum LexerMode {
    /** Literal prompt text; whitespace is significant. */
    DEFAULT,
    /** Inside {@code [...]}. */
    DIRECTIVE,
    /** Inside {@code {{...}}}. */
    VARIABLE,
    /** Free-form text inside the parentheses of an operator call or {@code #context(...)}. */
    OPERATOR_ARG
}
