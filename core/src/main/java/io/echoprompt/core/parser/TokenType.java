package io.echoprompt.core.parser;

/** Token kinds produced by {@link EchoLexer}. */
public enum TokenType {
    TEXT,
    VARIABLE_OPEN,
    VARIABLE_CLOSE,
    IF_OPEN,
    ELSE_IF,
    ELSE,
    END_IF,
    SECTION_OPEN,
    END_SECTION,
    IMPORT,
    INCLUDE,
    CONTEXT_OPEN,
    OPERATOR,
    IDENTIFIER,
    STRING,
    NUMBER,
    EQUALS,
    DEFAULT_OP,
    LPAREN,
    ARG_TEXT,
    RPAREN,
    CLOSE_BRACKET
}
