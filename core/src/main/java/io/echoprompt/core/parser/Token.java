package io.echoprompt.core.parser;

import io.echoprompt.core.model.SourceLocation;

/**
 * A lexed token. Lines and columns are 1-indexed and the end position is
 * inclusive; offsets are 0-indexed with an exclusive end.
 */
public record Token(
        TokenType type,
        String text,
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        int startOffset,
        int endOffset) {

    public SourceLocation location() {
        return new SourceLocation(startLine, startColumn, endLine, endColumn, text);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + startLine + ":" + startColumn;
    }
}
