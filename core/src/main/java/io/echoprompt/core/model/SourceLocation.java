package io.echoprompt.core.model;

/**
 * A span in the template source, attached to every AST node and diagnostic.
 * Lines and columns are 1-indexed; the end position is inclusive.
 *
 * @param startLine   line of the first character
 * @param startColumn column of the first character
 * @param endLine     line of the last character
 * @param endColumn   column of the last character
 * @param sourceText  the covered source text, or {@code null} when not captured
 */
public record SourceLocation(int startLine, int startColumn, int endLine, int endColumn, String sourceText) {

    public SourceLocation {
        if (startLine < 1 || startColumn < 1) {
            throw new IllegalArgumentException(
                    "Source positions are 1-indexed, got " + startLine + ":" + startColumn);
        }
    }

    /** Creates a location for a single point without captured text. */
    public static SourceLocation at(int line, int column) {
        return new SourceLocation(line, column, line, column, null);
    }

    /** Returns a location spanning from the start of {@code this} to the end of {@code end}. */
    public SourceLocation through(SourceLocation end, String text) {
        return new SourceLocation(startLine, startColumn, end.endLine(), end.endColumn(), text);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn;
    }
}
