package io.echoprompt.core.model;

import java.util.Objects;

/** Literal text, emitted verbatim. */
public record TextNode(String value, SourceLocation location) implements Node {

    public TextNode {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }
}
