package io.echoprompt.core.model;

import java.util.Objects;

/** {@code [#INCLUDE name]}: expands the body of the section with that name. */
public record IncludeNode(String name, SourceLocation location) implements Node {

    public IncludeNode {
        Objects.requireNonNull(name, "name must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInclude(this);
    }
}
