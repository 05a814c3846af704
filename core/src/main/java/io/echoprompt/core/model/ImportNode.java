package io.echoprompt.core.model;

import java.util.Objects;

/** {@code [#IMPORT "path"]}. Resolution belongs to an outer layer; the core only models the node. */
public record ImportNode(String path, SourceLocation location) implements Node {

    public ImportNode {
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImport(this);
    }
}
