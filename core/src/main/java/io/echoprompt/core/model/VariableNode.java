package io.echoprompt.core.model;

import java.util.Objects;

/**
 * A variable reference: {@code {{path}}} or {@code {{path ?? "default"}}}.
 *
 * @param path         dotted/bracketed accessor, e.g. {@code user.items[0].name}
 * @param defaultValue literal used when the path resolves to nothing, may be null
 */
public record VariableNode(String path, String defaultValue, SourceLocation location) implements Node {

    public VariableNode {
        Objects.requireNonNull(path, "path must not be null");
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
