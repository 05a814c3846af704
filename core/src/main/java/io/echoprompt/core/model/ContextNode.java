package io.echoprompt.core.model;

import java.util.Objects;

/**
 * A reference to an external asset: {@code #context(product-image)} or
 * {@code #context(plp://logo-v2)}. The resolved content lives in a
 * {@link ResolvedContext} side table, never on the node.
 */
public record ContextNode(String path, SourceLocation location) implements Node {

    public ContextNode {
        Objects.requireNonNull(path, "path must not be null");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitContext(this);
    }
}
