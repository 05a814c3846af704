package io.echoprompt.core.model;

import java.util.List;
import java.util.Objects;

/** {@code [#SECTION name="x"]...[END SECTION]}: a named fragment that renders only when included. */
public record SectionNode(String name, List<Node> body, SourceLocation location) implements Node {

    public SectionNode {
        Objects.requireNonNull(name, "name must not be null");
        body = List.copyOf(body);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSection(this);
    }
}
