package io.echoprompt.core.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code [#IF cond]...[ELSE IF cond]...[ELSE]...[END IF]}. An {@code ELSE IF}
 * chain is right-nested: each link's {@link Alternate.ElseIf} points at the
 * next link.
 */
public record ConditionalNode(
        ConditionExpr condition, List<Node> consequent, Alternate alternate, SourceLocation location)
        implements Node {

    public ConditionalNode {
        Objects.requireNonNull(condition, "condition must not be null");
        consequent = List.copyOf(consequent);
        alternate = alternate != null ? alternate : Alternate.NONE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConditional(this);
    }
}
