package io.echoprompt.core.model;

/**
 * A node of the template syntax tree. The set of node kinds is closed; traverse
 * with a {@link NodeVisitor} so that every kind is handled.
 *
 * <p>
 * Nodes are immutable and created once per parse.
 */
public sealed interface Node
        permits TextNode, VariableNode, ContextNode, ConditionalNode, SectionNode, ImportNode, IncludeNode {

    /** Where the node was found in the template. */
    SourceLocation location();

    /** Dispatches to the visitor method for this node kind. */
    <R> R accept(NodeVisitor<R> visitor);
}
