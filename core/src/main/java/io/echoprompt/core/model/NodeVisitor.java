package io.echoprompt.core.model;

/** Visitor over the closed set of {@link Node} kinds. */
public interface NodeVisitor<R> {

    R visitText(TextNode node);

    R visitVariable(VariableNode node);

    R visitContext(ContextNode node);

    R visitConditional(ConditionalNode node);

    R visitSection(SectionNode node);

    R visitImport(ImportNode node);

    R visitInclude(IncludeNode node);
}
