package io.echoprompt.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/** Traversal helpers over node trees. */
public final class Nodes {

    private Nodes() {}

    /**
     * Visits every node in depth-first source order, descending into
     * conditional branches (the whole alternate chain) and section bodies.
     */
    public static void walk(List<Node> nodes, Consumer<Node> action) {
        for (Node node : nodes) {
            action.accept(node);
            if (node instanceof ConditionalNode conditional) {
                walk(conditional.consequent(), action);
                conditional.alternate().fold(
                        () -> null,
                        body -> {
                            walk(body, action);
                            return null;
                        },
                        next -> {
                            walk(List.of(next), action);
                            return null;
                        });
            } else if (node instanceof SectionNode section) {
                walk(section.body(), action);
            }
        }
    }

    /** Every conditional, including {@code ELSE IF} links, whose condition is flagged async. */
    public static List<ConditionalNode> collectAsyncConditions(List<Node> nodes) {
        List<ConditionalNode> found = new ArrayList<>();
        walk(nodes, node -> {
            if (node instanceof ConditionalNode conditional && conditional.condition().async()) {
                found.add(conditional);
            }
        });
        return found;
    }
}
