package io.echoprompt.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NodesTest {

    private static ConditionalNode conditional(String variable, boolean async, List<Node> body, Alternate alternate) {
        return new ConditionalNode(new ConditionExpr(variable, async ? "ai_gate" : "exists", null, async), body, alternate, null);
    }

    private static TextNode text(String value) {
        return new TextNode(value, null);
    }

    @Test
    void walkVisitsBranchesChainsAndSectionsInSourceOrder() {
        ConditionalNode elseIf = conditional("b", true, List.of(text("B")), new Alternate.Else(List.of(text("C"))));
        List<Node> ast = List.of(
                conditional("a", false, List.of(text("A")), new Alternate.ElseIf(elseIf)),
                new SectionNode("s", List.of(text("S")), null));

        List<String> seen = new ArrayList<>();
        Nodes.walk(ast, node -> seen.add(node instanceof TextNode t ? t.value() : node.getClass().getSimpleName()));

        assertThat(seen).containsExactly("ConditionalNode", "A", "ConditionalNode", "B", "C", "SectionNode", "S");
    }

    @Test
    void collectsAsyncConditionsIncludingElseIfLinks() {
        ConditionalNode nestedAsync = conditional("inner", true, List.of(), null);
        ConditionalNode elseIf = conditional("b", true, List.of(nestedAsync), null);
        List<Node> ast = List.of(conditional("a", false, List.of(), new Alternate.ElseIf(elseIf)));

        assertThat(Nodes.collectAsyncConditions(ast))
                .extracting(node -> node.condition().variable())
                .containsExactly("b", "inner");
    }
}
