package io.echoprompt.core.model;

import java.util.List;
import java.util.Map;

/**
 * Output of evaluation: a flat node list with every conditional resolved and
 * every include expanded, plus the sections collected from the template.
 */
public record EvaluationResult(List<Node> ast, Map<String, List<Node>> sections) {

    public EvaluationResult {
        ast = List.copyOf(ast);
        sections = Map.copyOf(sections);
    }
}
