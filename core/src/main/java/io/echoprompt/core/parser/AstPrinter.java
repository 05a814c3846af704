package io.echoprompt.core.parser;

import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.NodeVisitor;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.TextNode;
import io.echoprompt.core.model.VariableNode;
import java.util.List;

/**
 * Pretty-prints an AST as an indented outline, one node per line. Long text is
 * truncated so the outline stays readable.
 *
 * <pre>
 * IF {{genre}} #equals(Horror)
 *   TEXT "Suggest scary movies."
 * ELSE
 *   TEXT "Suggest popular movies."
 * </pre>
 */
public final class AstPrinter {

    static final int MAX_TEXT = 50;

    private AstPrinter() {}

    public static String print(List<Node> ast) {
        StringBuilder out = new StringBuilder();
        new Printer(out, 0).printAll(ast);
        return out.toString();
    }

    private static final class Printer implements NodeVisitor<Void> {

        private final StringBuilder out;
        private final int depth;

        Printer(StringBuilder out, int depth) {
            this.out = out;
            this.depth = depth;
        }

        void printAll(List<Node> nodes) {
            for (Node node : nodes) {
                node.accept(this);
            }
        }

        private Printer nested() {
            return new Printer(out, depth + 1);
        }

        private void line(String text) {
            out.append("  ".repeat(depth)).append(text).append('\n');
        }

        @Override
        public Void visitText(TextNode node) {
            String value = node.value();
            if (value.length() > MAX_TEXT) {
                value = value.substring(0, MAX_TEXT) + "...";
            }
            line("TEXT \"" + value.replace("\n", "\\n") + "\"");
            return null;
        }

        @Override
        public Void visitVariable(VariableNode node) {
            line("VAR {{" + node.path() + (node.hasDefault() ? " ?? \"" + node.defaultValue() + "\"" : "") + "}}");
            return null;
        }

        @Override
        public Void visitContext(ContextNode node) {
            line("CONTEXT " + node.path());
            return null;
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            return printConditional(node, "IF ");
        }

        private Void printConditional(ConditionalNode node, String keyword) {
            line(keyword + node.condition() + (node.condition().async() ? " [async]" : ""));
            nested().printAll(node.consequent());
            return node.alternate().fold(
                    () -> null,
                    body -> {
                        line("ELSE");
                        nested().printAll(body);
                        return null;
                    },
                    next -> printConditional(next, "ELSE IF "));
        }

        @Override
        public Void visitSection(SectionNode node) {
            line("SECTION " + node.name());
            nested().printAll(node.body());
            return null;
        }

        @Override
        public Void visitImport(ImportNode node) {
            line("IMPORT \"" + node.path() + "\"");
            return null;
        }

        @Override
        public Void visitInclude(IncludeNode node) {
            line("INCLUDE " + node.name());
            return null;
        }
    }
}
