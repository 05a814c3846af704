package io.echoprompt.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.echoprompt.core.error.UndefinedVariableException;
import io.echoprompt.core.error.UnresolvedReferenceException;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContentBlock;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.NodeVisitor;
import io.echoprompt.core.model.ResolvedContent;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.TextNode;
import io.echoprompt.core.model.VariableNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an evaluated node list into output text or multimodal content blocks.
 * The renderer never branches on conditions: by the time it runs every
 * conditional has been replaced by its selected branch.
 *
 * <p>
 * Post-processing runs in a fixed order: newline collapsing first, then
 * trimming.
 *
 * <p>
 * Thread-safe: stateless.
 */
public final class EchoRenderer {

    private static final Logger LOG = LoggerFactory.getLogger(EchoRenderer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern BLANK_LINES = Pattern.compile("\n{3,}");

    /** Renders to a single string. */
    public String render(List<Node> evaluated, Map<String, ?> variables, RenderOptions options) {
        StringBuilder out = new StringBuilder();
        StringVisitor visitor = new StringVisitor(out, variables, options);
        for (Node node : evaluated) {
            node.accept(visitor);
        }
        String result = out.toString();
        if (options.collapseNewlines()) {
            result = collapseNewlines(result);
        }
        if (options.trim()) {
            result = result.trim();
        }
        return result;
    }

    /**
     * Renders to text and image blocks. Adjacent text is coalesced into one
     * block; a context reference resolved to an image closes the current text
     * block. Newline collapsing applies per text block; trimming applies to the
     * outer edges of the first and last blocks, and a block left empty by
     * trimming is dropped.
     */
    public List<ContentBlock> renderMultimodal(List<Node> evaluated, Map<String, ?> variables, RenderOptions options) {
        BlockVisitor visitor = new BlockVisitor(variables, options);
        for (Node node : evaluated) {
            node.accept(visitor);
        }
        visitor.flush();
        List<ContentBlock> blocks = visitor.blocks;

        if (options.trim() && !blocks.isEmpty()) {
            if (blocks.get(0) instanceof ContentBlock.TextBlock first) {
                String text = first.text().stripLeading();
                if (text.isEmpty()) {
                    blocks.remove(0);
                } else {
                    blocks.set(0, new ContentBlock.TextBlock(text));
                }
            }
            int last = blocks.size() - 1;
            if (last >= 0 && blocks.get(last) instanceof ContentBlock.TextBlock lastBlock) {
                String text = lastBlock.text().stripTrailing();
                if (text.isEmpty()) {
                    blocks.remove(last);
                } else {
                    blocks.set(last, new ContentBlock.TextBlock(text));
                }
            }
        }
        return List.copyOf(blocks);
    }

    /** Reduces every run of three or more newlines to exactly two. */
    public static String collapseNewlines(String text) {
        return BLANK_LINES.matcher(text).replaceAll("\n\n");
    }

    /**
     * Stringifies a variable value: strings as-is, numbers without a trailing
     * {@code .0} when integral, booleans as {@code true}/{@code false}, lists
     * and arrays element-wise joined with {@code ", "}, anything else as
     * compact JSON.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Number number) {
            return Values.formatNumber(number);
        }
        if (value instanceof Boolean || value instanceof Character) {
            return value.toString();
        }
        if (value instanceof JsonNode node) {
            return node.isTextual() ? node.textValue() : stringify(MAPPER.convertValue(node, Object.class));
        }
        List<Object> items = Values.asList(value);
        if (items != null) {
            List<String> parts = new ArrayList<>(items.size());
            for (Object item : items) {
                parts.add(stringify(item));
            }
            return String.join(", ", parts);
        }
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.debug("Falling back to toString() for {}: {}", value.getClass().getName(), e.getMessage());
            return value.toString();
        }
    }

    /** Shared rendering of the node kinds that produce text. */
    private abstract static class TextRendering {

        final Map<String, ?> variables;
        final RenderOptions options;

        TextRendering(Map<String, ?> variables, RenderOptions options) {
            this.variables = variables;
            this.options = options;
        }

        String variable(VariableNode node) {
            Object value = VariableResolver.resolve(node.path(), variables, options.strict());
            if (value == null) {
                if (node.hasDefault()) {
                    return node.defaultValue();
                }
                if (options.strict()) {
                    throw new UndefinedVariableException(node.path());
                }
                LOG.debug("Variable '{}' is undefined, rendering empty string", node.path());
                return "";
            }
            return stringify(value);
        }

        /** Text for a context reference that is not inlined as an image. */
        String contextText(ContextNode node, Optional<ResolvedContent> content) {
            if (content.isPresent()) {
                ResolvedContent resolved = content.get();
                if (resolved.dataUrl() != null && !resolved.dataUrl().isEmpty()) {
                    return resolved.dataUrl();
                }
                if (resolved.text() != null && !resolved.text().isEmpty()) {
                    return resolved.text();
                }
            }
            if (options.strict()) {
                throw new UnresolvedReferenceException(UnresolvedReferenceException.Kind.CONTEXT, node.path());
            }
            return "[CONTEXT: " + node.path() + "]";
        }

        void unresolvedImport(ImportNode node) {
            if (options.strict()) {
                throw new UnresolvedReferenceException(UnresolvedReferenceException.Kind.IMPORT, node.path());
            }
            LOG.debug("Skipping unresolved import '{}'", node.path());
        }

        void unresolvedInclude(IncludeNode node) {
            if (options.strict()) {
                throw new UnresolvedReferenceException(UnresolvedReferenceException.Kind.INCLUDE, node.name());
            }
            LOG.debug("Skipping unresolved include '{}'", node.name());
        }
    }

    private static final class StringVisitor extends TextRendering implements NodeVisitor<Void> {

        private final StringBuilder out;

        StringVisitor(StringBuilder out, Map<String, ?> variables, RenderOptions options) {
            super(variables, options);
            this.out = out;
        }

        @Override
        public Void visitText(TextNode node) {
            out.append(node.value());
            return null;
        }

        @Override
        public Void visitVariable(VariableNode node) {
            out.append(variable(node));
            return null;
        }

        @Override
        public Void visitContext(ContextNode node) {
            out.append(contextText(node, options.resolvedContext().lookup(node.path())));
            return null;
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            // Only reachable when evaluation was bypassed: render the consequent unconditionally.
            LOG.debug("Unevaluated conditional at {} reached the renderer", node.location());
            for (Node child : node.consequent()) {
                child.accept(this);
            }
            return null;
        }

        @Override
        public Void visitSection(SectionNode node) {
            return null;
        }

        @Override
        public Void visitImport(ImportNode node) {
            unresolvedImport(node);
            return null;
        }

        @Override
        public Void visitInclude(IncludeNode node) {
            unresolvedInclude(node);
            return null;
        }
    }

    private static final class BlockVisitor extends TextRendering implements NodeVisitor<Void> {

        private final List<ContentBlock> blocks = new ArrayList<>();
        private final StringBuilder pending = new StringBuilder();

        BlockVisitor(Map<String, ?> variables, RenderOptions options) {
            super(variables, options);
        }

        void flush() {
            if (pending.length() > 0) {
                String text = pending.toString();
                if (options.collapseNewlines()) {
                    text = collapseNewlines(text);
                }
                blocks.add(new ContentBlock.TextBlock(text));
                pending.setLength(0);
            }
        }

        @Override
        public Void visitText(TextNode node) {
            pending.append(node.value());
            return null;
        }

        @Override
        public Void visitVariable(VariableNode node) {
            pending.append(variable(node));
            return null;
        }

        @Override
        public Void visitContext(ContextNode node) {
            Optional<ResolvedContent> content = options.resolvedContext().lookup(node.path());
            if (content.isPresent() && content.get().isImage()) {
                flush();
                blocks.add(new ContentBlock.ImageBlock(content.get().dataUrl()));
            } else {
                pending.append(contextText(node, content));
            }
            return null;
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            LOG.debug("Unevaluated conditional at {} reached the renderer", node.location());
            for (Node child : node.consequent()) {
                child.accept(this);
            }
            return null;
        }

        @Override
        public Void visitSection(SectionNode node) {
            return null;
        }

        @Override
        public Void visitImport(ImportNode node) {
            unresolvedImport(node);
            return null;
        }

        @Override
        public Void visitInclude(IncludeNode node) {
            unresolvedInclude(node);
            return null;
        }
    }
}
