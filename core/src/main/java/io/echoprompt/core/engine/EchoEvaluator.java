package io.echoprompt.core.engine;

import io.echoprompt.core.engine.EvaluationContext.AsyncKey;
import io.echoprompt.core.error.EchoException;
import io.echoprompt.core.error.IncludeCycleException;
import io.echoprompt.core.error.OperatorEvaluationException;
import io.echoprompt.core.error.SectionNotFoundException;
import io.echoprompt.core.error.UnknownOperatorException;
import io.echoprompt.core.model.ConditionExpr;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.EvaluationResult;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.NodeVisitor;
import io.echoprompt.core.model.Nodes;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.TextNode;
import io.echoprompt.core.model.VariableNode;
import io.echoprompt.core.spi.OperatorDefinition;
import io.echoprompt.core.spi.TelemetryListener;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves a parsed template against a variable context, producing a flat node
 * list with no conditionals, sections or includes left.
 *
 * <p>
 * Evaluation runs in three passes:
 *
 * <ol>
 *   <li>Every section in the tree is collected by name, so an include sees a section no matter
 *       where it is declared. A later section with the same name replaces an earlier one.
 *   <li>Every condition whose operator is async is resolved, and each distinct (variable, value,
 *       argument) triple is handed to its operator once. All calls run concurrently and the pass
 *       waits for the whole batch, so latency is bounded by the slowest single call.
 *   <li>The tree is walked: each conditional is replaced by its selected branch, sections are
 *       dropped, and includes are replaced by the evaluated section body.
 * </ol>
 *
 * <p>
 * Unknown operators, handler failures, missing include targets and include
 * cycles raise in strict mode. In lenient mode they are logged at WARN and the
 * condition counts as {@code false} (or the include is dropped).
 *
 * <p>
 * Thread-safe: all per-render state lives in an {@link EvaluationContext}.
 */
public final class EchoEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(EchoEvaluator.class);

    private final TelemetryListener telemetryListener;

    public EchoEvaluator() {
        this(null);
    }

    /** @param telemetryListener notified after each async batch, may be null */
    public EchoEvaluator(TelemetryListener telemetryListener) {
        this.telemetryListener = telemetryListener; // nullable
    }

    public EvaluationResult evaluate(
            List<Node> ast, Map<String, ?> variables, boolean strict, Map<String, OperatorDefinition> operators) {
        return evaluate(ast, new EvaluationContext(variables, strict, operators));
    }

    public EvaluationResult evaluate(List<Node> ast, EvaluationContext ctx) {
        collectSections(ast, ctx);
        preEvaluateAsync(ast, ctx);
        List<Node> output = new ArrayList<>();
        new TreeWalker(ctx, output).walk(ast);
        return new EvaluationResult(output, ctx.sections());
    }

    // --- pass 1 ---

    private static void collectSections(List<Node> ast, EvaluationContext ctx) {
        Nodes.walk(ast, node -> {
            if (node instanceof SectionNode section) {
                ctx.sections().put(section.name(), section.body());
            }
        });
    }

    // --- pass 2 ---

    private record Pending(String operator, CompletableFuture<Boolean> result) {}

    private void preEvaluateAsync(List<Node> ast, EvaluationContext ctx) {
        List<ConditionalNode> conditionals = Nodes.collectAsyncConditions(ast);
        if (conditionals.isEmpty()) {
            return;
        }
        long start = System.nanoTime();

        Map<AsyncKey, Pending> pending = new LinkedHashMap<>();
        for (ConditionalNode conditional : conditionals) {
            ConditionExpr condition = conditional.condition();
            Object value = ctx.resolve(condition.variable());
            AsyncKey key = new AsyncKey(condition.variable(), value, condition.argument());
            if (pending.containsKey(key)) {
                continue;
            }
            // Unknown operators are reported by the tree walk.
            Optional<OperatorDefinition> operator = ctx.operator(condition.operator());
            operator.ifPresent(definition -> pending.put(
                    key, new Pending(condition.operator(), definition.invoke(value, condition.argument()))));
        }

        CompletableFuture.allOf(pending.values().stream()
                        .map(Pending::result)
                        .toArray(CompletableFuture[]::new))
                .exceptionally(error -> null)
                .join();

        for (Map.Entry<AsyncKey, Pending> entry : pending.entrySet()) {
            String operator = entry.getValue().operator();
            try {
                ctx.asyncResults().put(entry.getKey(), Boolean.TRUE.equals(entry.getValue().result().join()));
            } catch (CompletionException | CancellationException e) {
                Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                if (ctx.strict()) {
                    throw asEvalException(operator, cause);
                }
                LOG.warn(
                        "Async operator #{} failed for variable '{}', treating condition as false: {}",
                        operator,
                        entry.getKey().variable(),
                        cause.getMessage());
                ctx.asyncResults().put(entry.getKey(), false);
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.debug(
                "Pre-evaluated {} async condition(s) with {} invocation(s) in {}ms",
                conditionals.size(),
                pending.size(),
                durationMs);
        notifyAsyncBatch(conditionals.size(), pending.size(), durationMs);
    }

    private static EchoException asEvalException(String operator, Throwable cause) {
        if (cause instanceof EchoException echo) {
            return echo;
        }
        return new OperatorEvaluationException(operator, cause);
    }

    private void notifyAsyncBatch(int conditions, int invocations, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onAsyncBatchCompleted(
                    new TelemetryListener.AsyncBatchEvent(conditions, invocations, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onAsyncBatchCompleted failed", e);
        }
    }

    // --- pass 3 ---

    /** Appends the evaluated form of each visited node to the output list. */
    private static final class TreeWalker implements NodeVisitor<Void> {

        private final EvaluationContext ctx;
        private final List<Node> output;
        private final Deque<String> includeChain = new ArrayDeque<>();

        TreeWalker(EvaluationContext ctx, List<Node> output) {
            this.ctx = ctx;
            this.output = output;
        }

        void walk(List<Node> nodes) {
            for (Node node : nodes) {
                node.accept(this);
            }
        }

        @Override
        public Void visitText(TextNode node) {
            output.add(node);
            return null;
        }

        @Override
        public Void visitVariable(VariableNode node) {
            output.add(node);
            return null;
        }

        @Override
        public Void visitContext(ContextNode node) {
            output.add(node);
            return null;
        }

        @Override
        public Void visitImport(ImportNode node) {
            output.add(node);
            return null;
        }

        @Override
        public Void visitSection(SectionNode node) {
            return null;
        }

        @Override
        public Void visitConditional(ConditionalNode node) {
            walk(selectBranch(node));
            return null;
        }

        @Override
        public Void visitInclude(IncludeNode node) {
            String name = node.name();
            List<Node> body = ctx.sections().get(name);
            if (body == null) {
                if (ctx.strict()) {
                    throw new SectionNotFoundException(name);
                }
                LOG.warn("Section '{}' not found, dropping include at {}", name, node.location());
                return null;
            }
            if (includeChain.contains(name)) {
                String chain = describeChain(name);
                if (ctx.strict()) {
                    throw new IncludeCycleException(name, chain);
                }
                LOG.warn("Include cycle {} detected, dropping include of '{}'", chain, name);
                return null;
            }
            includeChain.push(name);
            try {
                walk(body);
            } finally {
                includeChain.pop();
            }
            return null;
        }

        private String describeChain(String reentered) {
            StringBuilder chain = new StringBuilder();
            for (Iterator<String> it = includeChain.descendingIterator(); it.hasNext(); ) {
                chain.append(it.next()).append(" -> ");
            }
            return chain.append(reentered).toString();
        }

        private List<Node> selectBranch(ConditionalNode node) {
            if (test(node.condition())) {
                return node.consequent();
            }
            return node.alternate().fold(List::of, body -> body, this::selectBranch);
        }

        private boolean test(ConditionExpr condition) {
            Object value = ctx.resolve(condition.variable());
            if (condition.async()) {
                Boolean cached = ctx.asyncResults()
                        .get(new AsyncKey(condition.variable(), value, condition.argument()));
                if (cached != null) {
                    return cached;
                }
            }

            String name = condition.operator();
            Optional<OperatorDefinition> operator = ctx.operator(name);
            if (operator.isEmpty()) {
                if (ctx.strict()) {
                    throw new UnknownOperatorException(name);
                }
                LOG.warn("Unknown operator #{} on '{}', treating condition as false", name, condition.variable());
                return false;
            }
            try {
                return operator.get().evaluate(value, condition.argument());
            } catch (RuntimeException e) {
                if (ctx.strict()) {
                    throw asEvalException(name, e);
                }
                LOG.warn(
                        "Operator #{} failed on '{}', treating condition as false: {}",
                        name,
                        condition.variable(),
                        e.getMessage());
                return false;
            }
        }
    }
}
