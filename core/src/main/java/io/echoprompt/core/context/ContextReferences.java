package io.echoprompt.core.context;

import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.Nodes;
import io.echoprompt.core.model.ResolvedContent;
import io.echoprompt.core.model.ResolvedContext;
import io.echoprompt.core.spi.ContextResolveResult;
import io.echoprompt.core.spi.ContextResolver;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the {@code #context(...)} references of a template and resolves them
 * into a {@link ResolvedContext} side table. The AST itself is never modified.
 */
public final class ContextReferences {

    private static final Logger LOG = LoggerFactory.getLogger(ContextReferences.class);

    private ContextReferences() {}

    /** Distinct context paths in source order, including those inside branches and sections. */
    public static List<String> collectPaths(List<Node> ast) {
        Set<String> paths = new LinkedHashSet<>();
        Nodes.walk(ast, node -> {
            if (node instanceof ContextNode context) {
                paths.add(context.path());
            }
        });
        return List.copyOf(paths);
    }

    /**
     * Resolves every context path of {@code ast} with one batch call. Paths the
     * resolver could not resolve are left out of the table and logged at DEBUG;
     * rendering decides what to do with them.
     */
    public static ResolvedContext resolve(List<Node> ast, ContextResolver resolver) {
        List<String> paths = collectPaths(ast);
        if (paths.isEmpty() || resolver == null) {
            return ResolvedContext.empty();
        }
        Map<String, ContextResolveResult> results = resolver.resolveBatch(paths);
        Map<String, ResolvedContent> resolved = new LinkedHashMap<>();
        for (String path : paths) {
            ContextResolveResult result = results != null ? results.get(path) : null;
            if (result != null && result.success() && result.content() != null) {
                resolved.put(path, result.content());
            } else {
                LOG.debug(
                        "Context '{}' not resolved: {}",
                        path,
                        result != null && result.error() != null ? result.error() : "no result");
            }
        }
        return ResolvedContext.of(resolved);
    }
}
