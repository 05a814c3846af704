package io.echoprompt.core.engine;

import io.echoprompt.core.model.ResolvedContext;

/**
 * Options for one render.
 *
 * @param strict           raise on undefined variables and unresolved references instead of
 *                         degrading
 * @param trim             trim leading and trailing whitespace from the output
 * @param collapseNewlines reduce runs of three or more newlines to two
 * @param resolvedContext  content for {@code #context(...)} references, never null
 */
public record RenderOptions(boolean strict, boolean trim, boolean collapseNewlines, ResolvedContext resolvedContext) {

    public RenderOptions {
        resolvedContext = resolvedContext != null ? resolvedContext : ResolvedContext.empty();
    }

    /** Lenient rendering with newline collapsing, no trimming and no resolved context. */
    public static RenderOptions defaults() {
        return new RenderOptions(false, false, true, ResolvedContext.empty());
    }

    public RenderOptions withResolvedContext(ResolvedContext context) {
        return new RenderOptions(strict, trim, collapseNewlines, context);
    }
}
