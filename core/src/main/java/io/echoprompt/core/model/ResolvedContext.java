package io.echoprompt.core.model;

import java.util.Map;
import java.util.Optional;

/**
 * Side table of resolved {@code #context(...)} content, keyed by context path.
 * Built before rendering so that {@link ContextNode}s stay immutable.
 */
public final class ResolvedContext {

    private static final ResolvedContext EMPTY = new ResolvedContext(Map.of());

    private final Map<String, ResolvedContent> byPath;

    private ResolvedContext(Map<String, ResolvedContent> byPath) {
        this.byPath = byPath;
    }

    public static ResolvedContext empty() {
        return EMPTY;
    }

    public static ResolvedContext of(Map<String, ResolvedContent> byPath) {
        return byPath.isEmpty() ? EMPTY : new ResolvedContext(Map.copyOf(byPath));
    }

    public Optional<ResolvedContent> lookup(String path) {
        return Optional.ofNullable(byPath.get(path));
    }

    public int size() {
        return byPath.size();
    }

    public Map<String, ResolvedContent> asMap() {
        return byPath;
    }
}
