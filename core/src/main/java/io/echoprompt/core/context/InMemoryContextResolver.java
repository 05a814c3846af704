package io.echoprompt.core.context;

import io.echoprompt.core.model.ResolvedContent;
import io.echoprompt.core.spi.ContextResolveResult;
import io.echoprompt.core.spi.ContextResolver;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link ContextResolver}, useful for tests and for callers that
 * preload their assets. Paths are checked with
 * {@link ContextPaths#validate(String)} before lookup.
 *
 * <p>
 * Thread-safe.
 */
public final class InMemoryContextResolver implements ContextResolver {

    private final Map<String, ResolvedContent> contents = new ConcurrentHashMap<>();

    public InMemoryContextResolver() {}

    public InMemoryContextResolver(Map<String, ResolvedContent> contents) {
        this.contents.putAll(contents);
    }

    public InMemoryContextResolver put(String path, ResolvedContent content) {
        contents.put(path, content);
        return this;
    }

    @Override
    public ContextResolveResult resolve(String path) {
        Optional<String> invalid = ContextPaths.validate(path);
        if (invalid.isPresent()) {
            return ContextResolveResult.failed(invalid.get());
        }
        ResolvedContent content = contents.get(path);
        return content != null
                ? ContextResolveResult.ok(content)
                : ContextResolveResult.failed("Context not found: " + path);
    }
}
