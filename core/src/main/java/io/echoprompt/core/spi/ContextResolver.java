package io.echoprompt.core.spi;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fetches the content behind {@code #context(path)} references. Path validation
 * (traversal, external URLs, percent-encoding) is the resolver's job; see
 * {@code ContextPaths}.
 */
public interface ContextResolver {

    /** Resolves one path. Failures are reported in the result, not thrown. */
    ContextResolveResult resolve(String path);

    /**
     * Resolves several paths. The default resolves them one by one; resolvers
     * backed by a remote store may override it to fetch in bulk.
     *
     * @return results keyed by path, in the iteration order of {@code paths}
     */
    default Map<String, ContextResolveResult> resolveBatch(Collection<String> paths) {
        Map<String, ContextResolveResult> results = new LinkedHashMap<>();
        for (String path : paths) {
            results.put(path, resolve(path));
        }
        return results;
    }
}
