package io.echoprompt.core.spi;

import io.echoprompt.core.model.ResolvedContent;

/** Outcome of resolving one context path. Exactly one of {@code content} and {@code error} is set. */
public record ContextResolveResult(boolean success, ResolvedContent content, String error) {

    public static ContextResolveResult ok(ResolvedContent content) {
        return new ContextResolveResult(true, content, null);
    }

    public static ContextResolveResult failed(String error) {
        return new ContextResolveResult(false, null, error);
    }
}
