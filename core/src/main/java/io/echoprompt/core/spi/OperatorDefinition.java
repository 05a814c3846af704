package io.echoprompt.core.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * A named condition operator as stored in the registry. Registering a custom
 * operator needs only a kind, a handler and a description; {@code example} is
 * optional documentation.
 *
 * <p>
 * Fields are not null-checked here so that plugin validation can report each
 * missing part by name.
 */
public record OperatorDefinition(OperatorKind kind, OperatorHandler handler, String description, String example) {

    public OperatorDefinition(OperatorKind kind, OperatorHandler handler, String description) {
        this(kind, handler, description, null);
    }

    public static OperatorDefinition comparison(
            String description, String example, BiPredicate<Object, Object> predicate) {
        return new OperatorDefinition(OperatorKind.COMPARISON, OperatorHandler.of(predicate), description, example);
    }

    public static OperatorDefinition unary(String description, String example, Predicate<Object> predicate) {
        return new OperatorDefinition(
                OperatorKind.UNARY, OperatorHandler.of((value, ignored) -> predicate.test(value)), description, example);
    }

    public static OperatorDefinition async(String description, String example, OperatorHandler handler) {
        return new OperatorDefinition(OperatorKind.ASYNC, handler, description, example);
    }

    public boolean isAsync() {
        return kind == OperatorKind.ASYNC;
    }

    /**
     * Invokes the handler. Exceptions thrown synchronously by the handler, and
     * a {@code null} stage, are returned as a failed future so callers handle
     * every failure in one place.
     */
    public CompletableFuture<Boolean> invoke(Object value, Object argument) {
        try {
            CompletionStage<Boolean> stage = handler.apply(value, argument);
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Operator handler returned null"));
            }
            return stage.toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Invokes the handler and waits for its result. A handler failure is
     * rethrown unwrapped when it is unchecked; a {@code null} result counts as
     * {@code false}.
     */
    public boolean evaluate(Object value, Object argument) {
        try {
            return Boolean.TRUE.equals(invoke(value, argument).join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
