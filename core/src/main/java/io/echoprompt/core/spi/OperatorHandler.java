package io.echoprompt.core.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiPredicate;

/**
 * Condition predicate behind an operator. Synchronous handlers return an
 * already completed stage; {@link #of(BiPredicate)} adapts a plain predicate.
 *
 * <p>
 * Implementations must be thread-safe: one handler may serve concurrent
 * renders.
 */
@FunctionalInterface
public interface OperatorHandler {

    /**
     * @param value    the resolved variable value, or {@code null} when the path resolved to nothing
     * @param argument the classified operator argument ({@link Double}, {@code List<String>},
     *                 {@link String}) or {@code null}
     */
    CompletionStage<Boolean> apply(Object value, Object argument);

    static OperatorHandler of(BiPredicate<Object, Object> predicate) {
        return (value, argument) -> CompletableFuture.completedFuture(predicate.test(value, argument));
    }
}
