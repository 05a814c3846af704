package io.echoprompt.core.model;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * What a conditional falls back to when its condition is false: nothing, an
 * {@code [ELSE]} body, or the next {@code [ELSE IF]} conditional of the chain.
 */
public sealed interface Alternate permits Alternate.None, Alternate.Else, Alternate.ElseIf {

    /** The shared "no alternate" instance. */
    None NONE = new None();

    /** Applies the function matching this alternate's shape. */
    <R> R fold(Supplier<R> onNone, Function<List<Node>, R> onElse, Function<ConditionalNode, R> onElseIf);

    /** No {@code [ELSE]} or {@code [ELSE IF]} follows. */
    record None() implements Alternate {
        @Override
        public <R> R fold(
                Supplier<R> onNone, Function<List<Node>, R> onElse, Function<ConditionalNode, R> onElseIf) {
            return onNone.get();
        }
    }

    /** A plain {@code [ELSE]} body. */
    record Else(List<Node> body) implements Alternate {
        public Else {
            body = List.copyOf(body);
        }

        @Override
        public <R> R fold(
                Supplier<R> onNone, Function<List<Node>, R> onElse, Function<ConditionalNode, R> onElseIf) {
            return onElse.apply(body);
        }
    }

    /** The next link of an {@code [ELSE IF]} chain. */
    record ElseIf(ConditionalNode conditional) implements Alternate {
        public ElseIf {
            Objects.requireNonNull(conditional, "conditional must not be null");
        }

        @Override
        public <R> R fold(
                Supplier<R> onNone, Function<List<Node>, R> onElse, Function<ConditionalNode, R> onElseIf) {
            return onElseIf.apply(conditional);
        }
    }
}
