package io.echoprompt.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.echoprompt.core.error.IncludeCycleException;
import io.echoprompt.core.error.OperatorConfigurationException;
import io.echoprompt.core.error.OperatorEvaluationException;
import io.echoprompt.core.error.SectionNotFoundException;
import io.echoprompt.core.error.UnknownOperatorException;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.EvaluationResult;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.ParseResult;
import io.echoprompt.core.parser.EchoParser;
import io.echoprompt.core.spi.OperatorDefinition;
import io.echoprompt.core.spi.TelemetryListener;
import io.echoprompt.core.spi.TelemetryListener.AsyncBatchEvent;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

/** Tests for the three-pass evaluator: section collection, async pre-evaluation, tree walk. */
@DisplayName("EchoEvaluatorTest")
class EchoEvaluatorTest {

    private OperatorRegistry registry;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger evaluatorLogger;

    @BeforeEach
    void setUp() {
        registry = OperatorRegistry.withBuiltins(null);
        evaluatorLogger = (Logger) LoggerFactory.getLogger(EchoEvaluator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        evaluatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        evaluatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<Node> parse(String template) {
        ParseResult parsed = new EchoParser(registry::isAsync).parse(template);
        assertThat(parsed.errors()).isEmpty();
        return parsed.ast();
    }

    private EvaluationResult evaluate(String template, Map<String, ?> variables, boolean strict) {
        return new EchoEvaluator().evaluate(parse(template), variables, strict, registry.snapshot());
    }

    private String render(String template, Map<String, ?> variables, boolean strict) {
        EvaluationResult evaluated = evaluate(template, variables, strict);
        return new EchoRenderer()
                .render(evaluated.ast(), variables, new RenderOptions(strict, false, false, null));
    }

    private List<String> warnings() {
        return logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Nested
    @DisplayName("Conditionals")
    class Conditionals {

        @ParameterizedTest(name = "x={0} -> {1}")
        @CsvSource({"a, A", "b, B", "anything-else, C", "B, B"})
        @DisplayName("ELSE-IF chain selects exactly one branch")
        void elseIfChain(String x, String expected) {
            String template = "[#IF {{x}} #equals(a)]A[ELSE IF {{x}} #equals(b)]B[ELSE]C[END IF]";

            assertThat(render(template, Map.of("x", x), false)).isEqualTo(expected);
        }

        @Test
        @DisplayName("false condition without alternate selects nothing")
        void noAlternate() {
            assertThat(render("<[#IF {{x}} #exists]A[END IF]>", Map.of(), false)).isEqualTo("<>");
        }

        @Test
        @DisplayName("output is flat with no conditionals left")
        void flatOutput() {
            EvaluationResult result = evaluate(
                    "[#IF {{a}} #exists]1[#IF {{b}} #exists]2[ELSE]3[END IF][END IF]", Map.of("a", "yes"), false);

            assertThat(result.ast()).noneMatch(node -> node instanceof ConditionalNode);
            assertThat(render("[#IF {{a}} #exists]1[#IF {{b}} #exists]2[ELSE]3[END IF][END IF]", Map.of("a", "y"), false))
                    .isEqualTo("13");
        }
    }

    @Nested
    @DisplayName("Sections and includes")
    class Sections {

        @Test
        @DisplayName("include before the section declaration still renders it")
        void orderingIndependence() {
            String template = "Start [#INCLUDE greeting] end.[#SECTION name=\"greeting\"]Hi {{name}}![END SECTION]";

            assertThat(render(template, Map.of("name", "Ann"), false)).isEqualTo("Start Hi Ann! end.");
        }

        @Test
        @DisplayName("sections are collected even inside a false branch")
        void sectionInsideFalseBranch() {
            String template = "[#IF {{x}} #exists][#SECTION name=\"s\"]S[END SECTION][END IF][#INCLUDE s]";

            assertThat(render(template, Map.of(), false)).isEqualTo("S");
        }

        @Test
        @DisplayName("a later section with the same name wins")
        void lastDuplicateWins() {
            String template = "[#SECTION name=\"s\"]first[END SECTION][#SECTION name=\"s\"]second[END SECTION][#INCLUDE s]";

            assertThat(render(template, Map.of(), false)).isEqualTo("second");
        }

        @Test
        @DisplayName("collected sections are returned")
        void sectionsReturned() {
            EvaluationResult result = evaluate("[#SECTION name=\"intro\"]x[END SECTION]", Map.of(), false);

            assertThat(result.sections()).containsOnlyKeys("intro");
            assertThat(result.ast()).isEmpty();
        }

        @Test
        @DisplayName("missing include target raises in strict mode")
        void missingIncludeStrict() {
            assertThatThrownBy(() -> evaluate("[#INCLUDE nowhere]", Map.of(), true))
                    .isInstanceOf(SectionNotFoundException.class)
                    .hasMessage("Section not found: nowhere");
        }

        @Test
        @DisplayName("missing include target is dropped in lenient mode")
        void missingIncludeLenient() {
            assertThat(render("a[#INCLUDE nowhere]b", Map.of(), false)).isEqualTo("ab");
            assertThat(warnings()).anyMatch(m -> m.contains("Section 'nowhere' not found"));
        }

        @Test
        @DisplayName("include cycle raises in strict mode with the chain")
        void includeCycleStrict() {
            String template = "[#SECTION name=\"a\"]A[#INCLUDE b][END SECTION]"
                    + "[#SECTION name=\"b\"]B[#INCLUDE a][END SECTION][#INCLUDE a]";

            assertThatThrownBy(() -> evaluate(template, Map.of(), true))
                    .isInstanceOf(IncludeCycleException.class)
                    .hasMessageContaining("a -> b -> a");
        }

        @Test
        @DisplayName("include cycle is cut in lenient mode")
        void includeCycleLenient() {
            String template = "[#SECTION name=\"a\"]A[#INCLUDE b][END SECTION]"
                    + "[#SECTION name=\"b\"]B[#INCLUDE a][END SECTION][#INCLUDE a]";

            assertThat(render(template, Map.of(), false)).isEqualTo("AB");
            assertThat(warnings()).anyMatch(m -> m.contains("Include cycle a -> b -> a"));
        }

        @Test
        @DisplayName("the same section may be included twice in a row")
        void repeatedIncludeIsNotACycle() {
            String template = "[#SECTION name=\"s\"]x[END SECTION][#INCLUDE s][#INCLUDE s]";

            assertThat(render(template, Map.of(), true)).isEqualTo("xx");
        }
    }

    @Nested
    @DisplayName("Operator failures")
    class OperatorFailures {

        @Test
        @DisplayName("unknown operator raises in strict mode")
        void unknownStrict() {
            assertThatThrownBy(() -> evaluate("[#IF {{x}} #bogus]A[END IF]", Map.of("x", 1), true))
                    .isInstanceOf(UnknownOperatorException.class)
                    .hasMessage("Unknown operator: #bogus");
        }

        @Test
        @DisplayName("unknown operator is false in lenient mode")
        void unknownLenient() {
            assertThat(render("[#IF {{x}} #bogus]A[ELSE]B[END IF]", Map.of("x", 1), false)).isEqualTo("B");
            assertThat(warnings()).containsExactly("Unknown operator #bogus on 'x', treating condition as false");
        }

        @Test
        @DisplayName("throwing handler raises in strict mode with the cause")
        void handlerFailureStrict() {
            IllegalStateException boom = new IllegalStateException("boom");
            registry.register("explode", OperatorDefinition.unary("Always fails", null, value -> {
                throw boom;
            }));

            assertThatThrownBy(() -> evaluate("[#IF {{x}} #explode]A[END IF]", Map.of(), true))
                    .isInstanceOf(OperatorEvaluationException.class)
                    .hasMessage("Operator #explode failed: boom")
                    .hasCause(boom);
        }

        @Test
        @DisplayName("throwing handler is false in lenient mode")
        void handlerFailureLenient() {
            registry.register("explode", OperatorDefinition.unary("Always fails", null, value -> {
                throw new IllegalStateException("boom");
            }));

            assertThat(render("[#IF {{x}} #explode]A[ELSE]B[END IF]", Map.of(), false)).isEqualTo("B");
            assertThat(warnings()).anyMatch(m -> m.contains("#explode failed") && m.contains("boom"));
        }

        @Test
        @DisplayName("malformed variable path in a condition raises in strict mode")
        void malformedPathStrict() {
            assertThatThrownBy(() -> evaluate("[#IF {{items[]}} #exists]A[END IF]", Map.of("items", List.of()), true))
                    .hasMessageContaining("empty brackets");
        }
    }

    @Nested
    @DisplayName("Async pre-evaluation")
    class AsyncPreEvaluation {

        private final AtomicInteger calls = new AtomicInteger();

        private void registerCountingAsync(boolean answer) {
            registry.register("slow_check", OperatorDefinition.async("Counts calls", null, (value, argument) -> {
                calls.incrementAndGet();
                return CompletableFuture.completedFuture(answer);
            }));
        }

        @Test
        @DisplayName("identical triples are invoked once")
        void deduplicates() {
            registerCountingAsync(true);
            String template = "[#IF {{topic}} #slow_check(safe)]A[END IF]"
                    + " [#IF {{topic}} #slow_check(safe)]B[ELSE]C[END IF]"
                    + " [#IF {{other}} #exists]D[ELSE IF {{topic}} #slow_check(safe)]E[END IF]";

            String output = render(template, Map.of("topic", "cats"), false);

            assertThat(output).isEqualTo("A B E");
            assertThat(calls).hasValue(1);
        }

        @Test
        @DisplayName("different arguments are separate invocations")
        void distinctTriples() {
            registerCountingAsync(false);

            render("[#IF {{t}} #slow_check(one)]A[END IF][#IF {{t}} #slow_check(two)]B[END IF]", Map.of("t", "x"), false);

            assertThat(calls).hasValue(2);
        }

        @Test
        @DisplayName("distinct calls run concurrently")
        void concurrent() {
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                CountDownLatch bothStarted = new CountDownLatch(2);
                registry.register("rendezvous", OperatorDefinition.async("Waits for a peer", null, (value, argument) ->
                        CompletableFuture.supplyAsync(() -> {
                            bothStarted.countDown();
                            try {
                                return bothStarted.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                                return false;
                            }
                        }, executor)));

                String output = render(
                        "[#IF {{a}} #rendezvous(1)]A[END IF][#IF {{b}} #rendezvous(2)]B[END IF]",
                        Map.of("a", "x", "b", "y"),
                        false);

                assertThat(output).isEqualTo("AB");
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("unconfigured ai_gate raises its configuration error in strict mode")
        void unconfiguredGateStrict() {
            assertThatThrownBy(() -> evaluate("[#IF {{c}} #ai_gate(Is it safe?)]A[END IF]", Map.of("c", "x"), true))
                    .isInstanceOf(OperatorConfigurationException.class);
        }

        @Test
        @DisplayName("failed async call is false in lenient mode")
        void failedAsyncLenient() {
            String output = render("[#IF {{c}} #ai_gate(Is it safe?)]A[ELSE]B[END IF]", Map.of("c", "x"), false);

            assertThat(output).isEqualTo("B");
            assertThat(warnings()).anyMatch(m -> m.startsWith("Async operator #ai_gate failed for variable 'c'"));
        }

        @Test
        @DisplayName("batch completion is reported to the telemetry listener")
        void telemetry() {
            registerCountingAsync(true);
            TelemetryListener listener = mock(TelemetryListener.class);

            new EchoEvaluator(listener)
                    .evaluate(
                            parse("[#IF {{t}} #slow_check]A[END IF][#IF {{t}} #slow_check]B[END IF]"),
                            Map.of("t", "x"),
                            false,
                            registry.snapshot());

            ArgumentCaptor<AsyncBatchEvent> event = ArgumentCaptor.forClass(AsyncBatchEvent.class);
            verify(listener).onAsyncBatchCompleted(event.capture());
            assertThat(event.getValue().conditions()).isEqualTo(2);
            assertThat(event.getValue().invocations()).isEqualTo(1);
        }

        @Test
        @DisplayName("templates without async conditions skip the batch")
        void noAsyncConditions() {
            TelemetryListener listener = mock(TelemetryListener.class);

            new EchoEvaluator(listener).evaluate(parse("[#IF {{t}} #exists]A[END IF]"), Map.of(), false, registry.snapshot());

            verifyNoInteractions(listener);
        }
    }
}
