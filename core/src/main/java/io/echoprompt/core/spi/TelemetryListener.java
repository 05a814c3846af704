package io.echoprompt.core.spi;

/**
 * SPI for observability hooks around renders.
 *
 * <p>
 * Adapters bridge these events to their telemetry system of choice; the core
 * has no telemetry dependency. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by listeners are caught and logged by the
 * engine and never affect the render.
 */
public interface TelemetryListener {

    /** Called when a render begins. */
    void onRenderStarted(RenderStartedEvent event);

    /** Called when a render produced output. */
    void onRenderCompleted(RenderCompletedEvent event);

    /** Called when a render failed, including parse failures. */
    void onRenderFailed(RenderFailedEvent event);

    /** Called after the async pre-evaluation batch of a render finished. */
    void onAsyncBatchCompleted(AsyncBatchEvent event);

    // --- Event records ---

    /** A render started; {@code multimodal} distinguishes content-block renders. */
    record RenderStartedEvent(int templateLength, boolean strict, boolean multimodal) {}

    /** A render completed; {@code outputSize} is characters for strings, blocks for multimodal. */
    record RenderCompletedEvent(long durationMs, int outputSize) {}

    /** A render failed with {@code errorDetail}. */
    record RenderFailedEvent(long durationMs, String errorType, String errorDetail) {}

    /**
     * Async pre-evaluation finished: {@code conditions} flagged conditions were
     * served by {@code invocations} distinct handler calls.
     */
    record AsyncBatchEvent(int conditions, int invocations, long durationMs) {}
}
