package io.echoprompt.core.config;

import io.echoprompt.core.spi.AiJudge;
import io.echoprompt.core.spi.ContextResolver;
import io.echoprompt.core.spi.TelemetryListener;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine configuration. Passed to the engine explicitly; nothing is read from
 * global state.
 *
 * <p>
 * Use {@link #builder()} to construct instances; unset fields take the defaults
 * below.
 *
 * @param strict            raise on evaluation and render errors instead of degrading (default
 *                          false)
 * @param collapseNewlines  collapse runs of 3+ newlines in output to 2 (default true)
 * @param trim              trim leading/trailing whitespace of output (default false)
 * @param aiJudge           predicate behind {@code ai_gate}; null leaves it unconfigured
 * @param contextResolver   resolver for {@code #context(...)}; null leaves references unresolved
 * @param telemetryListener render lifecycle listener, may be null
 * @param plugins           fully-qualified {@code EchoPlugin} class names loaded at construction
 */
public record EchoConfig(
        boolean strict,
        boolean collapseNewlines,
        boolean trim,
        AiJudge aiJudge,
        ContextResolver contextResolver,
        TelemetryListener telemetryListener,
        List<String> plugins) {

    public EchoConfig {
        plugins = plugins != null ? List.copyOf(plugins) : List.of();
    }

    /** Lenient defaults with no collaborators. */
    public static EchoConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder initialised from this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .strict(strict)
                .collapseNewlines(collapseNewlines)
                .trim(trim)
                .aiJudge(aiJudge)
                .contextResolver(contextResolver)
                .telemetryListener(telemetryListener)
                .plugins(plugins);
    }

    /** Builder for {@link EchoConfig}. */
    public static final class Builder {
        private boolean strict;
        private boolean collapseNewlines = true;
        private boolean trim;
        private AiJudge aiJudge;
        private ContextResolver contextResolver;
        private TelemetryListener telemetryListener;
        private final List<String> plugins = new ArrayList<>();

        Builder() {}

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder collapseNewlines(boolean collapseNewlines) {
            this.collapseNewlines = collapseNewlines;
            return this;
        }

        public Builder trim(boolean trim) {
            this.trim = trim;
            return this;
        }

        public Builder aiJudge(AiJudge aiJudge) {
            this.aiJudge = aiJudge;
            return this;
        }

        public Builder contextResolver(ContextResolver contextResolver) {
            this.contextResolver = contextResolver;
            return this;
        }

        public Builder telemetryListener(TelemetryListener telemetryListener) {
            this.telemetryListener = telemetryListener;
            return this;
        }

        /** Replaces the plugin class list. */
        public Builder plugins(List<String> pluginClassNames) {
            this.plugins.clear();
            this.plugins.addAll(pluginClassNames);
            return this;
        }

        public Builder plugin(String pluginClassName) {
            this.plugins.add(pluginClassName);
            return this;
        }

        public EchoConfig build() {
            return new EchoConfig(
                    strict, collapseNewlines, trim, aiJudge, contextResolver, telemetryListener, plugins);
        }
    }
}
