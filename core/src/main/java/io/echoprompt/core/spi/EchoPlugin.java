package io.echoprompt.core.spi;

import java.util.Map;

/**
 * A bundle of operators loaded into an engine as a unit. Plugins are validated
 * on load, their operators registered (shadowing built-ins of the same name),
 * and {@link #onLoad()} called last.
 *
 * <p>
 * Implementations discovered through {@link java.util.ServiceLoader} or named
 * in configuration need a public no-argument constructor.
 */
public interface EchoPlugin {

    /** Non-blank plugin name. */
    String name();

    /** Plugin version; required. */
    String version();

    /** Operators contributed by this plugin, keyed by operator name. */
    default Map<String, OperatorDefinition> operators() {
        return Map.of();
    }

    /** Called once after the plugin's operators are registered. */
    default void onLoad() {}
}
