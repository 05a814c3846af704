package io.echoprompt.core.error;

/** Thrown when a plugin is malformed, cannot be instantiated, or its {@code onLoad} hook fails. */
public final class PluginLoadException extends EchoLoadException {

    private static final long serialVersionUID = 1L;

    public PluginLoadException(String message, String pluginName) {
        super(message, pluginName);
    }

    public PluginLoadException(String message, Throwable cause, String pluginName) {
        super(message, cause, pluginName);
    }
}
