package io.echoprompt.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.echoprompt.core.config.EchoConfig;
import io.echoprompt.core.context.ContextReferences;
import io.echoprompt.core.error.PluginLoadException;
import io.echoprompt.core.error.TemplateParseException;
import io.echoprompt.core.model.ContentBlock;
import io.echoprompt.core.model.EvaluationResult;
import io.echoprompt.core.model.ParseResult;
import io.echoprompt.core.model.ResolvedContext;
import io.echoprompt.core.model.ValidationResult;
import io.echoprompt.core.parser.EchoParser;
import io.echoprompt.core.spi.EchoPlugin;
import io.echoprompt.core.spi.OperatorDefinition;
import io.echoprompt.core.spi.TelemetryListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.BiFunction;
import java.util.function.ToIntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the template pipeline: parse, evaluate, then render.
 *
 * <p>
 * An engine owns an {@link OperatorRegistry} seeded with the built-in
 * operators. Operators registered directly or through plugins shadow built-ins
 * of the same name. Plugins named in {@link EchoConfig#plugins()} are
 * instantiated and loaded at construction.
 *
 * <p>
 * Thread-safe: renders share no mutable state, and each render evaluates
 * against a snapshot of the operator table taken when it starts.
 */
public final class EchoEngine {

    private static final Logger LOG = LoggerFactory.getLogger(EchoEngine.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final EchoConfig config;
    private final OperatorRegistry registry;
    private final EchoParser parser;
    private final EchoEvaluator evaluator;
    private final EchoRenderer renderer = new EchoRenderer();
    private final Map<String, EchoPlugin> plugins = Collections.synchronizedMap(new LinkedHashMap<>());

    /** Creates an engine with lenient defaults and no collaborators. */
    public EchoEngine() {
        this(EchoConfig.defaults());
    }

    /**
     * @throws PluginLoadException if a configured plugin class cannot be instantiated or fails
     *                             validation
     */
    public EchoEngine(EchoConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = OperatorRegistry.withBuiltins(config.aiJudge());
        this.parser = new EchoParser(registry::isAsync);
        this.evaluator = new EchoEvaluator(config.telemetryListener());
        for (String className : config.plugins()) {
            loadPlugin(instantiatePlugin(className));
        }
    }

    public EchoConfig config() {
        return config;
    }

    public OperatorRegistry operators() {
        return registry;
    }

    // --- Template entry points ---

    /** Parses a template. Async flags are set for every operator registered as ASYNC. */
    public ParseResult parse(String template) {
        return parser.parse(template);
    }

    /** Checks a template without rendering it. */
    public ValidationResult validate(String template) {
        return new TemplateValidator(registry, config.strict()).validate(parser.parse(template));
    }

    /**
     * Renders a template to a string.
     *
     * @throws TemplateParseException if the template does not parse
     * @throws io.echoprompt.core.error.EchoException in strict mode, on the first evaluation or
     *     render error
     */
    public String render(String template, Map<String, ?> context) {
        return execute(template, context, false, (evaluated, options) ->
                renderer.render(evaluated.ast(), context, options), String::length);
    }

    /** Renders with a Jackson object node as the variable context. */
    public String render(String template, JsonNode context) {
        return render(template, toVariables(context));
    }

    /**
     * Renders a template to text and image blocks, resolving
     * {@code #context(...)} references through the configured context resolver.
     */
    public List<ContentBlock> renderMultimodal(String template, Map<String, ?> context) {
        return execute(template, context, true, (evaluated, options) ->
                renderer.renderMultimodal(evaluated.ast(), context, options), List::size);
    }

    /** Multimodal render with a Jackson object node as the variable context. */
    public List<ContentBlock> renderMultimodal(String template, JsonNode context) {
        return renderMultimodal(template, toVariables(context));
    }

    private <T> T execute(
            String template,
            Map<String, ?> context,
            boolean multimodal,
            BiFunction<EvaluationResult, RenderOptions, T> output,
            ToIntFunction<T> size) {
        Objects.requireNonNull(template, "template must not be null");
        long start = System.nanoTime();
        notifyRenderStarted(template.length(), multimodal);
        try {
            ParseResult parsed = parser.parse(template);
            if (!parsed.success()) {
                throw new TemplateParseException(
                        "Parse error:\n" + ErrorFormatter.format(template, parsed.errors()), parsed.errors());
            }
            EvaluationResult evaluated =
                    evaluator.evaluate(parsed.ast(), context, config.strict(), registry.snapshot());
            ResolvedContext resolved = config.contextResolver() != null
                    ? ContextReferences.resolve(evaluated.ast(), config.contextResolver())
                    : ResolvedContext.empty();
            RenderOptions options =
                    new RenderOptions(config.strict(), config.trim(), config.collapseNewlines(), resolved);
            T result = output.apply(evaluated, options);
            notifyRenderCompleted(elapsedMs(start), size.applyAsInt(result));
            return result;
        } catch (RuntimeException e) {
            notifyRenderFailed(elapsedMs(start), e);
            throw e;
        }
    }

    private static Map<String, Object> toVariables(JsonNode context) {
        if (context == null || context.isNull() || context.isMissingNode()) {
            return Map.of();
        }
        if (!context.isObject()) {
            throw new IllegalArgumentException(
                    "Render context must be a JSON object, got " + context.getNodeType());
        }
        return MAPPER.convertValue(context, new TypeReference<Map<String, Object>>() {});
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // --- Operators and plugins ---

    /** Registers a custom operator, shadowing any built-in of the same name. */
    public void registerOperator(String name, OperatorDefinition definition) {
        registry.register(name, definition);
    }

    /**
     * Validates a plugin, registers its operators and then calls its
     * {@code onLoad} hook.
     *
     * @throws PluginLoadException if the plugin has no name or version, an operator definition is
     *                             incomplete, or {@code onLoad} fails
     */
    public void loadPlugin(EchoPlugin plugin) {
        Map<String, OperatorDefinition> operators = validatePlugin(plugin);
        String name = plugin.name();
        operators.forEach(registry::register);
        plugins.put(name, plugin);
        try {
            plugin.onLoad();
        } catch (RuntimeException e) {
            throw new PluginLoadException("Plugin '" + name + "' failed in onLoad: " + e.getMessage(), e, name);
        }
        LOG.info("Loaded plugin {} {} with {} operator(s)", name, plugin.version(), operators.size());
    }

    /**
     * Loads every {@link EchoPlugin} registered with {@link ServiceLoader}
     * under {@code META-INF/services/io.echoprompt.core.spi.EchoPlugin}.
     *
     * @return the plugins loaded, in discovery order
     */
    public List<EchoPlugin> loadInstalledPlugins() {
        List<EchoPlugin> loaded = new ArrayList<>();
        try {
            for (EchoPlugin plugin : ServiceLoader.load(EchoPlugin.class)) {
                loadPlugin(plugin);
                loaded.add(plugin);
            }
        } catch (ServiceConfigurationError e) {
            throw new PluginLoadException("Failed to discover installed plugins: " + e.getMessage(), e, null);
        }
        return loaded;
    }

    /** Names of the plugins loaded so far, in load order. */
    public List<String> loadedPlugins() {
        synchronized (plugins) {
            return List.copyOf(plugins.keySet());
        }
    }

    private static Map<String, OperatorDefinition> validatePlugin(EchoPlugin plugin) {
        if (plugin == null) {
            throw new PluginLoadException("Plugin must not be null", null);
        }
        String name = plugin.name();
        if (name == null || name.isBlank()) {
            throw new PluginLoadException("Plugin must have a name", name);
        }
        if (plugin.version() == null) {
            throw new PluginLoadException("Plugin must have a version", name);
        }
        Map<String, OperatorDefinition> operators = plugin.operators();
        if (operators == null) {
            throw new PluginLoadException("Plugin '" + name + "' returned null operators", name);
        }
        for (Map.Entry<String, OperatorDefinition> entry : operators.entrySet()) {
            String operator = entry.getKey();
            if (operator == null || operator.isBlank()) {
                throw new PluginLoadException("Plugin '" + name + "' has an operator without a name", name);
            }
            if (entry.getValue() == null) {
                throw new PluginLoadException("Operator " + operator + " must have a definition", name);
            }
            String problem = OperatorRegistry.describeProblem(entry.getValue());
            if (problem != null) {
                throw new PluginLoadException("Operator " + operator + " " + problem, name);
            }
        }
        return operators;
    }

    private static EchoPlugin instantiatePlugin(String className) {
        try {
            Class<?> type = Class.forName(className, true, EchoEngine.class.getClassLoader());
            if (!EchoPlugin.class.isAssignableFrom(type)) {
                throw new PluginLoadException(
                        "Class " + className + " does not implement " + EchoPlugin.class.getName(), className);
            }
            return (EchoPlugin) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new PluginLoadException(
                    "Cannot instantiate plugin class " + className + ": " + e.getMessage(), e, className);
        }
    }

    // --- Telemetry notification helpers ---

    private void notifyRenderStarted(int templateLength, boolean multimodal) {
        TelemetryListener listener = config.telemetryListener();
        if (listener == null) return;
        try {
            listener.onRenderStarted(
                    new TelemetryListener.RenderStartedEvent(templateLength, config.strict(), multimodal));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onRenderStarted failed", e);
        }
    }

    private void notifyRenderCompleted(long durationMs, int outputSize) {
        TelemetryListener listener = config.telemetryListener();
        if (listener == null) return;
        try {
            listener.onRenderCompleted(new TelemetryListener.RenderCompletedEvent(durationMs, outputSize));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onRenderCompleted failed", e);
        }
    }

    private void notifyRenderFailed(long durationMs, RuntimeException error) {
        TelemetryListener listener = config.telemetryListener();
        if (listener == null) return;
        try {
            listener.onRenderFailed(new TelemetryListener.RenderFailedEvent(
                    durationMs, error.getClass().getSimpleName(), error.getMessage()));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onRenderFailed failed", e);
        }
    }
}
