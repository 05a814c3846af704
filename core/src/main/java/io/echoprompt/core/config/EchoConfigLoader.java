package io.echoprompt.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.echoprompt.core.error.ConfigLoadException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link EchoConfig} from a YAML file with an environment variable
 * overlay.
 *
 * <pre>
 * strict: true
 * render:
 *   collapse-newlines: true
 *   trim: false
 * plugins:
 *   - com.example.MyPlugin
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values: {@code ECHO_STRICT},
 * {@code ECHO_RENDER_TRIM}, {@code ECHO_RENDER_COLLAPSE_NEWLINES} and
 * {@code ECHO_PLUGINS} (comma-separated class names). An env var is "set" only
 * when it is defined and non-blank after trimming; otherwise the YAML value
 * stands.
 *
 * <p>
 * Collaborators (AI judge, context resolver, telemetry) are code, not
 * configuration: add them with {@link EchoConfig#toBuilder()} after loading.
 */
public final class EchoConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "echo.config.yaml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final Set<String> TOP_LEVEL_KEYS = Set.of("strict", "render", "plugins");

    private EchoConfigLoader() {
        // utility class
    }

    /** Loads from {@code configPath}, overlaying {@link System#getenv}. */
    public static EchoConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads from {@code configPath}, overlaying variables from
     * {@code envLookup} ({@code null} means undefined).
     *
     * @throws ConfigLoadException if the file is missing, unreadable, not valid YAML, or has
     *                             unknown top-level keys
     */
    public static EchoConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath, configPath.toString());
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            return mapToConfig(root, envLookup, configPath.toString());
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException(
                    "Failed to parse YAML configuration: " + configPath, e, configPath.toString());
        }
    }

    /** Builds a configuration from defaults and environment variables alone. */
    public static EchoConfig fromEnvironment(Function<String, String> envLookup) {
        return mapToConfig(null, envLookup, "<environment>");
    }

    private static EchoConfig mapToConfig(JsonNode root, Function<String, String> envLookup, String source) {
        EchoConfig.Builder builder = EchoConfig.builder();

        if (root != null && !root.isNull() && !root.isMissingNode()) {
            if (!root.isObject()) {
                throw new ConfigLoadException("Configuration root must be a mapping", source);
            }
            for (Iterator<String> names = root.fieldNames(); names.hasNext(); ) {
                String name = names.next();
                if (!TOP_LEVEL_KEYS.contains(name)) {
                    throw new ConfigLoadException(
                            "Unknown configuration key '" + name + "' (expected one of " + TOP_LEVEL_KEYS + ")",
                            source);
                }
            }

            if (root.has("strict")) builder.strict(root.get("strict").asBoolean());

            JsonNode render = root.path("render");
            if (render.has("collapse-newlines"))
                builder.collapseNewlines(render.get("collapse-newlines").asBoolean());
            if (render.has("trim")) builder.trim(render.get("trim").asBoolean());

            JsonNode plugins = root.path("plugins");
            if (!plugins.isMissingNode() && !plugins.isNull()) {
                if (!plugins.isArray()) {
                    throw new ConfigLoadException("'plugins' must be a list of class names", source);
                }
                List<String> names = new ArrayList<>();
                plugins.forEach(plugin -> names.add(plugin.asText()));
                builder.plugins(names);
            }
        }

        // --- Environment variable overlay ---
        envBool(envLookup, "ECHO_STRICT", builder::strict);
        envBool(envLookup, "ECHO_RENDER_TRIM", builder::trim);
        envBool(envLookup, "ECHO_RENDER_COLLAPSE_NEWLINES", builder::collapseNewlines);
        if (isSet(envLookup, "ECHO_PLUGINS")) {
            builder.plugins(Arrays.stream(envLookup.apply("ECHO_PLUGINS").split(","))
                    .map(String::trim)
                    .filter(name -> !name.isEmpty())
                    .toList());
        }

        return builder.build();
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
