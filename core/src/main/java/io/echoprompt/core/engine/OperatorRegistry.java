package io.echoprompt.core.engine;

import io.echoprompt.core.spi.AiJudge;
import io.echoprompt.core.spi.OperatorDefinition;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name to {@link OperatorDefinition} table. Custom registrations (direct or
 * from plugins) shadow built-ins of the same name; built-ins are never mutated.
 *
 * <p>
 * Thread-safe: registration and lookup may happen concurrently. Each render
 * works on a {@link #snapshot()}, so registering an operator never changes a
 * render already in flight.
 */
public final class OperatorRegistry {

    private final Map<String, OperatorDefinition> builtins;
    private final Map<String, OperatorDefinition> custom = new ConcurrentHashMap<>();

    public OperatorRegistry(Map<String, OperatorDefinition> builtins) {
        this.builtins = Map.copyOf(builtins);
    }

    /** A registry holding the built-in operators, with {@code ai_gate} backed by {@code aiJudge}. */
    public static OperatorRegistry withBuiltins(AiJudge aiJudge) {
        return new OperatorRegistry(BuiltinOperators.create(aiJudge));
    }

    /**
     * Registers an operator. A later registration under the same name replaces
     * the earlier one (last-write-wins).
     *
     * @throws NullPointerException     if name or definition is null
     * @throws IllegalArgumentException if the name is blank or the definition lacks a kind, handler
     *                                  or description
     */
    public void register(String name, OperatorDefinition definition) {
        if (name == null) {
            throw new NullPointerException("operator name must not be null");
        }
        if (definition == null) {
            throw new NullPointerException("operator definition must not be null");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("operator name must not be blank");
        }
        String problem = describeProblem(definition);
        if (problem != null) {
            throw new IllegalArgumentException("Operator '" + name + "' " + problem);
        }
        custom.put(name, definition);
    }

    /**
     * Returns what is missing from a definition, or {@code null} when it is
     * complete.
     */
    static String describeProblem(OperatorDefinition definition) {
        if (definition.kind() == null) {
            return "must have a kind";
        }
        if (definition.handler() == null) {
            return "must have a handler";
        }
        if (definition.description() == null || definition.description().isBlank()) {
            return "must have a description";
        }
        return null;
    }

    /** Looks up an operator, custom registrations first. */
    public Optional<OperatorDefinition> lookup(String name) {
        OperatorDefinition definition = custom.get(name);
        return Optional.ofNullable(definition != null ? definition : builtins.get(name));
    }

    public boolean has(String name) {
        return custom.containsKey(name) || builtins.containsKey(name);
    }

    /** {@code true} when {@code name} is a registered operator of kind ASYNC. */
    public boolean isAsync(String name) {
        return lookup(name).map(OperatorDefinition::isAsync).orElse(false);
    }

    /** All known operator names, sorted. */
    public Set<String> names() {
        Set<String> names = new TreeSet<>(builtins.keySet());
        names.addAll(custom.keySet());
        return names;
    }

    /** An immutable merged view for one render: built-ins overlaid with custom registrations. */
    public Map<String, OperatorDefinition> snapshot() {
        Map<String, OperatorDefinition> merged = new LinkedHashMap<>(builtins);
        merged.putAll(custom);
        return Map.copyOf(merged);
    }
}
