package io.echoprompt.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.echoprompt.core.error.InvalidVariablePathException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves dotted/bracketed variable paths such as {@code user.items[0].name}
 * against a context.
 *
 * <p>
 * Segments are walked left to right. Maps are read by key, lists and arrays by
 * {@code [n]} index (and expose {@code length}), Jackson {@link JsonNode}s are
 * converted to plain Java values first, and any other object is read through
 * its Jackson bean properties. A {@code null} anywhere along the path
 * short-circuits to {@code null}; an index past the end is {@code null} too.
 *
 * <p>
 * Malformed brackets (empty, non-numeric, negative, unbalanced) and indexing
 * into something that is not a list raise {@link InvalidVariablePathException}
 * in strict mode and resolve to {@code null} in lenient mode.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class VariableResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private VariableResolver() {}

    /** One step of a path: a property name or a list index. */
    private sealed interface Segment permits Key, Index {}

    private record Key(String name) implements Segment {}

    private record Index(int value, String prefix) implements Segment {}

    /**
     * @param path    the accessor, e.g. {@code items[0].name}
     * @param context variable bindings, may be null
     * @param strict  raise on malformed paths instead of returning {@code null}
     * @return the resolved value, or {@code null} when nothing is bound there
     */
    public static Object resolve(String path, Map<String, ?> context, boolean strict) {
        List<Segment> segments;
        try {
            segments = parse(path);
        } catch (InvalidVariablePathException e) {
            if (strict) {
                throw e;
            }
            return null;
        }

        Object current = context;
        for (Segment segment : segments) {
            current = plain(current);
            if (current == null) {
                return null;
            }
            if (segment instanceof Key key) {
                current = property(current, key.name());
            } else {
                Index index = (Index) segment;
                List<Object> items = Values.asList(current);
                if (items == null) {
                    if (strict) {
                        throw new InvalidVariablePathException(
                                "Cannot index into non-array value '" + index.prefix() + "' in path '" + path + "'",
                                path);
                    }
                    return null;
                }
                current = index.value() < items.size() ? items.get(index.value()) : null;
            }
        }
        return plain(current);
    }

    private static List<Segment> parse(String path) {
        if (path == null || path.isEmpty()) {
            throw new InvalidVariablePathException("Variable path must not be empty", String.valueOf(path));
        }
        List<Segment> segments = new ArrayList<>();
        for (String part : path.split("\\.", -1)) {
            int bracket = part.indexOf('[');
            String name = bracket < 0 ? part : part.substring(0, bracket);
            if (name.indexOf(']') >= 0) {
                throw malformed(path, "unbalanced brackets");
            }
            if (name.isEmpty() && bracket != 0) {
                throw malformed(path, "empty segment");
            }
            if (!name.isEmpty()) {
                segments.add(new Key(name));
            }
            if (bracket >= 0) {
                parseIndexes(path, part, bracket, segments);
            }
        }
        return segments;
    }

    private static void parseIndexes(String path, String part, int from, List<Segment> segments) {
        int i = from;
        while (i < part.length()) {
            if (part.charAt(i) != '[') {
                throw malformed(path, "unbalanced brackets");
            }
            int close = part.indexOf(']', i);
            int nextOpen = part.indexOf('[', i + 1);
            if (close < 0 || (nextOpen >= 0 && nextOpen < close)) {
                throw malformed(path, "unbalanced brackets");
            }
            String content = part.substring(i + 1, close).trim();
            if (content.isEmpty()) {
                throw malformed(path, "empty brackets");
            }
            if (content.startsWith("-") && content.length() > 1 && content.substring(1).chars().allMatch(Character::isDigit)) {
                throw new InvalidVariablePathException(
                        "Negative array index [" + content + "] in path '" + path + "'", path);
            }
            if (!content.chars().allMatch(Character::isDigit)) {
                throw malformed(path, "non-numeric index [" + content + "]");
            }
            int value;
            try {
                value = Integer.parseInt(content);
            } catch (NumberFormatException e) {
                throw new InvalidVariablePathException(
                        "Array index [" + content + "] out of range in path '" + path + "'", path);
            }
            segments.add(new Index(value, part.substring(0, i)));
            i = close + 1;
        }
    }

    private static InvalidVariablePathException malformed(String path, String reason) {
        return new InvalidVariablePathException("Invalid variable path '" + path + "': " + reason, path);
    }

    private static Object property(Object target, String name) {
        if (target instanceof Map<?, ?> map) {
            return map.get(name);
        }
        List<Object> items = Values.asList(target);
        if (items != null) {
            return "length".equals(name) ? items.size() : null;
        }
        if (target instanceof CharSequence text) {
            return "length".equals(name) ? text.length() : null;
        }
        if (target instanceof Number || target instanceof Boolean) {
            return null;
        }
        try {
            return MAPPER.convertValue(target, Map.class).get(name);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Converts Jackson trees to plain maps, lists and scalars; other values pass through. */
    private static Object plain(Object value) {
        if (value instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return null;
            }
            return MAPPER.convertValue(node, Object.class);
        }
        return value;
    }
}
