package io.echoprompt.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.echoprompt.core.error.InvalidVariablePathException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("VariableResolverTest")
class VariableResolverTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private static final Map<String, Object> CONTEXT = Map.of(
            "name", "Ann",
            "user", Map.of("profile", Map.of("city", "Oslo")),
            "items", List.of(1, 2),
            "matrix", List.of(List.of("a", "b"), List.of("c")),
            "orders", List.of(Map.of("id", "o-1")));

    /** Plain bean read through its Jackson properties. */
    public static final class Customer {
        public String getTier() {
            return "gold";
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "name, Ann",
            "user.profile.city, Oslo",
            "items[1], 2",
            "matrix[1][0], c",
            "orders[0].id, o-1",
            "items.length, 2",
            "name.length, 3"
        })
        void resolvesPaths(String path, String expected) {
            assertThat(String.valueOf(VariableResolver.resolve(path, CONTEXT, true))).isEqualTo(expected);
        }

        @Test
        @DisplayName("missing values short-circuit to null in both modes")
        void missingShortCircuits() {
            assertThat(VariableResolver.resolve("missing.deeper.still", CONTEXT, true)).isNull();
            assertThat(VariableResolver.resolve("user.nothing.city", CONTEXT, false)).isNull();
            assertThat(VariableResolver.resolve("name.first", CONTEXT, true)).isNull();
        }

        @Test
        @DisplayName("index past the end is null")
        void outOfBounds() {
            assertThat(VariableResolver.resolve("items[5]", CONTEXT, true)).isNull();
        }

        @Test
        @DisplayName("null values inside maps resolve to null")
        void nullValue() {
            Map<String, Object> context = new HashMap<>();
            context.put("nothing", null);

            assertThat(VariableResolver.resolve("nothing.below", context, true)).isNull();
        }

        @Test
        @DisplayName("Jackson trees are converted to plain values")
        void jsonNodes() throws Exception {
            Map<String, Object> context = Map.of("doc", JSON.readTree("{\"tags\":[\"x\",\"y\"],\"n\":null}"));

            assertThat(VariableResolver.resolve("doc.tags[1]", context, true)).isEqualTo("y");
            assertThat(VariableResolver.resolve("doc.tags", context, true)).isEqualTo(List.of("x", "y"));
            assertThat(VariableResolver.resolve("doc.n", context, true)).isNull();
        }

        @Test
        @DisplayName("beans are read through their properties")
        void beans() {
            assertThat(VariableResolver.resolve("customer.tier", Map.of("customer", new Customer()), true))
                    .isEqualTo("gold");
        }

        @Test
        @DisplayName("null context resolves to null")
        void nullContext() {
            assertThat(VariableResolver.resolve("name", null, true)).isNull();
        }
    }

    @Nested
    @DisplayName("Malformed paths")
    class Malformed {

        @ParameterizedTest(name = "{0}")
        @CsvSource(
                delimiter = '|',
                quoteCharacter = '"',
                value = {
                    "items[]      | Invalid variable path 'items[]': empty brackets",
                    "items[abc]   | Invalid variable path 'items[abc]': non-numeric index [abc]",
                    "items[0      | Invalid variable path 'items[0': unbalanced brackets",
                    "items]       | Invalid variable path 'items]': unbalanced brackets",
                    "user..name   | Invalid variable path 'user..name': empty segment",
                    "items[-1]    | Negative array index [-1] in path 'items[-1]'",
                    "name[0]      | Cannot index into non-array value 'name' in path 'name[0]'"
                })
        void strictRaises(String path, String message) {
            assertThatThrownBy(() -> VariableResolver.resolve(path, CONTEXT, true))
                    .isInstanceOf(InvalidVariablePathException.class)
                    .hasMessage(message)
                    .extracting(e -> ((InvalidVariablePathException) e).subject())
                    .isEqualTo(path);
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource({"items[]", "items[abc]", "items[0", "user..name", "items[-1]", "name[0]"})
        void lenientResolvesToNull(String path) {
            assertThat(VariableResolver.resolve(path, CONTEXT, false)).isNull();
        }
    }
}
