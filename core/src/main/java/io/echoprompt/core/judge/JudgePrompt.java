package io.echoprompt.core.judge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Builds the yes/no prompt an {@link io.echoprompt.core.spi.AiJudge}
 * implementation sends to its model. Strings are embedded verbatim; any other
 * value is embedded as pretty-printed JSON.
 */
public final class JudgePrompt {

    /** System instruction to pair with {@link #build(Object, String)} for chat-style models. */
    public static final String SYSTEM_INSTRUCTION = "You are a precise yes/no evaluator. Answer ONLY with \"yes\" or"
            + " \"no\" (lowercase, no punctuation). Do not explain or elaborate.";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JudgePrompt() {}

    public static String build(Object value, String question) {
        return "Given the following value:\n---\n"
                + describe(value)
                + "\n---\n\nAnswer with ONLY \"yes\" or \"no\":\n"
                + question;
    }

    private static String describe(Object value) {
        if (value instanceof String text) {
            return text;
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
