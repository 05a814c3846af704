package io.echoprompt.core.judge;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps a model's free-text answer to a boolean. */
public final class JudgeAnswer {

    private static final Logger LOG = LoggerFactory.getLogger(JudgeAnswer.class);

    private JudgeAnswer() {}

    /**
     * An exact {@code yes}/{@code no} (ignoring case and surrounding
     * whitespace) wins; otherwise the first of "yes" or "no" found as a
     * substring decides, checking "yes" first. Anything else, including
     * {@code null}, is {@code false}.
     */
    public static boolean interpret(String answer) {
        if (answer == null) {
            LOG.warn("AI judge returned no answer, defaulting to false");
            return false;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("yes")) {
            return true;
        }
        if (normalized.equals("no")) {
            return false;
        }
        if (normalized.contains("yes")) {
            return true;
        }
        if (!normalized.contains("no")) {
            LOG.warn("AI judge returned unexpected response '{}', defaulting to false", normalized);
        }
        return false;
    }
}
