package io.echoprompt.core.engine;

import io.echoprompt.core.model.EchoDiagnostic;
import io.echoprompt.core.model.SourceLocation;
import java.util.List;

/**
 * Formats diagnostics for humans, pointing at the offending source line:
 *
 * <pre>
 * Error: Unclosed [#IF]: expected [END IF]
 *   3 | [#IF {{x}} #exists]content
 *     | ^
 * </pre>
 */
public final class ErrorFormatter {

    private ErrorFormatter() {}

    public static String format(String template, List<EchoDiagnostic> diagnostics) {
        String[] lines = template.split("\n", -1);
        StringBuilder out = new StringBuilder();
        for (EchoDiagnostic diagnostic : diagnostics) {
            out.append("Error: ").append(diagnostic.message()).append('\n');
            SourceLocation location = diagnostic.location();
            if (location != null) {
                int lineIndex = location.startLine() - 1;
                if (lineIndex >= 0 && lineIndex < lines.length) {
                    out.append("  ")
                            .append(location.startLine())
                            .append(" | ")
                            .append(lines[lineIndex])
                            .append('\n');
                    out.append("    | ")
                            .append(" ".repeat(location.startColumn() - 1))
                            .append("^\n");
                }
            }
            out.append('\n');
        }
        return out.toString();
    }
}
