package io.echoprompt.core.model;

import java.util.List;

/** Outcome of {@code validate(template)}: valid when there are no errors; warnings never fail it. */
public record ValidationResult(boolean valid, List<EchoDiagnostic> errors, List<EchoDiagnostic> warnings) {

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<EchoDiagnostic> errors, List<EchoDiagnostic> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
