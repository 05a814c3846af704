package io.echoprompt.core.engine;

import io.echoprompt.core.context.ContextPaths;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.EchoDiagnostic;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.Nodes;
import io.echoprompt.core.model.ParseResult;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Static checks on a parsed template, without a variable context.
 *
 * <p>
 * Lex and parse errors are always errors. Unknown operators and includes of
 * undeclared sections are errors in strict mode and warnings otherwise,
 * matching how rendering treats them. Imports (which the core does not
 * resolve), the deprecated {@code ai_judge} alias and context paths that break
 * the path rules are warnings.
 */
final class TemplateValidator {

    private final OperatorRegistry registry;
    private final boolean strict;

    TemplateValidator(OperatorRegistry registry, boolean strict) {
        this.registry = registry;
        this.strict = strict;
    }

    ValidationResult validate(ParseResult parsed) {
        if (!parsed.success()) {
            return ValidationResult.of(parsed.errors(), List.of());
        }
        List<Node> ast = parsed.ast();
        List<EchoDiagnostic> errors = new ArrayList<>();
        List<EchoDiagnostic> warnings = new ArrayList<>();
        List<EchoDiagnostic> modeDependent = strict ? errors : warnings;

        Set<String> sections = new HashSet<>();
        Nodes.walk(ast, node -> {
            if (node instanceof SectionNode section) {
                sections.add(section.name());
            }
        });

        Nodes.walk(ast, node -> {
            if (node instanceof ConditionalNode conditional) {
                String operator = conditional.condition().operator();
                if (!registry.has(operator)) {
                    modeDependent.add(new EchoDiagnostic(
                            EchoDiagnostic.UNKNOWN_OPERATOR, "Unknown operator: #" + operator, node.location()));
                } else if (BuiltinOperators.AI_JUDGE.equals(operator)) {
                    warnings.add(new EchoDiagnostic(
                            EchoDiagnostic.DEPRECATED_OPERATOR,
                            "#ai_judge is deprecated, use #ai_gate instead",
                            node.location()));
                }
            } else if (node instanceof IncludeNode include && !sections.contains(include.name())) {
                modeDependent.add(new EchoDiagnostic(
                        EchoDiagnostic.UNKNOWN_SECTION, "Unknown section: " + include.name(), node.location()));
            } else if (node instanceof ImportNode importNode) {
                warnings.add(new EchoDiagnostic(
                        EchoDiagnostic.IMPORT_NOT_RESOLVED,
                        "Import '" + importNode.path() + "' is not resolved by the engine and will be skipped",
                        node.location()));
            } else if (node instanceof ContextNode context) {
                Optional<String> invalid = ContextPaths.validate(context.path());
                invalid.ifPresent(reason -> warnings.add(new EchoDiagnostic(
                        EchoDiagnostic.INVALID_CONTEXT_PATH,
                        "Invalid context path '" + context.path() + "': " + reason,
                        node.location())));
            }
        });
        return ValidationResult.of(errors, warnings);
    }
}
