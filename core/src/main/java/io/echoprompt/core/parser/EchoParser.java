package io.echoprompt.core.parser;

import io.echoprompt.core.model.Alternate;
import io.echoprompt.core.model.ConditionExpr;
import io.echoprompt.core.model.ConditionalNode;
import io.echoprompt.core.model.ContextNode;
import io.echoprompt.core.model.EchoDiagnostic;
import io.echoprompt.core.model.ImportNode;
import io.echoprompt.core.model.IncludeNode;
import io.echoprompt.core.model.Node;
import io.echoprompt.core.model.ParseResult;
import io.echoprompt.core.model.SectionNode;
import io.echoprompt.core.model.SourceLocation;
import io.echoprompt.core.model.TextNode;
import io.echoprompt.core.model.VariableNode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser building the template AST from {@link EchoLexer}
 * tokens.
 *
 * <p>
 * Grammar:
 *
 * <pre>
 * template    := node*
 * node        := text | variable | conditional | section | import | include | context
 * conditional := "[#IF" condition "]" node* ("[ELSE IF" condition "]" node*)* ("[ELSE]" node*)? "[END IF]"
 * condition   := "{{" identifier "}}" "#" operatorName ("(" argText ")")?
 * section     := "[#SECTION" "name=" string "]" node* "[END SECTION]"
 * </pre>
 *
 * <p>
 * Syntax errors do not abort the parse: the parser records a diagnostic, skips
 * to the end of the offending directive or variable reference, and carries on
 * so that one pass reports every problem. A parse with any diagnostic yields no
 * AST. Lex errors are fatal and returned as-is.
 *
 * <p>
 * The flat run of {@code [ELSE IF]} blocks is folded into a right-nested chain:
 * the list is walked in reverse and each link takes the previously built
 * alternate.
 *
 * <p>
 * Thread-safe: each {@link #parse(String)} call keeps its state in a private
 * cursor.
 */
public final class EchoParser {

    private static final Logger LOG = LoggerFactory.getLogger(EchoParser.class);

    /** Operators treated as asynchronous when no registry is consulted. */
    public static final Predicate<String> BUILTIN_ASYNC_OPERATORS =
            name -> "ai_gate".equals(name) || "ai_judge".equals(name);

    private static final Pattern NUMERIC_ARGUMENT = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private static final Set<TokenType> CONDITIONAL_CLOSERS =
            EnumSet.of(TokenType.ELSE_IF, TokenType.ELSE, TokenType.END_IF);
    private static final Set<TokenType> SECTION_CLOSERS = EnumSet.of(TokenType.END_SECTION);

    private final Predicate<String> asyncOperators;

    public EchoParser() {
        this(BUILTIN_ASYNC_OPERATORS);
    }

    /**
     * @param asyncOperators decides, per operator name, whether a condition is flagged async and
     *                       takes part in pre-evaluation
     */
    public EchoParser(Predicate<String> asyncOperators) {
        this.asyncOperators = Objects.requireNonNull(asyncOperators, "asyncOperators must not be null");
    }

    /** Parses {@code source}. Never throws for malformed templates; see {@link ParseResult#errors()}. */
    public ParseResult parse(String source) {
        Objects.requireNonNull(source, "source must not be null");
        LexResult lexed = EchoLexer.tokenize(source);
        if (lexed.hasErrors()) {
            LOG.debug("Template failed to lex with {} error(s)", lexed.errors().size());
            return ParseResult.failed(lexed.errors());
        }
        Cursor cursor = new Cursor(source, lexed.tokens());
        List<Node> ast = cursor.parseNodes(EnumSet.noneOf(TokenType.class));
        if (!cursor.errors.isEmpty()) {
            LOG.debug("Template failed to parse with {} error(s)", cursor.errors.size());
            return ParseResult.failed(cursor.errors);
        }
        return ParseResult.ok(ast);
    }

    /**
     * Classifies free-form operator argument text: a numeric literal becomes a
     * {@link Double}, text with a comma becomes a list of trimmed, unquoted
     * strings, anything else an unquoted string. A single quoted string is kept
     * whole even when it contains commas. Blank text yields {@code null}.
     */
    public static Object classifyArgument(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (NUMERIC_ARGUMENT.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        if (text.indexOf(',') >= 0 && !isSingleQuoted(text)) {
            return Arrays.stream(text.split(",", -1))
                    .map(String::trim)
                    .map(EchoParser::stripQuotes)
                    .toList();
        }
        return stripQuotes(text);
    }

    static String stripQuotes(String text) {
        if (text.length() >= 2) {
            char first = text.charAt(0);
            if ((first == '"' || first == '\'') && text.charAt(text.length() - 1) == first) {
                return text.substring(1, text.length() - 1);
            }
        }
        return text;
    }

    private static boolean isSingleQuoted(String text) {
        if (text.length() < 2) {
            return false;
        }
        char first = text.charAt(0);
        return (first == '"' || first == '\'')
                && text.charAt(text.length() - 1) == first
                && text.indexOf(first, 1) == text.length() - 1;
    }

    /** One parse run: token cursor plus the diagnostics collected so far. */
    private final class Cursor {

        private final String source;
        private final List<Token> tokens;
        private final List<EchoDiagnostic> errors = new ArrayList<>();
        private int index;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        /** Parses nodes until end of input or a token in {@code stop}, which is left unconsumed. */
        List<Node> parseNodes(Set<TokenType> stop) {
            List<Node> nodes = new ArrayList<>();
            while (!atEnd() && !stop.contains(peek().type())) {
                Node node = parseNode(stop);
                if (node != null) {
                    nodes.add(node);
                }
            }
            return nodes;
        }

        private Node parseNode(Set<TokenType> stop) {
            Token token = next();
            return switch (token.type()) {
                case TEXT -> new TextNode(token.text(), token.location());
                case VARIABLE_OPEN -> parseVariable(token);
                case CONTEXT_OPEN -> parseContext(token);
                case IF_OPEN -> parseConditional(token, stop);
                case SECTION_OPEN -> parseSection(token, stop);
                case IMPORT -> parseImport(token);
                case INCLUDE -> parseInclude(token);
                case ELSE_IF -> {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "[ELSE IF] without a matching [#IF]", token);
                    skipPast(TokenType.CLOSE_BRACKET);
                    yield null;
                }
                case ELSE -> {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "[ELSE] without a matching [#IF]", token);
                    yield null;
                }
                case END_IF -> {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "[END IF] without a matching [#IF]", token);
                    yield null;
                }
                case END_SECTION -> {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "[END SECTION] without a matching [#SECTION]", token);
                    yield null;
                }
                default -> {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "Unexpected '" + token.text() + "'", token);
                    yield null;
                }
            };
        }

        // {{path}} or {{path ?? default}}
        private Node parseVariable(Token open) {
            Token path = expect(TokenType.IDENTIFIER, "Expected a variable path after '{{'");
            if (path == null) {
                skipPast(TokenType.VARIABLE_CLOSE);
                return null;
            }
            String defaultValue = null;
            if (check(TokenType.DEFAULT_OP)) {
                next();
                Token literal = atEnd() ? null : peek();
                if (literal != null
                        && (literal.type() == TokenType.STRING
                                || literal.type() == TokenType.NUMBER
                                || literal.type() == TokenType.IDENTIFIER)) {
                    next();
                    defaultValue = literal.type() == TokenType.STRING ? stripQuotes(literal.text()) : literal.text();
                } else {
                    errorAtCurrent("Expected a default value after '??'");
                    skipPast(TokenType.VARIABLE_CLOSE);
                    return null;
                }
            }
            Token close = expect(TokenType.VARIABLE_CLOSE, "Expected '}}' to close variable reference");
            if (close == null) {
                skipPast(TokenType.VARIABLE_CLOSE);
                return null;
            }
            return new VariableNode(path.text(), defaultValue, span(open, close));
        }

        // #context(path)
        private Node parseContext(Token open) {
            String path = "";
            if (check(TokenType.ARG_TEXT)) {
                path = stripQuotes(next().text().trim());
            }
            Token close = expect(TokenType.RPAREN, "Expected ')' to close #context(");
            return close == null ? null : new ContextNode(path, span(open, close));
        }

        private Node parseConditional(Token open, Set<TokenType> outerStop) {
            Set<TokenType> stop = union(outerStop, CONDITIONAL_CLOSERS);
            ConditionExpr condition = parseCondition();
            List<Node> consequent = parseNodes(stop);

            List<Branch> elseIfs = new ArrayList<>();
            List<Node> elseBody = null;
            while (check(TokenType.ELSE_IF) || check(TokenType.ELSE)) {
                Token branch = next();
                if (elseBody != null) {
                    error(EchoDiagnostic.UNEXPECTED_TOKEN, "[" + label(branch) + "] after [ELSE]", branch);
                }
                if (branch.type() == TokenType.ELSE_IF) {
                    ConditionExpr branchCondition = parseCondition();
                    List<Node> body = parseNodes(stop);
                    if (branchCondition != null) {
                        elseIfs.add(new Branch(branchCondition, body, span(branch, previous())));
                    }
                } else {
                    elseBody = parseNodes(stop);
                }
            }

            if (!check(TokenType.END_IF)) {
                errors.add(new EchoDiagnostic(
                        EchoDiagnostic.UNCLOSED_BLOCK, "Unclosed [#IF]: expected [END IF]", open.location()));
                return null;
            }
            Token end = next();
            if (condition == null) {
                return null;
            }

            Alternate alternate = elseBody != null ? new Alternate.Else(elseBody) : Alternate.NONE;
            for (int i = elseIfs.size() - 1; i >= 0; i--) {
                Branch branch = elseIfs.get(i);
                alternate = new Alternate.ElseIf(
                        new ConditionalNode(branch.condition(), branch.body(), alternate, branch.location()));
            }
            return new ConditionalNode(condition, consequent, alternate, span(open, end));
        }

        /** Parses {@code {{var}} #op(arg) ]}; on error skips past the closing bracket and returns null. */
        private ConditionExpr parseCondition() {
            if (expect(TokenType.VARIABLE_OPEN, "Expected '{{variable}}' in condition") == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            Token variable = expect(TokenType.IDENTIFIER, "Expected a variable path after '{{'");
            if (variable == null
                    || expect(TokenType.VARIABLE_CLOSE, "Expected '}}' after condition variable") == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            Token operator = expect(TokenType.OPERATOR, "Expected an operator such as #equals after {{"
                    + variable.text() + "}}");
            if (operator == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            Object argument = null;
            if (check(TokenType.LPAREN)) {
                next();
                if (check(TokenType.ARG_TEXT)) {
                    argument = classifyArgument(next().text());
                }
                if (expect(TokenType.RPAREN, "Expected ')' to close operator argument") == null) {
                    skipPast(TokenType.CLOSE_BRACKET);
                    return null;
                }
            }
            if (expect(TokenType.CLOSE_BRACKET, "Expected ']' to close condition") == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            String name = operator.text().substring(1);
            return new ConditionExpr(variable.text(), name, argument, asyncOperators.test(name));
        }

        // [#SECTION name="x"] ... [END SECTION]
        private Node parseSection(Token open, Set<TokenType> outerStop) {
            String name = null;
            Token key = expect(TokenType.IDENTIFIER, "Expected name=\"...\" in [#SECTION]");
            if (key != null && !"name".equals(key.text())) {
                error(EchoDiagnostic.UNEXPECTED_TOKEN, "Expected 'name' but found '" + key.text() + "'", key);
                key = null;
            }
            if (key != null && expect(TokenType.EQUALS, "Expected '=' after 'name'") != null) {
                Token value = atEnd() ? null : peek();
                if (value != null && (value.type() == TokenType.STRING || value.type() == TokenType.IDENTIFIER)) {
                    next();
                    name = stripQuotes(value.text());
                } else {
                    errorAtCurrent("Expected a section name string after 'name='");
                }
            }
            if (name != null && expect(TokenType.CLOSE_BRACKET, "Expected ']' to close [#SECTION]") == null) {
                name = null;
            }
            if (name == null) {
                skipPast(TokenType.CLOSE_BRACKET);
            }

            List<Node> body = parseNodes(union(outerStop, SECTION_CLOSERS));
            if (!check(TokenType.END_SECTION)) {
                errors.add(new EchoDiagnostic(
                        EchoDiagnostic.UNCLOSED_BLOCK,
                        "Unclosed [#SECTION]: expected [END SECTION]",
                        open.location()));
                return null;
            }
            Token end = next();
            return name == null ? null : new SectionNode(name, body, span(open, end));
        }

        // [#IMPORT "path"]
        private Node parseImport(Token open) {
            Token path = expectOneOf("Expected a quoted path in [#IMPORT]", TokenType.STRING, TokenType.IDENTIFIER);
            Token close = path == null ? null : expect(TokenType.CLOSE_BRACKET, "Expected ']' to close [#IMPORT]");
            if (close == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            return new ImportNode(stripQuotes(path.text()), span(open, close));
        }

        // [#INCLUDE name]
        private Node parseInclude(Token open) {
            Token name = expectOneOf("Expected a section name in [#INCLUDE]", TokenType.IDENTIFIER, TokenType.STRING);
            Token close = name == null ? null : expect(TokenType.CLOSE_BRACKET, "Expected ']' to close [#INCLUDE]");
            if (close == null) {
                skipPast(TokenType.CLOSE_BRACKET);
                return null;
            }
            return new IncludeNode(stripQuotes(name.text()), span(open, close));
        }

        // --- cursor helpers ---

        private boolean atEnd() {
            return index >= tokens.size();
        }

        private Token peek() {
            return tokens.get(index);
        }

        private Token next() {
            return tokens.get(index++);
        }

        private Token previous() {
            return tokens.get(index - 1);
        }

        private boolean check(TokenType type) {
            return !atEnd() && peek().type() == type;
        }

        private Token expect(TokenType type, String message) {
            if (check(type)) {
                return next();
            }
            errorAtCurrent(message);
            return null;
        }

        private Token expectOneOf(String message, TokenType... types) {
            for (TokenType type : types) {
                if (check(type)) {
                    return next();
                }
            }
            errorAtCurrent(message);
            return null;
        }

        /** Skips tokens up to and including the next {@code type}, or to end of input. */
        private void skipPast(TokenType type) {
            while (!atEnd()) {
                if (next().type() == type) {
                    return;
                }
            }
        }

        private void errorAtCurrent(String message) {
            if (atEnd()) {
                SourceLocation location = tokens.isEmpty()
                        ? SourceLocation.at(1, 1)
                        : previous().location();
                errors.add(new EchoDiagnostic(
                        EchoDiagnostic.UNEXPECTED_TOKEN, message + " but reached end of template", location));
            } else {
                Token found = peek();
                error(EchoDiagnostic.UNEXPECTED_TOKEN, message + " but found '" + found.text() + "'", found);
            }
        }

        private void error(String code, String message, Token at) {
            errors.add(new EchoDiagnostic(code, message, at.location()));
        }

        private SourceLocation span(Token start, Token end) {
            return new SourceLocation(
                    start.startLine(),
                    start.startColumn(),
                    end.endLine(),
                    end.endColumn(),
                    source.substring(start.startOffset(), end.endOffset()));
        }
    }

    private record Branch(ConditionExpr condition, List<Node> body, SourceLocation location) {}

    private static Set<TokenType> union(Set<TokenType> a, Set<TokenType> b) {
        Set<TokenType> merged = EnumSet.noneOf(TokenType.class);
        merged.addAll(a);
        merged.addAll(b);
        return merged;
    }

    private static String label(Token token) {
        return token.type() == TokenType.ELSE_IF ? "ELSE IF" : "ELSE";
    }
}
