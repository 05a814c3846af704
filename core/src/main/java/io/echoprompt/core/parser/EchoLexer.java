package io.echoprompt.core.parser;

import io.echoprompt.core.model.EchoDiagnostic;
import io.echoprompt.core.model.SourceLocation;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts template text into tokens using an explicit stack of
 * {@link LexerMode}s.
 *
 * <p>
 * In {@link LexerMode#DEFAULT} mode everything up to the next reserved opening
 * sequence is literal text, whitespace included. An opening sequence pushes the
 * mode that knows how to read what follows, and the matching closing token pops
 * it again, so a {@code {{...}}} reference nested inside a directive is
 * recognised the same way as one in plain text. A lone {@code [} or {@code {}
 * that does not start a reserved sequence stays ordinary text.
 *
 * <p>
 * Lex errors are collected rather than thrown. Any error makes the token stream
 * unusable for parsing; modes still open at the end of input are reported at
 * the location of the token that opened them.
 *
 * <p>
 * Instances are single-use; call {@link #tokenize(String)}.
 */
public final class EchoLexer {

    private static final Pattern NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<EchoDiagnostic> errors = new ArrayList<>();
    private final Deque<Frame> modes = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int column = 1;
    private int lastLine = 1;
    private int lastColumn = 1;

    /** An open mode together with the token that opened it, for error reporting. */
    private record Frame(LexerMode mode, Token opener) {}

    /** A reserved opening sequence found in default mode. */
    private record Opening(TokenType type, int length, LexerMode push) {}

    private EchoLexer(String source) {
        this.source = source;
    }

    /** Tokenizes {@code source}. Never throws for malformed input; see {@link LexResult#errors()}. */
    public static LexResult tokenize(String source) {
        Objects.requireNonNull(source, "source must not be null");
        return new EchoLexer(source).run();
    }

    private LexResult run() {
        boolean reachedEnd = true;
        while (pos < source.length()) {
            boolean keepGoing =
                    switch (currentMode()) {
                        case DEFAULT -> lexDefault();
                        case DIRECTIVE -> lexDirective();
                        case VARIABLE -> lexVariable();
                        case OPERATOR_ARG -> lexArgument();
                    };
            if (!keepGoing) {
                reachedEnd = false;
                break;
            }
        }
        if (reachedEnd) {
            for (Frame frame : modes) {
                errors.add(unterminated(frame));
            }
        }
        return new LexResult(tokens, errors);
    }

    private LexerMode currentMode() {
        return modes.isEmpty() ? LexerMode.DEFAULT : modes.peek().mode();
    }

    // --- default mode ---

    private boolean lexDefault() {
        Opening opening = openingAt(pos);
        if (opening != null) {
            Token token = consume(opening.type(), opening.length());
            if (opening.push() != null) {
                modes.push(new Frame(opening.push(), token));
            }
            return true;
        }
        int startOffset = pos;
        int startLine = line;
        int startColumn = column;
        while (pos < source.length() && openingAt(pos) == null) {
            advance();
        }
        emit(TokenType.TEXT, startOffset, startLine, startColumn);
        return true;
    }

    private Opening openingAt(int i) {
        char c = source.charAt(i);
        if (c == '{') {
            return source.startsWith("{{", i) ? new Opening(TokenType.VARIABLE_OPEN, 2, LexerMode.VARIABLE) : null;
        }
        if (c == '#') {
            return source.startsWith("#context(", i)
                    ? new Opening(TokenType.CONTEXT_OPEN, 9, LexerMode.OPERATOR_ARG)
                    : null;
        }
        if (c != '[') {
            return null;
        }
        if (source.startsWith("[#", i)) {
            Opening directive = keyword(i, "[#IF", TokenType.IF_OPEN);
            if (directive == null) {
                directive = keyword(i, "[#SECTION", TokenType.SECTION_OPEN);
            }
            if (directive == null) {
                directive = keyword(i, "[#IMPORT", TokenType.IMPORT);
            }
            if (directive == null) {
                directive = keyword(i, "[#INCLUDE", TokenType.INCLUDE);
            }
            return directive;
        }
        if (source.startsWith("[ELSE]", i)) {
            return new Opening(TokenType.ELSE, 6, null);
        }
        if (source.startsWith("[END IF]", i)) {
            return new Opening(TokenType.END_IF, 8, null);
        }
        if (source.startsWith("[END SECTION]", i)) {
            return new Opening(TokenType.END_SECTION, 13, null);
        }
        if (source.startsWith("[ELSE", i)) {
            int j = i + 5;
            while (j < source.length() && isBlank(source.charAt(j))) {
                j++;
            }
            if (j > i + 5 && source.startsWith("IF", j) && isKeywordBoundary(j + 2)) {
                return new Opening(TokenType.ELSE_IF, j + 2 - i, LexerMode.DIRECTIVE);
            }
        }
        return null;
    }

    private Opening keyword(int i, String keyword, TokenType type) {
        if (source.startsWith(keyword, i) && isKeywordBoundary(i + keyword.length())) {
            return new Opening(type, keyword.length(), LexerMode.DIRECTIVE);
        }
        return null;
    }

    private boolean isKeywordBoundary(int j) {
        return j >= source.length() || Character.isWhitespace(source.charAt(j)) || source.charAt(j) == ']';
    }

    // --- directive mode ---

    private boolean lexDirective() {
        skipWhitespace();
        if (pos >= source.length()) {
            return true;
        }
        char c = source.charAt(pos);
        if (c == ']') {
            consume(TokenType.CLOSE_BRACKET, 1);
            modes.pop();
        } else if (source.startsWith("{{", pos)) {
            Token open = consume(TokenType.VARIABLE_OPEN, 2);
            modes.push(new Frame(LexerMode.VARIABLE, open));
        } else if (c == '#' && pos + 1 < source.length() && isNameStart(source.charAt(pos + 1))) {
            int length = 2;
            while (pos + length < source.length() && isNamePart(source.charAt(pos + length))) {
                length++;
            }
            consume(TokenType.OPERATOR, length);
        } else if (c == '(') {
            Token open = consume(TokenType.LPAREN, 1);
            modes.push(new Frame(LexerMode.OPERATOR_ARG, open));
        } else if (c == '=') {
            consume(TokenType.EQUALS, 1);
        } else if (c == '"' || c == '\'') {
            return lexString();
        } else if (isDirectiveWordPart(c)) {
            int length = 1;
            while (pos + length < source.length() && isDirectiveWordPart(source.charAt(pos + length))) {
                length++;
            }
            String word = source.substring(pos, pos + length);
            consume(NUMBER.matcher(word).matches() ? TokenType.NUMBER : TokenType.IDENTIFIER, length);
        } else {
            unexpected(c);
        }
        return true;
    }

    // --- variable mode ---

    private boolean lexVariable() {
        skipWhitespace();
        if (pos >= source.length()) {
            return true;
        }
        char c = source.charAt(pos);
        if (source.startsWith("}}", pos)) {
            consume(TokenType.VARIABLE_CLOSE, 2);
            modes.pop();
        } else if (source.startsWith("??", pos)) {
            consume(TokenType.DEFAULT_OP, 2);
        } else if (c == '"' || c == '\'') {
            return lexString();
        } else if (isPathStart(c)) {
            int length = 1;
            while (pos + length < source.length() && isPathPart(source.charAt(pos + length))) {
                length++;
            }
            consume(TokenType.IDENTIFIER, length);
        } else if (Character.isDigit(c)
                || (c == '-' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
            var matcher = NUMBER.matcher(source).region(pos, source.length());
            matcher.lookingAt();
            consume(TokenType.NUMBER, matcher.end() - pos);
        } else {
            unexpected(c);
        }
        return true;
    }

    // --- operator argument mode ---

    /**
     * Captures free-form text up to the matching {@code )}. Nested parentheses
     * are balanced, and a quote opening an argument item (at the start or after
     * a comma) protects its content, so {@code "a)b"} stays one argument while
     * {@code Shimon's} needs no escaping.
     */
    private boolean lexArgument() {
        int startOffset = pos;
        int startLine = line;
        int startColumn = column;
        int depth = 0;
        char quote = 0;
        boolean itemStart = true;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                }
            } else if ((c == '"' || c == '\'') && itemStart) {
                quote = c;
                itemStart = false;
            } else if (c == '(') {
                depth++;
                itemStart = false;
            } else if (c == ')') {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (c == ',') {
                itemStart = true;
            } else if (!Character.isWhitespace(c)) {
                itemStart = false;
            }
            advance();
        }
        if (pos >= source.length()) {
            return true;
        }
        if (pos > startOffset) {
            emit(TokenType.ARG_TEXT, startOffset, startLine, startColumn);
        }
        consume(TokenType.RPAREN, 1);
        modes.pop();
        return true;
    }

    // --- shared ---

    private boolean lexString() {
        char quote = source.charAt(pos);
        int end = source.indexOf(quote, pos + 1);
        if (end < 0) {
            errors.add(new EchoDiagnostic(
                    EchoDiagnostic.UNTERMINATED_STRING,
                    "Unterminated string literal starting with " + quote,
                    new SourceLocation(line, column, line, column, source.substring(pos))));
            return false;
        }
        consume(TokenType.STRING, end + 1 - pos);
        return true;
    }

    private void unexpected(char c) {
        errors.add(new EchoDiagnostic(
                EchoDiagnostic.UNEXPECTED_CHARACTER,
                "Unexpected character '" + c + "' inside " + describe(currentMode()),
                new SourceLocation(line, column, line, column, String.valueOf(c))));
        advance();
    }

    private EchoDiagnostic unterminated(Frame frame) {
        Token opener = frame.opener();
        return switch (frame.mode()) {
            case VARIABLE -> new EchoDiagnostic(
                    EchoDiagnostic.UNTERMINATED_VARIABLE,
                    "Unclosed variable reference: expected '}}' to close '{{'",
                    opener.location());
            case DIRECTIVE -> new EchoDiagnostic(
                    EchoDiagnostic.UNTERMINATED_DIRECTIVE,
                    "Unclosed directive: expected ']' to close '" + opener.text() + "'",
                    opener.location());
            case OPERATOR_ARG, DEFAULT -> new EchoDiagnostic(
                    EchoDiagnostic.UNTERMINATED_ARGUMENT,
                    "Unclosed argument: expected ')' to close '" + opener.text() + "'",
                    opener.location());
        };
    }

    private static String describe(LexerMode mode) {
        return switch (mode) {
            case DIRECTIVE -> "directive";
            case VARIABLE -> "variable reference";
            case OPERATOR_ARG -> "operator argument";
            case DEFAULT -> "text";
        };
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            advance();
        }
    }

    private Token consume(TokenType type, int length) {
        int startOffset = pos;
        int startLine = line;
        int startColumn = column;
        for (int k = 0; k < length; k++) {
            advance();
        }
        return emit(type, startOffset, startLine, startColumn);
    }

    private Token emit(TokenType type, int startOffset, int startLine, int startColumn) {
        Token token = new Token(
                type, source.substring(startOffset, pos), startLine, startColumn, lastLine, lastColumn, startOffset, pos);
        tokens.add(token);
        return token;
    }

    private void advance() {
        lastLine = line;
        lastColumn = column;
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isNamePart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDirectiveWordPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '/' || c == '-';
    }

    private static boolean isPathStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isPathPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '[' || c == ']' || c == '-';
    }
}
