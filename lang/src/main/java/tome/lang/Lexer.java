package tome.lang;

import static java.util.Map.entry;
import static tome.lang.Token.Type.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Single forward scan over a tome script.
 *
 * <p>Indentation is measured at the start of every logical line against a stack of levels
 * starting at {@code [0]}: a deeper line emits one {@code INDENT}, a shallower line emits one
 * {@code DEDENT} per popped level. Blank and comment-only lines never touch the stack. At the end
 * of input every open level is closed with a synthetic {@code DEDENT} before {@code EOF}.
 *
 * <p>Inside double quotes the lexer switches to string mode, emitting {@code STRING} runs and
 * bracketing each {@code #{ ... }} span with {@code INTERPOLATION_START}/{@code INTERPOLATION_END};
 * the span itself is scanned in default mode.
 *
 * <p>A lexer is good for exactly one pass, either {@link #lex()} or {@link #tokenize()}.
 */
@RequiredArgsConstructor
public final class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, Token.Type> keywords = Map.ofEntries(
        entry("node", NODE),
        entry("say", SAY),
        entry("choice", CHOICE),
        entry("goto", GOTO),
        entry("if", IF),
        entry("end", END),
        entry("true", TRUE),
        entry("false", FALSE));

    private static final Map<String, Token.Type> operators = Map.ofEntries(
        entry("==", EQUALS_EQUALS),
        entry("!=", NOT_EQUALS),
        entry(">=", GREATER_EQUALS),
        entry("<=", LESS_EQUALS),
        entry("&&", AND),
        entry("||", OR),
        entry("+=", PLUS_EQUALS),
        entry("-=", MINUS_EQUALS),
        entry("*=", STAR_EQUALS),
        entry("/=", SLASH_EQUALS),
        entry("=", EQUALS),
        entry("+", PLUS),
        entry("-", MINUS),
        entry("*", STAR),
        entry("/", SLASH),
        entry(">", GREATER),
        entry("<", LESS),
        entry("!", NOT),
        entry("@", AT_SIGN),
        entry(":", COLON),
        entry(",", COMMA),
        entry("(", LEFT_PAREN),
        entry(")", RIGHT_PAREN));

    private static final String OPERATOR_START = "=!<>&|+-*/@:,()";

    private enum Mode { STRING, INTERPOLATION }

    /** An open string literal or interpolation span. */
    private static final class Frame {
        final Mode mode;
        final int line;
        final int column;
        int parts = 0;

        Frame(Mode mode, int line, int column) {
            this.mode = mode;
            this.line = line;
            this.column = column;
        }
    }

    private final @NonNull String source;

    private final List<Integer> indentStack = new ArrayList<>(List.of(0));
    private final Deque<Frame> frames = new ArrayDeque<>();
    private final Deque<Token> pending = new ArrayDeque<>();
    private final List<LexError> errors = new ArrayList<>();

    private int current = 0;
    private int line = 1;
    private int column = 1;

    private char indentChar = 0;
    private boolean atLineStart = true;
    private boolean started = false;
    private boolean finished = false;
    private boolean failFast = true;

    /**
     * Tokenizes the whole source, collecting every lexical error instead of stopping at the
     * first. Never throws for malformed input.
     */
    public LexResult lex() {
        begin(false);
        var tokens = ImmutableList.<Token>builder();
        while (hasNextToken()) {
            tokens.add(pending.removeFirst());
        }
        var result = LexResult.of(tokens.build(), ImmutableList.copyOf(errors));
        LOG.debug("lexed {} tokens with {} errors", result.tokens().size(), errors.size());
        return result;
    }

    /**
     * Lazily tokenizes the source. The returned iterator throws {@link LexerException} on the
     * first lexical error.
     */
    public Iterator<Token> tokenize() {
        begin(true);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return hasNextToken();
            }

            @Override
            public Token next() {
                if (!hasNextToken()) {
                    throw new NoSuchElementException();
                }
                return pending.removeFirst();
            }
        };
    }

    private void begin(boolean failFast) {
        if (started) {
            throw new IllegalStateException("lexer has already been used");
        }
        started = true;
        this.failFast = failFast;
        skipLeadingBlankLines();
    }

    private boolean hasNextToken() {
        while (pending.isEmpty() && !finished) {
            scanToken();
        }
        return !pending.isEmpty();
    }

    private void scanToken() {
        if (isAtEnd()) {
            finish();
            return;
        }

        var frame = frames.peek();
        if (frame != null && frame.mode == Mode.STRING) {
            stringContent(frame);
            return;
        }

        var c = peek();
        if (c == '}' && frame != null) {
            frames.pop();
            var startColumn = column;
            advance();
            addToken(INTERPOLATION_END, "}", line, startColumn);
            return;
        }

        if (isNewline(c)) {
            newline();
            return;
        }

        if (atLineStart) {
            indentation();
            return;
        }

        switch (c) {
        case ' ':
        case '\t':
            advance();
            break;
        case '#':
            skipToEndOfLine();
            break;
        case '"':
            frames.push(new Frame(Mode.STRING, line, column));
            advance();
            break;
        default:
            if (isDigit(c)) {
                number();
            } else if (isAlpha(c)) {
                identifier();
            } else if (OPERATOR_START.indexOf(c) >= 0) {
                operator();
            } else {
                error("Unexpected character: '" + c + "'", line, column);
                advance();
            }
        }
    }

    private void newline() {
        var startColumn = column;
        if (advance() == '\r') {
            match('\n');
        }
        addToken(NEWLINE, "\n", line, startColumn);
        line++;
        column = 1;
        atLineStart = true;
    }

    private void indentation() {
        var startLine = line;
        var startColumn = column;

        var end = current;
        while (end < source.length() && isIndent(source.charAt(end))) {
            end++;
        }

        // blank and comment-only lines are not logical lines
        if (end >= source.length() || isNewline(source.charAt(end)) || source.charAt(end) == '#') {
            while (current < end) {
                advance();
            }
            skipToEndOfLine();
            return;
        }

        var spaces = 0;
        var tabs = 0;
        while (current < end) {
            if (advance() == ' ') {
                spaces++;
            } else {
                tabs++;
            }
        }
        atLineStart = false;

        if (spaces > 0 && tabs > 0) {
            error("Mixed indentation (spaces + tabs) detected", startLine, startColumn);
        }
        var used = spaces > 0 ? ' ' : tabs > 0 ? '\t' : 0;
        if (used != 0) {
            if (indentChar == 0) {
                indentChar = (char) used;
            } else if (used != indentChar) {
                error("Inconsistent indentation character", startLine, startColumn);
            }
        }

        var level = spaces + tabs;
        var top = indentStack.get(indentStack.size() - 1);
        if (level > top) {
            indentStack.add(level);
            addToken(INDENT, level, startLine, startColumn);
        } else if (level < top) {
            while (indentStack.size() > 1 && indentStack.get(indentStack.size() - 1) > level) {
                var popped = indentStack.remove(indentStack.size() - 1);
                addToken(DEDENT, popped, startLine, startColumn);
            }
            if (indentStack.get(indentStack.size() - 1) != level) {
                error("Invalid dedentation level", startLine, column);
            }
        }
    }

    private void stringContent(Frame frame) {
        var c = peek();
        if (c == '"') {
            frames.pop();
            if (frame.parts == 0) {
                addToken(STRING, "", frame.line, frame.column + 1);
            }
            advance();
            return;
        }
        if (c == '#' && peekNext() == '{') {
            var startColumn = column;
            advance();
            advance();
            frame.parts++;
            addToken(INTERPOLATION_START, "#{", line, startColumn);
            frames.push(new Frame(Mode.INTERPOLATION, line, startColumn));
            return;
        }

        var startLine = line;
        var startColumn = column;
        var value = new StringBuilder();
        while (!isAtEnd() && peek() != '"' && !(peek() == '#' && peekNext() == '{')) {
            var ch = advance();
            if (ch == '\\' && !isAtEnd()) {
                var escaped = advance();
                switch (escaped) {
                case 'n':
                    value.append('\n');
                    break;
                case 't':
                    value.append('\t');
                    break;
                case 'r':
                    value.append('\r');
                    break;
                case '"':
                case '\\':
                    value.append(escaped);
                    break;
                default:
                    // unrecognized escapes are kept verbatim
                    value.append('\\').append(escaped);
                    if (isNewline(escaped)) {
                        nextLine(escaped);
                    }
                }
            } else if (isNewline(ch)) {
                value.append(ch);
                if (ch == '\r' && match('\n')) {
                    value.append('\n');
                }
                line++;
                column = 1;
            } else {
                value.append(ch);
            }
        }
        frame.parts++;
        addToken(STRING, value.toString(), startLine, startColumn);
    }

    private void nextLine(char newline) {
        if (newline == '\r') {
            match('\n');
        }
        line++;
        column = 1;
    }

    private void number() {
        var startColumn = column;
        var start = current;
        while (isDigit(peek())) {
            advance();
        }
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) {
                advance();
            }
        }
        addToken(NUMBER, Double.valueOf(source.substring(start, current)), line, startColumn);
    }

    private void identifier() {
        var startColumn = column;
        var start = current;
        while (isAlphaNumeric(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        addToken(keywords.getOrDefault(text, IDENTIFIER), text, line, startColumn);
    }

    private void operator() {
        var startColumn = column;
        var first = String.valueOf(advance());
        var pair = first + peek();
        if (!isAtEnd() && operators.containsKey(pair)) {
            advance();
            addToken(operators.get(pair), pair, line, startColumn);
        } else if (operators.containsKey(first)) {
            addToken(operators.get(first), first, line, startColumn);
        } else {
            error("Unknown operator or symbol: '" + first + "'", line, startColumn);
        }
    }

    private void finish() {
        for (var frame : frames) {
            if (frame.mode == Mode.STRING) {
                error("Unterminated string at end of file", frame.line, frame.column);
            } else {
                error("Unterminated interpolation block at end of file", frame.line, frame.column);
            }
        }
        frames.clear();

        while (indentStack.size() > 1) {
            var popped = indentStack.remove(indentStack.size() - 1);
            addToken(DEDENT, popped, line, column);
        }
        addToken(EOF, "EOF", line, column);
        finished = true;
    }

    private void skipLeadingBlankLines() {
        var lineStart = current;
        while (!isAtEnd()) {
            var c = peek();
            if (isIndent(c)) {
                advance();
            } else if (isNewline(c)) {
                nextLine(advance());
                lineStart = current;
            } else {
                break;
            }
        }
        // the first logical line keeps its indentation
        current = lineStart;
        column = 1;
    }

    private void skipToEndOfLine() {
        while (!isAtEnd() && !isNewline(peek())) {
            advance();
        }
    }

    private static boolean isIndent(char c) {
        return c == ' ' || c == '\t';
    }

    private static boolean isNewline(char c) {
        return c == '\n' || c == '\r';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        column++;
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private void addToken(Token.Type type, Object value, int tokenLine, int tokenColumn) {
        var endColumn = tokenLine == line ? Math.max(column, tokenColumn) : column;
        pending.addLast(new Token(type, value, tokenLine, tokenColumn, endColumn));
    }

    private void error(String message, int errorLine, int errorColumn) {
        var error = new LexError(message, errorLine, errorColumn);
        if (failFast) {
            throw new LexerException(error);
        }
        errors.add(error);
    }
}
