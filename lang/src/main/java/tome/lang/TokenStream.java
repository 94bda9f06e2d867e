package tome.lang;

import static tome.lang.Token.Type.EOF;

import java.util.Iterator;

import lombok.NonNull;

/**
 * Pulls tokens from a lazy source keeping exactly two of them buffered, {@code current} and
 * {@code next}, which gives the parser one token of lookahead. Once the source is exhausted
 * every further read yields {@code EOF}.
 */
public final class TokenStream {

    private final @NonNull Iterator<Token> source;

    private Token current;
    private Token next;
    private Token previous = null;

    public TokenStream(@NonNull Iterator<Token> source) {
        this.source = source;
        this.current = pull(null);
        this.next = pull(current);
    }

    public Token previous() {
        return previous != null ? previous : current;
    }

    public boolean isAtEnd() {
        return current.type() == EOF;
    }

    public Token peek() {
        return current;
    }

    public Token peekNext() {
        return next;
    }

    public Token advance() {
        previous = current;
        if (!isAtEnd()) {
            current = next;
            next = pull(current);
        }
        return previous;
    }

    private Token pull(Token last) {
        if (last != null && last.type() == EOF) {
            return last;
        }
        if (source.hasNext()) {
            return source.next();
        }
        var line = last != null ? last.line() : 1;
        var column = last != null ? last.endColumn() : 1;
        return new Token(EOF, "EOF", line, column, column);
    }
}
