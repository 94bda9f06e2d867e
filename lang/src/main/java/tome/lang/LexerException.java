package tome.lang;

import lombok.Getter;

/** Raised by the streaming form of the {@link Lexer} on the first lexical error. */
public class LexerException extends RuntimeException {
    @Getter
    private final LexError error;

    LexerException(LexError error) {
        super(error.toString());
        this.error = error;
    }
}
