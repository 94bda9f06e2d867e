package tome.lang;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

/**
 * Outcome of {@link Lexer#lex()}: either the complete token list or the lexical errors, never
 * both.
 */
public record LexResult(
    boolean valid,
    @NonNull ImmutableList<LexError> errors,
    @NonNull ImmutableList<Token> tokens) {

    static LexResult of(ImmutableList<Token> tokens, ImmutableList<LexError> errors) {
        if (errors.isEmpty()) {
            return new LexResult(true, errors, tokens);
        }
        return new LexResult(false, errors, ImmutableList.of());
    }
}
