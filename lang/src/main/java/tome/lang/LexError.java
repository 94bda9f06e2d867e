package tome.lang;

import java.util.Optional;

import lombok.NonNull;

/** A lexical error at a 1-based source position. */
public record LexError(@NonNull String message, int line, int column) {

    /** Formats the error with a caret excerpt taken from {@code source}, when given. */
    public String render(String source) {
        return "Lexical Error at line " + line + ", column " + column + ": " + message
            + SourceExcerpt.render(SourceExcerpt.lineOf(source, line), column);
    }

    /** The offending line of {@code source} with a caret under the error column. */
    public Optional<String> excerpt(String source) {
        return SourceExcerpt.excerpt(SourceExcerpt.lineOf(source, line), column);
    }

    @Override
    public String toString() {
        return message + " at line " + line + ", column " + column;
    }
}
