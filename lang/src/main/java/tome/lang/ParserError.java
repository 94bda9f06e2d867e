package tome.lang;

import java.util.Optional;

import lombok.NonNull;

/**
 * A syntax error. {@code sourceLine} is the text of the offending line when the parser was given
 * the source, and is used to render a caret excerpt.
 */
public record ParserError(@NonNull String message, int line, int column, String sourceLine) {

    public String render() {
        return "Parse Error at line " + line + ", column " + column + ": " + message
            + SourceExcerpt.render(sourceLine, column);
    }

    public Optional<String> excerpt() {
        return SourceExcerpt.excerpt(sourceLine, column);
    }

    @Override
    public String toString() {
        return message + " at line " + line + ", column " + column;
    }
}
