package tome.lang;

import java.util.Optional;

import com.google.common.base.Strings;

/** Renders a one-line, caret annotated excerpt of a source line. */
final class SourceExcerpt {

    private SourceExcerpt() {
    }

    static String lineOf(String source, int line) {
        if (source == null || line < 1) {
            return null;
        }
        var lines = source.split("\r\n|\r|\n", -1);
        return line <= lines.length ? lines[line - 1] : null;
    }

    /**
     * <pre>
     *   say "unterminated
     *       ^
     * </pre>
     */
    static String render(String sourceLine, int column) {
        return excerpt(sourceLine, column).map(e -> "\n\n" + e + "\n").orElse("");
    }

    /** The indented source line and its caret line, without surrounding blank lines. */
    static Optional<String> excerpt(String sourceLine, int column) {
        if (sourceLine == null) {
            return Optional.empty();
        }
        var trimmed = sourceLine.stripLeading();
        var indent = sourceLine.length() - trimmed.length();
        var caret = Math.max(1, column - indent);
        return Optional.of("  " + trimmed + "\n  " + Strings.repeat(" ", caret - 1) + "^");
    }
}
