package tome.lang;

import java.util.Locale;

import lombok.NonNull;

/** Advice; {@code fix} optionally describes how to act on it. */
public record AnalysisSuggestion(
    @NonNull Type type,
    @NonNull String message,
    int line,
    int column,
    int endColumn,
    String node,
    String fix) implements Diagnostic {

    public enum Type {
        UNUSED_VARIABLE;

        public String tag() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    @Override
    public String tag() {
        return type.tag();
    }

    @Override
    public Severity severity() {
        return Severity.INFO;
    }
}
