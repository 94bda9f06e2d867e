package tome.lang;

import java.util.Locale;

import lombok.NonNull;

/** A finding that makes the script invalid. */
public record AnalysisError(
    @NonNull Type type,
    @NonNull String message,
    int line,
    int column,
    int endColumn,
    String node) implements Diagnostic {

    public enum Type {
        MISSING_NODE,
        DUPLICATE_NODE,
        INVALID_FUNCTION,
        INVALID_FUNCTION_ARGS,
        MISSING_ENTRY_POINT,
        EMPTY_NODE;

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
        return Severity.ERROR;
    }
}
