package tome.lang;

import java.util.Locale;

import lombok.NonNull;

/** A likely mistake that does not make the script invalid. */
public record AnalysisWarning(
    @NonNull Type type,
    @NonNull String message,
    int line,
    int column,
    int endColumn,
    String node) implements Diagnostic {

    public enum Type {
        UNREACHABLE_NODE,
        DEAD_END,
        UNDEFINED_VARIABLE,
        CIRCULAR_REFERENCE,
        TYPE_MISMATCH,
        SUSPICIOUS_CONDITION,
        IDENTICAL_CHOICE;

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
        return Severity.WARNING;
    }
}
