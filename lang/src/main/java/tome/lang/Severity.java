package tome.lang;

import java.util.Locale;

/** Diagnostic severities, most severe first. */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Whether a diagnostic of this severity passes a {@code minimum} severity filter. */
    public boolean isAtLeast(Severity minimum) {
        return ordinal() <= minimum.ordinal();
    }

    public static Severity fromLabel(String label) {
        for (var severity : values()) {
            if (severity.label.equals(label.toLowerCase(Locale.ROOT))) {
                return severity;
            }
        }
        throw new IllegalArgumentException("unknown severity: " + label);
    }
}
