package tome.lang;

import lombok.NonNull;

/** An expression spliced into a say text over the character range {@code [start, end)}. */
public record Interpolation(@NonNull Expression expression, int start, int end) {

    static final String PLACEHOLDER = "#{...}";
}
