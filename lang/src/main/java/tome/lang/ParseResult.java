package tome.lang;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

/** {@code value} is non-null exactly when {@code valid}. */
public record ParseResult(boolean valid, Program value, @NonNull ImmutableList<ParserError> errors) {

    public Optional<Program> program() {
        return Optional.ofNullable(value);
    }
}
