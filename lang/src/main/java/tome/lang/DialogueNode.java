package tome.lang;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

/** A named block of statements; the position is that of its identifier. */
public record DialogueNode(
    @NonNull String id,
    @NonNull ImmutableList<Statement> statements,
    int line,
    int column) {
}
