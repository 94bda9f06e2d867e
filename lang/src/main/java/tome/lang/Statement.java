package tome.lang;

import java.util.Optional;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

public sealed interface Statement {

    int line();

    int column();

    <R> R accept(Visitor<R> visitor);

    /** {@code @variable op value}; the position is that of the variable name. */
    record Assignment(
        @NonNull String variable,
        @NonNull String operator,
        @NonNull Expression value,
        int line,
        int column) implements Statement {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignmentStatement(this);
        }
    }

    /**
     * A line of dialogue. Each interpolation's expression was lifted out of {@code text}, which
     * holds the placeholder {@code #{...}} at the interpolation's range instead.
     */
    record Say(
        @NonNull String text,
        @NonNull ImmutableList<Interpolation> interpolations,
        int line,
        int column) implements Statement {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSayStatement(this);
        }
    }

    /**
     * A player-facing option. {@code line}/{@code column} locate the {@code :} before the target,
     * {@code textLine}/{@code textColumn} the choice text.
     */
    record Choice(
        @NonNull String text,
        @NonNull String target,
        Expression condition,
        int line,
        int column,
        int textLine,
        int textColumn) implements Statement {

        public Optional<Expression> getCondition() {
            return Optional.ofNullable(condition);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitChoiceStatement(this);
        }
    }

    /** An unconditional jump; the position is that of the {@code :} before the target. */
    record Goto(@NonNull String target, int line, int column) implements Statement {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGotoStatement(this);
        }
    }

    interface Visitor<R> {
        R visitAssignmentStatement(Assignment statement);
        R visitSayStatement(Say statement);
        R visitChoiceStatement(Choice statement);
        R visitGotoStatement(Goto statement);
    }
}
