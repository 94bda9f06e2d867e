package tome.lang;

import lombok.NonNull;

/**
 * A single lexeme produced by the {@link Lexer}.
 *
 * <p>{@code value} is the decoded text of the token, except for {@link Type#NUMBER} where it is a
 * {@link Double}, and {@link Type#INDENT}/{@link Type#DEDENT} where it is the {@link Integer}
 * indentation level. Positions are 1-based; {@code endColumn} is exclusive.
 */
public record Token(
    @NonNull Type type,
    @NonNull Object value,
    int line,
    int column,
    int endColumn) {

    public String text() {
        return String.valueOf(value);
    }

    public double number() {
        return ((Number) value).doubleValue();
    }

    /** Human readable form of the token for use in error messages. */
    public String describe() {
        switch (type) {
        case NEWLINE:
            return "newline";
        case INDENT:
            return "indent";
        case DEDENT:
            return "dedent";
        case EOF:
            return "end of file";
        case NUMBER:
            return Literals.formatNumber(number());
        default:
            return text();
        }
    }

    public boolean isKeyword() {
        return type.keyword;
    }

    @Override
    public String toString() {
        return "(Token " + type + " \"" + describe() + "\" " + line + ":" + column + ")";
    }

    public enum Type {
        // keywords
        NODE("node", true),
        SAY("say", true),
        CHOICE("choice", true),
        GOTO("goto", true),
        IF("if", true),
        END("end", true),

        // literals
        IDENTIFIER,
        NUMBER,
        STRING,
        TRUE("true", true),
        FALSE("false", true),

        // symbols
        AT_SIGN("@"),
        COLON(":"),
        COMMA(","),
        LEFT_PAREN("("),
        RIGHT_PAREN(")"),

        // assignment
        EQUALS("="),
        PLUS_EQUALS("+="),
        MINUS_EQUALS("-="),
        STAR_EQUALS("*="),
        SLASH_EQUALS("/="),

        // comparison
        EQUALS_EQUALS("=="),
        NOT_EQUALS("!="),
        GREATER(">"),
        GREATER_EQUALS(">="),
        LESS("<"),
        LESS_EQUALS("<="),

        // logical
        AND("&&"),
        OR("||"),
        NOT("!"),

        // arithmetic
        PLUS("+"),
        MINUS("-"),
        STAR("*"),
        SLASH("/"),

        // string interpolation
        INTERPOLATION_START("#{"),
        INTERPOLATION_END("}"),

        // structure
        NEWLINE,
        INDENT,
        DEDENT,
        EOF;

        private final String lexeme;
        private final boolean keyword;

        Type() {
            this(null, false);
        }

        Type(String lexeme) {
            this(lexeme, false);
        }

        Type(String lexeme, boolean keyword) {
            this.lexeme = lexeme;
            this.keyword = keyword;
        }

        /** The fixed spelling of this token type, or {@code null} when it has none. */
        public String lexeme() {
            return lexeme;
        }

        public boolean isAssignment() {
            return this == EQUALS
                || this == PLUS_EQUALS
                || this == MINUS_EQUALS
                || this == STAR_EQUALS
                || this == SLASH_EQUALS;
        }

        @Override
        public String toString() {
            return lexeme != null ? name() + "(" + lexeme + ")" : name();
        }
    }
}
