package tome.lang;

import com.google.common.collect.ImmutableList;

import lombok.NonNull;

/**
 * Expression tree. Every expression spans {@code [column, endColumn)} on {@code line}, the line of
 * its first token.
 */
public sealed interface Expression {

    int line();

    int column();

    int endColumn();

    <R> R accept(Visitor<R> visitor);

    /** A number ({@link Double}), string or boolean constant. */
    record Literal(@NonNull Object value, int line, int column, int endColumn) implements Expression {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteralExpression(this);
        }
    }

    /** A read of {@code @name}; the position is that of the {@code @}. */
    record Variable(@NonNull String name, int line, int column, int endColumn) implements Expression {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariableExpression(this);
        }
    }

    record BinaryOp(
        @NonNull String operator,
        @NonNull Expression left,
        @NonNull Expression right,
        int line,
        int column,
        int endColumn) implements Expression {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryOpExpression(this);
        }
    }

    record UnaryOp(
        @NonNull String operator,
        @NonNull Expression operand,
        int line,
        int column,
        int endColumn) implements Expression {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryOpExpression(this);
        }
    }

    record FunctionCall(
        @NonNull String name,
        @NonNull ImmutableList<Expression> args,
        int line,
        int column,
        int endColumn) implements Expression {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCallExpression(this);
        }
    }

    interface Visitor<R> {
        R visitLiteralExpression(Literal expression);
        R visitVariableExpression(Variable expression);
        R visitBinaryOpExpression(BinaryOp expression);
        R visitUnaryOpExpression(UnaryOp expression);
        R visitFunctionCallExpression(FunctionCall expression);
    }
}
