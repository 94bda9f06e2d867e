package tome.lang;

import java.math.BigDecimal;

/**
 * Value helpers shared by the printer and the analyzer's constant folding. Literal values are
 * {@link Double}, {@link String} or {@link Boolean}.
 */
final class Literals {

    private Literals() {
    }

    /** Shortest plain decimal form, never exponent notation, so the lexer reads it back. */
    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    static boolean isTruthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Double d) {
            return d != 0 && !d.isNaN();
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return value != null;
    }

    static double toNumber(Object value) {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1 : 0;
        }
        if (value instanceof String s) {
            var trimmed = s.strip();
            if (trimmed.isEmpty()) {
                return 0;
            }
            try {
                return Double.parseDouble(trimmed);
            } catch (NumberFormatException ex) {
                return Double.NaN;
            }
        }
        return Double.NaN;
    }

    /** Equality with coercion between numbers, numeric strings and booleans, so {@code "1" == 1}. */
    static boolean looseEquals(Object left, Object right) {
        if (left instanceof String && right instanceof String) {
            return left.equals(right);
        }
        if (left instanceof Boolean && right instanceof Boolean) {
            return left.equals(right);
        }
        return toNumber(left) == toNumber(right);
    }

    /**
     * Relational comparison: two strings compare lexicographically, anything else numerically.
     * Returns {@code null} when the comparison is undefined (a NaN operand).
     */
    static Integer compare(Object left, Object right) {
        if (left instanceof String l && right instanceof String r) {
            return Integer.signum(l.compareTo(r));
        }
        var l = toNumber(left);
        var r = toNumber(right);
        if (Double.isNaN(l) || Double.isNaN(r)) {
            return null;
        }
        return Double.compare(l, r);
    }
}
