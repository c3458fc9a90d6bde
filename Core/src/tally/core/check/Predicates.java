package tally.core.check;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;

/**
 * The fixed set of pure predicates that checks are built on.
 *
 * Operands of any type are accepted. Numbers are compared by numeric value regardless of their boxed type, so
 * {@code equal(2, 2L)} holds. A NaN operand makes every ordering and closeness predicate false, while
 * {@code differ} against NaN is true. Arrays are compared by content. Anything else is compared with
 * {@link Object#equals(Object)} and, for orderings, {@link Comparable}.
 */
public final class Predicates {

    private Predicates() {}

    public static boolean equal(Object x, Object y) {
        if (x instanceof Number && y instanceof Number) {
            Integer comparison = compareNumbers((Number) x, (Number) y);
            return comparison != null && comparison == 0;
        }
        if (x != null && y != null && x.getClass().isArray() && y.getClass().isArray()) {
            return Arrays.deepEquals(new Object[]{ x }, new Object[]{ y });
        }
        return Objects.equals(x, y);
    }

    public static boolean differ(Object x, Object y) {
        return !equal(x, y);
    }

    /**
     * Returns true iff {@code y - x} lies strictly inside {@code (-delta, +delta)}. The bounds are excluded.
     */
    public static boolean close(Number x, Number y, Number delta) {
        if (x == null || y == null || delta == null) {
            return false;
        }
        double difference = y.doubleValue() - x.doubleValue();
        double d = delta.doubleValue();
        return (difference < d) && (difference > -d);
    }

    public static boolean less(Object x, Object y) {
        Integer comparison = compare(x, y);
        return comparison != null && comparison < 0;
    }

    public static boolean lessOrEqual(Object x, Object y) {
        Integer comparison = compare(x, y);
        return comparison != null && comparison <= 0;
    }

    public static boolean more(Object x, Object y) {
        Integer comparison = compare(x, y);
        return comparison != null && comparison > 0;
    }

    public static boolean moreOrEqual(Object x, Object y) {
        Integer comparison = compare(x, y);
        return comparison != null && comparison >= 0;
    }

    /**
     * Returns true if the first {@code size} bytes of {@code x} and {@code y} are the same.
     *
     * A size of zero is always true, as is passing the same array twice. If exactly one array is null and the size is
     * positive the result is false. No bytes are read in any of these cases.
     *
     * @throws IllegalArgumentException if size is negative, or larger than either of two distinct non-null arrays.
     */
    public static boolean sameData(byte[] x, byte[] y, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be non-negative but was: " + size);
        }
        if (size == 0) {
            return true;
        }
        if (x == y) {
            return true;
        }
        if (x == null || y == null) {
            return false;
        }
        if (size > x.length || size > y.length) {
            throw new IllegalArgumentException("size " + size + " exceeds the length of the data.");
        }
        for (int i = 0; i < size; i++) {
            if (x[i] != y[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the sign of comparing x to y, or null if the two cannot be ordered (a null operand, a NaN, or
     * incomparable types).
     */
    private static Integer compare(Object x, Object y) {
        if (x == null || y == null) {
            return null;
        }
        if (x instanceof Number && y instanceof Number) {
            return compareNumbers((Number) x, (Number) y);
        }
        boolean relatedTypes = x.getClass().isInstance(y) || y.getClass().isInstance(x);
        if (x instanceof Comparable && relatedTypes) {
            return Integer.signum(((Comparable<Object>) x).compareTo(y));
        }
        return null;
    }

    private static Integer compareNumbers(Number x, Number y) {
        if (isNaN(x) || isNaN(y)) {
            return null;
        }
        if (isInfinite(x) || isInfinite(y)) {
            return Double.compare(x.doubleValue(), y.doubleValue());
        }
        return toBigDecimal(x).compareTo(toBigDecimal(y));
    }

    private static boolean isNaN(Number number) {
        return (number instanceof Double || number instanceof Float) && Double.isNaN(number.doubleValue());
    }

    private static boolean isInfinite(Number number) {
        return (number instanceof Double || number instanceof Float) && Double.isInfinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            return new BigDecimal(number.doubleValue());
        }
        try {
            return new BigDecimal(number.toString());
        } catch (NumberFormatException e) {
            return new BigDecimal(number.doubleValue());
        }
    }
}
