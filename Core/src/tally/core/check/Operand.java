package tally.core.check;

import java.util.Arrays;

/**
 * A check operand: the literal source text of an expression together with the value it evaluated to.
 *
 * Failure conditions show both, e.g. {@code fixture.count (1) == 2 (2)}. When no text is given the rendered value
 * stands in for it, which is exactly what a literal operand would look like.
 */
public final class Operand<T> {
    private final String text;
    private final T value;

    private Operand(String text, T value) {
        this.text = text;
        this.value = value;
    }

    public static <T> Operand<T> of(T value) {
        return new Operand<>(render(value), value);
    }

    public static <T> Operand<T> of(String text, T value) {
        return new Operand<>((text == null) ? render(value) : text, value);
    }

    /**
     * Returns the given object itself if it is already an operand, or else a new operand for the value.
     */
    static Operand<?> wrap(Object value) {
        return (value instanceof Operand) ? (Operand<?>) value : of(value);
    }

    public String text() {
        return this.text;
    }

    public T value() {
        return this.value;
    }

    public String renderedValue() {
        return render(this.value);
    }

    /**
     * Renders any value as a string, independent of its type. Arrays are rendered by content.
     */
    public static String render(Object value) {
        if (value == null) {
            return "null";
        }
        if (!value.getClass().isArray()) {
            return String.valueOf(value);
        }
        String rendering = Arrays.deepToString(new Object[]{ value });
        // Strip the wrapping array.
        return rendering.substring(1, rendering.length() - 1);
    }

    @Override
    public String toString() {
        return this.text + " (" + renderedValue() + ")";
    }
}
