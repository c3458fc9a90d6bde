package tally.core.check;

/**
 * The checks available to a test body.
 *
 * Every check evaluates a condition and, when the condition does not hold, reports exactly one failure for the
 * running test and leaves the test body immediately: checks after a failed one are never evaluated. Each check has
 * a variant taking a trailing note that is appended to the reported condition.
 *
 * Operands may be passed as plain values or as {@link Operand}s carrying the source text of the expression.
 */
public interface Checks {
    public static final String DEFAULT_ACTION_DESCRIPTION = "action";

    public void check(boolean predicate, String text, String note);

    public void equal(Operand<?> x, Operand<?> y, String note);

    public void differ(Operand<?> x, Operand<?> y, String note);

    public void close(Operand<? extends Number> x, Operand<? extends Number> y, Operand<? extends Number> delta, String note);

    public void less(Operand<?> x, Operand<?> y, String note);

    public void lessOrEqual(Operand<?> x, Operand<?> y, String note);

    public void more(Operand<?> x, Operand<?> y, String note);

    public void moreOrEqual(Operand<?> x, Operand<?> y, String note);

    public void sameData(Operand<byte[]> x, Operand<byte[]> y, Operand<Integer> size, String note);

    public void throwsException(String description, Class<? extends Throwable> kind, Action action, String note);

    public void throwsAny(String description, Action action, String note);

    public void noThrow(String description, Action action, String note);

    /**
     * Fails the running test unconditionally.
     *
     * @param note The note, may be null.
     */
    public void fail(String note);

    default void check(boolean predicate) {
        check(predicate, String.valueOf(predicate), null);
    }

    default void check(boolean predicate, String text) {
        check(predicate, text, null);
    }

    default void equal(Object x, Object y) {
        equal(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void equal(Object x, Object y, String note) {
        equal(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void differ(Object x, Object y) {
        differ(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void differ(Object x, Object y, String note) {
        differ(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void close(Number x, Number y, Number delta) {
        close(Operand.of(x), Operand.of(y), Operand.of(delta), null);
    }

    default void close(Number x, Number y, Number delta, String note) {
        close(Operand.of(x), Operand.of(y), Operand.of(delta), note);
    }

    default void less(Object x, Object y) {
        less(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void less(Object x, Object y, String note) {
        less(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void lessOrEqual(Object x, Object y) {
        lessOrEqual(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void lessOrEqual(Object x, Object y, String note) {
        lessOrEqual(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void more(Object x, Object y) {
        more(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void more(Object x, Object y, String note) {
        more(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void moreOrEqual(Object x, Object y) {
        moreOrEqual(Operand.wrap(x), Operand.wrap(y), null);
    }

    default void moreOrEqual(Object x, Object y, String note) {
        moreOrEqual(Operand.wrap(x), Operand.wrap(y), note);
    }

    default void sameData(byte[] x, byte[] y, int size) {
        sameData(Operand.of(x), Operand.of(y), Operand.of(size), null);
    }

    default void sameData(byte[] x, byte[] y, int size, String note) {
        sameData(Operand.of(x), Operand.of(y), Operand.of(size), note);
    }

    default void throwsException(Class<? extends Throwable> kind, Action action) {
        throwsException(DEFAULT_ACTION_DESCRIPTION, kind, action, null);
    }

    default void throwsException(String description, Class<? extends Throwable> kind, Action action) {
        throwsException(description, kind, action, null);
    }

    default void throwsAny(Action action) {
        throwsAny(DEFAULT_ACTION_DESCRIPTION, action, null);
    }

    default void throwsAny(String description, Action action) {
        throwsAny(description, action, null);
    }

    default void noThrow(Action action) {
        noThrow(DEFAULT_ACTION_DESCRIPTION, action, null);
    }

    default void noThrow(String description, Action action) {
        noThrow(description, action, null);
    }

    default void fail() {
        fail(null);
    }
}
