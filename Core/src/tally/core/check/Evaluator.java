package tally.core.check;

import tally.core.exception.CheckAbortError;
import tally.core.fault.FaultException;
import tally.core.util.ObjectChecker;

/**
 * Evaluates checks into {@link CheckOutcome}s. Nothing is reported here: deciding what a failed outcome means for
 * the running test is the job of {@link CheckContext}.
 *
 * Exception-expectation checks run their action, but never absorb the engine's own control flow: a check failing
 * or a fault raised inside the action always propagates.
 */
public final class Evaluator {
    public static final String EXPLICIT_FAILURE = "Explicit failure";

    private Evaluator() {}

    public static CheckOutcome equal(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.equal(x.value(), y.value()), binary(x, "==", y));
    }

    public static CheckOutcome differ(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.differ(x.value(), y.value()), binary(x, "!=", y));
    }

    public static CheckOutcome close(Operand<? extends Number> x, Operand<? extends Number> y, Operand<? extends Number> delta) {
        return CheckOutcome.of(Predicates.close(x.value(), y.value(), delta.value()), x + " close to " + y + " with delta " + delta);
    }

    public static CheckOutcome less(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.less(x.value(), y.value()), binary(x, "<", y));
    }

    public static CheckOutcome lessOrEqual(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.lessOrEqual(x.value(), y.value()), binary(x, "<=", y));
    }

    public static CheckOutcome more(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.more(x.value(), y.value()), binary(x, ">", y));
    }

    public static CheckOutcome moreOrEqual(Operand<?> x, Operand<?> y) {
        return CheckOutcome.of(Predicates.moreOrEqual(x.value(), y.value()), binary(x, ">=", y));
    }

    public static CheckOutcome sameData(Operand<byte[]> x, Operand<byte[]> y, Operand<Integer> size) {
        ObjectChecker.assertNonNull(size.value());
        boolean same = Predicates.sameData(x.value(), y.value(), size.value());
        // Only the operand texts are shown, never the data.
        return CheckOutcome.of(same, x.text() + " has same data as " + y.text() + " with size " + size.text());
    }

    public static CheckOutcome predicate(boolean predicate, String text) {
        return CheckOutcome.of(predicate, text);
    }

    public static CheckOutcome explicitFailure() {
        return CheckOutcome.failed(EXPLICIT_FAILURE);
    }

    public static CheckOutcome throwsException(String description, Class<? extends Throwable> kind, Action action) {
        ObjectChecker.assertNonNull(description, kind, action);
        String condition = description + " throws exception " + kind.getSimpleName();
        try {
            action.act();
        } catch (Throwable t) {
            rethrowIfControlFlow(t);
            return CheckOutcome.of(kind.isInstance(t), condition);
        }
        return CheckOutcome.failed(condition);
    }

    public static CheckOutcome throwsAny(String description, Action action) {
        ObjectChecker.assertNonNull(description, action);
        try {
            action.act();
        } catch (Throwable t) {
            rethrowIfControlFlow(t);
            return CheckOutcome.passed();
        }
        return CheckOutcome.failed(description + " throws any exception");
    }

    public static CheckOutcome noThrow(String description, Action action) {
        ObjectChecker.assertNonNull(description, action);
        try {
            action.act();
        } catch (Throwable t) {
            rethrowIfControlFlow(t);
            return CheckOutcome.failed(description + " does not throw exception");
        }
        return CheckOutcome.passed();
    }

    private static String binary(Operand<?> x, String operator, Operand<?> y) {
        return x + " " + operator + " " + y;
    }

    private static void rethrowIfControlFlow(Throwable t) {
        if (t instanceof CheckAbortError) {
            throw (CheckAbortError) t;
        }
        if (t instanceof FaultException) {
            throw (FaultException) t;
        }
    }
}
