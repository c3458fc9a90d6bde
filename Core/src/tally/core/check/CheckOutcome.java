package tally.core.check;

import tally.core.util.ObjectChecker;

/**
 * The outcome of evaluating one check: either it passed, or it failed with the condition text describing why.
 */
public final class CheckOutcome {
    private static final CheckOutcome PASSED = new CheckOutcome(true, null);
    private final boolean passed;
    private final String condition;

    private CheckOutcome(boolean passed, String condition) {
        this.passed = passed;
        this.condition = condition;
    }

    public static CheckOutcome passed() {
        return PASSED;
    }

    public static CheckOutcome failed(String condition) {
        ObjectChecker.assertNonNull(condition);
        return new CheckOutcome(false, condition);
    }

    public static CheckOutcome of(boolean passed, String conditionIfFailed) {
        return passed ? PASSED : failed(conditionIfFailed);
    }

    public boolean isPassed() {
        return this.passed;
    }

    /**
     * Returns the failed condition, or null if the check passed.
     */
    public String getCondition() {
        return this.condition;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + (this.passed ? "passed" : "failed: " + this.condition) + " }";
    }
}
