package tally.core.check;

import tally.core.exception.CheckAbortError;
import tally.core.fault.FaultTranslator;
import tally.core.output.ResultSink;
import tally.core.type.FailureRecord;
import tally.core.util.ObjectChecker;

import java.util.Optional;

/**
 * The {@link Checks} handed to one execution of one test.
 *
 * A context reports at most one failure to its sink: the first failure of the execution wins and every later one,
 * whether from a check or from an unhandled error, is dropped. Failed checks record the file and line of the
 * statement that called them.
 *
 * Every check first gives the fault translator a chance to raise a fault that was delivered while the test ran.
 */
public final class CheckContext implements Checks {
    private static final String UNHANDLED_PREFIX = "Unhandled exception: ";
    private static final String UNKNOWN_DESCRIPTION = "unknown";
    private static final StackWalker STACK_WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);
    private final String testName;
    private final ResultSink sink;
    private final FaultTranslator translator;
    private FailureRecord failure = null;

    private CheckContext(String testName, ResultSink sink, FaultTranslator translator) {
        ObjectChecker.assertNonNull(testName, sink);
        this.testName = testName;
        this.sink = sink;
        this.translator = translator;
    }

    /**
     * Creates the context for one execution of the named test.
     *
     * @param testName The name of the test.
     * @param sink The sink failures are reported to.
     * @param translator The fault translator whose pending faults are raised at each check, or null if faults are
     *                   not being translated.
     * @return the context.
     */
    public static CheckContext forTest(String testName, ResultSink sink, FaultTranslator translator) {
        return new CheckContext(testName, sink, translator);
    }

    public boolean hasFailed() {
        return this.failure != null;
    }

    /**
     * Returns the failure reported through this context, or null if there was none.
     */
    public FailureRecord getFailure() {
        return this.failure;
    }

    /**
     * Reports that an error escaped the test body. Dropped if a failure was already reported.
     *
     * @param description The description of the error, or null if it has none.
     */
    public void reportUnhandled(String description) {
        String what = (description == null || description.isEmpty()) ? UNKNOWN_DESCRIPTION : description;
        report(FailureRecord.withoutLocation(UNHANDLED_PREFIX + what, this.testName));
    }

    @Override
    public void check(boolean predicate, String text, String note) {
        verify(Evaluator.predicate(predicate, (text == null) ? String.valueOf(predicate) : text), note);
    }

    @Override
    public void equal(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.equal(x, y), note);
    }

    @Override
    public void differ(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.differ(x, y), note);
    }

    @Override
    public void close(Operand<? extends Number> x, Operand<? extends Number> y, Operand<? extends Number> delta, String note) {
        verify(Evaluator.close(x, y, delta), note);
    }

    @Override
    public void less(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.less(x, y), note);
    }

    @Override
    public void lessOrEqual(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.lessOrEqual(x, y), note);
    }

    @Override
    public void more(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.more(x, y), note);
    }

    @Override
    public void moreOrEqual(Operand<?> x, Operand<?> y, String note) {
        verify(Evaluator.moreOrEqual(x, y), note);
    }

    @Override
    public void sameData(Operand<byte[]> x, Operand<byte[]> y, Operand<Integer> size, String note) {
        verify(Evaluator.sameData(x, y, size), note);
    }

    @Override
    public void throwsException(String description, Class<? extends Throwable> kind, Action action, String note) {
        safepoint();
        verify(Evaluator.throwsException(description, kind, action), note);
    }

    @Override
    public void throwsAny(String description, Action action, String note) {
        safepoint();
        verify(Evaluator.throwsAny(description, action), note);
    }

    @Override
    public void noThrow(String description, Action action, String note) {
        safepoint();
        verify(Evaluator.noThrow(description, action), note);
    }

    @Override
    public void fail(String note) {
        verify(Evaluator.explicitFailure(), note);
    }

    private void verify(CheckOutcome outcome, String note) {
        safepoint();
        if (!outcome.isPassed()) {
            String condition = FailureRecord.conditionWithNote(outcome.getCondition(), note);
            Optional<StackWalker.StackFrame> caller = STACK_WALKER.walk(frames -> frames
                    .filter(frame -> frame.getDeclaringClass() != CheckContext.class && frame.getDeclaringClass() != Checks.class)
                    .findFirst());

            String fileName = caller.map(StackWalker.StackFrame::getFileName).orElse(null);
            int line = caller.map(StackWalker.StackFrame::getLineNumber).orElse(FailureRecord.UNKNOWN_LINE);
            if (fileName == null || line < 0) {
                report(FailureRecord.withoutLocation(condition, this.testName));
            } else {
                report(FailureRecord.at(condition, this.testName, fileName, line));
            }
            throw new CheckAbortError(this.testName);
        }
    }

    private void safepoint() {
        if (this.translator != null) {
            this.translator.throwIfPending();
        }
    }

    private void report(FailureRecord record) {
        if (this.failure == null) {
            this.failure = record;
            this.sink.addFailure(record);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { test: " + this.testName + ", failed: " + hasFailed() + " }";
    }
}
