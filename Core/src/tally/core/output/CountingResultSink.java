package tally.core.output;

import tally.core.node.NodeKind;
import tally.core.node.TestNode;
import tally.core.type.FailureRecord;

/**
 * The base sink: counts executed test cases and failures and times the run. Subclasses render the events and must
 * call up into this class when they override a callback.
 *
 * Counts cover the current or last run only: they start over at {@link #allTestsBegin()}. A sink is NOT
 * thread-safe, like the runs that drive it.
 */
public class CountingResultSink implements ResultSink {
    private int testCount = 0;
    private int failureCount = 0;
    private long startNanos = 0;
    private long elapsedNanos = 0;

    @Override
    public void allTestsBegin() {
        this.testCount = 0;
        this.failureCount = 0;
        this.elapsedNanos = 0;
        this.startNanos = System.nanoTime();
    }

    @Override
    public void allTestsEnd() {
        this.elapsedNanos = System.nanoTime() - this.startNanos;
    }

    @Override
    public void testBegins(TestNode node) {
    }

    @Override
    public void testEnds(TestNode node) {
        if (node.kind() == NodeKind.CASE) {
            this.testCount++;
        }
    }

    @Override
    public void addFailure(FailureRecord failure) {
        this.failureCount++;
    }

    @Override
    public int testCount() {
        return this.testCount;
    }

    @Override
    public int failures() {
        return this.failureCount;
    }

    @Override
    public long elapsedNanos() {
        return this.elapsedNanos;
    }

    public int passed() {
        return this.testCount - this.failureCount;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + this.testCount + ", failures: " + this.failureCount + " }";
    }
}
