package tally.core.output;

import tally.core.node.TestNode;
import tally.core.type.FailureRecord;

/**
 * Receives the events of a run and owns whatever is made of them: counts, timing, rendering.
 *
 * Events arrive on the thread running the tests and in order: {@code allTestsBegin}, then for every node
 * {@code testBegins}, any failures of that node and its descendants, {@code testEnds}, and finally
 * {@code allTestsEnd}. Every {@code testBegins} is matched by a {@code testEnds}, even when a test faults.
 *
 * @see CountingResultSink
 */
public interface ResultSink {

    /**
     * Invoked once before any test runs.
     */
    public void allTestsBegin();

    /**
     * Invoked once after every test has run.
     */
    public void allTestsEnd();

    /**
     * Invoked when a suite or a test case is entered.
     *
     * @param node The node being entered.
     */
    public void testBegins(TestNode node);

    /**
     * Invoked when a suite or a test case is left.
     *
     * @param node The node being left.
     */
    public void testEnds(TestNode node);

    /**
     * Invoked when a test fails. At most once per test case execution.
     *
     * @param failure The failure.
     */
    public void addFailure(FailureRecord failure);

    /**
     * Returns the number of test cases executed so far.
     */
    public int testCount();

    /**
     * Returns the number of failures so far.
     */
    public int failures();

    /**
     * Returns the wall-clock duration of the last complete run in nanoseconds.
     */
    public long elapsedNanos();
}
