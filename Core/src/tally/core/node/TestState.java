package tally.core.node;

/**
 * Where a test case is in its execution.
 *
 * NOT_STARTED -> RUNNING -> one of PASSED, FAILED (a check failed) or FAULTED (an error or fault escaped the body).
 */
public enum TestState {
    NOT_STARTED,
    RUNNING,
    PASSED,
    FAILED,
    FAULTED
}
