package tally.core.exception;

/**
 * Thrown by a failed check, after its failure has been reported, to leave the current test body immediately.
 *
 * It extends {@link Error} so that test bodies catching {@link Exception} do not intercept it. It carries no
 * stack trace.
 */
public final class CheckAbortError extends Error {

    public CheckAbortError(String testName) {
        super("check failed in test: " + testName, null, false, false);
    }
}
