package tally.core.exception;

/**
 * Carries a checked exception out of a test when the engine is configured not to catch errors, so that it can abort
 * the run. Unchecked exceptions and errors abort the run as they are.
 */
public final class TestExecutionException extends RuntimeException {

    public TestExecutionException(String testName, Throwable cause) {
        super("test " + testName + " threw: " + cause, cause);
    }
}
