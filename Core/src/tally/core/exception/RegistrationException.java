package tally.core.exception;

/**
 * Thrown while declaring suites, tests or fixtures when the declaration is malformed, for example a duplicate
 * suite name or a reference to a suite that was never declared.
 *
 * This is always raised during assembly, strictly before any run starts.
 */
public final class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }
}
