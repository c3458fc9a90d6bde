package tally.core.fault;

import tally.core.util.ObjectChecker;

/**
 * A translated fault, raised on the thread running a test so that it unwinds through the same path as any other
 * thrown error.
 */
public final class FaultException extends RuntimeException {
    private final FaultKind kind;

    public FaultException(FaultKind kind) {
        super(kindDescription(kind));
        this.kind = kind;
    }

    private static String kindDescription(FaultKind kind) {
        ObjectChecker.assertNonNull(kind);
        return kind.description();
    }

    public FaultKind getKind() {
        return this.kind;
    }
}
