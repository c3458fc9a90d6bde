package tally.core.fault;

/**
 * The OS signals the fault translator attempts to intercept. Which of them can actually be intercepted depends on
 * the platform and on the signals the JVM reserves for itself.
 */
public enum FaultKind {
    TERMINATION("TERM", "Termination"),
    ABORT("ABRT", "Abort"),
    SEGMENTATION_FAULT("SEGV", "SegmentationFault"),
    FLOATING_POINT("FPE", "FloatingPoint"),
    ILLEGAL_INSTRUCTION("ILL", "IllegalInstruction"),
    INTERRUPT("INT", "Interrupt"),
    BAD_ACCESS("BUS", "BadAccess"),
    BAD_SYSTEM_CALL("SYS", "BadSystemCall"),
    KILL("KILL", "Kill");

    private final String signalName;
    private final String displayName;

    FaultKind(String signalName, String displayName) {
        this.signalName = signalName;
        this.displayName = displayName;
    }

    /**
     * Returns the signal name without its {@code SIG} prefix, e.g. {@code INT}.
     */
    public String signalName() {
        return this.signalName;
    }

    /**
     * Returns the description used in failure reports, e.g. {@code InterruptException}.
     */
    public String description() {
        return this.displayName + "Exception";
    }
}
