package tally.core.fault;

import sun.misc.Signal;
import tally.core.util.Logger;

/**
 * Registers handlers for real OS signals.
 *
 * Signals the JVM uses itself (SEGV, FPE, ILL and BUS among them) and signals that cannot be caught at all (KILL)
 * are refused by the JVM and reported as not interceptable. A signal arriving while no test is running is not a
 * test failure: the process exits with the conventional {@code 128 + signal number} status.
 */
final class NativeSignalRegistrar implements SignalRegistrar {
    private static final Logger LOGGER = Logger.forClass(NativeSignalRegistrar.class);

    @Override
    public boolean register(FaultKind kind, FaultTranslator translator) {
        try {
            Signal.handle(new Signal(kind.signalName()), signal -> {
                if (!translator.deliver(kind)) {
                    LOGGER.log("Received SIG" + signal.getName() + " outside of any test. Exiting.");
                    Runtime.getRuntime().exit(128 + signal.getNumber());
                }
            });
            return true;
        } catch (IllegalArgumentException e) {
            LOGGER.log("SIG" + kind.signalName() + " cannot be intercepted on this platform: " + e.getMessage());
            return false;
        }
    }
}
