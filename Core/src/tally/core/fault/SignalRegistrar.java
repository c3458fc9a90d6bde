package tally.core.fault;

/**
 * Installs a process-wide handler for one kind of fault.
 */
@FunctionalInterface
public interface SignalRegistrar {

    /**
     * Installs a handler that passes every occurrence of the given kind of fault to
     * {@link FaultTranslator#deliver(FaultKind)}.
     *
     * @param kind The kind of fault to intercept.
     * @param translator The translator to deliver the fault to.
     * @return whether a handler could be installed for this kind on this platform.
     */
    public boolean register(FaultKind kind, FaultTranslator translator);
}
