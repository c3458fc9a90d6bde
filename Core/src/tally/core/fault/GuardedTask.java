package tally.core.fault;

/**
 * A task to execute inside a guarded frame of the {@link FaultTranslator}.
 */
@FunctionalInterface
public interface GuardedTask {

    /**
     * Executes the task.
     *
     * @throws Exception If something goes wrong executing the task.
     */
    public void execute() throws Exception;
}
