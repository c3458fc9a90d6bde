package tally.core.registry;

/**
 * A unit of test declarations. Plans are declared into a {@link RegistryBuilder} in a fixed order, which fixes the
 * order in which their suites and tests run.
 *
 * A plan loaded by name must have a public no-argument constructor.
 */
@FunctionalInterface
public interface TestPlan {

    /**
     * Declares this plan's suites, fixtures and tests.
     *
     * @param builder The builder to declare into.
     */
    public void declare(RegistryBuilder builder);
}
