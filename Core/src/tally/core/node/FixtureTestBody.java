package tally.core.node;

import tally.core.check.Checks;

/**
 * The code of a test case that uses a fixture.
 */
@FunctionalInterface
public interface FixtureTestBody<F> {
    public void run(F fixture, Checks checks) throws Exception;
}
