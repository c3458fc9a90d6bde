package tally.core.node;

import tally.core.check.Checks;
import tally.core.fixture.FixtureDefinition;
import tally.core.fixture.FixtureScope;
import tally.core.util.ObjectChecker;

/**
 * The code of a test case.
 */
@FunctionalInterface
public interface TestBody {

    /**
     * Runs the test.
     *
     * @param checks The checks to evaluate the test's conditions with.
     * @throws Exception Anything the test does not handle itself. It fails the test.
     */
    public void run(Checks checks) throws Exception;

    /**
     * Returns a body that sets up a fresh fixture from the definition, runs the given body with it, and tears the
     * fixture down again however the body ends.
     */
    public static <F> TestBody withFixture(FixtureDefinition<F> fixture, FixtureTestBody<F> body) {
        ObjectChecker.assertNonNull(fixture, body);
        return checks -> {
            try (FixtureScope<F> scope = fixture.open()) {
                body.run(scope.get(), checks);
            }
        };
    }
}
