package tally.core.fixture;

import tally.core.util.ObjectChecker;

/**
 * Owns one fixture for the duration of one test execution.
 *
 * Opening the scope runs the setup to completion. Closing it runs the teardown exactly once, however the scope is
 * left; further closes do nothing. Used with try-with-resources, this guarantees teardown on normal completion, on a
 * failed check and on any thrown error or fault alike. If the setup throws, there is no fixture and hence no
 * teardown.
 */
public final class FixtureScope<F> implements AutoCloseable {
    private final FixtureDefinition<F> definition;
    private final F fixture;
    private boolean isClosed = false;

    private FixtureScope(FixtureDefinition<F> definition, F fixture) {
        this.definition = definition;
        this.fixture = fixture;
    }

    static <F> FixtureScope<F> open(FixtureDefinition<F> definition) {
        ObjectChecker.assertNonNull(definition);
        return new FixtureScope<>(definition, definition.setUp());
    }

    /**
     * Returns the fixture owned by this scope.
     */
    public F get() {
        if (this.isClosed) {
            throw new IllegalStateException("fixture " + this.definition.getName() + " has been torn down.");
        }
        return this.fixture;
    }

    public boolean isClosed() {
        return this.isClosed;
    }

    @Override
    public void close() {
        if (!this.isClosed) {
            this.isClosed = true;
            this.definition.tearDown(this.fixture);
        }
    }
}
