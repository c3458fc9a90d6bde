package tally.core.fixture;

import tally.core.util.ObjectChecker;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * A named recipe for the per-test state of a test.
 *
 * The setup constructs a fresh fixture; its members are simply the fields of the object it returns. The teardown
 * receives that same object once the test is done with it. A definition is shared by every test that uses it, the
 * fixtures it creates never are.
 */
public final class FixtureDefinition<F> {
    private final String name;
    private final Supplier<? extends F> setup;
    private final Consumer<? super F> teardown;

    private FixtureDefinition(String name, Supplier<? extends F> setup, Consumer<? super F> teardown) {
        ObjectChecker.assertNonBlank(name, "fixture name");
        ObjectChecker.assertNonNull(setup, teardown);
        this.name = name;
        this.setup = setup;
        this.teardown = teardown;
    }

    public static <F> FixtureDefinition<F> of(String name, Supplier<? extends F> setup) {
        return new FixtureDefinition<>(name, setup, fixture -> {});
    }

    public static <F> FixtureDefinition<F> of(String name, Supplier<? extends F> setup, Consumer<? super F> teardown) {
        return new FixtureDefinition<>(name, setup, teardown);
    }

    /**
     * Sets up a new fixture and returns the scope that owns it.
     */
    public FixtureScope<F> open() {
        return FixtureScope.open(this);
    }

    public String getName() {
        return this.name;
    }

    F setUp() {
        F fixture = this.setup.get();
        if (fixture == null) {
            throw new NullPointerException("setup of fixture " + this.name + " returned null.");
        }
        return fixture;
    }

    void tearDown(F fixture) {
        this.teardown.accept(fixture);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.name + " }";
    }
}
