package tally.core.check;

/**
 * A piece of code handed to an exception-expectation check.
 */
@FunctionalInterface
public interface Action {
    public void act() throws Throwable;
}
