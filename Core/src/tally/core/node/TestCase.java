package tally.core.node;

import tally.core.check.CheckContext;
import tally.core.config.EngineConfig;
import tally.core.exception.CheckAbortError;
import tally.core.exception.TestExecutionException;
import tally.core.fault.FaultTranslator;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.Collections;
import java.util.List;

/**
 * A single named test.
 *
 * Each run executes the body with a fresh {@link CheckContext}. A failed check ends the body and fails the test. When
 * the engine catches exceptions, anything else the body throws is contained and reported as an unhandled exception,
 * and when it also catches signals the body runs guarded by the {@link FaultTranslator} so that a fault is reported
 * the same way. Either way, the test reports at most one failure per run.
 *
 * A test case is NOT thread-safe.
 */
public final class TestCase extends TestNode {
    private static final Logger LOGGER = Logger.forClass(TestCase.class);
    private final TestBody body;
    private TestState state = TestState.NOT_STARTED;
    private boolean reported = false;

    private TestCase(String name, TestBody body) {
        super(name, NodeKind.CASE);
        ObjectChecker.assertNonNull(body);
        this.body = body;
    }

    public static TestCase of(String name, TestBody body) {
        return new TestCase(name, body);
    }

    public TestState state() {
        return this.state;
    }

    /**
     * Returns true once the sink has been told the last run of this test ended.
     */
    public boolean isReported() {
        return this.reported;
    }

    @Override
    public List<TestNode> children() {
        return Collections.emptyList();
    }

    @Override
    protected void execute(RunContext context) {
        EngineConfig config = context.getConfig();
        FaultTranslator translator = config.catchSignals ? context.getTranslator() : null;
        CheckContext checks = CheckContext.forTest(name(), context.getSink(), translator);

        this.state = TestState.RUNNING;
        this.reported = false;

        try {
            if (translator != null) {
                translator.install();
                translator.runGuarded(() -> this.body.run(checks));
            } else {
                this.body.run(checks);
            }
            this.state = checks.hasFailed() ? TestState.FAILED : TestState.PASSED;
        } catch (CheckAbortError e) {
            if (!checks.hasFailed()) {
                checks.reportUnhandled(e.getMessage());
            }
            this.state = TestState.FAILED;
        } catch (Throwable t) {
            this.state = checks.hasFailed() ? TestState.FAILED : TestState.FAULTED;
            if (!config.catchExceptions) {
                throw propagate(t);
            }
            LOGGER.log("Test " + name() + " ended with an unhandled error.", t);
            checks.reportUnhandled(t.getMessage());
        }
    }

    @Override
    protected void onReported() {
        this.reported = true;
    }

    private RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return new TestExecutionException(name(), error);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + name() + ", state: " + this.state + " }";
    }
}
