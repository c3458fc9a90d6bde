package tally.core.node;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import tally.core.config.EngineConfig;
import tally.core.exception.TestExecutionException;
import tally.core.fault.FaultKind;
import tally.core.fault.FaultTranslator;
import tally.core.fixture.FixtureDefinition;
import tally.core.helper.AssertHelper;
import tally.core.helper.RecordingRegistrar;
import tally.core.helper.RecordingSink;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.equalTo;

public class TestCaseTest {
    private RecordingSink sink;
    private FaultTranslator translator;
    private RunContext context;

    @Before
    public void setup() {
        this.sink = new RecordingSink();
        this.translator = FaultTranslator.withRegistrar(RecordingRegistrar.supportingAll());
        this.context = RunContext.of(this.sink, EngineConfig.defaults(), this.translator);
    }

    @Test
    public void testPassingTest() {
        TestCase test = TestCase.of("Passing", checks -> checks.check(true));
        Assert.assertEquals(TestState.NOT_STARTED, test.state());

        Assert.assertEquals(0, test.run(this.context));

        Assert.assertEquals(TestState.PASSED, test.state());
        Assert.assertTrue(test.isReported());
        Assert.assertEquals(Arrays.asList("begin Passing", "end Passing"), this.sink.events);
        Assert.assertEquals(1, this.sink.testCount());
        Assert.assertTrue(this.translator.isInstalled());
    }

    @Test
    public void testFailedCheckEndsTheBody() {
        List<String> reached = new ArrayList<>();
        TestCase test = TestCase.of("Failing", checks -> {
            reached.add("before");
            checks.equal(1, 2);
            reached.add("after");
        });

        Assert.assertEquals(1, test.run(this.context));

        Assert.assertEquals(TestState.FAILED, test.state());
        Assert.assertEquals(Arrays.asList("before"), reached);
        Assert.assertEquals(Arrays.asList("begin Failing", "failure Failing", "end Failing"), this.sink.events);
        Assert.assertThat(this.sink.failureRecords.get(0).fileName, equalTo("TestCaseTest.java"));
    }

    @Test
    public void testUnhandledExceptionIsContained() {
        TestCase test = TestCase.of("Throwing", checks -> {
            throw new IllegalStateException("Unexpected state");
        });

        Assert.assertEquals(1, test.run(this.context));

        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).toString(), equalTo("unknown file(-1): Failure: \"Unhandled exception: Unexpected state\""));
    }

    @Test
    public void testUnhandledErrorWithoutMessage() {
        TestCase test = TestCase.of("Erroring", checks -> {
            throw new AssertionError();
        });

        test.run(this.context);

        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).condition, equalTo("Unhandled exception: unknown"));
    }

    @Test
    public void testErrorAfterASwallowedCheckFailureReportsOnlyTheCheck() {
        TestCase test = TestCase.of("Swallowing", checks -> {
            try {
                checks.fail("first");
            } catch (Throwable t) {
                throw new IllegalStateException("second");
            }
        });

        Assert.assertEquals(1, test.run(this.context));

        Assert.assertEquals(TestState.FAILED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).condition, equalTo("Explicit failure, Note: first"));
    }

    @Test
    public void testDeliveredFaultBecomesAFailure() {
        TestCase test = TestCase.of("Faulting", checks -> {
            this.translator.deliver(FaultKind.SEGMENTATION_FAULT);
            checks.check(true);
        });

        Assert.assertEquals(1, test.run(this.context));

        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).condition, equalTo("Unhandled exception: SegmentationFaultException"));
        Assert.assertTrue(test.isReported());
        Assert.assertFalse(this.translator.isGuarding());
    }

    @Test
    public void testFaultWithoutASafepointIsRaisedWhenTheBodyEnds() {
        TestCase test = TestCase.of("Faulting", checks -> this.translator.deliver(FaultKind.TERMINATION));

        test.run(this.context);

        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).condition, equalTo("Unhandled exception: TerminationException"));
    }

    @Test
    public void testFixtureIsTornDownAfterAFailedCheck() {
        List<String> lifecycle = new ArrayList<>();
        FixtureDefinition<List<String>> fixture = FixtureDefinition.of("Lifecycle", () -> {
            lifecycle.add("setup");
            return lifecycle;
        }, f -> f.add("teardown"));

        TestCase test = TestCase.of("WithFixture", TestBody.withFixture(fixture, (f, checks) -> {
            f.add("body");
            checks.fail();
            f.add("unreachable");
        }));
        test.run(this.context);

        Assert.assertEquals(TestState.FAILED, test.state());
        Assert.assertEquals(Arrays.asList("setup", "body", "teardown"), lifecycle);
    }

    @Test
    public void testFailingSetupFaultsTheTest() {
        FixtureDefinition<String> fixture = FixtureDefinition.of("Broken", () -> {
            throw new IllegalStateException("no fixture");
        });

        TestCase test = TestCase.of("BrokenFixture", TestBody.withFixture(fixture, (f, checks) -> checks.check(true)));
        test.run(this.context);

        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertThat(this.sink.failureRecords.get(0).condition, equalTo("Unhandled exception: no fixture"));
    }

    @Test
    public void testStateResetsOnEachRun() {
        boolean[] fail = { true };
        TestCase test = TestCase.of("Flaky", checks -> checks.check(!fail[0]));

        Assert.assertEquals(1, test.run(this.context));
        Assert.assertEquals(TestState.FAILED, test.state());

        fail[0] = false;
        Assert.assertEquals(0, test.run(this.context));
        Assert.assertEquals(TestState.PASSED, test.state());
        Assert.assertEquals(2, this.sink.testCount());
        Assert.assertEquals(1, this.sink.failures());
    }

    @Test
    public void testWithoutSignalCatchingNoFaultIsTranslated() {
        RunContext noSignals = RunContext.of(this.sink, EngineConfig.Builder.newBuilder().catchSignals(false).build(), this.translator);
        boolean[] delivered = { true };
        TestCase test = TestCase.of("Unguarded", checks -> delivered[0] = this.translator.deliver(FaultKind.INTERRUPT));

        Assert.assertEquals(0, test.run(noSignals));

        Assert.assertFalse(delivered[0]);
        Assert.assertFalse(this.translator.isInstalled());
        Assert.assertEquals(TestState.PASSED, test.state());
    }

    @Test
    public void testWithoutExceptionCatchingErrorsAbortTheRun() {
        RunContext noCatch = RunContext.of(this.sink, EngineConfig.Builder.newBuilder().catchExceptions(false).build(), this.translator);
        TestCase test = TestCase.of("Throwing", checks -> {
            throw new IllegalStateException("abort");
        });

        IllegalStateException error = AssertHelper.assertThrows(IllegalStateException.class, () -> test.run(noCatch));

        Assert.assertThat(error.getMessage(), equalTo("abort"));
        Assert.assertEquals(TestState.FAULTED, test.state());
        Assert.assertFalse(test.isReported());
        Assert.assertEquals(0, this.sink.failures());
        Assert.assertEquals(Arrays.asList("begin Throwing"), this.sink.events);
    }

    @Test
    public void testWithoutExceptionCatchingCheckedExceptionsAreWrapped() {
        RunContext noCatch = RunContext.of(this.sink, EngineConfig.Builder.newBuilder().catchExceptions(false).build(), this.translator);
        TestCase test = TestCase.of("Throwing", checks -> {
            throw new IOException("disk");
        });

        TestExecutionException error = AssertHelper.assertThrows(TestExecutionException.class, () -> test.run(noCatch));
        Assert.assertTrue(error.getCause() instanceof IOException);
    }

    @Test
    public void testWithoutExceptionCatchingCheckFailuresAreStillContained() {
        RunContext noCatch = RunContext.of(this.sink, EngineConfig.Builder.newBuilder().catchExceptions(false).build(), this.translator);
        TestCase test = TestCase.of("Failing", checks -> checks.fail());

        Assert.assertEquals(1, test.run(noCatch));
        Assert.assertEquals(TestState.FAILED, test.state());
        Assert.assertTrue(test.isReported());
    }
}
