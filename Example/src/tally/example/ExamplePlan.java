package tally.example;

import tally.core.check.Checks;
import tally.core.check.Operand;
import tally.core.fault.FaultKind;
import tally.core.fault.FaultTranslator;
import tally.core.fixture.FixtureDefinition;
import tally.core.registry.RegistryBuilder;
import tally.core.registry.TestPlan;

/**
 * Exercises every kind of check twice, once passing and once failing, followed by the errors and faults that a test
 * can end with.
 *
 * Running it yields {@value #EXPECTED_TESTS} tests of which {@value #EXPECTED_FAILURES} fail.
 */
public final class ExamplePlan implements TestPlan {
    public static final String ROOT_SUITE = "Tally";
    public static final String ASSERTIONS_SUITE = "Assertions";
    public static final String FAILURES_SUITE = "Failures";
    public static final String UNHANDLED_SUITE = "UnhandledExceptions";
    public static final String FAILURE_NOTE = "This test should fail";
    public static final int EXPECTED_TESTS = 28;
    public static final int EXPECTED_FAILURES = 16;
    private static final byte[] DATA = { 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 };

    @Override
    public void declare(RegistryBuilder builder) {
        builder.declareSuite(ROOT_SUITE);
        declareAssertions(builder);
        declareFailures(builder);
        declareUnhandledExceptions(builder);
    }

    private static void declareAssertions(RegistryBuilder builder) {
        builder.declareSubsuite(ROOT_SUITE, ASSERTIONS_SUITE);
        FixtureDefinition<AssertionsFixture> fixture = builder.declareFixture("AssertionsFixture", AssertionsFixture::new, AssertionsFixture::tearDown);

        builder.declareTest("Check", checks -> checks.check(true));
        builder.declareTest("CheckEqual", fixture, (f, checks) -> checks.equal(Operand.of("F.i", f.i), Operand.of(2), null));
        builder.declareTest("CheckDiffer", fixture, (f, checks) -> checks.differ(Operand.of("F.i", f.i), Operand.of(0), null));
        builder.declareTest("CheckClose", fixture, (f, checks) -> checks.close(f.f, 3.0001, 0.001));
        builder.declareTest("CheckLessThan", fixture, (f, checks) -> checks.less(f.f, 3.1));
        builder.declareTest("CheckLessOrEqual", fixture, (f, checks) -> {
            checks.lessOrEqual(f.f, 3.1);
            checks.lessOrEqual(f.f, 3.0);
        });
        builder.declareTest("CheckMoreThan", fixture, (f, checks) -> checks.more(f.f, 2.9));
        builder.declareTest("CheckMoreOrEqual", fixture, (f, checks) -> {
            checks.moreOrEqual(f.f, 2.9);
            checks.moreOrEqual(f.f, 3.0);
        });
        builder.declareTest("CheckSameData", fixture, (f, checks) -> checks.sameData(f.d, DATA.clone(), 10));
        builder.declareTest("CheckThrows", checks -> checks.throwsException("throw 1", IllegalStateException.class, () -> {
            throw new IllegalStateException("1");
        }));
        builder.declareTest("CheckThrowsAny", checks -> checks.throwsAny("throw 1", () -> {
            throw new IllegalStateException("1");
        }));
        builder.declareTest("CheckNoThrow", checks -> {
            int[] i = { 0 };
            checks.noThrow("i++", () -> i[0]++);
        });
    }

    private static void declareFailures(RegistryBuilder builder) {
        builder.declareSubsuite(ROOT_SUITE, FAILURES_SUITE);
        FixtureDefinition<FailuresFixture> fixture = builder.declareFixture("FailuresFixture", FailuresFixture::new, FailuresFixture::tearDown);

        builder.declareTest("CheckFailure", checks -> checks.check(false, "false", FAILURE_NOTE));
        builder.declareTest("CheckEqualFailure", fixture, (f, checks) -> checks.equal(Operand.of("F.i", f.i), Operand.of(2), FAILURE_NOTE));
        builder.declareTest("CheckDifferFailure", fixture, (f, checks) -> checks.differ(Operand.of("F.i", f.i), Operand.of(1), FAILURE_NOTE));
        builder.declareTest("CheckCloseFailure", fixture, (f, checks) -> checks.close(Operand.of("F.f", f.f), Operand.of(3.01), Operand.of(0.001), FAILURE_NOTE));
        builder.declareTest("CheckLessThanFailure", fixture, (f, checks) -> checks.less(Operand.of("F.f", f.f), Operand.of(2.9), FAILURE_NOTE));
        builder.declareTest("CheckLessOrEqualFailure", fixture, (f, checks) -> checks.lessOrEqual(Operand.of("F.f", f.f), Operand.of(2.9), FAILURE_NOTE));
        builder.declareTest("CheckMoreThanFailure", fixture, (f, checks) -> checks.more(Operand.of("F.f", f.f), Operand.of(3.1), FAILURE_NOTE));
        builder.declareTest("CheckMoreOrEqualFailure", fixture, (f, checks) -> checks.moreOrEqual(Operand.of("F.f", f.f), Operand.of(3.1), FAILURE_NOTE));
        builder.declareTest("CheckSameDataFailure", fixture, (f, checks) -> checks.sameData(Operand.of("F.d", f.d), Operand.of("data", DATA.clone()), Operand.of(10), FAILURE_NOTE));
        builder.declareTest("CheckThrowsFailure", checks -> {
            int[] i = { 0 };
            checks.throwsException("i++", IllegalStateException.class, () -> i[0]++, FAILURE_NOTE);
        });
        builder.declareTest("CheckThrowsAnyFailure", checks -> {
            int[] i = { 0 };
            checks.throwsAny("i++", () -> i[0]++, FAILURE_NOTE);
        });
        builder.declareTest("CheckNoThrowFailure", checks -> checks.noThrow("throw 1", () -> {
            throw new IllegalStateException("1");
        }, FAILURE_NOTE));
        builder.declareTest("CheckFail", checks -> checks.fail(FAILURE_NOTE));
    }

    private static void declareUnhandledExceptions(RegistryBuilder builder) {
        builder.declareSubsuite(ROOT_SUITE, UNHANDLED_SUITE);

        builder.declareTest("UnhandledRuntimeException", checks -> {
            throw new IllegalStateException("Unexpected state");
        });
        builder.declareTest("UnhandledErrorWithoutMessage", checks -> {
            throw new AssertionError();
        });
        builder.declareTest("UnhandledFault", ExamplePlan::raiseFault);
    }

    private static void raiseFault(Checks checks) {
        // Stands in for a bad pointer access, which the JVM never lets reach a signal handler.
        if (FaultTranslator.global().deliver(FaultKind.SEGMENTATION_FAULT)) {
            checks.check(true);
        } else {
            checks.fail("Faults are not being translated");
        }
    }
}
