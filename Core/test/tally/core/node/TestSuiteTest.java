package tally.core.node;

import org.junit.Assert;
import org.junit.Test;
import tally.core.config.EngineConfig;
import tally.core.fault.FaultTranslator;
import tally.core.helper.RecordingRegistrar;
import tally.core.helper.RecordingSink;

import java.util.Arrays;
import java.util.Collections;

public class TestSuiteTest {

    @Test
    public void testChildrenRunInOrderInsideTheSuite() {
        RecordingSink sink = new RecordingSink();
        RunContext context = RunContext.of(sink, EngineConfig.defaults(), FaultTranslator.withRegistrar(RecordingRegistrar.supportingAll()));

        TestSuite inner = TestSuite.of("Inner", Collections.singletonList(TestCase.of("C", checks -> checks.fail())));
        TestSuite outer = TestSuite.of("Outer", Arrays.asList(
                TestCase.of("A", checks -> checks.check(true)),
                TestCase.of("B", checks -> {
                    throw new IllegalStateException();
                }),
                inner));

        Assert.assertEquals(2, outer.run(context));

        Assert.assertEquals(Arrays.asList(
                "begin Outer",
                "begin A", "end A",
                "begin B", "failure B", "end B",
                "begin Inner", "begin C", "failure C", "end C", "end Inner",
                "end Outer"), sink.events);
        Assert.assertEquals(3, sink.testCount());
    }

    @Test
    public void testNodeShape() {
        TestCase test = TestCase.of("A", checks -> {});
        TestSuite suite = TestSuite.of("S", Collections.singletonList(test));

        Assert.assertEquals(NodeKind.SUITE, suite.kind());
        Assert.assertEquals(NodeKind.CASE, test.kind());
        Assert.assertTrue(test.children().isEmpty());
        Assert.assertSame(test, suite.children().get(0));
    }
}
