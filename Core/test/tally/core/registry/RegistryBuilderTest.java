package tally.core.registry;

import org.junit.Assert;
import org.junit.Test;
import tally.core.exception.RegistrationException;
import tally.core.fixture.FixtureDefinition;
import tally.core.helper.AssertHelper;
import tally.core.node.NodeKind;
import tally.core.node.TestBody;
import tally.core.node.TestNode;

import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

public class RegistryBuilderTest {
    private static final TestBody EMPTY = checks -> {};

    @Test
    public void testTestGoesIntoTheMostRecentSuite() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareSuite("A")
                .declareSubsuite("A", "B")
                .declareTest("T", EMPTY)
                .build();

        Assert.assertEquals(1, registry.topLevel().size());
        Assert.assertEquals(NodeKind.CASE, registry.find("A", "B", "T").kind());
        Assert.assertThat(registry.find("A", "T"), nullValue());
        Assert.assertEquals(1, registry.find("A").children().size());
    }

    @Test
    public void testCurrentSuiteIsASingleSlot() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareSuite("A")
                .declareSubsuite("A", "B")
                .declareTest("InB", EMPTY)
                .declareSubsuite("A", "C")
                .declareTest("InC", EMPTY)
                .build();

        TestNode a = registry.find("A");
        Assert.assertThat(a.children().get(0).name(), equalTo("B"));
        Assert.assertThat(a.children().get(1).name(), equalTo("C"));
        Assert.assertNotNull(registry.find("A", "C", "InC"));
    }

    @Test
    public void testExplicitPlacementLeavesTheCurrentSuiteAlone() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareSuite("A")
                .declareSuite("B")
                .declareTestIn("A", "Explicit", EMPTY)
                .declareTest("Implicit", EMPTY)
                .build();

        Assert.assertNotNull(registry.find("A", "Explicit"));
        Assert.assertNotNull(registry.find("B", "Implicit"));
    }

    @Test
    public void testTestBeforeAnySuiteGoesIntoTheDefaultSuite() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareTest("First", EMPTY)
                .declareTest("Second", EMPTY)
                .declareSuite("A")
                .build();

        Assert.assertThat(registry.topLevel().get(0).name(), equalTo(RegistryBuilder.DEFAULT_SUITE_NAME));
        Assert.assertEquals(2, registry.topLevel().get(0).children().size());
        Assert.assertThat(registry.topLevel().get(1).name(), equalTo("A"));
    }

    @Test
    public void testDeclarationOrderIsKept() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareSuite("S")
                .declareTest("3", EMPTY)
                .declareTest("1", EMPTY)
                .declareTest("2", EMPTY)
                .build();

        TestNode suite = registry.find("S");
        Assert.assertThat(suite.children().get(0).name(), equalTo("3"));
        Assert.assertThat(suite.children().get(1).name(), equalTo("1"));
        Assert.assertThat(suite.children().get(2).name(), equalTo("2"));
    }

    @Test
    public void testMalformedDeclarations() {
        RegistryBuilder builder = RegistryBuilder.newBuilder().declareSuite("A").declareTest("T", EMPTY);

        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareSuite("A"));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareSubsuite("A", "A"));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareSubsuite("Missing", "X"));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareTest("T", EMPTY));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareTestIn("Missing", "U", EMPTY));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareSuite(" "));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareTest("", EMPTY));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareTest(null, EMPTY));
    }

    @Test
    public void testSameTestNameInDifferentSuites() {
        Registry registry = RegistryBuilder.newBuilder()
                .declareSuite("A")
                .declareTest("T", EMPTY)
                .declareSuite("B")
                .declareTest("T", EMPTY)
                .build();

        Assert.assertNotNull(registry.find("A", "T"));
        Assert.assertNotNull(registry.find("B", "T"));
    }

    @Test
    public void testDuplicateFixtureName() {
        RegistryBuilder builder = RegistryBuilder.newBuilder();
        FixtureDefinition<StringBuilder> fixture = builder.declareFixture("F", StringBuilder::new);

        Assert.assertThat(fixture.getName(), equalTo("F"));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareFixture("F", StringBuilder::new, sb -> sb.setLength(0)));
        AssertHelper.assertThrows(RegistrationException.class, () -> builder.declareFixture("", StringBuilder::new));
    }

    @Test
    public void testIncludeDeclaresThePlan() {
        TestPlan plan = builder -> builder.declareSuite("FromPlan").declareTest("T", EMPTY);
        Registry registry = RegistryBuilder.newBuilder().include(plan).build();
        Assert.assertNotNull(registry.find("FromPlan", "T"));
    }
}
