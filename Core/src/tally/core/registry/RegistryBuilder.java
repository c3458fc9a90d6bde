package tally.core.registry;

import tally.core.config.EngineConfig;
import tally.core.exception.RegistrationException;
import tally.core.fault.FaultTranslator;
import tally.core.fixture.FixtureDefinition;
import tally.core.node.FixtureTestBody;
import tally.core.node.NodeKind;
import tally.core.node.TestBody;
import tally.core.node.TestCase;
import tally.core.node.TestNode;
import tally.core.node.TestSuite;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Collects the declarations of a test tree and builds the {@link Registry} that runs it.
 *
 * Tests are declared into the current suite: the suite most recently declared, whatever its depth. A test declared
 * before any suite goes into a top-level suite named {@value #DEFAULT_SUITE_NAME}, created on first use.
 *
 * Every malformed declaration throws a {@link RegistrationException} immediately.
 */
public final class RegistryBuilder {
    public static final String DEFAULT_SUITE_NAME = "DefaultTestSuite";
    private static final Logger LOGGER = Logger.forClass(RegistryBuilder.class);
    private static final int NO_SUITE = -1;
    private final List<Descriptor> arena = new ArrayList<>();
    private final List<Integer> topLevel = new ArrayList<>();
    private final Map<String, Integer> suitesByName = new HashMap<>();
    private final Map<String, FixtureDefinition<?>> fixturesByName = new HashMap<>();
    private int currentSuite = NO_SUITE;
    private EngineConfig config = null;
    private FaultTranslator translator = null;

    private RegistryBuilder() {}

    public static RegistryBuilder newBuilder() {
        return new RegistryBuilder();
    }

    /**
     * Declares a top-level suite and makes it the current suite.
     *
     * @param name The name of the suite. Unique among all suites.
     * @return this builder.
     */
    public RegistryBuilder declareSuite(String name) {
        int index = addSuite(name);
        this.topLevel.add(index);
        this.currentSuite = index;
        return this;
    }

    /**
     * Declares a suite inside an already declared suite and makes it the current suite.
     *
     * @param parentName The name of the enclosing suite.
     * @param name The name of the suite. Unique among all suites.
     * @return this builder.
     */
    public RegistryBuilder declareSubsuite(String parentName, String name) {
        int parent = suiteIndex(parentName);
        int index = addSuite(name);
        this.arena.get(parent).children.add(index);
        this.currentSuite = index;
        return this;
    }

    /**
     * Declares a test in the current suite.
     */
    public RegistryBuilder declareTest(String name, TestBody body) {
        return addTest(currentSuiteIndex(), name, body);
    }

    /**
     * Declares a test in the current suite that runs with a fresh instance of the given fixture.
     */
    public <F> RegistryBuilder declareTest(String name, FixtureDefinition<F> fixture, FixtureTestBody<F> body) {
        ObjectChecker.assertNonNull(fixture, body);
        return addTest(currentSuiteIndex(), name, TestBody.withFixture(fixture, body));
    }

    /**
     * Declares a test in the named suite. The current suite is left as it is.
     */
    public RegistryBuilder declareTestIn(String suiteName, String name, TestBody body) {
        return addTest(suiteIndex(suiteName), name, body);
    }

    /**
     * Declares a fixture without teardown.
     */
    public <F> FixtureDefinition<F> declareFixture(String name, Supplier<? extends F> setup) {
        return registerFixture(FixtureDefinition.of(checkName(name, "fixture"), setup));
    }

    /**
     * Declares a fixture. Each test that uses it gets an instance of its own from {@code setup}, which is handed to
     * {@code teardown} once the test is over.
     *
     * @param name The name of the fixture. Unique among all fixtures.
     * @param setup Constructs a fixture instance.
     * @param teardown Releases a fixture instance.
     * @return the fixture definition to declare tests with.
     */
    public <F> FixtureDefinition<F> declareFixture(String name, Supplier<? extends F> setup, Consumer<? super F> teardown) {
        return registerFixture(FixtureDefinition.of(checkName(name, "fixture"), setup, teardown));
    }

    /**
     * Lets the plan declare its tests into this builder.
     */
    public RegistryBuilder include(TestPlan plan) {
        ObjectChecker.assertNonNull(plan);
        LOGGER.log("Declaring test plan: " + plan.getClass().getName());
        plan.declare(this);
        return this;
    }

    public RegistryBuilder withConfig(EngineConfig config) {
        ObjectChecker.assertNonNull(config);
        this.config = config;
        return this;
    }

    public RegistryBuilder withFaultTranslator(FaultTranslator translator) {
        ObjectChecker.assertNonNull(translator);
        this.translator = translator;
        return this;
    }

    /**
     * Builds the registry. Unless overridden, it is configured from the system properties and translates faults with
     * the global translator.
     *
     * @return the registry.
     */
    public Registry build() {
        List<TestNode> nodes = new ArrayList<>();
        for (int index : this.topLevel) {
            nodes.add(buildNode(index));
        }
        EngineConfig builtConfig = (this.config == null) ? EngineConfig.fromSystemProperties() : this.config;
        FaultTranslator builtTranslator = (this.translator == null) ? FaultTranslator.global() : this.translator;
        return new Registry(nodes, builtConfig, builtTranslator);
    }

    private TestNode buildNode(int index) {
        Descriptor descriptor = this.arena.get(index);
        if (descriptor.kind == NodeKind.CASE) {
            return TestCase.of(descriptor.name, descriptor.body);
        }
        List<TestNode> children = new ArrayList<>();
        for (int child : descriptor.children) {
            children.add(buildNode(child));
        }
        return TestSuite.of(descriptor.name, children);
    }

    private int addSuite(String name) {
        checkName(name, "suite");
        if (this.suitesByName.containsKey(name)) {
            throw new RegistrationException("Duplicate suite name: " + name);
        }
        int index = this.arena.size();
        this.arena.add(Descriptor.suite(name));
        this.suitesByName.put(name, index);
        return index;
    }

    private RegistryBuilder addTest(int suite, String name, TestBody body) {
        checkName(name, "test");
        ObjectChecker.assertNonNull(body);
        Descriptor parent = this.arena.get(suite);
        if (!parent.testNames.add(name)) {
            throw new RegistrationException("Duplicate test name in suite " + parent.name + ": " + name);
        }
        int index = this.arena.size();
        this.arena.add(Descriptor.test(name, body));
        parent.children.add(index);
        return this;
    }

    private <F> FixtureDefinition<F> registerFixture(FixtureDefinition<F> fixture) {
        if (this.fixturesByName.putIfAbsent(fixture.getName(), fixture) != null) {
            throw new RegistrationException("Duplicate fixture name: " + fixture.getName());
        }
        return fixture;
    }

    private int currentSuiteIndex() {
        if (this.currentSuite == NO_SUITE) {
            Integer existing = this.suitesByName.get(DEFAULT_SUITE_NAME);
            if (existing == null) {
                declareSuite(DEFAULT_SUITE_NAME);
            } else {
                this.currentSuite = existing;
            }
        }
        return this.currentSuite;
    }

    private int suiteIndex(String name) {
        checkName(name, "suite");
        Integer index = this.suitesByName.get(name);
        if (index == null) {
            throw new RegistrationException("Unknown suite: " + name);
        }
        return index;
    }

    private static String checkName(String name, String what) {
        if (name == null || name.trim().isEmpty()) {
            throw new RegistrationException("The " + what + " name must not be blank.");
        }
        return name;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { nodes: " + this.arena.size() + ", suites: " + this.suitesByName.size() + " }";
    }

    private static final class Descriptor {
        private final NodeKind kind;
        private final String name;
        private final TestBody body;
        private final List<Integer> children = new ArrayList<>();
        private final Set<String> testNames = new HashSet<>();

        private Descriptor(NodeKind kind, String name, TestBody body) {
            this.kind = kind;
            this.name = name;
            this.body = body;
        }

        private static Descriptor suite(String name) {
            return new Descriptor(NodeKind.SUITE, name, null);
        }

        private static Descriptor test(String name, TestBody body) {
            return new Descriptor(NodeKind.CASE, name, body);
        }
    }
}
