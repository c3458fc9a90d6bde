package tally.core.registry;

import tally.core.config.EngineConfig;
import tally.core.fault.FaultTranslator;
import tally.core.node.RunContext;
import tally.core.node.TestNode;
import tally.core.output.ResultSink;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A built test tree, ready to run. A registry can be run any number of times, each time against any sink.
 */
public final class Registry {
    private static final Logger LOGGER = Logger.forClass(Registry.class);
    private final List<TestNode> topLevel;
    private final EngineConfig config;
    private final FaultTranslator translator;

    Registry(List<TestNode> topLevel, EngineConfig config, FaultTranslator translator) {
        ObjectChecker.assertNonNull(topLevel, config, translator);
        this.topLevel = Collections.unmodifiableList(new ArrayList<>(topLevel));
        this.config = config;
        this.translator = translator;
    }

    /**
     * Returns the top-level nodes in declaration order.
     */
    public List<TestNode> topLevel() {
        return this.topLevel;
    }

    /**
     * Finds a node by the names along its path from the top level.
     *
     * @param path The names, outermost first.
     * @return the node, or null if there is none at that path.
     */
    public TestNode find(String... path) {
        ObjectChecker.assertNonNull((Object) path);
        List<TestNode> candidates = this.topLevel;
        TestNode found = null;
        for (String name : path) {
            found = null;
            for (TestNode candidate : candidates) {
                if (candidate.name().equals(name)) {
                    found = candidate;
                    break;
                }
            }
            if (found == null) {
                return null;
            }
            candidates = found.children();
        }
        return found;
    }

    /**
     * Runs every test, depth-first in declaration order, reporting to the given sink.
     *
     * @param sink The sink to report to.
     * @return the number of failures reported during this run.
     */
    public int runAll(ResultSink sink) {
        ObjectChecker.assertNonNull(sink);
        RunContext context = RunContext.of(sink, this.config, this.translator);
        LOGGER.log("Running " + this.topLevel.size() + " top-level node(s) with " + this.config);

        int failures = 0;
        sink.allTestsBegin();
        for (TestNode node : this.topLevel) {
            failures += node.run(context);
        }
        sink.allTestsEnd();

        LOGGER.log("Run finished with " + failures + " failure(s).");
        return failures;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { top level: " + this.topLevel.size() + ", config: " + this.config + " }";
    }
}
