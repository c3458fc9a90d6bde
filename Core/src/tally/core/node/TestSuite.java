package tally.core.node;

import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of test nodes, run in declaration order. A suite is never failed itself: only its test cases count.
 */
public final class TestSuite extends TestNode {
    private final List<TestNode> children;

    private TestSuite(String name, List<TestNode> children) {
        super(name, NodeKind.SUITE);
        ObjectChecker.assertNonNull(children);
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public static TestSuite of(String name, List<TestNode> children) {
        return new TestSuite(name, children);
    }

    @Override
    public List<TestNode> children() {
        return this.children;
    }

    @Override
    protected void execute(RunContext context) {
        for (TestNode child : this.children) {
            child.run(context);
        }
    }
}
