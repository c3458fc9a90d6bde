package tally.core.node;

import tally.core.output.ResultSink;
import tally.core.util.ObjectChecker;

import java.util.List;

/**
 * A node in a test tree: either a single {@link TestCase} or a {@link TestSuite} of further nodes.
 *
 * Running a node always brackets its own execution between {@link ResultSink#testBegins(TestNode)} and
 * {@link ResultSink#testEnds(TestNode)}.
 */
public abstract class TestNode {
    private final String name;
    private final NodeKind kind;

    protected TestNode(String name, NodeKind kind) {
        ObjectChecker.assertNonBlank(name, "name");
        ObjectChecker.assertNonNull(kind);
        this.name = name;
        this.kind = kind;
    }

    public final String name() {
        return this.name;
    }

    public final NodeKind kind() {
        return this.kind;
    }

    /**
     * Returns the children of this node in declaration order. Always empty for a test case.
     */
    public abstract List<TestNode> children();

    /**
     * Runs this node, reporting to the sink of the given context.
     *
     * @param context The run context.
     * @return the number of failures reported while this node ran.
     */
    public final int run(RunContext context) {
        ObjectChecker.assertNonNull(context);
        ResultSink sink = context.getSink();
        int failuresBefore = sink.failures();

        sink.testBegins(this);
        execute(context);
        sink.testEnds(this);
        onReported();

        return sink.failures() - failuresBefore;
    }

    /**
     * Executes this node itself. Implementations contain every failure unless the configuration says otherwise.
     */
    protected abstract void execute(RunContext context);

    /**
     * Invoked after the sink has been told this node ended.
     */
    protected void onReported() {
    }

    @Override
    public String toString() {
        return this.kind + " { " + this.name + " }";
    }
}
