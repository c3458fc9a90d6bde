package tally.core.output;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import tally.core.node.NodeKind;
import tally.core.node.TestCase;
import tally.core.node.TestNode;
import tally.core.type.FailureRecord;
import tally.core.util.ObjectChecker;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Collects a run into a JSON report and prints it, on a single line, once the run ends.
 *
 * The report holds the counts, the duration, the outcome of every test case by its slash-separated path, and every
 * failure both as structured fields and in its standard textual rendering.
 */
public final class JsonResultSink extends CountingResultSink {
    private final PrintStream out;
    private final Deque<String> path = new ArrayDeque<>();
    private JsonArray cases = new JsonArray();
    private JsonArray failureRecords = new JsonArray();

    private JsonResultSink(PrintStream out) {
        ObjectChecker.assertNonNull(out);
        this.out = out;
    }

    public static JsonResultSink toStream(PrintStream out) {
        return new JsonResultSink(out);
    }

    @Override
    public void allTestsBegin() {
        super.allTestsBegin();
        this.cases = new JsonArray();
        this.failureRecords = new JsonArray();
        this.path.clear();
    }

    @Override
    public void allTestsEnd() {
        super.allTestsEnd();
        this.out.println(toJsonString());
        this.out.flush();
    }

    @Override
    public void testBegins(TestNode node) {
        super.testBegins(node);
        this.path.addLast(node.name());
    }

    @Override
    public void testEnds(TestNode node) {
        super.testEnds(node);
        if (node.kind() == NodeKind.CASE) {
            JsonObject testCase = new JsonObject();
            testCase.addProperty("path", String.join("/", this.path));
            if (node instanceof TestCase) {
                testCase.addProperty("status", ((TestCase) node).state().name());
            }
            this.cases.add(testCase);
        }
        this.path.pollLast();
    }

    @Override
    public void addFailure(FailureRecord failure) {
        super.addFailure(failure);
        JsonObject record = new JsonObject();
        record.addProperty("test", failure.testName);
        record.addProperty("file", failure.fileName);
        record.addProperty("line", failure.line);
        record.addProperty("condition", failure.condition);
        record.addProperty("text", failure.toString());
        this.failureRecords.add(record);
    }

    /**
     * Returns the report of the current or last run as a JSON-encoded string.
     *
     * @return the JSON report.
     */
    public String toJsonString() {
        JsonObject report = new JsonObject();
        report.addProperty("tests", testCount());
        report.addProperty("passed", passed());
        report.addProperty("failures", failures());
        report.addProperty("duration_nanos", elapsedNanos());
        report.add("cases", this.cases);
        report.add("failure_records", this.failureRecords);
        return report.toString();
    }
}
