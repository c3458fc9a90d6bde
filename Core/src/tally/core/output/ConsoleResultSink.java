package tally.core.output;

import tally.core.node.NodeKind;
import tally.core.node.TestNode;
import tally.core.type.FailureRecord;
import tally.core.util.ObjectChecker;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders a run as an indented tree on a print stream.
 *
 * Suites are printed as {@code + name}, test cases as {@code - name}, each failure as {@code ! <failure>} under the
 * test it belongs to. A summary of the counts and the running time follows the run.
 */
public final class ConsoleResultSink extends CountingResultSink {
    private static final int INDENT_STEP = 2;
    private final PrintStream out;
    private int indent = 0;

    private ConsoleResultSink(PrintStream out) {
        ObjectChecker.assertNonNull(out);
        this.out = out;
    }

    public static ConsoleResultSink toStream(PrintStream out) {
        return new ConsoleResultSink(out);
    }

    @Override
    public void allTestsBegin() {
        super.allTestsBegin();
        this.out.println();
        this.out.println();
        this.out.println("Running unit tests...");
        this.out.println();
    }

    @Override
    public void allTestsEnd() {
        super.allTestsEnd();
        this.out.println();
        this.out.println("Summary:");
        this.out.println("  - Executed tests : " + alignRight(8, String.valueOf(testCount())));
        this.out.println("  - Passed tests   : " + alignRight(8, String.valueOf(passed())));
        if (failures() != 0) {
            this.out.println("  - Failed tests   : " + alignRight(8, String.valueOf(failures())));
        }
        this.out.println();
        this.out.println("Tests running time: " + nanosToSecondsString(elapsedNanos()) + "s.");
        this.out.println();
        this.out.flush();
    }

    @Override
    public void testBegins(TestNode node) {
        super.testBegins(node);
        String marker = (node.kind() == NodeKind.SUITE) ? "+ " : "- ";
        this.out.println(alignRight(this.indent + INDENT_STEP, marker) + node.name());
        this.indent += INDENT_STEP;
    }

    @Override
    public void testEnds(TestNode node) {
        super.testEnds(node);
        this.indent = Math.max(0, this.indent - INDENT_STEP);
    }

    @Override
    public void addFailure(FailureRecord failure) {
        super.addFailure(failure);
        this.out.println(alignRight(this.indent, "! ") + failure);
    }

    /**
     * Returns the current indentation depth, in columns.
     */
    public int getIndent() {
        return this.indent;
    }

    private static String alignRight(int width, String text) {
        StringBuilder builder = new StringBuilder();
        for (int i = text.length(); i < width; i++) {
            builder.append(' ');
        }
        return builder.append(text).toString();
    }

    private static String nanosToSecondsString(long nanos) {
        return BigDecimal.valueOf(nanos).setScale(4, RoundingMode.HALF_DOWN)
                .divide(BigDecimal.valueOf(1_000_000_000L), RoundingMode.HALF_DOWN).setScale(4, RoundingMode.HALF_DOWN)
                .toPlainString();
    }
}
