package tally.core.type;

import tally.core.util.ObjectChecker;

/**
 * An immutable description of a single test failure.
 *
 * {@link FailureRecord#condition}: the condition that provoked the failure, including any note.
 * {@link FailureRecord#testName}: the name of the test that failed.
 * {@link FailureRecord#fileName}: the source file of the failing check, or {@link #UNKNOWN_FILE}.
 * {@link FailureRecord#line}: the source line of the failing check, or {@link #UNKNOWN_LINE}.
 *
 * The rendering returned by {@link #toString()} is read by downstream result parsers and must not change.
 */
public final class FailureRecord {
    public static final String UNKNOWN_FILE = "unknown file";
    public static final int UNKNOWN_LINE = -1;

    public final String condition;
    public final String testName;
    public final String fileName;
    public final int line;

    private FailureRecord(String condition, String testName, String fileName, int line) {
        ObjectChecker.assertNonNull(condition, testName, fileName);
        this.condition = condition;
        this.testName = testName;
        this.fileName = fileName;
        this.line = line;
    }

    public static FailureRecord at(String condition, String testName, String fileName, int line) {
        return new FailureRecord(condition, testName, fileName, line);
    }

    public static FailureRecord withoutLocation(String condition, String testName) {
        return new FailureRecord(condition, testName, UNKNOWN_FILE, UNKNOWN_LINE);
    }

    /**
     * Appends the caller-supplied note to a condition the same way every failure does.
     */
    public static String conditionWithNote(String condition, String note) {
        if (note == null || note.isEmpty()) {
            return condition;
        }
        return condition + ", Note: " + note;
    }

    public boolean hasLocation() {
        return this.line != UNKNOWN_LINE;
    }

    @Override
    public String toString() {
        return this.fileName + "(" + this.line + "): Failure: \"" + this.condition + "\"";
    }
}
