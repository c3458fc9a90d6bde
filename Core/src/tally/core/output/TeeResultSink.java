package tally.core.output;

import tally.core.node.TestNode;
import tally.core.type.FailureRecord;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Passes every event on to each of the attached sinks, in the order they were attached, while keeping counts of its
 * own. With zero sinks attached it only counts.
 */
public final class TeeResultSink extends CountingResultSink {
    private final List<ResultSink> sinks;

    private TeeResultSink(List<ResultSink> sinks) {
        this.sinks = Collections.unmodifiableList(new ArrayList<>(sinks));
    }

    @Override
    public void allTestsBegin() {
        super.allTestsBegin();
        for (ResultSink sink : this.sinks) {
            sink.allTestsBegin();
        }
    }

    @Override
    public void allTestsEnd() {
        super.allTestsEnd();
        for (ResultSink sink : this.sinks) {
            sink.allTestsEnd();
        }
    }

    @Override
    public void testBegins(TestNode node) {
        super.testBegins(node);
        for (ResultSink sink : this.sinks) {
            sink.testBegins(node);
        }
    }

    @Override
    public void testEnds(TestNode node) {
        super.testEnds(node);
        for (ResultSink sink : this.sinks) {
            sink.testEnds(node);
        }
    }

    @Override
    public void addFailure(FailureRecord failure) {
        super.addFailure(failure);
        for (ResultSink sink : this.sinks) {
            sink.addFailure(failure);
        }
    }

    public List<ResultSink> getSinks() {
        return this.sinks;
    }

    public static final class Builder {
        private final List<ResultSink> sinks = new ArrayList<>();

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder attachSink(ResultSink sink) {
            ObjectChecker.assertNonNull(sink);
            this.sinks.add(sink);
            return this;
        }

        public TeeResultSink build() {
            return new TeeResultSink(this.sinks);
        }
    }
}
