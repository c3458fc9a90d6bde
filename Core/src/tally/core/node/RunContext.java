package tally.core.node;

import tally.core.config.EngineConfig;
import tally.core.fault.FaultTranslator;
import tally.core.output.ResultSink;
import tally.core.util.ObjectChecker;

/**
 * Everything a node needs while it runs: where to report, how to behave, and which translator guards it.
 */
public final class RunContext {
    private final ResultSink sink;
    private final EngineConfig config;
    private final FaultTranslator translator;

    private RunContext(ResultSink sink, EngineConfig config, FaultTranslator translator) {
        ObjectChecker.assertNonNull(sink, config, translator);
        this.sink = sink;
        this.config = config;
        this.translator = translator;
    }

    public static RunContext of(ResultSink sink, EngineConfig config, FaultTranslator translator) {
        return new RunContext(sink, config, translator);
    }

    public ResultSink getSink() {
        return this.sink;
    }

    public EngineConfig getConfig() {
        return this.config;
    }

    public FaultTranslator getTranslator() {
        return this.translator;
    }
}
