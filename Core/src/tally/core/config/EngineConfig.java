package tally.core.config;

/**
 * The switches the engine consults while running tests.
 *
 * The defaults can be overridden by system properties (see {@link #fromSystemProperties()}) or explicitly through
 * the {@link Builder}.
 *
 * {@link EngineConfig#catchExceptions}: when false, no error thrown by a test body or fixture teardown is caught and
 * the first one aborts the whole run. Failed checks still end only their own test.
 * {@link EngineConfig#catchSignals}: when false, OS signals are not translated into test failures. Signal catching
 * is never active while exception catching is off.
 */
public final class EngineConfig {
    public static final String CATCH_EXCEPTIONS_PROPERTY = "tally.catch_exceptions";
    public static final String CATCH_SIGNALS_PROPERTY = "tally.catch_signals";
    public static final String ENABLE_LOGGER_PROPERTY = "tally.enable_logger";

    public final boolean catchExceptions;
    public final boolean catchSignals;
    public final boolean enableLogger;

    private EngineConfig(boolean catchExceptions, boolean catchSignals, boolean enableLogger) {
        this.catchExceptions = catchExceptions;
        this.catchSignals = catchExceptions && catchSignals;
        this.enableLogger = enableLogger;
    }

    /**
     * Returns the default configuration: exceptions and signals are caught, logging is off.
     */
    public static EngineConfig defaults() {
        return Builder.newBuilder().build();
    }

    /**
     * Returns the configuration described by the {@code tally.*} system properties, falling back to the defaults for
     * any property that is not set.
     */
    public static EngineConfig fromSystemProperties() {
        return Builder.newBuilder()
                .catchExceptions(booleanProperty(CATCH_EXCEPTIONS_PROPERTY, true))
                .catchSignals(booleanProperty(CATCH_SIGNALS_PROPERTY, true))
                .enableLogger(booleanProperty(ENABLE_LOGGER_PROPERTY, false))
                .build();
    }

    private static boolean booleanProperty(String name, boolean defaultValue) {
        String value = System.getProperty(name);
        return (value == null) ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { catch exceptions: " + this.catchExceptions + ", catch signals: " + this.catchSignals + ", logger: " + this.enableLogger + " }";
    }

    public static final class Builder {
        private boolean catchExceptions = true;
        private boolean catchSignals = true;
        private boolean enableLogger = false;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder catchExceptions(boolean catchExceptions) {
            this.catchExceptions = catchExceptions;
            return this;
        }

        public Builder catchSignals(boolean catchSignals) {
            this.catchSignals = catchSignals;
            return this;
        }

        public Builder enableLogger(boolean enableLogger) {
            this.enableLogger = enableLogger;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this.catchExceptions, this.catchSignals, this.enableLogger);
        }
    }
}
