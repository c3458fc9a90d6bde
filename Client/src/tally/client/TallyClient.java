package tally.client;

import tally.core.config.EngineConfig;
import tally.core.exception.RegistrationException;
import tally.core.output.ConsoleResultSink;
import tally.core.output.CountingResultSink;
import tally.core.output.JsonResultSink;
import tally.core.output.TeeResultSink;
import tally.core.registry.Registry;
import tally.core.registry.RegistryBuilder;
import tally.core.registry.TestPlan;
import tally.core.type.Result;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.nio.charset.StandardCharsets;

/**
 * A single-use client that declares the given test plans, runs them once and exits with the number of failures.
 */
public final class TallyClient {
    public static final String OUTPUT_PROPERTY = "tally.output";
    public static final String REPORT_FILE_PROPERTY = "tally.report_file";
    public static final int MAX_EXIT_CODE = 255;
    private static final Logger LOGGER = Logger.forClass(TallyClient.class);

    /**
     * We expect every argument to be the fully-qualified name of a {@link TestPlan} class with a public no-argument
     * constructor. The plans are declared in argument order.
     *
     * The process exits with the number of failed tests, capped at {@value #MAX_EXIT_CODE}, or with 1 if the
     * arguments or the declarations are malformed.
     *
     * @param args The program arguments.
     */
    public static void main(String[] args) {
        Result<Integer> result;
        try {
            result = run(args, System.out);
        } catch (Throwable t) {
            System.err.println("Unexpected Error!");
            t.printStackTrace();
            System.exit(1);
            return;
        } finally {
            LOGGER.log("Exiting.");
        }

        if (!result.isSuccess()) {
            System.err.println(result.getError());
            System.err.println(usage());
            System.exit(1);
            return;
        }
        System.exit(exitCodeFor(result.getData()));
    }

    /**
     * Declares and runs the given test plans, printing to the given stream.
     *
     * @param args The fully-qualified names of the test plan classes.
     * @param out The stream to print results to.
     * @return the number of failures, or an error if the plans could not be loaded or declared.
     */
    public static Result<Integer> run(String[] args, PrintStream out) throws IOException {
        ObjectChecker.assertNonNull(out);
        if (args == null || args.length == 0) {
            return Result.error("No test plans given.");
        }

        EngineConfig config = EngineConfig.fromSystemProperties();
        if (config.enableLogger) {
            Logger.globalEnable();
        } else {
            Logger.globalDisable();
        }
        logArguments(args);

        String output = System.getProperty(OUTPUT_PROPERTY, "console");
        if (!output.equals("console") && !output.equals("json")) {
            return Result.error("Unknown " + OUTPUT_PROPERTY + " value: " + output);
        }

        RegistryBuilder builder = RegistryBuilder.newBuilder().withConfig(config);
        for (String className : args) {
            Result<TestPlan> plan = loadPlan(className);
            if (!plan.isSuccess()) {
                return Result.error(plan.getError());
            }
            try {
                builder.include(plan.getData());
            } catch (RegistrationException e) {
                return Result.error("Malformed declaration in " + className + ": " + e.getMessage());
            }
        }
        Registry registry = builder.build();

        CountingResultSink console = output.equals("json") ? JsonResultSink.toStream(out) : ConsoleResultSink.toStream(out);
        String reportFile = System.getProperty(REPORT_FILE_PROPERTY);
        if (reportFile == null) {
            return Result.successful(registry.runAll(console));
        }

        LOGGER.log("Writing report to: " + reportFile);
        try (PrintStream report = new PrintStream(new FileOutputStream(reportFile), true, StandardCharsets.UTF_8)) {
            TeeResultSink sink = TeeResultSink.Builder.newBuilder()
                    .attachSink(console)
                    .attachSink(JsonResultSink.toStream(report))
                    .build();
            return Result.successful(registry.runAll(sink));
        }
    }

    /**
     * Returns the process exit code for the given number of failures.
     */
    public static int exitCodeFor(int failures) {
        ObjectChecker.assertNonNegative(failures);
        return Math.min(failures, MAX_EXIT_CODE);
    }

    private static Result<TestPlan> loadPlan(String className) {
        LOGGER.log("Loading test plan: " + className);
        Class<?> planClass;
        try {
            planClass = Class.forName(className);
        } catch (ClassNotFoundException e) {
            return Result.error("Unknown test plan class: " + className);
        }

        if (!TestPlan.class.isAssignableFrom(planClass)) {
            return Result.error("Not a " + TestPlan.class.getSimpleName() + ": " + className);
        }

        try {
            return Result.successful((TestPlan) planClass.getConstructor().newInstance());
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException e) {
            return Result.error("Cannot instantiate test plan " + className + ": it needs a public no-argument constructor.");
        } catch (InvocationTargetException e) {
            return Result.error("Constructor of test plan " + className + " threw: " + e.getCause());
        }
    }

    private static void logArguments(String[] args) {
        LOGGER.log("ARGS ------------------------------------------------");
        for (String a : args) {
            LOGGER.log(a);
        }
        LOGGER.log("ARGS ------------------------------------------------\n");
    }

    private static String usage() {
        return "USAGE: " + TallyClient.class.getName() + " <test plan class> [<test plan class>...]\n"
                + "  -D" + EngineConfig.CATCH_EXCEPTIONS_PROPERTY + "=true|false\n"
                + "  -D" + EngineConfig.CATCH_SIGNALS_PROPERTY + "=true|false\n"
                + "  -D" + EngineConfig.ENABLE_LOGGER_PROPERTY + "=true|false\n"
                + "  -D" + OUTPUT_PROPERTY + "=console|json\n"
                + "  -D" + REPORT_FILE_PROPERTY + "=<path>";
    }
}
