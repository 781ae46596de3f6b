package tally.core.config;

import tally.core.exception.ParseException;
import tally.core.output.ReportOutput;
import tally.core.output.color.AnsiColorizer;
import tally.core.output.color.PlainColorizer;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.Properties;

/**
 * Builds a {@link RunConfig} from properties, typically the system properties the test program was launched with.
 *
 * The recognized properties are:
 *
 * tally.parallel = whether tests run in parallel (default false)
 * tally.machine_output = whether reports are meant for machines (default false)
 * tally.quiet = whether debug reports are dropped (default false)
 * tally.colors = whether human reports are colored with ANSI sequences (default false)
 * tally.output_file = the file reports are written to (default: stdout)
 * tally.split_output = whether each report goes to its own file, named by the output file followed by an index
 *                      (default false, requires tally.output_file)
 * tally.enable_logger = whether diagnostic logging is enabled (default false)
 */
public final class RunConfigLoader {
    private static final Logger LOGGER = Logger.forClass(RunConfigLoader.class);
    public static final String PARALLEL_PROPERTY = "tally.parallel";
    public static final String MACHINE_OUTPUT_PROPERTY = "tally.machine_output";
    public static final String QUIET_PROPERTY = "tally.quiet";
    public static final String COLORS_PROPERTY = "tally.colors";
    public static final String OUTPUT_FILE_PROPERTY = "tally.output_file";
    public static final String SPLIT_OUTPUT_PROPERTY = "tally.split_output";
    public static final String ENABLE_LOGGER_PROPERTY = "tally.enable_logger";

    private RunConfigLoader() {}

    public static RunConfig fromSystemProperties() throws ParseException {
        return fromProperties(System.getProperties());
    }

    /**
     * Returns the run configuration described by the given properties. Absent properties take their defaults.
     *
     * @param properties The properties.
     * @return the run configuration.
     */
    public static RunConfig fromProperties(Properties properties) throws ParseException {
        ObjectChecker.assertNonNull(properties);

        if (parseBoolean(properties, ENABLE_LOGGER_PROPERTY)) {
            Logger.globalEnable();
        }

        boolean parallel = parseBoolean(properties, PARALLEL_PROPERTY);
        boolean machineOutput = parseBoolean(properties, MACHINE_OUTPUT_PROPERTY);
        boolean quiet = parseBoolean(properties, QUIET_PROPERTY);
        boolean colors = parseBoolean(properties, COLORS_PROPERTY);
        boolean split = parseBoolean(properties, SPLIT_OUTPUT_PROPERTY);
        String outputFile = properties.getProperty(OUTPUT_FILE_PROPERTY);

        if (outputFile != null && outputFile.trim().isEmpty()) {
            throw new ParseException(OUTPUT_FILE_PROPERTY, "expected a path but was empty");
        }
        if (split && outputFile == null) {
            throw new ParseException(SPLIT_OUTPUT_PROPERTY, "split output requires " + OUTPUT_FILE_PROPERTY + " to be set");
        }

        ReportOutput output;
        if (outputFile == null) {
            output = ReportOutput.standardOutput();
        } else if (split) {
            output = ReportOutput.splitFiles(outputFile);
        } else {
            output = ReportOutput.file(outputFile);
        }

        RunConfig config = RunConfig.Builder.newBuilder()
                .setDefaultReporters(parallel, machineOutput)
                .setQuiet(quiet)
                .setOutput(output)
                .setColorizer(colors ? AnsiColorizer.ansi() : PlainColorizer.plain())
                .build();

        LOGGER.log("Loaded run config: " + config);
        return config;
    }

    private static boolean parseBoolean(Properties properties, String property) throws ParseException {
        String value = properties.getProperty(property);
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase("true")) {
            return true;
        } else if (trimmed.equalsIgnoreCase("false")) {
            return false;
        } else {
            throw new ParseException(property, "expected true or false but was: " + value);
        }
    }
}
