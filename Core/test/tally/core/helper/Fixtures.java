package tally.core.helper;

import tally.core.config.RunConfig;
import tally.core.model.FlatTest;
import tally.core.model.Location;
import tally.core.model.ResultPayload;
import tally.core.model.TestOutcome;
import tally.core.model.TestPath;
import tally.core.output.ReportOutput;
import tally.core.report.TestReporter;

import java.io.ByteArrayOutputStream;
import java.util.Collections;

/**
 * Builders for the tests, results and configurations shared by the unit tests.
 */
public final class Fixtures {

    public static FlatTest<Void> test(String flatName) {
        return FlatTest.discovered(TestPath.of(flatName.split("\\.")), null);
    }

    public static FlatTest<Void> test(String flatName, String file, int line) {
        return FlatTest.discovered(TestPath.of(flatName.split("\\.")), Location.of(file, line));
    }

    public static ResultPayload payload(TestOutcome outcome, String message, long wallTimeMs) {
        return ResultPayload.Builder.newBuilder()
                .outcome(outcome)
                .message(message)
                .wallTimeMs(wallTimeMs)
                .build();
    }

    public static FlatTest<ResultPayload> result(FlatTest<Void> test, TestOutcome outcome, String message, long wallTimeMs) {
        return test.withPayload(payload(outcome, message, wallTimeMs));
    }

    public static RunConfig configFor(TestReporter reporter, boolean quiet, ByteArrayOutputStream bytes) {
        return RunConfig.Builder.newBuilder()
                .setReporters(Collections.singletonList(reporter))
                .setQuiet(quiet)
                .setOutput(ReportOutput.stream(bytes, false))
                .build();
    }
}
