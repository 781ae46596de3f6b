package tally.core.report.human;

import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.output.ReportLevel;
import tally.core.report.DefaultReporters;
import tally.core.report.ReportContext;
import tally.core.report.TestReporter;

import java.util.List;

/**
 * Reports a run whose tests execute one after the other, as text for humans.
 *
 * Since nothing interleaves, the start message of a test is immediately followed by its result.
 */
public final class HumanSequentialReporter implements TestReporter {

    @Override
    public String id() {
        return DefaultReporters.HUMAN_SEQUENTIAL;
    }

    @Override
    public void reportAllTests(ReportContext context, List<FlatTest<Void>> tests) {
        HumanReports.reportAllTests(context, tests);
    }

    @Override
    public void reportGlobalStart(ReportContext context, List<FlatTest<Void>> tests) {
        // Nothing to announce.
    }

    @Override
    public void reportTestStart(ReportContext context, FlatTest<Void> test) {
        HumanReports.reportStartMessage(context, ReportLevel.DEBUG, test);
    }

    @Override
    public void reportTestResult(ReportContext context, FlatTest<ResultPayload> test) {
        HumanReports.reportResult(context, test);
    }

    @Override
    public void reportGlobalResults(ReportContext context, long wallTimeMs, List<FlatTest<ResultPayload>> passed,
                                    List<FlatTest<ResultPayload>> pending, List<FlatTest<ResultPayload>> failed,
                                    List<FlatTest<ResultPayload>> errored) {
        HumanReports.reportGlobalResults(context, wallTimeMs, passed, pending, failed, errored);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + id() + " }";
    }
}
