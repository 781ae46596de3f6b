package tally.core.report.machine;

import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.report.DefaultReporters;
import tally.core.report.ReportContext;
import tally.core.report.TestReporter;

import java.util.List;

/**
 * Reports a run whose tests execute one after the other as structured events for machines.
 */
public final class MachineSequentialReporter implements TestReporter {

    @Override
    public String id() {
        return DefaultReporters.MACHINE_SEQUENTIAL;
    }

    @Override
    public void reportAllTests(ReportContext context, List<FlatTest<Void>> tests) {
        MachineReports.reportAllTests(context, tests);
    }

    @Override
    public void reportGlobalStart(ReportContext context, List<FlatTest<Void>> tests) {
        // Consumers learn about the tests from the test list and the start events.
    }

    @Override
    public void reportTestStart(ReportContext context, FlatTest<Void> test) {
        MachineReports.reportTestStart(context, test);
    }

    @Override
    public void reportTestResult(ReportContext context, FlatTest<ResultPayload> test) {
        MachineReports.reportTestResult(context, test);
    }

    @Override
    public void reportGlobalResults(ReportContext context, long wallTimeMs, List<FlatTest<ResultPayload>> passed,
                                    List<FlatTest<ResultPayload>> pending, List<FlatTest<ResultPayload>> failed,
                                    List<FlatTest<ResultPayload>> errored) {
        MachineReports.reportGlobalResults(context, wallTimeMs, passed, pending, failed, errored);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + id() + " }";
    }
}
