package tally.core.report.machine;

import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.model.RunTotals;
import tally.core.output.ReportLevel;
import tally.core.report.ReportContext;

import java.util.List;

/**
 * The machine-readable reports that the sequential and parallel machine reporters have in common. Machine reports are
 * always written at info level: a consumer must see every event, quiet or not.
 */
final class MachineReports {

    private MachineReports() {}

    static void reportTestStart(ReportContext context, FlatTest<Void> test) {
        context.channel.writeJson(ReportLevel.INFO, MachineFormatter.testStartEvent(test));
    }

    static void reportTestResult(ReportContext context, FlatTest<ResultPayload> test) {
        context.channel.writeJson(ReportLevel.INFO, MachineFormatter.testEndEvent(test));
    }

    static void reportAllTests(ReportContext context, List<FlatTest<Void>> tests) {
        context.channel.writeJson(ReportLevel.INFO, MachineFormatter.testListEvent(tests));
    }

    static void reportGlobalResults(ReportContext context, long wallTimeMs, List<FlatTest<ResultPayload>> passed,
                                    List<FlatTest<ResultPayload>> pending, List<FlatTest<ResultPayload>> failed,
                                    List<FlatTest<ResultPayload>> errored) {
        RunTotals totals = RunTotals.count(wallTimeMs, passed, pending, failed, errored);
        context.channel.writeJson(ReportLevel.INFO, MachineFormatter.testResultsEvent(totals));
    }
}
