package tally.core.report.human;

import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.model.RunTotals;
import tally.core.model.TestOutcome;
import tally.core.output.ReportLevel;
import tally.core.report.ReportContext;

import java.util.List;

/**
 * The human-readable reports that the sequential and parallel human reporters have in common.
 */
final class HumanReports {

    private HumanReports() {}

    static HumanFormatter formatter(ReportContext context) {
        return HumanFormatter.withColors(context.colorizer());
    }

    static void reportStartMessage(ReportContext context, ReportLevel level, FlatTest<?> test) {
        context.channel.writeLine(level, formatter(context).startMessage(test));
    }

    /**
     * Passed tests are reported at debug level. Any other outcome is reported at info level, and, since in quiet mode
     * the debug-level start message was dropped, is then preceded by the start message at info level.
     */
    static void reportResult(ReportContext context, FlatTest<ResultPayload> test) {
        HumanFormatter formatter = formatter(context);

        if (test.payload.outcome == TestOutcome.PASS) {
            context.channel.writeLine(ReportLevel.DEBUG, formatter.resultMessage(test.payload));
        } else {
            if (context.isQuiet()) {
                reportStartMessage(context, ReportLevel.INFO, test);
            }
            context.channel.writeLine(ReportLevel.INFO, formatter.resultMessage(test.payload));
        }
    }

    static void reportAllTests(ReportContext context, List<FlatTest<Void>> tests) {
        context.channel.writeLine(ReportLevel.INFO, formatter(context).testList(tests));
    }

    static void reportGlobalResults(ReportContext context, long wallTimeMs, List<FlatTest<ResultPayload>> passed,
                                    List<FlatTest<ResultPayload>> pending, List<FlatTest<ResultPayload>> failed,
                                    List<FlatTest<ResultPayload>> errored) {
        HumanFormatter formatter = formatter(context);
        RunTotals totals = RunTotals.count(wallTimeMs, passed, pending, failed, errored);

        context.channel.writeLine(ReportLevel.INFO, formatter.totalsBlock(totals));
        if (!pending.isEmpty()) {
            context.channel.writeLine(ReportLevel.INFO, formatter.bucketBlock(TestOutcome.PENDING, pending));
        }
        if (!failed.isEmpty()) {
            context.channel.writeLine(ReportLevel.INFO, formatter.bucketBlock(TestOutcome.FAIL, failed));
        }
        if (!errored.isEmpty()) {
            context.channel.writeLine(ReportLevel.INFO, formatter.bucketBlock(TestOutcome.ERROR, errored));
        }
        context.channel.writeLine(ReportLevel.INFO, formatter.totalTime(totals.wallTimeMs));
    }
}
