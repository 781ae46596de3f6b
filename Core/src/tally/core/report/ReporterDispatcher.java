package tally.core.report;

import tally.core.config.RunConfig;
import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.output.OutputChannel;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.util.List;

/**
 * A class that is responsible for broadcasting the lifecycle events of a single test run to every reporter registered
 * in the run's configuration.
 *
 * Each event is handed to the reporters one after the other, in the order they were registered. The dispatcher does not
 * catch anything a reporter throws: a reporter that fails to write its report fails the run, since a silently missing
 * report is worse than a crashed run.
 *
 * The dispatcher owns the {@link OutputChannel} of the run and MUST be closed once the run is finished so that an
 * output file opened for the run is flushed and closed.
 *
 * The dispatcher holds no mutable state of its own apart from its closed flag, so the per-test events may be dispatched
 * concurrently by several executor workers.
 */
public final class ReporterDispatcher implements AutoCloseable {
    private static final Logger LOGGER = Logger.forClass(ReporterDispatcher.class);
    private final List<TestReporter> reporters;
    private final ReportContext context;
    private volatile boolean isClosed = false;

    private ReporterDispatcher(RunConfig config, OutputChannel channel) {
        this.reporters = config.reporters;
        this.context = ReportContext.of(config, channel);
    }

    /**
     * Returns a dispatcher for the given run configuration, opening the run's output channel.
     *
     * @param config The run configuration.
     * @return the dispatcher.
     */
    public static ReporterDispatcher forConfig(RunConfig config) {
        ObjectChecker.assertNonNull(config);
        ReporterDispatcher dispatcher = new ReporterDispatcher(config, OutputChannel.open(config.quiet, config.output));
        LOGGER.log("Dispatching to " + config.reporters.size() + " reporter(s): " + config);
        return dispatcher;
    }

    public void reportAllTests(List<FlatTest<Void>> tests) {
        throwIfClosed();
        ObjectChecker.assertNonNull(tests);

        for (TestReporter reporter : this.reporters) {
            reporter.reportAllTests(this.context, tests);
        }
    }

    public void reportGlobalStart(List<FlatTest<Void>> tests) {
        throwIfClosed();
        ObjectChecker.assertNonNull(tests);

        for (TestReporter reporter : this.reporters) {
            reporter.reportGlobalStart(this.context, tests);
        }
    }

    public void reportTestStart(FlatTest<Void> test) {
        throwIfClosed();
        ObjectChecker.assertNonNull(test);

        for (TestReporter reporter : this.reporters) {
            reporter.reportTestStart(this.context, test);
        }
    }

    public void reportTestResult(FlatTest<ResultPayload> test) {
        throwIfClosed();
        ObjectChecker.assertNonNull(test);
        ObjectChecker.assertNonNull(test.payload);

        for (TestReporter reporter : this.reporters) {
            reporter.reportTestResult(this.context, test);
        }
    }

    public void reportGlobalResults(long wallTimeMs, List<FlatTest<ResultPayload>> passed, List<FlatTest<ResultPayload>> pending,
                                    List<FlatTest<ResultPayload>> failed, List<FlatTest<ResultPayload>> errored) {
        throwIfClosed();
        ObjectChecker.assertNonNull(passed, pending, failed, errored);
        ObjectChecker.assertNonNegative(wallTimeMs);

        for (TestReporter reporter : this.reporters) {
            reporter.reportGlobalResults(this.context, wallTimeMs, passed, pending, failed, errored);
        }
    }

    public ReportContext getContext() {
        return this.context;
    }

    /**
     * Closes the output channel of the run if this dispatcher is not already closed.
     */
    @Override
    public void close() {
        if (!this.isClosed) {
            this.isClosed = true;
            this.context.channel.close();
            LOGGER.log("Dispatcher closed.");
        }
    }

    private void throwIfClosed() {
        if (this.isClosed) {
            throw new IllegalStateException("dispatcher is closed.");
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { reporters: " + this.reporters.size() + (this.isClosed ? ", [closed]" : ", [open]") + " }";
    }
}
