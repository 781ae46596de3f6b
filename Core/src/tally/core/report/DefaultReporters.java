package tally.core.report;

import tally.core.report.human.HumanParallelReporter;
import tally.core.report.human.HumanSequentialReporter;
import tally.core.report.machine.MachineParallelReporter;
import tally.core.report.machine.MachineSequentialReporter;

import java.util.Collections;
import java.util.List;

/**
 * The standard reporters, one for each combination of execution mode and presentation.
 */
public final class DefaultReporters {
    public static final String HUMAN_SEQUENTIAL = "human-sequential";
    public static final String HUMAN_PARALLEL = "human-parallel";
    public static final String MACHINE_SEQUENTIAL = "machine-sequential";
    public static final String MACHINE_PARALLEL = "machine-parallel";

    private static final TestReporter HUMAN_SEQUENTIAL_REPORTER = new HumanSequentialReporter();
    private static final TestReporter HUMAN_PARALLEL_REPORTER = new HumanParallelReporter();
    private static final TestReporter MACHINE_SEQUENTIAL_REPORTER = new MachineSequentialReporter();
    private static final TestReporter MACHINE_PARALLEL_REPORTER = new MachineParallelReporter();

    private DefaultReporters() {}

    /**
     * Returns the reporter for the given combination of execution mode and presentation.
     *
     * @param parallel Whether the tests run in parallel.
     * @param machineOutput Whether the output is meant for machines.
     * @return the reporter.
     */
    public static TestReporter select(boolean parallel, boolean machineOutput) {
        if (machineOutput) {
            return parallel ? MACHINE_PARALLEL_REPORTER : MACHINE_SEQUENTIAL_REPORTER;
        } else {
            return parallel ? HUMAN_PARALLEL_REPORTER : HUMAN_SEQUENTIAL_REPORTER;
        }
    }

    /**
     * Returns the default list of reporters for a run: the single reporter selected by {@link #select}.
     *
     * @param parallel Whether the tests run in parallel.
     * @param machineOutput Whether the output is meant for machines.
     * @return the reporters.
     */
    public static List<TestReporter> defaultReporters(boolean parallel, boolean machineOutput) {
        return Collections.singletonList(select(parallel, machineOutput));
    }
}
