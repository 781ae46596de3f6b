package tally.core.report;

import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;

import java.util.List;

/**
 * A reporter that is notified about the lifecycle of a test run and renders it in one presentation.
 *
 * Reporters are stateless: everything they need, including the channel to write to, is handed to them in the
 * {@link ReportContext}. Under parallel execution the test start and test result callbacks may be invoked concurrently
 * from several workers, so implementations must not keep mutable state between calls.
 */
public interface TestReporter {

    /**
     * Returns the identifier of this reporter.
     *
     * @return the identifier.
     */
    public String id();

    /**
     * Invoked with every test of the run, in discovery order, when a listing of the tests was requested.
     *
     * @param context The context of the run.
     * @param tests All tests of the run.
     */
    public void reportAllTests(ReportContext context, List<FlatTest<Void>> tests);

    /**
     * Invoked once before the first test starts.
     *
     * @param context The context of the run.
     * @param tests The tests about to run.
     */
    public void reportGlobalStart(ReportContext context, List<FlatTest<Void>> tests);

    /**
     * Invoked when a test starts.
     *
     * @param context The context of the run.
     * @param test The test.
     */
    public void reportTestStart(ReportContext context, FlatTest<Void> test);

    /**
     * Invoked when a test has completed. The same test was previously passed to {@link #reportTestStart}.
     *
     * @param context The context of the run.
     * @param test The test with its result.
     */
    public void reportTestResult(ReportContext context, FlatTest<ResultPayload> test);

    /**
     * Invoked once after all tests have completed. Each outcome bucket lists its tests most recently completed first.
     *
     * @param context The context of the run.
     * @param wallTimeMs The wall-clock time of the whole run in milliseconds.
     * @param passed The passed tests.
     * @param pending The pending tests.
     * @param failed The failed tests.
     * @param errored The tests that raised an error.
     */
    public void reportGlobalResults(ReportContext context, long wallTimeMs, List<FlatTest<ResultPayload>> passed,
                                    List<FlatTest<ResultPayload>> pending, List<FlatTest<ResultPayload>> failed,
                                    List<FlatTest<ResultPayload>> errored);
}
