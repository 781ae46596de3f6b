package tally.core.report.human;

import tally.core.exception.UnreachableException;
import tally.core.model.CallStackFrame;
import tally.core.model.FlatTest;
import tally.core.model.ResultPayload;
import tally.core.model.RunTotals;
import tally.core.model.TestOutcome;
import tally.core.output.color.Color;
import tally.core.output.color.Colorizer;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Renders test events as text for humans.
 *
 * A formatter only renders: it holds no state besides its colorizer, so rendering the same event twice always yields
 * the same text. None of the rendered strings end in a line terminator; the output channel adds one per report.
 */
public final class HumanFormatter {
    static final String TEST_START_PREFIX = "[TEST] ";
    static final String OK_SUFFIX = "+++ OK";
    static final String PENDING_SUFFIX = "^^^ Pending!";
    static final String FAILED_SUFFIX = "*** Failed!";
    static final String ERROR_SUFFIX = "@@@ Error!";
    static final String PENDING_LABEL = "* Pending:";
    static final String FAILURES_LABEL = "* Failures:";
    static final String ERRORS_LABEL = "* Errors:";
    private static final String INDENT = "  ";
    private final Colorizer colorizer;

    private HumanFormatter(Colorizer colorizer) {
        this.colorizer = colorizer;
    }

    public static HumanFormatter withColors(Colorizer colorizer) {
        ObjectChecker.assertNonNull(colorizer);
        return new HumanFormatter(colorizer);
    }

    /**
     * Returns the flat name of the test, followed by its location in parentheses when the location is known.
     */
    public String testName(FlatTest<?> test) {
        ObjectChecker.assertNonNull(test);
        return test.hasLocation()
                ? test.flatName() + " (" + test.location.show() + ")"
                : test.flatName();
    }

    public String startMessage(FlatTest<?> test) {
        return this.colorizer.colorize(Color.TEST_START, TEST_START_PREFIX) + testName(test);
    }

    public String parallelStartMessage(FlatTest<?> test) {
        return "Starting " + testName(test);
    }

    /**
     * Returns the result message of a completed test: its message with the call stack attached, followed by the
     * outcome suffix and the elapsed time.
     */
    public String resultMessage(ResultPayload result) {
        ObjectChecker.assertNonNull(result);
        String message = attachCallStack(result.message, result.callersInPrintOrder());
        return ensureNewline(message) + outcomeSuffix(result.outcome) + " (" + result.wallTimeMs + "ms)";
    }

    /**
     * Returns the tests as a bulleted list, one test per line.
     */
    public String testList(List<? extends FlatTest<?>> tests) {
        ObjectChecker.assertNonNull(tests);
        List<String> lines = new ArrayList<>();
        for (FlatTest<?> test : tests) {
            lines.add("* " + testName(test));
        }
        return String.join("\n", lines);
    }

    public String totalsBlock(RunTotals totals) {
        ObjectChecker.assertNonNull(totals);
        return "* Tests:    " + totals.total() + "\n"
                + "* Passed:   " + totals.passed() + "\n"
                + this.colorizer.colorize(Color.PENDING, PENDING_LABEL) + "  " + totals.pending() + "\n"
                + this.colorizer.colorize(Color.WARNING, FAILURES_LABEL) + " " + totals.failed() + "\n"
                + this.colorizer.colorize(Color.WARNING, ERRORS_LABEL) + "   " + totals.errored();
    }

    /**
     * Returns the block listing the tests of one outcome bucket under its label, preceded by a blank line.
     *
     * The bucket lists its tests most recently completed first, so it is printed reversed.
     */
    public String bucketBlock(TestOutcome outcome, List<FlatTest<ResultPayload>> bucket) {
        ObjectChecker.assertNonNull(outcome, bucket);
        List<FlatTest<ResultPayload>> inOrder = new ArrayList<>(bucket);
        Collections.reverse(inOrder);

        StringBuilder block = new StringBuilder("\n").append(bucketLabel(outcome));
        for (FlatTest<ResultPayload> test : inOrder) {
            block.append('\n').append(INDENT).append("* ").append(testName(test));
        }
        return block.toString();
    }

    public String totalTime(long wallTimeMs) {
        return "\nTotal execution time: " + wallTimeMs + "ms";
    }

    static String attachCallStack(String message, List<CallStackFrame> frames) {
        if (frames.isEmpty()) {
            return message;
        }
        StringBuilder withStack = new StringBuilder(ensureNewline(message));
        for (CallStackFrame frame : frames) {
            withStack.append(INDENT).append("called from ").append(frame.location.show());
            if (frame.hasNote()) {
                withStack.append(" (").append(frame.note).append(')');
            }
            withStack.append('\n');
        }
        return withStack.toString();
    }

    static String ensureNewline(String text) {
        return (text.isEmpty() || text.endsWith("\n")) ? text : text + "\n";
    }

    private String outcomeSuffix(TestOutcome outcome) {
        switch (outcome) {
            case PASS: return this.colorizer.colorize(Color.TEST_OK, OK_SUFFIX);
            case PENDING: return this.colorizer.colorize(Color.PENDING, PENDING_SUFFIX);
            case FAIL: return this.colorizer.colorize(Color.WARNING, FAILED_SUFFIX);
            case ERROR: return this.colorizer.colorize(Color.WARNING, ERROR_SUFFIX);
            default: throw new UnreachableException(outcome);
        }
    }

    private String bucketLabel(TestOutcome outcome) {
        switch (outcome) {
            case PENDING: return this.colorizer.colorize(Color.PENDING, PENDING_LABEL);
            case FAIL: return this.colorizer.colorize(Color.WARNING, FAILURES_LABEL);
            case ERROR: return this.colorizer.colorize(Color.WARNING, ERRORS_LABEL);
            default: throw new IllegalArgumentException("passed tests are not listed: " + outcome);
        }
    }
}
