package tally.core.model;

import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The payload attached to a completed test.
 *
 * {@link ResultPayload#outcome}: the outcome of the test.
 * {@link ResultPayload#message}: the human-readable message produced by the test, possibly empty.
 * {@link ResultPayload#callers}: the "called from" frames, most recently pushed frame first.
 * {@link ResultPayload#wallTimeMs}: the wall-clock time in milliseconds the test took to execute.
 */
public final class ResultPayload {
    public final TestOutcome outcome;
    public final String message;
    public final List<CallStackFrame> callers;
    public final long wallTimeMs;

    private ResultPayload(TestOutcome outcome, String message, List<CallStackFrame> callers, long wallTimeMs) {
        this.outcome = outcome;
        this.message = message;
        this.callers = Collections.unmodifiableList(callers);
        this.wallTimeMs = wallTimeMs;
    }

    /**
     * Returns the callers in the order they should be printed: the outermost call last.
     *
     * @return the callers in print order.
     */
    public List<CallStackFrame> callersInPrintOrder() {
        List<CallStackFrame> reversed = new ArrayList<>(this.callers);
        Collections.reverse(reversed);
        return reversed;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { outcome: " + this.outcome.asString + ", callers: " + this.callers.size() + ", wall time: " + this.wallTimeMs + "ms }";
    }

    public static final class Builder {
        private TestOutcome outcome;
        private String message = "";
        private final List<CallStackFrame> callers = new ArrayList<>();
        private Long wallTimeMs;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder outcome(TestOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        /**
         * Pushes a frame onto the call stack. Frames are kept most recently pushed first and are printed in the order
         * they were pushed.
         */
        public Builder pushCaller(CallStackFrame frame) {
            ObjectChecker.assertNonNull(frame);
            this.callers.add(0, frame);
            return this;
        }

        public Builder wallTimeMs(long wallTimeMs) {
            this.wallTimeMs = wallTimeMs;
            return this;
        }

        public ResultPayload build() {
            ObjectChecker.assertNonNull(this.outcome, this.message, this.wallTimeMs);
            ObjectChecker.assertNonNegative(this.wallTimeMs);
            return new ResultPayload(this.outcome, this.message, new ArrayList<>(this.callers), this.wallTimeMs);
        }
    }
}
