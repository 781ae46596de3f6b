package tally.core.model;

import tally.core.util.ObjectChecker;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The aggregate tallies of a finished run, derived by counting the four outcome buckets collected by the execution
 * engine. The buckets themselves are never modified.
 */
public final class RunTotals {
    private final Map<TestOutcome, Integer> outcomeCounts;
    public final long wallTimeMs;

    private RunTotals(Map<TestOutcome, Integer> outcomeCounts, long wallTimeMs) {
        this.outcomeCounts = outcomeCounts;
        this.wallTimeMs = wallTimeMs;
    }

    public static RunTotals count(long wallTimeMs, List<?> passed, List<?> pending, List<?> failed, List<?> errored) {
        ObjectChecker.assertNonNull(passed, pending, failed, errored);
        ObjectChecker.assertNonNegative(wallTimeMs);

        Map<TestOutcome, Integer> counts = new EnumMap<>(TestOutcome.class);
        counts.put(TestOutcome.PASS, passed.size());
        counts.put(TestOutcome.PENDING, pending.size());
        counts.put(TestOutcome.FAIL, failed.size());
        counts.put(TestOutcome.ERROR, errored.size());
        return new RunTotals(counts, wallTimeMs);
    }

    public int getCount(TestOutcome outcome) {
        ObjectChecker.assertNonNull(outcome);
        return this.outcomeCounts.get(outcome);
    }

    public int passed() {
        return getCount(TestOutcome.PASS);
    }

    public int pending() {
        return getCount(TestOutcome.PENDING);
    }

    public int failed() {
        return getCount(TestOutcome.FAIL);
    }

    public int errored() {
        return getCount(TestOutcome.ERROR);
    }

    public int total() {
        int total = 0;
        for (int count : this.outcomeCounts.values()) {
            total += count;
        }
        return total;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { tests: " + total() + ", passed: " + passed() + ", pending: " + pending()
                + ", failed: " + failed() + ", errors: " + errored() + ", wall time: " + this.wallTimeMs + "ms }";
    }
}
