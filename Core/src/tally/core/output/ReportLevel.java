package tally.core.output;

/**
 * The verbosity level of a report. Levels are ordered: {@link #DEBUG} is below {@link #INFO}.
 *
 * Debug reports are dropped when the run is quiet; info reports are always written.
 */
public enum ReportLevel {
    DEBUG,
    INFO;

    public boolean isBelow(ReportLevel other) {
        return this.compareTo(other) < 0;
    }
}
