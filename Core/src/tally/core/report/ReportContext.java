package tally.core.report;

import tally.core.config.RunConfig;
import tally.core.output.OutputChannel;
import tally.core.output.color.Colorizer;
import tally.core.util.ObjectChecker;

/**
 * Everything a {@link TestReporter} needs to know about the run it reports on: the run's configuration and the channel
 * its reports are written through.
 */
public final class ReportContext {
    public final RunConfig config;
    public final OutputChannel channel;

    private ReportContext(RunConfig config, OutputChannel channel) {
        this.config = config;
        this.channel = channel;
    }

    public static ReportContext of(RunConfig config, OutputChannel channel) {
        ObjectChecker.assertNonNull(config, channel);
        return new ReportContext(config, channel);
    }

    public boolean isQuiet() {
        return this.config.quiet;
    }

    public Colorizer colorizer() {
        return this.config.colorizer;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { config: " + this.config + ", channel: " + this.channel + " }";
    }
}
