package tally.core.config;

import tally.core.output.ReportOutput;
import tally.core.output.color.Colorizer;
import tally.core.output.color.PlainColorizer;
import tally.core.report.DefaultReporters;
import tally.core.report.TestReporter;
import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The reporting configuration of a single run. Created once when the run starts and never modified afterwards.
 */
public final class RunConfig {
    public final List<TestReporter> reporters;
    public final boolean quiet;
    public final ReportOutput output;
    public final Colorizer colorizer;

    private RunConfig(List<TestReporter> reporters, boolean quiet, ReportOutput output, Colorizer colorizer) {
        ObjectChecker.assertNonNull(reporters, output, colorizer);
        this.reporters = Collections.unmodifiableList(new ArrayList<>(reporters));
        this.quiet = quiet;
        this.output = output;
        this.colorizer = colorizer;
    }

    @Override
    public String toString() {
        List<String> ids = new ArrayList<>();
        for (TestReporter reporter : this.reporters) {
            ids.add(reporter.id());
        }
        return this.getClass().getSimpleName() + " { reporters: " + ids
                + ", output: " + this.output
                + ", colors: " + this.colorizer
                + ", " + (this.quiet ? "[quiet]" : "[verbose]") + " }";
    }

    public static class Builder {
        private List<TestReporter> reporters;
        private Boolean quiet;
        private ReportOutput output;
        private Colorizer colorizer;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder setReporters(List<TestReporter> reporters) {
            if (this.reporters != null) {
                throw new IllegalStateException("reporters are already set.");
            }
            ObjectChecker.assertNonNull(reporters);
            this.reporters = new ArrayList<>(reporters);
            return this;
        }

        public Builder setDefaultReporters(boolean parallel, boolean machineOutput) {
            return setReporters(DefaultReporters.defaultReporters(parallel, machineOutput));
        }

        public Builder setQuiet(boolean quiet) {
            if (this.quiet != null) {
                throw new IllegalStateException("quiet mode is already set.");
            }
            this.quiet = quiet;
            return this;
        }

        public Builder setOutput(ReportOutput output) {
            if (this.output != null) {
                throw new IllegalStateException("report output is already set.");
            }
            ObjectChecker.assertNonNull(output);
            this.output = output;
            return this;
        }

        public Builder setColorizer(Colorizer colorizer) {
            if (this.colorizer != null) {
                throw new IllegalStateException("colorizer is already set.");
            }
            ObjectChecker.assertNonNull(colorizer);
            this.colorizer = colorizer;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(
                    (this.reporters == null) ? DefaultReporters.defaultReporters(false, false) : this.reporters,
                    (this.quiet == null) ? false : this.quiet,
                    (this.output == null) ? ReportOutput.standardOutput() : this.output,
                    (this.colorizer == null) ? PlainColorizer.plain() : this.colorizer);
        }
    }
}
