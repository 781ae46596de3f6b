package tally.core.output;

import com.google.gson.JsonObject;
import tally.core.exception.ReportOutputException;
import tally.core.util.Logger;
import tally.core.util.ObjectChecker;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The channel that every report of a run is written through.
 *
 * The channel decides, per report, whether the report is written at all and where to. When the run is quiet, reports
 * below {@link ReportLevel#INFO} are dropped. Otherwise the report goes either to the shared stream, or, in split mode,
 * to a new file of its own.
 *
 * In split mode the file index is taken from a counter that is atomically incremented once per written report, so
 * that concurrent writers each get a distinct file and no index is skipped or used twice. This counter is the only
 * state shared between writers. The shared stream is not locked: concurrent writers to a shared stream may interleave.
 *
 * All I/O failures are thrown as {@link ReportOutputException}.
 */
public final class OutputChannel implements AutoCloseable {
    private static final Logger LOGGER = Logger.forClass(OutputChannel.class);
    private static final byte[] NEWLINE = "\n".getBytes(StandardCharsets.UTF_8);
    private final boolean quiet;
    private final ReportOutput output;
    private final OutputStream sharedStream;
    private final AtomicInteger nextIndex = new AtomicInteger(0);
    private boolean isClosed = false;

    private OutputChannel(boolean quiet, ReportOutput output, OutputStream sharedStream) {
        this.quiet = quiet;
        this.output = output;
        this.sharedStream = sharedStream;
    }

    /**
     * Opens a channel to the given destination. A single-file destination is created (or truncated) right away.
     *
     * @param quiet Whether debug reports should be dropped.
     * @param output The destination of the reports.
     * @return the channel.
     */
    public static OutputChannel open(boolean quiet, ReportOutput output) {
        ObjectChecker.assertNonNull(output);

        OutputStream sharedStream = null;
        if (output.isFile()) {
            try {
                sharedStream = new BufferedOutputStream(new FileOutputStream(output.getFilePath()));
            } catch (IOException e) {
                throw new ReportOutputException("Failed to open report file: " + output.getFilePath(), e);
            }
        } else if (!output.isSplit()) {
            sharedStream = output.getStream();
        }

        LOGGER.log("Opened output channel to " + output + (quiet ? " [quiet]" : ""));
        return new OutputChannel(quiet, output, sharedStream);
    }

    /**
     * Writes a report unless it is suppressed by the quiet setting.
     *
     * @param level The level of the report.
     * @param action The action rendering the report.
     */
    public void write(ReportLevel level, OutputAction action) {
        ObjectChecker.assertNonNull(level, action);

        if (isSuppressed(level)) {
            return;
        }

        if (this.output.isSplit()) {
            writeToNextSplitFile(action);
        } else {
            writeToSharedStream(action);
        }
    }

    /**
     * Writes the text followed by a line terminator.
     *
     * @param level The level of the report.
     * @param text The text to write.
     */
    public void writeLine(ReportLevel level, String text) {
        ObjectChecker.assertNonNull(text);
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        write(level, (stream) -> {
            stream.write(bytes);
            stream.write(NEWLINE);
        });
    }

    /**
     * Writes the bytes as they are.
     *
     * @param level The level of the report.
     * @param bytes The bytes to write.
     */
    public void writeBytes(ReportLevel level, byte[] bytes) {
        ObjectChecker.assertNonNull(bytes);
        write(level, (stream) -> stream.write(bytes));
    }

    /**
     * Writes a structured event in its encoded form.
     *
     * @param level The level of the report.
     * @param event The event to write.
     */
    public void writeJson(ReportLevel level, JsonObject event) {
        writeBytes(level, JsonEventEncoder.encode(event));
    }

    /**
     * Returns true iff a report of the given level would be dropped.
     *
     * @param level The level of the report.
     * @return whether reports of the level are dropped.
     */
    public boolean isSuppressed(ReportLevel level) {
        return this.quiet && level.isBelow(ReportLevel.INFO);
    }

    /**
     * Returns the index the next split file will be written to.
     *
     * @return the next split file index.
     */
    public int peekNextIndex() {
        return this.nextIndex.get();
    }

    /**
     * Closes the shared stream if this channel is responsible for it. Split files are closed after each report, so
     * there is nothing else to release.
     */
    @Override
    public synchronized void close() {
        if (this.isClosed) {
            return;
        }
        this.isClosed = true;

        if (this.sharedStream != null) {
            try {
                if (this.output.isCloseOnFinish()) {
                    this.sharedStream.close();
                } else {
                    this.sharedStream.flush();
                }
            } catch (IOException e) {
                throw new ReportOutputException("Failed to close report output " + this.output, e);
            }
        }
        LOGGER.log("Closed output channel to " + this.output);
    }

    private void writeToSharedStream(OutputAction action) {
        try {
            action.writeTo(this.sharedStream);
            this.sharedStream.flush();
        } catch (IOException e) {
            throw new ReportOutputException("Failed to write report to " + this.output, e);
        }
    }

    private void writeToNextSplitFile(OutputAction action) {
        String path = this.output.getSplitPrefix() + this.nextIndex.getAndIncrement();
        LOGGER.log("Writing report to split file: " + path);

        try (OutputStream stream = new BufferedOutputStream(new FileOutputStream(path))) {
            action.writeTo(stream);
        } catch (IOException e) {
            throw new ReportOutputException("Failed to write report to split file: " + path, e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { output: " + this.output + ", quiet: " + this.quiet + ", next index: " + this.nextIndex.get() + " }";
    }
}
