package tally.core.output;

import tally.core.util.ObjectChecker;

import java.io.OutputStream;

/**
 * Describes where the reports of a run go.
 *
 * There are two kinds of destination. A shared destination is a single stream that every report is written to, either
 * one given to us or a single file that we open. A split destination is a path prefix: each report is written to its
 * own freshly created file named by the prefix followed by a run-wide index, so that concurrent writers never share a
 * file handle.
 */
public final class ReportOutput {
    private final OutputStream stream;
    private final boolean closeOnFinish;
    private final String filePath;
    private final String splitPrefix;

    private ReportOutput(OutputStream stream, boolean closeOnFinish, String filePath, String splitPrefix) {
        this.stream = stream;
        this.closeOnFinish = closeOnFinish;
        this.filePath = filePath;
        this.splitPrefix = splitPrefix;
    }

    /**
     * Reports go to stdout, which is never closed.
     *
     * @return the destination.
     */
    public static ReportOutput standardOutput() {
        return new ReportOutput(System.out, false, null, null);
    }

    /**
     * Reports go to the given stream.
     *
     * @param stream The stream.
     * @param closeOnFinish Whether the stream should be closed once the run is finished.
     * @return the destination.
     */
    public static ReportOutput stream(OutputStream stream, boolean closeOnFinish) {
        ObjectChecker.assertNonNull(stream);
        return new ReportOutput(stream, closeOnFinish, null, null);
    }

    /**
     * Reports go to a single file, truncated when the run starts and closed once it is finished.
     *
     * @param path The file path.
     * @return the destination.
     */
    public static ReportOutput file(String path) {
        ObjectChecker.assertNonEmpty(path);
        return new ReportOutput(null, true, path, null);
    }

    /**
     * Each report goes to its own file named {@code prefix + index}.
     *
     * @param prefix The path prefix of the report files.
     * @return the destination.
     */
    public static ReportOutput splitFiles(String prefix) {
        ObjectChecker.assertNonEmpty(prefix);
        return new ReportOutput(null, false, null, prefix);
    }

    public boolean isSplit() {
        return this.splitPrefix != null;
    }

    public boolean isFile() {
        return this.filePath != null;
    }

    OutputStream getStream() {
        return this.stream;
    }

    boolean isCloseOnFinish() {
        return this.closeOnFinish;
    }

    String getFilePath() {
        return this.filePath;
    }

    String getSplitPrefix() {
        return this.splitPrefix;
    }

    @Override
    public String toString() {
        if (isSplit()) {
            return this.getClass().getSimpleName() + " { split files: " + this.splitPrefix + "<index> }";
        } else if (isFile()) {
            return this.getClass().getSimpleName() + " { file: " + this.filePath + " }";
        } else {
            return this.getClass().getSimpleName() + " { stream" + (this.closeOnFinish ? " [close on finish]" : "") + " }";
        }
    }
}
