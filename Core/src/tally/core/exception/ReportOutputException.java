package tally.core.exception;

import java.io.IOException;

/**
 * Thrown when a report could not be written to its output destination.
 *
 * Reports are never retried: a failed write is fatal to the run, so this exception is expected to propagate all the
 * way out of the reporting calls.
 */
public final class ReportOutputException extends RuntimeException {

    public ReportOutputException(String message, IOException cause) {
        super(message, cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }
}
