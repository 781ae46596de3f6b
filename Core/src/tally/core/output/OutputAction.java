package tally.core.output;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Renders one report onto the stream chosen for it by an {@link OutputChannel}.
 */
@FunctionalInterface
public interface OutputAction {

    /**
     * Writes the report to the given stream. Implementations must not close the stream.
     *
     * @param stream The stream to write to.
     */
    public void writeTo(OutputStream stream) throws IOException;
}
