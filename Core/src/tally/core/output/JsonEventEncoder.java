package tally.core.output;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import tally.core.util.ObjectChecker;

import java.nio.charset.StandardCharsets;

/**
 * Encodes structured report events for machine consumption.
 *
 * Each event is encoded as compact JSON followed by a line containing only {@code ;;}, so a consumer can split the
 * report stream into events without parsing it. Null members are kept so that absent values (an unknown location, say)
 * are explicit in the output.
 */
public final class JsonEventEncoder {
    public static final String EVENT_TERMINATOR = "\n;;\n";
    private static final Gson GSON = new GsonBuilder().serializeNulls().disableHtmlEscaping().create();

    private JsonEventEncoder() {}

    /**
     * Returns the framed UTF-8 encoding of the event.
     *
     * @param event The event to encode.
     * @return the encoded event.
     */
    public static byte[] encode(JsonObject event) {
        ObjectChecker.assertNonNull(event);
        return (GSON.toJson(event) + EVENT_TERMINATOR).getBytes(StandardCharsets.UTF_8);
    }
}
