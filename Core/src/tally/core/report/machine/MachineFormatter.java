package tally.core.report.machine;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import tally.core.model.CallStackFrame;
import tally.core.model.FlatTest;
import tally.core.model.Location;
import tally.core.model.ResultPayload;
import tally.core.model.RunTotals;
import tally.core.util.ObjectChecker;

import java.util.List;

/**
 * Builds the structured events that machine reporters emit. One event object is built per report; the objects carry
 * no color or free-text formatting.
 */
public final class MachineFormatter {
    public static final String TYPE_KEY = "type";
    public static final String TEST_START_TYPE = "test-start";
    public static final String TEST_END_TYPE = "test-end";
    public static final String TEST_LIST_TYPE = "test-list";
    public static final String TEST_RESULTS_TYPE = "test-results";

    private MachineFormatter() {}

    public static JsonObject testStartEvent(FlatTest<?> test) {
        JsonObject event = newEvent(TEST_START_TYPE);
        event.add("test", testObject(test, test.flatName()));
        return event;
    }

    /**
     * The callers are listed outermost call last, the same order a human report prints them in.
     */
    public static JsonObject testEndEvent(FlatTest<ResultPayload> test) {
        ObjectChecker.assertNonNull(test.payload);
        ResultPayload result = test.payload;

        JsonArray callers = new JsonArray();
        for (CallStackFrame frame : result.callersInPrintOrder()) {
            JsonObject caller = new JsonObject();
            caller.addProperty("message", frame.note);
            caller.add("location", locationObject(frame.location));
            callers.add(caller);
        }

        JsonObject event = newEvent(TEST_END_TYPE);
        event.add("test", testObject(test, test.flatName()));
        event.add("location", locationObject(test.location));
        event.add("callers", callers);
        event.addProperty("result", result.outcome.asString);
        event.addProperty("message", result.message);
        event.addProperty("wallTime", result.wallTimeMs);
        return event;
    }

    public static JsonObject testListEvent(List<? extends FlatTest<?>> tests) {
        ObjectChecker.assertNonNull(tests);
        JsonArray testObjects = new JsonArray();
        for (FlatTest<?> test : tests) {
            testObjects.add(testObject(test, test.flatName()));
        }

        JsonObject event = newEvent(TEST_LIST_TYPE);
        event.add("tests", testObjects);
        return event;
    }

    public static JsonObject testResultsEvent(RunTotals totals) {
        ObjectChecker.assertNonNull(totals);
        JsonObject event = newEvent(TEST_RESULTS_TYPE);
        event.addProperty("wallTime", totals.wallTimeMs);
        event.addProperty("passed", totals.passed());
        event.addProperty("pending", totals.pending());
        event.addProperty("failures", totals.failed());
        event.addProperty("errors", totals.errored());
        return event;
    }

    static JsonObject testObject(FlatTest<?> test, String flatName) {
        ObjectChecker.assertNonNull(test, flatName);
        JsonArray path = new JsonArray();
        for (String segment : test.path.segments) {
            path.add(segment);
        }

        JsonObject testObject = new JsonObject();
        testObject.addProperty("flatName", flatName);
        testObject.add("path", path);
        testObject.add("location", locationObject(test.location));
        return testObject;
    }

    private static JsonElement locationObject(Location location) {
        if (location == null) {
            return JsonNull.INSTANCE;
        }
        JsonObject locationObject = new JsonObject();
        locationObject.addProperty("file", location.file);
        locationObject.addProperty("line", location.line);
        return locationObject;
    }

    private static JsonObject newEvent(String type) {
        JsonObject event = new JsonObject();
        event.addProperty(TYPE_KEY, type);
        return event;
    }
}
