package tally.core.model;

import tally.core.util.ObjectChecker;

/**
 * One "called from" entry in the call stack attached to a test result: a location plus an optional note.
 */
public final class CallStackFrame {
    public final String note;
    public final Location location;

    private CallStackFrame(String note, Location location) {
        this.note = note;
        this.location = location;
    }

    public static CallStackFrame at(Location location) {
        ObjectChecker.assertNonNull(location);
        return new CallStackFrame(null, location);
    }

    public static CallStackFrame at(Location location, String note) {
        ObjectChecker.assertNonNull(location, note);
        return new CallStackFrame(note, location);
    }

    public boolean hasNote() {
        return this.note != null;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.location.show() + (this.note == null ? "" : ", note: " + this.note) + " }";
    }
}
