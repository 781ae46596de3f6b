package tally.core.model;

import tally.core.util.ObjectChecker;

/**
 * A position in a source file.
 */
public final class Location {
    public final String file;
    public final int line;

    private Location(String file, int line) {
        this.file = file;
        this.line = line;
    }

    public static Location of(String file, int line) {
        ObjectChecker.assertNonNull(file);
        ObjectChecker.assertNonNegative(line);
        return new Location(file, line);
    }

    /**
     * Returns the location rendered as {@code file:line}.
     *
     * @return the rendered location.
     */
    public String show() {
        return this.file + ":" + this.line;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Location)) {
            return false;
        }
        Location location = (Location) other;
        return this.line == location.line && this.file.equals(location.file);
    }

    @Override
    public int hashCode() {
        return 31 * this.file.hashCode() + this.line;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + show() + " }";
    }
}
