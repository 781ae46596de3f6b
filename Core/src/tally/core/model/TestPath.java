package tally.core.model;

import tally.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The hierarchical name of a test, from its outermost grouping down to the test itself.
 *
 * A path always has at least one segment.
 */
public final class TestPath {
    private static final String SEPARATOR = ".";
    public final List<String> segments;

    private TestPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    public static TestPath of(String... segments) {
        ObjectChecker.assertNonNull((Object) segments);
        return of(Arrays.asList(segments));
    }

    public static TestPath of(List<String> segments) {
        ObjectChecker.assertNonNull(segments);
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("a test path must have at least one segment.");
        }
        for (String segment : segments) {
            ObjectChecker.assertNonNull(segment);
        }
        return new TestPath(new ArrayList<>(segments));
    }

    /**
     * Returns the path flattened into a single dot-joined name.
     *
     * @return the flat name.
     */
    public String flatName() {
        return String.join(SEPARATOR, this.segments);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TestPath)) {
            return false;
        }
        return this.segments.equals(((TestPath) other).segments);
    }

    @Override
    public int hashCode() {
        return this.segments.hashCode();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + flatName() + " }";
    }
}
