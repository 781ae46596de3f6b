package tally.core.output.color;

/**
 * The semantic roles that human-readable report text can be colored with.
 */
public enum Color {
    TEST_START,
    TEST_OK,
    WARNING,
    PENDING
}
