package tally.core.model;

/**
 * The outcome of a completed test. Exactly one outcome is assigned to every test that ran.
 */
public enum TestOutcome {
    PASS("pass"),
    PENDING("pending"),
    FAIL("fail"),
    ERROR("error")
    ;

    public final String asString;
    TestOutcome(String string) {
        this.asString = string;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.asString + " }";
    }
}
