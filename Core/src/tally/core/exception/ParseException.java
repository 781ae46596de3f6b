package tally.core.exception;

/**
 * Thrown when a configuration property holds a value that cannot be interpreted.
 */
public final class ParseException extends Exception {
    private final String property;

    public ParseException(String property, String message) {
        super("Failed to parse property " + property + ": " + message);
        this.property = property;
    }

    /**
     * Returns the name of the offending property.
     *
     * @return the property name.
     */
    public String getProperty() {
        return this.property;
    }
}
