package tally.core.output.color;

/**
 * Applies presentation markup to report text according to its semantic role.
 *
 * Whether any markup is applied at all is up to the implementation, which is chosen from the capabilities of the
 * terminal the reports end up on.
 */
public interface Colorizer {

    /**
     * Returns the text marked up for the given role.
     *
     * @param color The role of the text.
     * @param text The text.
     * @return the marked-up text.
     */
    public String colorize(Color color, String text);
}
