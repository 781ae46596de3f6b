package tally.core.output.color;

import tally.core.util.ObjectChecker;

/**
 * A colorizer for outputs that do not understand markup: text is returned unchanged.
 */
public final class PlainColorizer implements Colorizer {
    private static final PlainColorizer INSTANCE = new PlainColorizer();

    private PlainColorizer() {}

    public static PlainColorizer plain() {
        return INSTANCE;
    }

    @Override
    public String colorize(Color color, String text) {
        ObjectChecker.assertNonNull(color, text);
        return text;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
