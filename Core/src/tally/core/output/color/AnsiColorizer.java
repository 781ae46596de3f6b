package tally.core.output.color;

import tally.core.exception.UnreachableException;
import tally.core.util.ObjectChecker;

/**
 * A colorizer for ANSI terminals. Each role gets an SGR sequence and the text is followed by a reset.
 */
public final class AnsiColorizer implements Colorizer {
    private static final String ESCAPE = "\u001B[";
    private static final String RESET = ESCAPE + "0m";
    private static final AnsiColorizer INSTANCE = new AnsiColorizer();

    private AnsiColorizer() {}

    public static AnsiColorizer ansi() {
        return INSTANCE;
    }

    @Override
    public String colorize(Color color, String text) {
        ObjectChecker.assertNonNull(color, text);
        return sequenceFor(color) + text + RESET;
    }

    static String sequenceFor(Color color) {
        switch (color) {
            case TEST_START: return ESCAPE + "1m";
            case TEST_OK: return ESCAPE + "32m";
            case WARNING: return ESCAPE + "1;31m";
            case PENDING: return ESCAPE + "1;36m";
            default: throw new UnreachableException(color);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
