package tally.core.util;

/**
 * A simple diagnostic logging utility that can be either enabled or disabled globally.
 *
 * Loggers write to stderr so that diagnostics never interleave with test reports written to stdout. All loggers start
 * out globally disabled.
 */
public final class Logger {
    private static volatile boolean globalEnabled = false;
    private final String className;

    private Logger(String className) {
        if (className == null) {
            throw new NullPointerException("className must be non-null.");
        }
        this.className = className;
    }

    /**
     * Constructs and returns a new logger for the given class.
     *
     * @param logClass The logging class.
     * @return the new logger.
     */
    public static Logger forClass(Class<?> logClass) {
        return new Logger(logClass.getName());
    }

    /**
     * Globally disables all loggers.
     */
    public static void globalDisable() {
        globalEnabled = false;
    }

    /**
     * Globally enables all loggers.
     */
    public static void globalEnable() {
        globalEnabled = true;
    }

    public static boolean isGlobalEnabled() {
        return globalEnabled;
    }

    /**
     * Logs the specified message if logging is enabled.
     *
     * @param message The message to log.
     */
    public void log(String message) {
        if (globalEnabled) {
            System.err.println(this.className + ": " + message);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class: " + this.className + ", enabled: " + globalEnabled + " }";
    }
}
