package tally.core.exception;

/**
 * Thrown to indicate that the system ended up in a code-path it expects should be unreachable, typically a switch over
 * an enum constant that some branch forgot to handle.
 */
public final class UnreachableException extends RuntimeException {

    public UnreachableException(Enum<?> unhandled) {
        super("Unhandled " + unhandled.getDeclaringClass().getSimpleName() + " constant: " + unhandled.name());
    }
}
