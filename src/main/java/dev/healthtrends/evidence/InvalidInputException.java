package dev.healthtrends.evidence;

import javax.annotation.Nullable;

/**
 * Thrown when scoring input is malformed or out of domain: negative counts, an unknown grade
 * label, a JSON document that is not an array of study objects, and so on.
 *
 * <p>This is a RuntimeException so it doesn't require explicit handling. The offending field and
 * value are carried along so callers can report exactly which constraint was violated.
 */
public class InvalidInputException extends RuntimeException {
    private final String field;
    private final @Nullable Object value;

    public InvalidInputException(String field, @Nullable Object value, String constraint) {
        this(field, value, constraint, null);
    }

    public InvalidInputException(
            String field, @Nullable Object value, String constraint, @Nullable Throwable cause) {
        super("invalid %s (%s): %s".formatted(field, value, constraint), cause);
        this.field = field;
        this.value = value;
    }

    /** Name of the input field that violated its constraint. */
    public String field() {
        return field;
    }

    public @Nullable Object value() {
        return value;
    }
}
