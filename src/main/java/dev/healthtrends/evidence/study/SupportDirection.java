package dev.healthtrends.evidence.study;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.healthtrends.evidence.InvalidInputException;
import java.util.Optional;

/** Whether a study's findings support the claim being scored. */
public enum SupportDirection {
    YES("yes"),
    NO("no"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String value;

    SupportDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** {@code no} and {@code mixed} both count against the claim. */
    public boolean contradicts() {
        return this == NO || this == MIXED;
    }

    public static Optional<SupportDirection> find(String value) {
        for (var direction : values()) {
            if (direction.value.equals(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static SupportDirection fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return find(value)
                .orElseThrow(
                        () ->
                                new InvalidInputException(
                                        "supports_claim",
                                        value,
                                        "expected yes, no, mixed or unknown"));
    }
}
