package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.healthtrends.evidence.InvalidInputException;

/** Provenance of a score. Orthogonal to the score itself. */
public enum ConfidenceLevel {
    AUTO("auto"),
    REVIEWED("reviewed"),
    EXPERT_VERIFIED("expert_verified");

    private final String value;

    ConfidenceLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ConfidenceLevel fromValue(String value) {
        for (var level : values()) {
            if (level.value.equals(value)) {
                return level;
            }
        }
        throw new InvalidInputException(
                "confidence_level", value, "expected one of auto, reviewed, expert_verified");
    }
}
