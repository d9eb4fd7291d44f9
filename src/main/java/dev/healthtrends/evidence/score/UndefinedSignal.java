package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A component with no qualifying evidence behind it. Not an error: the component resolves to a
 * documented default and the report lists which defaults were used.
 */
public enum UndefinedSignal {
    /** No study reported a direction. Consistency falls back to the neutral midpoint. */
    CONSISTENCY("consistency", "no study reported a direction; neutral midpoint used"),
    /** No dated study. Recency scores its minimum. */
    RECENCY("recency", "no dated evidence; recency scored at its minimum");

    private final String label;
    private final String resolution;

    UndefinedSignal(String label, String resolution) {
        this.label = label;
        this.resolution = resolution;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String resolution() {
        return resolution;
    }
}
