package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonValue;

/** The four weighted parts of an evidence score. */
public enum Component {
    QUANTITY("quantity"),
    QUALITY("quality"),
    CONSISTENCY("consistency"),
    RECENCY("recency");

    private final String label;

    Component(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
