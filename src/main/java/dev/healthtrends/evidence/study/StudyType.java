package dev.healthtrends.evidence.study;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.healthtrends.evidence.InvalidInputException;
import java.util.Optional;

/** Methodological category of a study, roughly ordered by evidentiary strength. */
public enum StudyType {
    META_ANALYSIS("meta_analysis"),
    SYSTEMATIC_REVIEW("systematic_review"),
    RCT("rct"),
    OBSERVATIONAL("observational"),
    CASE_STUDY("case_study"),
    ANIMAL("animal"),
    IN_VITRO("in_vitro");

    private final String value;

    StudyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Meta-analyses and systematic reviews already pool human evidence. */
    public boolean isPooled() {
        return this == META_ANALYSIS || this == SYSTEMATIC_REVIEW;
    }

    public static Optional<StudyType> find(String value) {
        for (var type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static StudyType fromValue(String value) {
        return find(value)
                .orElseThrow(
                        () -> new InvalidInputException("study_type", value, "unknown study type"));
    }
}
