package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.healthtrends.evidence.InvalidInputException;

/**
 * Letter grade for an evidence score.
 *
 * <p>Constants are declared from strongest to weakest and each carries its inclusive lower bound.
 * {@link #fromScore(double)} is a pure lookup, so it can grade a stored or externally supplied
 * score without re-deriving it.
 */
public enum EvidenceGrade {
    A_PLUS("A+", 9.5),
    A("A", 9.0),
    A_MINUS("A-", 8.5),
    B_PLUS("B+", 8.0),
    B("B", 7.0),
    B_MINUS("B-", 6.0),
    C_PLUS("C+", 5.0),
    C("C", 4.0),
    C_MINUS("C-", 3.0),
    D("D", 2.0),
    F("F", 0.0);

    private final String label;
    private final double lowerBound;

    EvidenceGrade(String label, double lowerBound) {
        this.label = label;
        this.lowerBound = lowerBound;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /** Smallest score (inclusive) that earns this grade. */
    public double lowerBound() {
        return lowerBound;
    }

    /** True if this grade is at least as strong as {@code other}. */
    public boolean isAtLeast(EvidenceGrade other) {
        return this.ordinal() <= other.ordinal();
    }

    /**
     * Map a 0-10 score to its grade.
     *
     * @throws InvalidInputException if the score is NaN or outside [0, 10]
     */
    public static EvidenceGrade fromScore(double score) {
        if (Double.isNaN(score) || score < 0.0 || score > ScoringModel.MAX_SCORE) {
            throw new InvalidInputException("score", score, "must be within [0, 10]");
        }
        for (var grade : values()) {
            if (score >= grade.lowerBound) {
                return grade;
            }
        }
        // unreachable: F has a lower bound of 0
        return F;
    }

    @JsonCreator
    public static EvidenceGrade fromLabel(String label) {
        for (var grade : values()) {
            if (grade.label.equals(label)) {
                return grade;
            }
        }
        throw new InvalidInputException("grade", label, "not a known evidence grade");
    }
}
