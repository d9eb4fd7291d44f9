package dev.healthtrends.evidence.score;

import javax.annotation.concurrent.Immutable;
import lombok.Builder;

/**
 * The single table of constants behind the evidence score.
 *
 * <p>Weights are fixed design constants and must sum to 1. The saturation and decay constants
 * shape the diminishing-returns curves and are tunable; {@link #DEFAULT} is calibrated so that 5
 * human RCTs, 1 meta-analysis and 3 other human studies (avg n=60, last published 2 years ago)
 * display as 9.5 with grade A.
 */
@Immutable
@Builder(toBuilder = true)
public record ScoringModel(
        double quantityWeight,
        double qualityWeight,
        double consistencyWeight,
        double recencyWeight,
        /** study count reaching ~63% of the quantity ceiling */
        double quantitySaturation,
        double metaAnalysisMultiplier,
        double humanRctMultiplier,
        double humanOtherMultiplier,
        double animalMultiplier,
        double inVitroMultiplier,
        /** weighted count reaching ~63% of the quality ceiling */
        double qualitySaturation,
        /** ceiling for quality derived from animal and in vitro evidence alone */
        double weakEvidenceCap,
        double weakEvidenceSaturation,
        double consistencyExponent,
        double neutralConsistency,
        int recencyFullCreditYears,
        int recencyFloorYears,
        double recencyFloor,
        int minimumCredibleSampleSize,
        double smallSamplePenalty,
        double noHumanEvidencePenalty,
        double maxReplicationBonus,
        /** smallest human RCT that earns the large-trial bonus */
        int largeTrialSampleSize,
        double largeTrialBonus,
        /** cap on all bonuses combined */
        double maxTotalBonus,
        double singleStudyCeiling) {

    public static final double MAX_SCORE = 10.0;
    public static final int MAX_REPLICATION_SCORE = 3;
    /** width of the narrowest grade band */
    private static final double MAX_BONUS = 0.5;
    private static final double WEIGHT_TOLERANCE = 1e-9;

    public static final ScoringModel DEFAULT =
            new ScoringModel(
                    0.25, // quantityWeight
                    0.40, // qualityWeight
                    0.20, // consistencyWeight
                    0.15, // recencyWeight
                    3.1, // quantitySaturation: 5 studies ~ 80%, 15 studies ~ 99%
                    5.0, // metaAnalysisMultiplier
                    3.0, // humanRctMultiplier
                    2.0, // humanOtherMultiplier
                    1.0, // animalMultiplier
                    0.5, // inVitroMultiplier
                    11.0, // qualitySaturation
                    4.5, // weakEvidenceCap
                    4.0, // weakEvidenceSaturation
                    2.0, // consistencyExponent: 50/50 split scores 2.5
                    5.0, // neutralConsistency
                    2, // recencyFullCreditYears
                    10, // recencyFloorYears
                    3.0, // recencyFloor
                    30, // minimumCredibleSampleSize
                    1.0, // smallSamplePenalty
                    2.0, // noHumanEvidencePenalty
                    0.5, // maxReplicationBonus
                    200, // largeTrialSampleSize
                    0.5, // largeTrialBonus
                    0.5, // maxTotalBonus: bonuses never cross more than one grade band
                    6.9 // singleStudyCeiling: just under B
                    );

    public ScoringModel {
        var weightSum = quantityWeight + qualityWeight + consistencyWeight + recencyWeight;
        if (Math.abs(weightSum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException(
                    "component weights must sum to 1.0 but sum to %s".formatted(weightSum));
        }
        requirePositive("quantitySaturation", quantitySaturation);
        requirePositive("qualitySaturation", qualitySaturation);
        requirePositive("weakEvidenceSaturation", weakEvidenceSaturation);
        requirePositive("consistencyExponent", consistencyExponent);
        if (weakEvidenceCap < 0 || weakEvidenceCap >= MAX_SCORE / 2) {
            throw new IllegalArgumentException(
                    "weakEvidenceCap must be in [0, 5) but was %s".formatted(weakEvidenceCap));
        }
        if (recencyFullCreditYears < 0 || recencyFloorYears <= recencyFullCreditYears) {
            throw new IllegalArgumentException(
                    "recency window must satisfy 0 <= full credit (%d) < floor (%d)"
                            .formatted(recencyFullCreditYears, recencyFloorYears));
        }
        if (recencyFloor <= 0 || recencyFloor > MAX_SCORE) {
            throw new IllegalArgumentException(
                    "recencyFloor must be in (0, 10] but was %s".formatted(recencyFloor));
        }
        if (minimumCredibleSampleSize < 0) {
            throw new IllegalArgumentException(
                    "minimumCredibleSampleSize must be >= 0 but was %d"
                            .formatted(minimumCredibleSampleSize));
        }
        requireBonus("maxReplicationBonus", maxReplicationBonus);
        requireBonus("largeTrialBonus", largeTrialBonus);
        requireBonus("maxTotalBonus", maxTotalBonus);
        if (largeTrialSampleSize < 1) {
            throw new IllegalArgumentException(
                    "largeTrialSampleSize must be >= 1 but was %d".formatted(largeTrialSampleSize));
        }
    }

    /** Weight of the given component. */
    public double weightOf(Component component) {
        return switch (component) {
            case QUANTITY -> quantityWeight;
            case QUALITY -> qualityWeight;
            case CONSISTENCY -> consistencyWeight;
            case RECENCY -> recencyWeight;
        };
    }

    private static void requireBonus(String name, double value) {
        if (!(value >= 0 && value <= MAX_BONUS)) {
            throw new IllegalArgumentException(
                    "%s must be in [0, %s] but was %s".formatted(name, MAX_BONUS, value));
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalArgumentException("%s must be > 0 but was %s".formatted(name, value));
        }
    }
}
