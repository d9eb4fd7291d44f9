package dev.healthtrends.evidence.aggregate;

import dev.healthtrends.evidence.InvalidInputException;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import lombok.Builder;

/**
 * The five scoring signals for one claim: quantity, quality mix, consistency, recency and sample
 * size, plus the optional upstream replication strength.
 *
 * <p>Built either by {@link EvidenceAggregator} from study records or directly from pre-tallied
 * counts. The scorer does not care which.
 */
@Immutable
@Builder(toBuilder = true)
public record ScoringInputs(
        int humanRcts,
        /** meta-analyses and systematic reviews */
        int metaAnalyses,
        /** human studies that are neither RCTs nor pooled designs */
        int humanOther,
        int animalStudies,
        int inVitroStudies,
        /** mean participant count of human studies. null (or 0) when no study reports one */
        @Nullable Double avgSampleSize,
        /** participant count of the largest human RCT. null when none reports one */
        @Nullable Integer largestRctSampleSize,
        int supportingStudies,
        /** studies whose findings are "no" or "mixed" */
        int contradictingStudies,
        /** years since the most recent dated study. null when there is no dated evidence */
        @Nullable Integer yearsSinceLast,
        /** 0-3: none, single lab, multiple labs, independent. null when not assessed */
        @Nullable Integer replicationScore) {

    public static final ScoringInputs NO_EVIDENCE = ScoringInputs.builder().build();

    public ScoringInputs {
        requireNonNegative("human_rcts", humanRcts);
        requireNonNegative("meta_analyses", metaAnalyses);
        requireNonNegative("human_other", humanOther);
        requireNonNegative("animal_studies", animalStudies);
        requireNonNegative("in_vitro_studies", inVitroStudies);
        requireNonNegative("supporting_studies", supportingStudies);
        requireNonNegative("contradicting_studies", contradictingStudies);
        if (avgSampleSize != null) {
            if (avgSampleSize.isNaN() || avgSampleSize.isInfinite() || avgSampleSize < 0) {
                throw new InvalidInputException(
                        "avg_sample_size", avgSampleSize, "must be a finite number >= 0");
            }
            if (avgSampleSize == 0.0) {
                // 0 and null both mean "no sample size reported"
                avgSampleSize = null;
            }
        }
        if (largestRctSampleSize != null && largestRctSampleSize < 0) {
            throw new InvalidInputException(
                    "largest_rct_sample_size", largestRctSampleSize, "must be >= 0");
        }
        if (yearsSinceLast != null && yearsSinceLast < 0) {
            throw new InvalidInputException(
                    "years_since_last",
                    yearsSinceLast,
                    "must be >= 0 (publication in the future?)");
        }
        if (replicationScore != null && (replicationScore < 0 || replicationScore > 3)) {
            throw new InvalidInputException(
                    "replication_score", replicationScore, "must be within [0, 3]");
        }
    }

    /**
     * Pre-tallied counts where every counted study supports the claim. Mirrors manual data entry:
     * the counts are what a reviewer read off the literature.
     */
    public static ScoringInputs fromCounts(
            int humanRcts,
            int metaAnalyses,
            int humanOther,
            @Nullable Double avgSampleSize,
            @Nullable Integer yearsSinceLast) {
        return fromCounts(humanRcts, metaAnalyses, humanOther, 0, avgSampleSize, yearsSinceLast, 0);
    }

    /**
     * Pre-tallied counts. The {@code contradicting} studies are counted as additional human RCTs
     * whose findings go against the claim; every other study supports it.
     */
    public static ScoringInputs fromCounts(
            int humanRcts,
            int metaAnalyses,
            int humanOther,
            int animalStudies,
            @Nullable Double avgSampleSize,
            @Nullable Integer yearsSinceLast,
            int contradicting) {
        requireNonNegative("contradicting", contradicting);
        int allRcts;
        try {
            allRcts = Math.addExact(humanRcts, contradicting);
        } catch (ArithmeticException e) {
            throw new InvalidInputException(
                    "contradicting", contradicting, "overflows the human RCT count", e);
        }
        var supporting = (long) humanRcts + metaAnalyses + humanOther + animalStudies;
        return ScoringInputs.builder()
                .humanRcts(allRcts)
                .metaAnalyses(metaAnalyses)
                .humanOther(humanOther)
                .animalStudies(animalStudies)
                .avgSampleSize(avgSampleSize)
                .supportingStudies((int) Math.min(Integer.MAX_VALUE, supporting))
                .contradictingStudies(contradicting)
                .yearsSinceLast(yearsSinceLast)
                .build();
    }

    /** All classified studies: human, pooled, animal and in vitro. */
    public long totalStudies() {
        return (long) humanRcts + metaAnalyses + humanOther + animalStudies + inVitroStudies;
    }

    /** Human primary studies. Pooled designs are counted separately. */
    public long humanStudies() {
        return (long) humanRcts + humanOther;
    }

    /** Studies that reported a direction, i.e. supporting plus contradicting. */
    public long directionalStudies() {
        return (long) supportingStudies + contradictingStudies;
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new InvalidInputException(field, value, "must be >= 0");
        }
    }
}
