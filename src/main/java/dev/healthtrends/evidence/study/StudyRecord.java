package dev.healthtrends.evidence.study;

import dev.healthtrends.evidence.InvalidInputException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.Builder;

/**
 * Metadata for a single study, as delivered by the retrieval layer.
 *
 * <p>Records arrive already deduplicated and free of retracted entries. They are immutable and only
 * live for one scoring pass.
 */
@Builder
public record StudyRecord(
        @Nonnull StudyType studyType,
        boolean isHuman,
        /** participant count. null when the abstract doesn't report one */
        @Nullable Integer sampleSize,
        @Nullable Integer publicationYear,
        /** direction of the findings. null is read as {@link SupportDirection#UNKNOWN} */
        @Nonnull SupportDirection supportsClaim,
        /** stable bibliographic identifier, e.g. a PubMed ID. only used to trace warnings */
        @Nullable String pmid) {

    public StudyRecord {
        if (studyType == null) {
            throw new InvalidInputException("study_type", null, "is required");
        }
        if (supportsClaim == null) {
            supportsClaim = SupportDirection.UNKNOWN;
        }
    }

    public static StudyRecord of(
            StudyType studyType,
            boolean isHuman,
            @Nullable Integer sampleSize,
            @Nullable Integer publicationYear,
            SupportDirection supportsClaim) {
        return new StudyRecord(
                studyType, isHuman, sampleSize, publicationYear, supportsClaim, null);
    }

    /** True when the study reports a participant count above zero. */
    public boolean hasKnownPositiveSampleSize() {
        return sampleSize != null && sampleSize > 0;
    }
}
