package dev.healthtrends.evidence.study;

import javax.annotation.Nullable;

/**
 * A study record that was skipped because one of its values was out of domain. Skips are not
 * fatal: the remaining records are still scored and the warnings travel alongside the result.
 */
public record PartialDataWarning(
        /** zero-based position of the record in the submitted batch */
        int index,
        @Nullable String pmid,
        String reason) {

    PartialDataWarning withIndex(int newIndex) {
        return new PartialDataWarning(newIndex, pmid, reason);
    }

    @Override
    public String toString() {
        return pmid == null
                ? "record #%d skipped: %s".formatted(index, reason)
                : "record #%d (pmid %s) skipped: %s".formatted(index, pmid, reason);
    }
}
