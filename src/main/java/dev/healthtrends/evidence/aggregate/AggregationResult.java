package dev.healthtrends.evidence.aggregate;

import dev.healthtrends.evidence.study.PartialDataWarning;
import java.util.List;
import javax.annotation.Nullable;

/** Outcome of reducing a batch of study records to scoring inputs. */
public record AggregationResult(
        ScoringInputs inputs,
        /** one entry per record that was skipped */
        List<PartialDataWarning> warnings,
        int recordsReceived,
        /** studies reporting mixed findings. already included in the contradicting count */
        int mixedStudies,
        @Nullable Integer largestSampleSize,
        @Nullable Integer mostRecentYear) {

    public AggregationResult {
        warnings = List.copyOf(warnings);
    }

    public int skippedRecords() {
        return warnings.size();
    }

    public int recordsUsed() {
        return recordsReceived - warnings.size();
    }
}
