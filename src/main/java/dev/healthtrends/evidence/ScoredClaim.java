package dev.healthtrends.evidence;

import dev.healthtrends.evidence.aggregate.AggregationResult;
import dev.healthtrends.evidence.score.ScoreReport;
import dev.healthtrends.evidence.study.PartialDataWarning;
import java.util.List;

/** A score computed from study records, together with how those records were aggregated. */
public record ScoredClaim(ScoreReport report, AggregationResult aggregation) {

    /** Number of records that were skipped as malformed. */
    public int skippedRecords() {
        return aggregation.skippedRecords();
    }

    public List<PartialDataWarning> warnings() {
        return aggregation.warnings();
    }
}
