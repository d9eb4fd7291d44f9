package dev.healthtrends.evidence;

import dev.healthtrends.evidence.aggregate.EvidenceAggregator;
import dev.healthtrends.evidence.aggregate.ScoringInputs;
import dev.healthtrends.evidence.config.EvidenceConfig;
import dev.healthtrends.evidence.json.EvidenceJsonMapper;
import dev.healthtrends.evidence.score.EvidenceScorer;
import dev.healthtrends.evidence.score.ScoreReport;
import dev.healthtrends.evidence.study.StudyRecord;
import dev.healthtrends.evidence.study.StudyRecordReader;
import java.util.List;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

/**
 * Main entry point for scoring the evidence behind a health claim.
 *
 * <p>Scores can be computed from pre-tallied counts or from individual study records. Either way
 * the same scorer runs, so the two paths agree whenever they describe the same evidence.
 *
 * <pre>{@code
 * var engine = EvidenceEngine.fromEnvironment();
 * var report = engine.score(ScoringInputs.fromCounts(5, 1, 3, 60.0, 2));
 * System.out.println(report.createReportString());
 * }</pre>
 */
@Slf4j
@ThreadSafe
@Getter
@Accessors(fluent = true)
public final class EvidenceEngine {
    private final @Nonnull EvidenceConfig config;
    private final @Nonnull EvidenceAggregator aggregator;
    private final @Nonnull EvidenceScorer scorer;

    public static EvidenceEngine fromEnvironment() {
        return of(EvidenceConfig.fromEnvironment());
    }

    public static EvidenceEngine of(@Nonnull EvidenceConfig config) {
        return new EvidenceEngine(config);
    }

    private EvidenceEngine(EvidenceConfig config) {
        this.config = config;
        this.aggregator = new EvidenceAggregator(config.currentYear());
        this.scorer = new EvidenceScorer(config.scoringModel());
        log.info(
                "evidence engine ready: current year {}, model {}",
                config.currentYear(),
                scorer.model());
    }

    /** Score pre-tallied inputs. */
    public ScoreReport score(@Nonnull ScoringInputs inputs) {
        return scorer.score(inputs);
    }

    /** Aggregate study records, then score them. Malformed records are skipped and reported. */
    public ScoredClaim score(@Nonnull List<StudyRecord> studies) {
        return score(studies, null);
    }

    public ScoredClaim score(
            @Nonnull List<StudyRecord> studies, @Nullable Integer replicationScore) {
        var aggregation = aggregator.aggregate(studies, replicationScore);
        return new ScoredClaim(scorer.score(aggregation.inputs()), aggregation);
    }

    /** Score a JSON array of study objects, as produced by the retrieval layer. */
    public ScoredClaim scoreJson(@Nonnull String studiesJson) {
        return scoreJson(studiesJson, null);
    }

    public ScoredClaim scoreJson(@Nonnull String studiesJson, @Nullable Integer replicationScore) {
        var read = StudyRecordReader.read(studiesJson);
        var aggregation = aggregator.aggregate(read, replicationScore);
        return new ScoredClaim(scorer.score(aggregation.inputs()), aggregation);
    }

    /** Score a JSON object of pre-tallied counts, e.g. {@code {"human_rcts": 3, ...}}. */
    public ScoreReport scoreCountsJson(@Nonnull String countsJson) {
        return score(EvidenceJsonMapper.fromJson("counts", countsJson, ScoringInputs.class));
    }

    public String toJson(@Nonnull ScoreReport report) {
        return EvidenceJsonMapper.toJson(report);
    }
}
