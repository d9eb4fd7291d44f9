package dev.healthtrends.evidence;

import static dev.healthtrends.evidence.study.StudyType.*;
import static dev.healthtrends.evidence.study.SupportDirection.*;
import static org.junit.jupiter.api.Assertions.*;

import dev.healthtrends.evidence.aggregate.ScoringInputs;
import dev.healthtrends.evidence.config.EvidenceConfig;
import dev.healthtrends.evidence.score.Adjustment;
import dev.healthtrends.evidence.score.EvidenceGrade;
import dev.healthtrends.evidence.study.StudyRecord;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EvidenceEngineTest {
    private static final int CURRENT_YEAR = 2025;

    private final EvidenceEngine engine =
            EvidenceEngine.of(EvidenceConfig.builder().currentYear(CURRENT_YEAR).build());

    @Test
    void referenceClaimFromCounts() {
        var report = engine.score(ScoringInputs.fromCounts(5, 1, 3, 60.0, 2));
        assertEquals("9.5", report.displayScore().toPlainString());
        assertEquals(EvidenceGrade.A, report.grade());
    }

    @Test
    void recordsAndCountsAgreeForTheSameEvidence() {
        var studies = new ArrayList<StudyRecord>();
        for (int i = 0; i < 5; i++) {
            studies.add(StudyRecord.of(RCT, true, 60, 2023, YES));
        }
        studies.add(StudyRecord.of(META_ANALYSIS, true, null, 2021, YES));
        for (int i = 0; i < 3; i++) {
            studies.add(StudyRecord.of(OBSERVATIONAL, true, 60, 2019, YES));
        }

        var fromRecords = engine.score(studies);
        var fromCounts =
                engine.score(
                        ScoringInputs.fromCounts(5, 1, 3, 60.0, 2).toBuilder()
                                .largestRctSampleSize(60)
                                .build());

        assertEquals(fromCounts, fromRecords.report());
        assertEquals(0, fromRecords.skippedRecords());
        assertEquals(9, fromRecords.aggregation().recordsUsed());
    }

    @Test
    void scoreJsonSkipsMalformedRecordsAndKeepsScoring() {
        var json =
                """
                [
                  {"pmid": "100", "study_type": "rct", "is_human": true, "sample_size": 250,
                   "publication_year": 2024, "supports_claim": "yes"},
                  {"pmid": "101", "study_type": "opinion", "is_human": true},
                  {"pmid": "102", "study_type": "observational", "is_human": true,
                   "sample_size": -10, "publication_year": 2020, "supports_claim": "yes"},
                  {"pmid": "103", "study_type": "meta_analysis", "is_human": true,
                   "publication_year": 2022, "supports_claim": "yes"}
                ]
                """;

        var claim = engine.scoreJson(json);

        assertEquals(2, claim.skippedRecords());
        assertEquals(
                List.of("101", "102"), claim.warnings().stream().map(w -> w.pmid()).toList());
        assertEquals(List.of(1, 2), claim.warnings().stream().map(w -> w.index()).toList());
        var inputs = claim.report().inputs();
        assertEquals(1, inputs.humanRcts());
        assertEquals(1, inputs.metaAnalyses());
        assertEquals(250.0, inputs.avgSampleSize());
        assertEquals(1, inputs.yearsSinceLast());
        assertEquals(250, inputs.largestRctSampleSize());
        assertEquals(
                List.of(Adjustment.LARGE_RCT_BONUS),
                claim.report().adjustments().stream().map(Adjustment::name).toList());
    }

    @Test
    void scoreJsonPassesReplicationThrough() {
        var claim =
                engine.scoreJson(
                        "[{\"study_type\": \"rct\", \"is_human\": true, \"sample_size\": 500,"
                                + " \"publication_year\": 2025, \"supports_claim\": \"yes\"}]",
                        3);
        assertEquals(
                List.of(
                        Adjustment.LARGE_RCT_BONUS,
                        Adjustment.REPLICATION_BONUS,
                        Adjustment.SINGLE_STUDY_CEILING),
                claim.report().adjustments().stream().map(Adjustment::name).toList());
        assertFalse(claim.report().grade().isAtLeast(EvidenceGrade.B));
    }

    @Test
    void nonHumanPrimaryStudyAloneScoresAsWeakEvidence() {
        var animalCohort = StudyRecord.of(OBSERVATIONAL, false, null, CURRENT_YEAR, YES);

        var claim = engine.score(List.of(animalCohort));

        var report = claim.report();
        assertEquals(1, report.inputs().totalStudies());
        assertEquals(
                List.of(Adjustment.NO_HUMAN_EVIDENCE_PENALTY, Adjustment.SINGLE_STUDY_CEILING),
                report.adjustments().stream().map(Adjustment::name).toList());
        assertTrue(report.totalScore() < 3.0, "scored " + report.totalScore());
        assertEquals(EvidenceGrade.D, report.grade());
    }

    @Test
    void scoreJsonRejectsStructurallyBrokenInput() {
        var e =
                assertThrows(
                        InvalidInputException.class,
                        () -> engine.scoreJson("{\"study_type\": \"rct\"}"));
        assertEquals("studies", e.field());
    }

    @Test
    void scoreCountsJson() {
        var report =
                engine.scoreCountsJson(
                        """
                        {"human_rcts": 5, "meta_analyses": 1, "human_other": 3,
                         "avg_sample_size": 60, "supporting_studies": 9, "years_since_last": 2}
                        """);
        assertEquals("9.5", report.displayScore().toPlainString());
        assertEquals(EvidenceGrade.A, report.grade());
    }

    @Test
    void scoreCountsJsonRejectsNegativeCounts() {
        var e =
                assertThrows(
                        InvalidInputException.class,
                        () -> engine.scoreCountsJson("{\"human_rcts\": -1}"));
        assertEquals("human_rcts", e.field());

        var malformed =
                assertThrows(
                        InvalidInputException.class,
                        () -> engine.scoreCountsJson("{\"human_rcts\""));
        assertEquals("counts", malformed.field());
    }

    @Test
    void configuredCurvesChangeTheScore() {
        var strict =
                EvidenceEngine.of(
                        EvidenceConfig.builder()
                                .currentYear(CURRENT_YEAR)
                                .minimumCredibleSampleSize(100)
                                .build());
        var inputs = ScoringInputs.fromCounts(5, 1, 3, 60.0, 2);

        var report = strict.score(inputs);

        assertEquals(
                List.of(Adjustment.SMALL_SAMPLE_PENALTY),
                report.adjustments().stream().map(Adjustment::name).toList());
        assertEquals(engine.score(inputs).totalScore() - 1.0, report.totalScore(), 1e-9);
    }

    @Test
    void toJsonUsesSnakeCase() {
        var json = engine.toJson(engine.score(ScoringInputs.NO_EVIDENCE));
        assertTrue(json.contains("\"undefined_signals\":[\"consistency\",\"recency\"]"), json);
        assertTrue(json.contains("\"grade\":\"F\""), json);
    }
}
