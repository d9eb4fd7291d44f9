package dev.healthtrends.evidence.score;

import static org.junit.jupiter.api.Assertions.*;

import dev.healthtrends.evidence.aggregate.ScoringInputs;
import dev.healthtrends.evidence.json.EvidenceJsonMapper;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreReportTest {
    private final EvidenceScorer scorer = new EvidenceScorer();

    @Test
    void displayScoreRoundsHalfUp() {
        assertEquals(new BigDecimal("9.5"), withTotal(9.45).displayScore());
        assertEquals(new BigDecimal("9.4"), withTotal(9.449).displayScore());
        assertEquals(new BigDecimal("10.0"), withTotal(10.0).displayScore());
        assertEquals(new BigDecimal("0.0"), withTotal(0.0).displayScore());
    }

    @Test
    void reportStringExplainsTheScore() {
        var report = scorer.score(ScoringInputs.fromCounts(5, 1, 3, 60.0, 2)).createReportString();

        assertTrue(report.contains("EVIDENCE SCORE: 9.5/10 (A)"), report);
        assertTrue(report.contains("  - Human RCTs: 5"), report);
        assertTrue(report.contains("  - Avg sample size: 60"), report);
        assertTrue(report.contains("quality:"), report);
        assertTrue(report.contains("Confidence: auto"), report);
        assertFalse(report.contains("Adjustments Applied"), report);
        assertFalse(report.contains("Defaults Used"), report);
    }

    @Test
    void reportStringListsAdjustmentsAndDefaults() {
        var penalized =
                scorer.score(ScoringInputs.builder().animalStudies(2).supportingStudies(2).build())
                        .createReportString();
        assertTrue(penalized.contains("Adjustments Applied:"), penalized);
        assertTrue(penalized.contains("- no-human-evidence-penalty -2.00"), penalized);
        assertTrue(penalized.contains("Defaults Used:"), penalized);
        assertTrue(penalized.contains("  - recency: no dated evidence"), penalized);
        assertFalse(penalized.contains("Quality Metrics"), penalized);
    }

    @Test
    void reportStringShowsLargeTrial() {
        var report =
                scorer.score(
                                ScoringInputs.fromCounts(4, 0, 0, 180.0, 1).toBuilder()
                                        .largestRctSampleSize(320)
                                        .build())
                        .createReportString();

        assertTrue(report.contains("  - Largest RCT: 320"), report);
        assertTrue(report.contains("  + large-rct-bonus +0.50"), report);
    }

    @Test
    void withConfidenceKeepsTheScore() {
        var report = scorer.score(ScoringInputs.fromCounts(2, 1, 0, 45.0, 3));
        var reviewed = report.withConfidence(ConfidenceLevel.REVIEWED);

        assertEquals(ConfidenceLevel.REVIEWED, reviewed.confidenceLevel());
        assertEquals(report.totalScore(), reviewed.totalScore());
        assertEquals(report.grade(), reviewed.grade());
        assertEquals(report.components(), reviewed.components());
        assertNotEquals(report, reviewed);
        assertTrue(reviewed.createReportString().contains("Confidence: reviewed"));
    }

    @Test
    void serializesForPersistence() {
        var json =
                EvidenceJsonMapper.toJson(scorer.score(ScoringInputs.fromCounts(5, 1, 3, 60.0, 2)));

        assertTrue(json.contains("\"display_score\":9.5"), json);
        assertTrue(json.contains("\"grade\":\"A\""), json);
        assertTrue(json.contains("\"confidence_level\":\"auto\""), json);
        assertTrue(json.contains("\"component\":\"quantity\""), json);
        assertTrue(json.contains("\"human_rcts\":5"), json);
        assertFalse(json.contains("\"replication_score\""), json);
        assertFalse(json.contains("penalty"), json);
    }

    @Test
    void listsAreImmutable() {
        var report = scorer.score(ScoringInputs.NO_EVIDENCE);
        assertThrows(UnsupportedOperationException.class, () -> report.adjustments().clear());
        assertThrows(
                UnsupportedOperationException.class,
                () -> report.undefinedSignals().add(UndefinedSignal.RECENCY));
    }

    private static ScoreReport withTotal(double total) {
        return new ScoreReport(
                total,
                EvidenceGrade.fromScore(total),
                total,
                List.of(),
                List.of(),
                List.of(),
                ScoringInputs.NO_EVIDENCE,
                ConfidenceLevel.AUTO);
    }
}
