package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.healthtrends.evidence.aggregate.ScoringInputs;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import javax.annotation.concurrent.Immutable;

/**
 * Evidence score for one claim, with everything needed to explain it.
 *
 * <p>The total keeps full precision and the grade is derived from it. {@link #displayScore()} is
 * the one-decimal value that gets shown and stored.
 */
@Immutable
public record ScoreReport(
        /** final score in [0, 10] after adjustments */
        double totalScore,
        EvidenceGrade grade,
        /** weighted composite before adjustments, clamped to [0, 10] */
        double baseScore,
        /** quantity, quality, consistency and recency, in that order */
        List<ComponentScore> components,
        /** bonuses and penalties in the order they were applied */
        List<Adjustment> adjustments,
        List<UndefinedSignal> undefinedSignals,
        ScoringInputs inputs,
        ConfidenceLevel confidenceLevel) {

    private static final String RULE = "=".repeat(60);

    public ScoreReport {
        components = List.copyOf(components);
        adjustments = List.copyOf(adjustments);
        undefinedSignals = List.copyOf(undefinedSignals);
    }

    /** The total rounded half-up to one decimal, as displayed and persisted. */
    @JsonProperty("display_score")
    public BigDecimal displayScore() {
        return BigDecimal.valueOf(totalScore).setScale(1, RoundingMode.HALF_UP);
    }

    public ComponentScore component(Component component) {
        return components.stream()
                .filter(c -> c.component() == component)
                .findFirst()
                .orElseThrow(
                        () -> new IllegalStateException("report is missing " + component));
    }

    /** Copy of this report with a different provenance. The score itself is unchanged. */
    public ScoreReport withConfidence(ConfidenceLevel level) {
        return new ScoreReport(
                totalScore,
                grade,
                baseScore,
                components,
                adjustments,
                undefinedSignals,
                inputs,
                level);
    }

    public String createReportString() {
        var out = new StringBuilder();
        line(out, RULE);
        line(out, "EVIDENCE SCORE: %s/10 (%s)", displayScore().toPlainString(), grade.label());
        line(out, RULE);

        line(out, "");
        line(out, "Study Counts:");
        line(out, "  - Total studies: %d", inputs.totalStudies());
        line(out, "  - Meta-analyses: %d", inputs.metaAnalyses());
        line(out, "  - Human RCTs: %d", inputs.humanRcts());
        line(out, "  - Other human studies: %d", inputs.humanOther());
        line(out, "  - Animal studies: %d", inputs.animalStudies());
        line(out, "  - In vitro: %d", inputs.inVitroStudies());

        if (inputs.avgSampleSize() != null
                || inputs.largestRctSampleSize() != null
                || inputs.yearsSinceLast() != null) {
            line(out, "");
            line(out, "Quality Metrics:");
            if (inputs.avgSampleSize() != null) {
                line(out, "  - Avg sample size: %.0f", inputs.avgSampleSize());
            }
            if (inputs.largestRctSampleSize() != null) {
                line(out, "  - Largest RCT: %d", inputs.largestRctSampleSize());
            }
            if (inputs.yearsSinceLast() != null) {
                line(out, "  - Years since last study: %d", inputs.yearsSinceLast());
            }
        }

        line(out, "");
        line(out, "Component Scores:");
        for (var c : components) {
            line(
                    out,
                    "  - %-12s %4.1f/10  x %.2f = %.2f  (%s)",
                    c.component().label() + ":",
                    c.raw(),
                    c.weight(),
                    c.weighted(),
                    c.detail());
        }
        line(out, "  - %-12s %4.1f/10", "Base score:", baseScore);

        if (!adjustments.isEmpty()) {
            line(out, "");
            line(out, "Adjustments Applied:");
            for (var a : adjustments) {
                line(
                        out,
                        "  %s %s %+.2f: %s",
                        a.isBonus() ? "+" : "-",
                        a.name(),
                        a.delta(),
                        a.reason());
            }
        }

        if (!undefinedSignals.isEmpty()) {
            line(out, "");
            line(out, "Defaults Used:");
            for (var signal : undefinedSignals) {
                line(out, "  - %s: %s", signal.label(), signal.resolution());
            }
        }

        line(out, "");
        line(out, "Confidence: %s", confidenceLevel.value());
        out.append(RULE);
        return out.toString();
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
