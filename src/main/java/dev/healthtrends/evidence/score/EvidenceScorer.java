package dev.healthtrends.evidence.score;

import static dev.healthtrends.evidence.score.ScoringModel.MAX_SCORE;

import dev.healthtrends.evidence.InvalidInputException;
import dev.healthtrends.evidence.aggregate.ScoringInputs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps {@link ScoringInputs} to a {@link ScoreReport}.
 *
 * <p>Stateless: the only field is the immutable constants table, so a single instance can score
 * any number of claims concurrently. Equal inputs always produce equal reports.
 *
 * <p>Scoring philosophy: extraordinary claims require extraordinary evidence.
 *
 * <ul>
 *   <li>A: multiple high-quality human trials or meta-analyses with consistent results
 *   <li>B: some human RCTs or strong observational evidence
 *   <li>C: limited human studies or mostly animal research
 *   <li>D: only animal or in vitro studies
 *   <li>F: no real evidence
 * </ul>
 */
@Slf4j
@ThreadSafe
public final class EvidenceScorer {
    private final @Nonnull ScoringModel model;

    public EvidenceScorer() {
        this(ScoringModel.DEFAULT);
    }

    public EvidenceScorer(@Nonnull ScoringModel model) {
        this.model = Objects.requireNonNull(model);
    }

    public ScoringModel model() {
        return model;
    }

    public ScoreReport score(ScoringInputs inputs) {
        if (inputs == null) {
            throw new InvalidInputException("inputs", null, "is required");
        }
        var undefined = new ArrayList<UndefinedSignal>();
        var components =
                List.of(
                        quantity(inputs),
                        quality(inputs),
                        consistency(inputs, undefined),
                        recency(inputs, undefined));

        var base = 0.0;
        for (var component : components) {
            base += component.weighted();
        }
        base = clamp(base);

        var adjustments = new ArrayList<Adjustment>();
        var total = applyAdjustments(inputs, base, adjustments);
        var grade = EvidenceGrade.fromScore(total);

        log.debug(
                "scored {} studies: base={} total={} grade={}",
                inputs.totalStudies(),
                base,
                total,
                grade.label());
        return new ScoreReport(
                total,
                grade,
                base,
                components,
                adjustments,
                undefined,
                inputs,
                ConfidenceLevel.AUTO);
    }

    /** Diminishing returns: a handful of studies earns most of the credit. */
    ComponentScore quantity(ScoringInputs inputs) {
        var n = inputs.totalStudies();
        var raw = saturate(n, model.quantitySaturation());
        return component(Component.QUANTITY, raw, format("%d studies", n));
    }

    /**
     * Strong evidence (pooled, RCT, other human) saturates towards 10. Animal and in vitro
     * evidence saturates towards its own cap below the midpoint and only fills part of the
     * headroom left by strong evidence, so weak study types cannot dominate.
     */
    ComponentScore quality(ScoringInputs inputs) {
        var strongWeight =
                model.metaAnalysisMultiplier() * inputs.metaAnalyses()
                        + model.humanRctMultiplier() * inputs.humanRcts()
                        + model.humanOtherMultiplier() * inputs.humanOther();
        var weakWeight =
                model.animalMultiplier() * inputs.animalStudies()
                        + model.inVitroMultiplier() * inputs.inVitroStudies();
        var strong = saturate(strongWeight, model.qualitySaturation());
        var weak =
                model.weakEvidenceCap()
                        * (1 - Math.exp(-weakWeight / model.weakEvidenceSaturation()));
        var raw = strong + (1 - strong / MAX_SCORE) * weak;
        return component(
                Component.QUALITY,
                raw,
                format("weighted study count %.1f strong, %.1f weak", strongWeight, weakWeight));
    }

    /**
     * Share of directional studies that support the claim, raised to an exponent so a split body
     * of evidence lands near the bottom rather than at the midpoint.
     */
    ComponentScore consistency(ScoringInputs inputs, List<UndefinedSignal> undefined) {
        var directional = inputs.directionalStudies();
        if (directional == 0) {
            undefined.add(UndefinedSignal.CONSISTENCY);
            return component(
                    Component.CONSISTENCY,
                    model.neutralConsistency(),
                    "no directional findings; neutral");
        }
        var ratio = inputs.supportingStudies() / (double) directional;
        var raw = MAX_SCORE * Math.pow(ratio, model.consistencyExponent());
        return component(
                Component.CONSISTENCY,
                raw,
                format(
                        "%d supporting, %d contradicting (%.0f%% agree)",
                        inputs.supportingStudies(),
                        inputs.contradictingStudies(),
                        ratio * 100));
    }

    /** Full credit for recent work, linear decay to a nonzero floor. */
    ComponentScore recency(ScoringInputs inputs, List<UndefinedSignal> undefined) {
        var years = inputs.yearsSinceLast();
        if (years == null) {
            undefined.add(UndefinedSignal.RECENCY);
            return component(Component.RECENCY, 0.0, "no dated evidence");
        }
        double raw;
        if (years <= model.recencyFullCreditYears()) {
            raw = MAX_SCORE;
        } else if (years >= model.recencyFloorYears()) {
            raw = model.recencyFloor();
        } else {
            var span = model.recencyFloorYears() - model.recencyFullCreditYears();
            var progress = (years - model.recencyFullCreditYears()) / (double) span;
            raw = MAX_SCORE - progress * (MAX_SCORE - model.recencyFloor());
        }
        return component(
                Component.RECENCY,
                raw,
                years == 1 ? "last study 1 year ago" : format("last study %d years ago", years));
    }

    private double applyAdjustments(
            ScoringInputs inputs, double base, List<Adjustment> adjustments) {
        var score = base;

        var avgSampleSize = inputs.avgSampleSize();
        if (avgSampleSize != null && avgSampleSize < model.minimumCredibleSampleSize()) {
            var next = Math.max(0.0, score - model.smallSamplePenalty());
            adjustments.add(
                    new Adjustment(
                            Adjustment.SMALL_SAMPLE_PENALTY,
                            next - score,
                            format(
                                    "average human sample size %.0f is below %d",
                                    avgSampleSize,
                                    model.minimumCredibleSampleSize())));
            score = next;
        }

        if (inputs.totalStudies() > 0
                && inputs.humanStudies() == 0
                && inputs.metaAnalyses() == 0) {
            var next = Math.max(0.0, score - model.noHumanEvidencePenalty());
            adjustments.add(
                    new Adjustment(
                            Adjustment.NO_HUMAN_EVIDENCE_PENALTY,
                            next - score,
                            "only animal or in vitro studies"));
            score = next;
        }

        var bonusBudget = model.maxTotalBonus();

        var largestRct = inputs.largestRctSampleSize();
        if (inputs.humanRcts() > 0
                && largestRct != null
                && largestRct >= model.largeTrialSampleSize()) {
            var bonus = Math.min(model.largeTrialBonus(), bonusBudget);
            bonusBudget -= bonus;
            var next = Math.min(MAX_SCORE, score + bonus);
            adjustments.add(
                    new Adjustment(
                            Adjustment.LARGE_RCT_BONUS,
                            next - score,
                            format("largest human RCT enrolled %d participants", largestRct)));
            score = next;
        }

        var replication = inputs.replicationScore();
        if (replication != null && replication > 0) {
            var bonus =
                    model.maxReplicationBonus() * replication / ScoringModel.MAX_REPLICATION_SCORE;
            var capped = bonus > bonusBudget;
            var next = Math.min(MAX_SCORE, score + (capped ? bonusBudget : bonus));
            adjustments.add(
                    new Adjustment(
                            Adjustment.REPLICATION_BONUS,
                            next - score,
                            format(
                                    "replication strength %d of %d%s",
                                    replication,
                                    ScoringModel.MAX_REPLICATION_SCORE,
                                    capped ? "; limited by the combined bonus cap" : "")));
            score = next;
        }

        // applied last so nothing can lift a single study past the ceiling
        if (inputs.totalStudies() == 1) {
            var next = Math.min(score, model.singleStudyCeiling());
            adjustments.add(
                    new Adjustment(
                            Adjustment.SINGLE_STUDY_CEILING,
                            next - score,
                            format(
                                    "only one study exists; capped at %.1f",
                                    model.singleStudyCeiling())));
            score = next;
        }

        return clamp(score);
    }

    private ComponentScore component(Component component, double raw, String detail) {
        return ComponentScore.of(component, clamp(raw), model.weightOf(component), detail);
    }

    /** {@code 10 * (1 - e^(-x/k))}: 0 at x=0, approaches 10 as x grows. */
    private static double saturate(double x, double k) {
        return MAX_SCORE * (1 - Math.exp(-x / k));
    }

    private static double clamp(double score) {
        return Math.max(0.0, Math.min(MAX_SCORE, score));
    }

    private static String format(String format, Object... args) {
        return String.format(Locale.ROOT, format, args);
    }
}
