package dev.healthtrends.evidence.score;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A named bonus or penalty applied after the weighted composite.
 *
 * <p>A delta of zero means the rule matched but did not change the score (a ceiling that was not
 * binding, for example). It is still reported so the rule is visible.
 */
public record Adjustment(String name, double delta, String reason) {
    public static final String SMALL_SAMPLE_PENALTY = "small-sample-penalty";
    public static final String NO_HUMAN_EVIDENCE_PENALTY = "no-human-evidence-penalty";
    public static final String LARGE_RCT_BONUS = "large-rct-bonus";
    public static final String REPLICATION_BONUS = "replication-bonus";
    public static final String SINGLE_STUDY_CEILING = "single-study-ceiling";

    @JsonIgnore
    public boolean isPenalty() {
        return delta < 0;
    }

    @JsonIgnore
    public boolean isBonus() {
        return delta > 0;
    }
}
