package dev.healthtrends.evidence.config;

import dev.healthtrends.evidence.score.ScoringModel;
import java.time.Year;
import java.util.HashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for the evidence scoring engine with sane defaults.
 *
 * <p>Most callers will want to use envars to configure the engine. However, it's also possible to
 * override any envar during config construction.
 *
 * <p>Only the tunable curve constants are exposed here. The component weights and grade thresholds
 * are fixed design constants and live in {@link ScoringModel}.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode(callSuper = false)
public final class EvidenceConfig extends BaseConfig {
    /** Year used to derive "years since the most recent study". */
    private final int currentYear = getConfig("EVIDENCE_CURRENT_YEAR", Year.now().getValue());

    private final double quantitySaturation =
            getConfig(
                    "EVIDENCE_QUANTITY_SATURATION", ScoringModel.DEFAULT.quantitySaturation());
    private final double qualitySaturation =
            getConfig("EVIDENCE_QUALITY_SATURATION", ScoringModel.DEFAULT.qualitySaturation());
    private final int recencyFloorYears =
            getConfig("EVIDENCE_RECENCY_FLOOR_YEARS", ScoringModel.DEFAULT.recencyFloorYears());
    private final int minimumCredibleSampleSize =
            getConfig(
                    "EVIDENCE_MIN_SAMPLE_SIZE",
                    ScoringModel.DEFAULT.minimumCredibleSampleSize());

    public static EvidenceConfig fromEnvironment() {
        return of();
    }

    public static EvidenceConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new EvidenceConfig(overridesMap);
    }

    private EvidenceConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        // fail fast on nonsensical curve constants rather than at first score
        scoringModel();
    }

    /** The scoring constants table, with this config's tunable values applied. */
    public ScoringModel scoringModel() {
        return ScoringModel.DEFAULT.toBuilder()
                .quantitySaturation(quantitySaturation)
                .qualitySaturation(qualitySaturation)
                .recencyFloorYears(recencyFloorYears)
                .minimumCredibleSampleSize(minimumCredibleSampleSize)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder currentYear(int value) {
            envOverrides.put("EVIDENCE_CURRENT_YEAR", String.valueOf(value));
            return this;
        }

        public Builder quantitySaturation(double value) {
            envOverrides.put("EVIDENCE_QUANTITY_SATURATION", String.valueOf(value));
            return this;
        }

        public Builder qualitySaturation(double value) {
            envOverrides.put("EVIDENCE_QUALITY_SATURATION", String.valueOf(value));
            return this;
        }

        public Builder recencyFloorYears(int value) {
            envOverrides.put("EVIDENCE_RECENCY_FLOOR_YEARS", String.valueOf(value));
            return this;
        }

        public Builder minimumCredibleSampleSize(int value) {
            envOverrides.put("EVIDENCE_MIN_SAMPLE_SIZE", String.valueOf(value));
            return this;
        }

        public EvidenceConfig build() {
            return new EvidenceConfig(envOverrides);
        }
    }
}
