package dev.healthtrends.evidence.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class BaseConfig {
    /** Sentinal used to set null in the env. Only used for testing. */
    static final String NULL_OVERRIDE = "EVIDENCE_NULL_SENTINAL_" + System.currentTimeMillis();

    protected final Map<String, String> envOverrides;

    BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected <T> @Nonnull T getConfig(@Nonnull String settingName, @Nonnull T defaultValue) {
        Objects.requireNonNull(defaultValue);
        return Objects.requireNonNull(
                getConfig(settingName, defaultValue, (Class<T>) defaultValue.getClass()));
    }

    protected <T> @Nullable T getConfig(
            @Nonnull String settingName, @Nullable T defaultValue, @Nonnull Class<T> settingClass) {
        @Nullable String rawVal = getEnvValue(settingName);
        if (rawVal == null) {
            return defaultValue;
        } else {
            return cast(settingName, rawVal, settingClass);
        }
    }

    protected <T> T cast(
            @Nonnull String settingName, @Nonnull String value, @Nonnull Class<T> clazz) {
        try {
            if (List.of(Integer.class, int.class).contains(clazz)) {
                return (T) Integer.valueOf(value.trim());
            } else if (List.of(Double.class, double.class).contains(clazz)) {
                return (T) Double.valueOf(value.trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "%s has a malformed value: '%s'".formatted(settingName, value), e);
        }
        throw new RuntimeException(
                "Unsupported default class: %s -- please implement or use a different default"
                        .formatted(clazz));
    }

    protected @Nullable String getEnvValue(@Nonnull String settingName) {
        // first try the override map
        var settingValue = envOverrides.get(settingName);
        if (settingValue == null) {
            // then get it from the sysenv
            settingValue = System.getenv(settingName);
        }
        return NULL_OVERRIDE.equals(settingValue) ? null : settingValue;
    }
}
