package dev.healthtrends.evidence.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import dev.healthtrends.evidence.InvalidInputException;
import lombok.SneakyThrows;

/**
 * Centralized ObjectMapper for study input and score report output.
 *
 * <p>Property names are snake_case to match the retrieval layer and the persisted columns.
 */
public final class EvidenceJsonMapper {

    private static volatile ObjectMapper instance;

    private EvidenceJsonMapper() {}

    public static ObjectMapper get() {
        if (instance == null) {
            synchronized (EvidenceJsonMapper.class) {
                if (instance == null) {
                    instance = newObjectMapper();
                }
            }
        }
        return instance;
    }

    private static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    /**
     * Parse caller-supplied JSON into a tree.
     *
     * @throws InvalidInputException if the text is not well-formed JSON
     */
    public static JsonNode readTree(String field, String json) {
        if (json == null) {
            throw new InvalidInputException(field, null, "is required");
        }
        try {
            return get().readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(
                    field, abbreviate(json), "malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Bind caller-supplied JSON to {@code targetClass}.
     *
     * @throws InvalidInputException if the text is malformed, has the wrong shape, or the target
     *     type rejects one of its values
     */
    public static <T> T fromJson(String field, String json, Class<T> targetClass) {
        if (json == null) {
            throw new InvalidInputException(field, null, "is required");
        }
        try {
            return get().readValue(json, targetClass);
        } catch (JsonProcessingException e) {
            if (e.getCause() instanceof InvalidInputException invalid) {
                throw invalid;
            }
            throw new InvalidInputException(
                    field, abbreviate(json), "cannot be read: " + e.getOriginalMessage(), e);
        }
    }

    private static String abbreviate(String json) {
        return json.length() <= 64 ? json : json.substring(0, 61) + "...";
    }
}
