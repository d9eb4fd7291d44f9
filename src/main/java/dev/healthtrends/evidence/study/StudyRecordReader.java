package dev.healthtrends.evidence.study;

import com.fasterxml.jackson.databind.JsonNode;
import dev.healthtrends.evidence.InvalidInputException;
import dev.healthtrends.evidence.json.EvidenceJsonMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads a JSON array of study objects as produced by the retrieval layer.
 *
 * <p>Structural problems fail the whole call: a document that is not an array, an element that is
 * not an object, a missing {@code study_type} or {@code is_human}, or a field of the wrong JSON
 * type. An unrecognized {@code study_type} or {@code supports_claim} value only skips that record.
 */
@Slf4j
public final class StudyRecordReader {
    private static final String FIELD = "studies";

    private StudyRecordReader() {}

    /** Records read from a batch, plus the warnings for elements that were skipped. */
    public record ReadResult(
            List<StudyRecord> records,
            /** position in the JSON array for each entry of {@link #records} */
            List<Integer> sourceIndexes,
            List<PartialDataWarning> warnings) {

        public ReadResult {
            records = List.copyOf(records);
            sourceIndexes = List.copyOf(sourceIndexes);
            warnings = List.copyOf(warnings);
        }

        /**
         * Rewrites warnings indexed against {@link #records} so they point into the original JSON
         * array instead.
         */
        public List<PartialDataWarning> toSourceIndexes(List<PartialDataWarning> recordWarnings) {
            return recordWarnings.stream()
                    .map(w -> w.withIndex(sourceIndexes.get(w.index())))
                    .toList();
        }
    }

    public static ReadResult read(String json) {
        var root = EvidenceJsonMapper.readTree(FIELD, json);
        if (!root.isArray()) {
            throw new InvalidInputException(
                    FIELD, root.getNodeType(), "expected a JSON array of study objects");
        }
        var records = new ArrayList<StudyRecord>();
        var sourceIndexes = new ArrayList<Integer>();
        var warnings = new ArrayList<PartialDataWarning>();
        for (int i = 0; i < root.size(); i++) {
            var node = root.get(i);
            if (!node.isObject()) {
                throw new InvalidInputException(
                        FIELD + "[" + i + "]", node.getNodeType(), "expected a study object");
            }
            var pmid = optionalText(node, i, "pmid");
            var studyTypeValue = requiredText(node, i, "study_type");
            var isHuman = requiredBoolean(node, i, "is_human");
            var sampleSize = optionalInt(node, i, "sample_size");
            var publicationYear = optionalInt(node, i, "publication_year");
            var directionValue = optionalText(node, i, "supports_claim");

            Optional<StudyType> studyType = StudyType.find(studyTypeValue);
            if (studyType.isEmpty()) {
                warnings.add(skip(i, pmid, "unknown study_type '%s'".formatted(studyTypeValue)));
                continue;
            }
            var direction =
                    directionValue == null
                            ? Optional.of(SupportDirection.UNKNOWN)
                            : SupportDirection.find(directionValue);
            if (direction.isEmpty()) {
                warnings.add(
                        skip(i, pmid, "unknown supports_claim '%s'".formatted(directionValue)));
                continue;
            }
            records.add(
                    new StudyRecord(
                            studyType.get(),
                            isHuman,
                            sampleSize,
                            publicationYear,
                            direction.get(),
                            pmid));
            sourceIndexes.add(i);
        }
        log.debug("read {} study records, skipped {}", records.size(), warnings.size());
        return new ReadResult(records, sourceIndexes, warnings);
    }

    private static PartialDataWarning skip(int index, @Nullable String pmid, String reason) {
        var warning = new PartialDataWarning(index, pmid, reason);
        log.warn("{}", warning);
        return warning;
    }

    private static String requiredText(JsonNode node, int index, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            throw new InvalidInputException(fieldName(index, name), null, "is required");
        }
        if (!value.isTextual()) {
            throw new InvalidInputException(
                    fieldName(index, name), value, "expected a string");
        }
        return value.textValue();
    }

    private static boolean requiredBoolean(JsonNode node, int index, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            throw new InvalidInputException(fieldName(index, name), null, "is required");
        }
        if (!value.isBoolean()) {
            throw new InvalidInputException(
                    fieldName(index, name), value, "expected true or false");
        }
        return value.booleanValue();
    }

    private static @Nullable Integer optionalInt(JsonNode node, int index, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new InvalidInputException(
                    fieldName(index, name), value, "expected an integer");
        }
        return value.intValue();
    }

    private static @Nullable String optionalText(JsonNode node, int index, String name) {
        var value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        // PubMed IDs show up as both strings and numbers
        if (value.isTextual() || value.isIntegralNumber()) {
            return value.asText();
        }
        throw new InvalidInputException(fieldName(index, name), value, "expected a string");
    }

    private static String fieldName(int index, String name) {
        return "%s[%d].%s".formatted(FIELD, index, name);
    }
}
