package dev.healthtrends.evidence.json;

import static org.junit.jupiter.api.Assertions.*;

import dev.healthtrends.evidence.InvalidInputException;
import dev.healthtrends.evidence.score.EvidenceGrade;
import org.junit.jupiter.api.Test;

class EvidenceJsonMapperTest {

    @Test
    void toJson_usesSnakeCase() {
        record Tally(int humanRcts, int metaAnalyses) {}

        assertEquals(
                "{\"human_rcts\":5,\"meta_analyses\":1}",
                EvidenceJsonMapper.toJson(new Tally(5, 1)));
    }

    @Test
    void toJson_excludesNullValues() {
        record TestRecord(String name, Integer yearsSinceLast) {}

        String json = EvidenceJsonMapper.toJson(new TestRecord("creatine", null));

        assertFalse(json.contains("years_since_last"));
        assertTrue(json.contains("\"name\":\"creatine\""));
    }

    @Test
    void fromJson_ignoresUnknownProperties() {
        record TestRecord(String name) {}

        var record =
                EvidenceJsonMapper.fromJson(
                        "studies", "{\"name\":\"x\",\"unknown_field\":1}", TestRecord.class);

        assertEquals("x", record.name());
    }

    @Test
    void fromJson_rethrowsInvalidInputFromTargetType() {
        record Graded(EvidenceGrade grade) {}

        var e =
                assertThrows(
                        InvalidInputException.class,
                        () ->
                                EvidenceJsonMapper.fromJson(
                                        "report", "{\"grade\":\"Z\"}", Graded.class));
        assertEquals("grade", e.field());
        assertEquals("Z", e.value());
    }

    @Test
    void fromJson_wrapsMalformedJson() {
        record TestRecord(String name) {}

        var e =
                assertThrows(
                        InvalidInputException.class,
                        () ->
                                EvidenceJsonMapper.fromJson(
                                        "counts", "{not json", TestRecord.class));
        assertEquals("counts", e.field());
        assertNotNull(e.getCause());
    }

    @Test
    void readTree_rejectsNullAndMalformedInput() {
        var missing =
                assertThrows(
                        InvalidInputException.class,
                        () -> EvidenceJsonMapper.readTree("studies", null));
        assertEquals("studies", missing.field());

        var e =
                assertThrows(
                        InvalidInputException.class,
                        () -> EvidenceJsonMapper.readTree("studies", "[{\"study_type\": }]"));
        assertTrue(e.getMessage().contains("malformed JSON"), e.getMessage());
    }

    @Test
    void readTree_abbreviatesLongInput() {
        var longJson = "[" + "1,".repeat(100);
        var e =
                assertThrows(
                        InvalidInputException.class,
                        () -> EvidenceJsonMapper.readTree("studies", longJson));
        assertTrue(e.value().toString().endsWith("..."));
        assertEquals(64, e.value().toString().length());
    }

    @Test
    void get_returnsSingleton() {
        assertSame(EvidenceJsonMapper.get(), EvidenceJsonMapper.get());
    }
}
