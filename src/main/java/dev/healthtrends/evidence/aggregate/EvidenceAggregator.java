package dev.healthtrends.evidence.aggregate;

import dev.healthtrends.evidence.InvalidInputException;
import dev.healthtrends.evidence.study.PartialDataWarning;
import dev.healthtrends.evidence.study.StudyRecord;
import dev.healthtrends.evidence.study.StudyRecordReader;
import dev.healthtrends.evidence.study.StudyType;
import dev.healthtrends.evidence.study.SupportDirection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * Reduces study records to {@link ScoringInputs}.
 *
 * <p>Records with out-of-domain values are skipped individually and reported as {@link
 * PartialDataWarning}s. A null batch or a null element fails the whole call.
 */
@Slf4j
@ThreadSafe
public final class EvidenceAggregator {
    private final int currentYear;

    public EvidenceAggregator(int currentYear) {
        this.currentYear = currentYear;
    }

    public int currentYear() {
        return currentYear;
    }

    public AggregationResult aggregate(List<StudyRecord> studies) {
        return aggregate(studies, null);
    }

    public AggregationResult aggregate(
            List<StudyRecord> studies, @Nullable Integer replicationScore) {
        if (studies == null) {
            throw new InvalidInputException("studies", null, "is required");
        }
        var tally = new Tally();
        var warnings = new ArrayList<PartialDataWarning>();
        for (int i = 0; i < studies.size(); i++) {
            var study = studies.get(i);
            if (study == null) {
                throw new InvalidInputException("studies[" + i + "]", null, "is required");
            }
            var problem = validate(study);
            if (problem.isPresent()) {
                var warning = new PartialDataWarning(i, study.pmid(), problem.get());
                log.warn("{}", warning);
                warnings.add(warning);
                continue;
            }
            tally.add(study);
        }
        var result = tally.toResult(currentYear, replicationScore, studies.size(), warnings);
        log.debug(
                "aggregated {} of {} records into {}",
                result.recordsUsed(),
                result.recordsReceived(),
                result.inputs());
        return result;
    }

    /**
     * Aggregate records read from JSON. Warnings from the reader and from aggregation are merged
     * and all point into the original JSON array.
     */
    public AggregationResult aggregate(
            StudyRecordReader.ReadResult read, @Nullable Integer replicationScore) {
        var aggregated = aggregate(read.records(), replicationScore);
        var warnings = new ArrayList<PartialDataWarning>(read.warnings());
        warnings.addAll(read.toSourceIndexes(aggregated.warnings()));
        warnings.sort(Comparator.comparingInt(PartialDataWarning::index));
        return new AggregationResult(
                aggregated.inputs(),
                warnings,
                read.records().size() + read.warnings().size(),
                aggregated.mixedStudies(),
                aggregated.largestSampleSize(),
                aggregated.mostRecentYear());
    }

    private Optional<String> validate(StudyRecord study) {
        var sampleSize = study.sampleSize();
        if (sampleSize != null && sampleSize < 0) {
            return Optional.of("negative sample_size " + sampleSize);
        }
        if (sampleSize != null
                && sampleSize == 0
                && study.isHuman()
                && !study.studyType().isPooled()) {
            return Optional.of("human %s with sample_size 0".formatted(study.studyType().value()));
        }
        var year = study.publicationYear();
        if (year != null && year > currentYear) {
            return Optional.of(
                    "publication_year %d is after the current year %d"
                            .formatted(year, currentYear));
        }
        return Optional.empty();
    }

    /** Mutable accumulator, confined to a single aggregate() call. */
    private static final class Tally {
        int humanRcts;
        int metaAnalyses;
        int humanOther;
        int animalStudies;
        int inVitroStudies;
        int supporting;
        int contradicting;
        int mixed;
        long sampleSizeSum;
        int sampleSizeCount;
        @Nullable Integer largestSample;
        @Nullable Integer largestRctSample;
        @Nullable Integer mostRecentYear;

        void add(StudyRecord study) {
            classify(study);
            if (study.isHuman() && study.hasKnownPositiveSampleSize()) {
                sampleSizeSum += study.sampleSize();
                sampleSizeCount++;
            }
            if (study.hasKnownPositiveSampleSize()
                    && (largestSample == null || study.sampleSize() > largestSample)) {
                largestSample = study.sampleSize();
            }
            if (study.studyType() == StudyType.RCT
                    && study.isHuman()
                    && study.hasKnownPositiveSampleSize()
                    && (largestRctSample == null || study.sampleSize() > largestRctSample)) {
                largestRctSample = study.sampleSize();
            }
            var year = study.publicationYear();
            if (year != null && (mostRecentYear == null || year > mostRecentYear)) {
                mostRecentYear = year;
            }
            var direction = study.supportsClaim();
            if (direction == SupportDirection.YES) {
                supporting++;
            } else if (direction.contradicts()) {
                contradicting++;
                if (direction == SupportDirection.MIXED) {
                    mixed++;
                }
            }
        }

        /** Every record lands in exactly one bucket, so each one counts toward quantity. */
        private void classify(StudyRecord study) {
            StudyType type = study.studyType();
            if (type.isPooled()) {
                metaAnalyses++;
            } else if (type == StudyType.RCT && study.isHuman()) {
                humanRcts++;
            } else if (study.isHuman()) {
                humanOther++;
            } else if (type == StudyType.IN_VITRO) {
                inVitroStudies++;
            } else {
                // non-human primary designs (animal trials and the like) are animal evidence
                animalStudies++;
            }
        }

        AggregationResult toResult(
                int currentYear,
                @Nullable Integer replicationScore,
                int received,
                List<PartialDataWarning> warnings) {
            var inputs =
                    ScoringInputs.builder()
                            .humanRcts(humanRcts)
                            .metaAnalyses(metaAnalyses)
                            .humanOther(humanOther)
                            .animalStudies(animalStudies)
                            .inVitroStudies(inVitroStudies)
                            .avgSampleSize(
                                    sampleSizeCount == 0
                                            ? null
                                            : (double) sampleSizeSum / sampleSizeCount)
                            .largestRctSampleSize(largestRctSample)
                            .supportingStudies(supporting)
                            .contradictingStudies(contradicting)
                            .yearsSinceLast(
                                    mostRecentYear == null ? null : currentYear - mostRecentYear)
                            .replicationScore(replicationScore)
                            .build();
            return new AggregationResult(
                    inputs,
                    warnings,
                    received,
                    mixed,
                    largestSample,
                    mostRecentYear);
        }
    }
}
