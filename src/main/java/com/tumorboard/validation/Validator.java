package com.tumorboard.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.AppLogger;
import com.tumorboard.VariantAssessor;
import com.tumorboard.batch.BatchExecutor;
import com.tumorboard.batch.ItemOutcome;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.GoldStandardEntry;
import com.tumorboard.models.GoldStandardFile;
import com.tumorboard.models.ValidationMetrics;
import com.tumorboard.models.ValidationResult;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Scores assessments against a gold-standard dataset.
 */
public class Validator {

    public static final int DEFAULT_MAX_CONCURRENT = 3;

    private final VariantAssessor assessor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public Validator(VariantAssessor assessor, ObjectMapper objectMapper) {
        this.assessor = Objects.requireNonNull(assessor, "assessor");
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * @throws IOException if the file is missing, unreadable, or not a valid gold-standard document
     */
    public List<GoldStandardEntry> loadGoldStandard(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new FileNotFoundException("Gold standard file not found: " + path);
        }
        GoldStandardFile file = objectMapper.readValue(path.toFile(), GoldStandardFile.class);
        List<GoldStandardEntry> entries = file != null ? file.getEntries() : new ArrayList<>();
        logger.info("Loaded " + entries.size() + " gold standard entries from " + path);
        return entries;
    }

    public ValidationResult validateEntry(GoldStandardEntry entry) throws Exception {
        ActionabilityAssessment assessment = assessor.assess(entry.toVariantInput());
        ValidationResult result = new ValidationResult(entry, assessment);
        if (!result.isCorrect()) {
            logger.debug("Mismatch for " + entry + ": predicted " + result.getPredictedTier().getLabel());
        }
        return result;
    }

    public ValidationMetrics validateDataset(List<GoldStandardEntry> entries) throws InterruptedException {
        return validateDataset(entries, DEFAULT_MAX_CONCURRENT);
    }

    /**
     * Validates every entry with at most {@code maxConcurrent} in flight. Entries whose assessment
     * fails are left out of the metrics and reported as {@code failed_cases}.
     */
    public ValidationMetrics validateDataset(List<GoldStandardEntry> entries, int maxConcurrent)
        throws InterruptedException {
        logger.info("Validating " + (entries != null ? entries.size() : 0) + " entries (max concurrent: "
            + maxConcurrent + ")");
        List<ItemOutcome<GoldStandardEntry, ValidationResult>> outcomes =
            new BatchExecutor(maxConcurrent).runAll(entries, this::validateEntry);

        List<ValidationResult> results = new ArrayList<>();
        int failed = 0;
        for (ItemOutcome<GoldStandardEntry, ValidationResult> outcome : outcomes) {
            if (outcome.isSuccess()) {
                results.add(outcome.getValue());
            } else {
                failed++;
                logger.error("Validation failed for " + outcome.getInput() + ": " + outcome.getError().getMessage());
            }
        }

        ValidationMetrics metrics = ValidationMetrics.fromResults(results, failed);
        logger.info("Validation complete: " + metrics.getCorrectPredictions() + "/" + metrics.getTotalCases()
            + " correct (" + String.format(Locale.ROOT, "%.1f%%", metrics.getAccuracy() * 100) + "), "
            + failed + " failed");
        return metrics;
    }
}
