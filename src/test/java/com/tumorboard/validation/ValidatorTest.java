package com.tumorboard.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.VariantAssessor;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.ActionabilityTier;
import com.tumorboard.models.GoldStandardEntry;
import com.tumorboard.models.ValidationMetrics;
import com.tumorboard.models.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorTest {

    private static final Map<String, ActionabilityTier> PREDICTIONS = Map.of(
        "BRAF", ActionabilityTier.TIER_I,
        "KRAS", ActionabilityTier.TIER_II,
        "TP53", ActionabilityTier.TIER_I);

    private static final VariantAssessor ASSESSOR = input -> {
        ActionabilityTier tier = PREDICTIONS.get(input.getGene());
        if (tier == null) {
            throw new IOException("evidence service unavailable for " + input.getGene());
        }
        return ActionabilityAssessment.builder()
            .gene(input.getGene())
            .variant(input.getVariant())
            .tumorType(input.getTumorType())
            .tier(tier)
            .confidenceScore(0.8)
            .summary("summary for " + input.getGene())
            .rationale("r")
            .build();
    };

    @Test
    void validateEntryComparesTiers() throws Exception {
        Validator validator = new Validator(ASSESSOR, new ObjectMapper());
        ValidationResult result = validator.validateEntry(
            new GoldStandardEntry("KRAS", "G12C", "NSCLC", ActionabilityTier.TIER_II));
        assertTrue(result.isCorrect());
        assertEquals(0, result.getTierDistance().getValue());
    }

    @Test
    void datasetMetricsExcludeFailedAssessments() throws Exception {
        Validator validator = new Validator(ASSESSOR, new ObjectMapper());
        List<GoldStandardEntry> entries = List.of(
            new GoldStandardEntry("BRAF", "V600E", "Melanoma", ActionabilityTier.TIER_I),
            new GoldStandardEntry("KRAS", "G12C", "NSCLC", ActionabilityTier.TIER_II),
            new GoldStandardEntry("TP53", "R175H", "Breast", ActionabilityTier.TIER_III),
            new GoldStandardEntry("MYC", "AMP", "Breast", ActionabilityTier.TIER_IV));

        ValidationMetrics metrics = validator.validateDataset(entries, 2);

        assertEquals(3, metrics.getTotalCases());
        assertEquals(2, metrics.getCorrectPredictions());
        assertEquals(1, metrics.getFailedCases());
        assertEquals(2.0 / 3.0, metrics.getAccuracy(), 1e-9);
        assertEquals(1, metrics.getFailureAnalysis().size());
        assertEquals("TP53 R175H", metrics.getFailureAnalysis().get(0).getVariant());
        assertFalse(metrics.getTierMetrics().containsKey("Tier IV"));
    }

    @Test
    void loadsGoldStandardFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gold.json");
        Files.writeString(file, "{\"entries\":[{\"gene\":\"BRAF\",\"variant\":\"V600E\",\"tumor_type\":\"Melanoma\","
            + "\"expected_tier\":\"Tier I\",\"notes\":\"approved\",\"references\":[\"PMID:1\"]}]}", StandardCharsets.UTF_8);

        List<GoldStandardEntry> entries = new Validator(ASSESSOR, new ObjectMapper()).loadGoldStandard(file);
        assertEquals(1, entries.size());
        assertEquals(ActionabilityTier.TIER_I, entries.get(0).getExpectedTier());
        assertEquals(List.of("PMID:1"), entries.get(0).getReferences());
    }

    @Test
    void missingOrMalformedGoldStandardFails(@TempDir Path dir) throws Exception {
        Validator validator = new Validator(ASSESSOR, new ObjectMapper());
        assertThrows(IOException.class, () -> validator.loadGoldStandard(dir.resolve("absent.json")));

        Path broken = dir.resolve("broken.json");
        Files.writeString(broken, "{\"entries\": [", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> validator.loadGoldStandard(broken));
    }
}
