package com.tumorboard.models;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ActionabilityAssessmentTest {

    private ActionabilityAssessment.Builder base() {
        return ActionabilityAssessment.builder()
            .gene("BRAF")
            .variant("V600E")
            .tumorType("Melanoma")
            .tier(ActionabilityTier.TIER_I)
            .summary("Targetable driver")
            .rationale("FDA-approved BRAF inhibitors");
    }

    @Test
    void confidenceBoundsAreInclusive() {
        assertEquals(0.0, base().confidenceScore(0.0).build().getConfidenceScore());
        assertEquals(1.0, base().confidenceScore(1.0).build().getConfidenceScore());
    }

    @Test
    void rejectsConfidenceOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> base().confidenceScore(1.01).build());
        assertThrows(IllegalArgumentException.class, () -> base().confidenceScore(-0.1).build());
        assertThrows(IllegalArgumentException.class, () -> base().confidenceScore(Double.NaN).build());
    }

    @Test
    void roundsConfidenceToThreeDecimals() {
        assertEquals(0.857, base().confidenceScore(0.85714).build().getConfidenceScore());
        assertEquals(0.124, base().confidenceScore(0.1235).build().getConfidenceScore());
    }

    @Test
    void defaultsConfidenceAndEmptyLists() {
        ActionabilityAssessment assessment = base().build();
        assertEquals(0.5, assessment.getConfidenceScore());
        assertTrue(assessment.getRecommendedTherapies().isEmpty());
        assertTrue(assessment.getReferences().isEmpty());
        assertFalse(assessment.isClinicalTrialsAvailable());
    }

    @Test
    void listsAreNotAliasedToBuilderInput() {
        List<String> refs = new ArrayList<>(List.of("PMID:1"));
        ActionabilityAssessment assessment = base().references(refs).build();
        refs.add("PMID:2");
        assertEquals(1, assessment.getReferences().size());
        assertThrows(UnsupportedOperationException.class, () -> assessment.getReferences().add("x"));
    }

    @Test
    void reportContainsTierTherapiesAndReferences() {
        String report = base()
            .confidenceScore(0.95)
            .addTherapy(new RecommendedTherapy("Vemurafenib", "FDA-approved", "Approved", null))
            .references(List.of("PMID:22663011"))
            .clinicalTrialsAvailable(true)
            .build()
            .toReport();

        assertTrue(report.contains("Variant: BRAF V600E"));
        assertTrue(report.contains("Tier: Tier I"));
        assertTrue(report.contains("Confidence: 95.0%"));
        assertTrue(report.contains("Evidence Strength: Not specified"));
        assertTrue(report.contains("RECOMMENDED THERAPIES (1)"));
        assertTrue(report.contains("1. Vemurafenib"));
        assertTrue(report.contains("Clinical trials may be available"));
        assertTrue(report.contains("1. PMID:22663011"));
    }

    @Test
    void serializesSnakeCaseWithTierLabel() throws Exception {
        JsonNode json = new ObjectMapper().valueToTree(base().confidenceScore(0.9).build());
        assertEquals("Tier I", json.get("tier").asText());
        assertEquals("Melanoma", json.get("tumor_type").asText());
        assertEquals(0.9, json.get("confidence_score").asDouble());
        assertTrue(json.has("clinical_trials_available"));
    }

    @Test
    void therapyRequiresDrugName() {
        assertThrows(IllegalArgumentException.class, () -> new RecommendedTherapy(" "));
    }
}
