package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Compact description of one misprediction, kept for the failure analysis section.
 */
@JsonPropertyOrder({"variant", "tumor_type", "expected", "predicted", "tier_distance", "confidence", "summary"})
public final class FailureRecord {

    static final int MAX_SUMMARY_LENGTH = 200;

    private final String variant;
    private final String tumorType;
    private final ActionabilityTier expected;
    private final ActionabilityTier predicted;
    private final TierDistance tierDistance;
    private final double confidence;
    private final String summary;

    public FailureRecord(ValidationResult result) {
        this.variant = result.getGene() + " " + result.getVariant();
        this.tumorType = result.getTumorType();
        this.expected = result.getExpectedTier();
        this.predicted = result.getPredictedTier();
        this.tierDistance = result.getTierDistance();
        this.confidence = result.getConfidenceScore();
        this.summary = truncate(result.getAssessment().getSummary());
    }

    static String truncate(String text) {
        if (text == null) {
            return "";
        }
        if (text.length() > MAX_SUMMARY_LENGTH) {
            return text.substring(0, MAX_SUMMARY_LENGTH) + "...";
        }
        return text;
    }

    @JsonProperty("variant")
    public String getVariant() {
        return variant;
    }

    @JsonProperty("tumor_type")
    public String getTumorType() {
        return tumorType;
    }

    @JsonProperty("expected")
    public ActionabilityTier getExpected() {
        return expected;
    }

    @JsonProperty("predicted")
    public ActionabilityTier getPredicted() {
        return predicted;
    }

    @JsonIgnore
    public TierDistance getTierDistance() {
        return tierDistance;
    }

    @JsonProperty("tier_distance")
    public int getTierDistanceValue() {
        return tierDistance.asLegacyValue();
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return confidence;
    }

    @JsonProperty("summary")
    public String getSummary() {
        return summary;
    }
}
