package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Outcome of scoring one assessment against its gold-standard label.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ValidationResult {

    private final String gene;
    private final String variant;
    private final String tumorType;
    private final ActionabilityTier expectedTier;
    private final ActionabilityTier predictedTier;
    private final boolean correct;
    private final double confidenceScore;
    private final ActionabilityAssessment assessment;

    public ValidationResult(GoldStandardEntry entry, ActionabilityAssessment assessment) {
        this.gene = entry.getGene();
        this.variant = entry.getVariant();
        this.tumorType = entry.getTumorType();
        this.expectedTier = entry.getExpectedTier();
        this.predictedTier = assessment.getTier();
        this.correct = expectedTier == predictedTier;
        this.confidenceScore = assessment.getConfidenceScore();
        this.assessment = assessment;
    }

    public String getGene() {
        return gene;
    }

    public String getVariant() {
        return variant;
    }

    public String getTumorType() {
        return tumorType;
    }

    public ActionabilityTier getExpectedTier() {
        return expectedTier;
    }

    public ActionabilityTier getPredictedTier() {
        return predictedTier;
    }

    @JsonProperty("is_correct")
    public boolean isCorrect() {
        return correct;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public ActionabilityAssessment getAssessment() {
        return assessment;
    }

    @JsonIgnore
    public TierDistance getTierDistance() {
        return TierDistance.between(expectedTier, predictedTier);
    }
}
