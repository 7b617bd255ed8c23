package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Confusion counts for one tier. Precision, recall and F1 are derived on read.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"tier", "true_positives", "false_positives", "false_negatives", "precision", "recall", "f1_score"})
public final class TierMetrics {

    private final ActionabilityTier tier;
    private final int truePositives;
    private final int falsePositives;
    private final int falseNegatives;

    public TierMetrics(ActionabilityTier tier, int truePositives, int falsePositives, int falseNegatives) {
        this.tier = tier;
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
    }

    public static TierMetrics empty(ActionabilityTier tier) {
        return new TierMetrics(tier, 0, 0, 0);
    }

    public TierMetrics withTruePositive() {
        return new TierMetrics(tier, truePositives + 1, falsePositives, falseNegatives);
    }

    public TierMetrics withFalsePositive() {
        return new TierMetrics(tier, truePositives, falsePositives + 1, falseNegatives);
    }

    public TierMetrics withFalseNegative() {
        return new TierMetrics(tier, truePositives, falsePositives, falseNegatives + 1);
    }

    public ActionabilityTier getTier() {
        return tier;
    }

    public int getTruePositives() {
        return truePositives;
    }

    public int getFalsePositives() {
        return falsePositives;
    }

    public int getFalseNegatives() {
        return falseNegatives;
    }

    public double getPrecision() {
        int denominator = truePositives + falsePositives;
        return denominator > 0 ? (double) truePositives / denominator : 0.0;
    }

    public double getRecall() {
        int denominator = truePositives + falseNegatives;
        return denominator > 0 ? (double) truePositives / denominator : 0.0;
    }

    public double getF1Score() {
        double precision = getPrecision();
        double recall = getRecall();
        if (precision + recall <= 0) {
            return 0.0;
        }
        return 2 * (precision * recall) / (precision + recall);
    }
}
