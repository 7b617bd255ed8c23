package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregate benchmark statistics for one validation run.
 *
 * Built in a single sequential pass by {@link #fromResults(List, int)}; instances never change afterwards.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"total_cases", "correct_predictions", "failed_cases", "accuracy", "average_confidence",
    "tier_metrics", "failure_analysis"})
public final class ValidationMetrics {

    private static final int REPORTED_FAILURES = 10;
    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    private final int totalCases;
    private final int correctPredictions;
    private final int failedCases;
    private final double accuracy;
    private final double averageConfidence;
    private final Map<String, TierMetrics> tierMetrics;
    private final List<FailureRecord> failureAnalysis;

    private ValidationMetrics(int totalCases, int correctPredictions, int failedCases, double accuracy,
                              double averageConfidence, Map<String, TierMetrics> tierMetrics,
                              List<FailureRecord> failureAnalysis) {
        this.totalCases = totalCases;
        this.correctPredictions = correctPredictions;
        this.failedCases = failedCases;
        this.accuracy = accuracy;
        this.averageConfidence = averageConfidence;
        this.tierMetrics = Collections.unmodifiableMap(tierMetrics);
        this.failureAnalysis = Collections.unmodifiableList(failureAnalysis);
    }

    public static ValidationMetrics fromResults(List<ValidationResult> results) {
        return fromResults(results, 0);
    }

    /**
     * Folds scored results into metrics.
     *
     * A correct prediction adds a true positive to its tier. A misprediction adds a false negative
     * to the expected tier and a false positive to the predicted tier, and appends a failure record.
     *
     * @param failedCases entries that were attempted but produced no assessment; reported only
     */
    public static ValidationMetrics fromResults(List<ValidationResult> results, int failedCases) {
        List<ValidationResult> safe = results != null ? results : Collections.emptyList();
        Map<String, TierMetrics> tiers = new LinkedHashMap<>();
        List<FailureRecord> failures = new ArrayList<>();
        int correct = 0;
        double confidenceSum = 0.0;

        for (ValidationResult result : safe) {
            confidenceSum += result.getConfidenceScore();
            ActionabilityTier expected = result.getExpectedTier();
            ActionabilityTier predicted = result.getPredictedTier();
            tiers.putIfAbsent(expected.getLabel(), TierMetrics.empty(expected));
            tiers.putIfAbsent(predicted.getLabel(), TierMetrics.empty(predicted));

            if (result.isCorrect()) {
                correct++;
                tiers.computeIfPresent(expected.getLabel(), (k, m) -> m.withTruePositive());
            } else {
                tiers.computeIfPresent(expected.getLabel(), (k, m) -> m.withFalseNegative());
                tiers.computeIfPresent(predicted.getLabel(), (k, m) -> m.withFalsePositive());
                failures.add(new FailureRecord(result));
            }
        }

        int total = safe.size();
        double accuracy = total > 0 ? (double) correct / total : 0.0;
        double averageConfidence = total > 0 ? confidenceSum / total : 0.0;
        return new ValidationMetrics(total, correct, Math.max(0, failedCases), accuracy, averageConfidence,
            tiers, failures);
    }

    public int getTotalCases() {
        return totalCases;
    }

    public int getCorrectPredictions() {
        return correctPredictions;
    }

    public int getFailedCases() {
        return failedCases;
    }

    public double getAccuracy() {
        return accuracy;
    }

    public double getAverageConfidence() {
        return averageConfidence;
    }

    public Map<String, TierMetrics> getTierMetrics() {
        return tierMetrics;
    }

    public List<FailureRecord> getFailureAnalysis() {
        return failureAnalysis;
    }

    public String toReport() {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("VALIDATION REPORT");
        lines.add(RULE);
        lines.add("\nTotal Cases: " + totalCases);
        lines.add("Correct Predictions: " + correctPredictions);
        if (failedCases > 0) {
            lines.add("Failed Assessments: " + failedCases);
        }
        lines.add("Overall Accuracy: " + percent(accuracy));
        lines.add("Average Confidence: " + percent(averageConfidence));
        lines.add("\n" + THIN_RULE);
        lines.add("PER-TIER METRICS");
        lines.add(THIN_RULE);

        for (ActionabilityTier tier : ActionabilityTier.REPORT_ORDER) {
            TierMetrics metrics = tierMetrics.get(tier.getLabel());
            if (metrics == null) {
                continue;
            }
            lines.add("\n" + tier.getLabel() + ":");
            lines.add("  Precision: " + percent(metrics.getPrecision()));
            lines.add("  Recall: " + percent(metrics.getRecall()));
            lines.add("  F1 Score: " + percent(metrics.getF1Score()));
            lines.add("  TP: " + metrics.getTruePositives()
                + ", FP: " + metrics.getFalsePositives()
                + ", FN: " + metrics.getFalseNegatives());
        }

        if (!failureAnalysis.isEmpty()) {
            lines.add("\n" + THIN_RULE);
            lines.add("FAILURE ANALYSIS (" + failureAnalysis.size() + " errors)");
            lines.add(THIN_RULE);
            int shown = Math.min(REPORTED_FAILURES, failureAnalysis.size());
            for (int i = 0; i < shown; i++) {
                FailureRecord failure = failureAnalysis.get(i);
                lines.add("\n" + (i + 1) + ". " + failure.getVariant() + " in " + failure.getTumorType());
                lines.add("   Expected: " + failure.getExpected().getLabel()
                    + " | Predicted: " + failure.getPredicted().getLabel()
                    + " | Distance: " + failure.getTierDistanceValue());
                lines.add("   Confidence: " + percent(failure.getConfidence()));
                lines.add("   Summary: " + failure.getSummary());
            }
            if (failureAnalysis.size() > REPORTED_FAILURES) {
                lines.add("\n... and " + (failureAnalysis.size() - REPORTED_FAILURES) + " more errors");
            }
        }

        lines.add("\n" + RULE);
        return String.join("\n", lines);
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value * 100);
    }
}
