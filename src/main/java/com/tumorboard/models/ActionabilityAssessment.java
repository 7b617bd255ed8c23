package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Complete actionability assessment for a variant. Immutable; build with {@link Builder}.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonPropertyOrder({"gene", "variant", "tumor_type", "tier", "confidence_score", "summary",
    "recommended_therapies", "rationale", "evidence_strength", "clinical_trials_available", "references"})
public final class ActionabilityAssessment {

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    private final String gene;
    private final String variant;
    private final String tumorType;
    private final ActionabilityTier tier;
    private final double confidenceScore;
    private final String summary;
    private final List<RecommendedTherapy> recommendedTherapies;
    private final String rationale;
    private final String evidenceStrength;
    private final boolean clinicalTrialsAvailable;
    private final List<String> references;

    private ActionabilityAssessment(Builder b) {
        this.gene = require(b.gene, "gene");
        this.variant = require(b.variant, "variant");
        this.tumorType = require(b.tumorType, "tumor_type");
        if (b.tier == null) {
            throw new IllegalArgumentException("tier is required");
        }
        this.tier = b.tier;
        this.confidenceScore = validateConfidence(b.confidenceScore);
        this.summary = require(b.summary, "summary");
        this.rationale = require(b.rationale, "rationale");
        this.evidenceStrength = b.evidenceStrength;
        this.clinicalTrialsAvailable = b.clinicalTrialsAvailable;
        this.recommendedTherapies = Collections.unmodifiableList(new ArrayList<>(b.recommendedTherapies));
        this.references = Collections.unmodifiableList(new ArrayList<>(b.references));
    }

    public static Builder builder() {
        return new Builder();
    }

    static double validateConfidence(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Confidence score must be between 0 and 1, got " + value);
        }
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }

    private static String require(String value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
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

    public ActionabilityTier getTier() {
        return tier;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }

    public String getSummary() {
        return summary;
    }

    public List<RecommendedTherapy> getRecommendedTherapies() {
        return recommendedTherapies;
    }

    public String getRationale() {
        return rationale;
    }

    public String getEvidenceStrength() {
        return evidenceStrength;
    }

    public boolean isClinicalTrialsAvailable() {
        return clinicalTrialsAvailable;
    }

    public List<String> getReferences() {
        return references;
    }

    /**
     * Fixed-width text report for terminal output.
     */
    public String toReport() {
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("VARIANT ACTIONABILITY ASSESSMENT REPORT");
        lines.add(RULE);
        lines.add("\nVariant: " + gene + " " + variant);
        lines.add("Tumor Type: " + tumorType);
        lines.add("\nTier: " + tier.getLabel());
        lines.add("Confidence: " + String.format(Locale.ROOT, "%.1f%%", confidenceScore * 100));
        lines.add("Evidence Strength: " + (evidenceStrength != null ? evidenceStrength : "Not specified"));
        lines.add("\n" + THIN_RULE);
        lines.add("SUMMARY\n" + THIN_RULE);
        lines.add(summary);
        lines.add("\n" + THIN_RULE);
        lines.add("RATIONALE\n" + THIN_RULE);
        lines.add(rationale);

        if (!recommendedTherapies.isEmpty()) {
            lines.add("\n" + THIN_RULE);
            lines.add("RECOMMENDED THERAPIES (" + recommendedTherapies.size() + ")");
            lines.add(THIN_RULE);
            int idx = 1;
            for (RecommendedTherapy therapy : recommendedTherapies) {
                lines.add("\n" + idx++ + ". " + therapy.getDrugName());
                if (therapy.getEvidenceLevel() != null) {
                    lines.add("   Evidence Level: " + therapy.getEvidenceLevel());
                }
                if (therapy.getApprovalStatus() != null) {
                    lines.add("   Approval Status: " + therapy.getApprovalStatus());
                }
                if (therapy.getClinicalContext() != null) {
                    lines.add("   Clinical Context: " + therapy.getClinicalContext());
                }
            }
        }

        if (clinicalTrialsAvailable) {
            lines.add("\n" + THIN_RULE);
            lines.add("Clinical trials may be available for this variant.");
        }

        if (!references.isEmpty()) {
            lines.add("\n" + THIN_RULE);
            lines.add("KEY REFERENCES (" + references.size() + ")");
            lines.add(THIN_RULE);
            int idx = 1;
            for (String ref : references) {
                lines.add(idx++ + ". " + ref);
            }
        }

        lines.add("\n" + RULE);
        return String.join("\n", lines);
    }

    public static class Builder {
        private String gene;
        private String variant;
        private String tumorType;
        private ActionabilityTier tier;
        private double confidenceScore = 0.5;
        private String summary;
        private String rationale;
        private String evidenceStrength;
        private boolean clinicalTrialsAvailable;
        private List<RecommendedTherapy> recommendedTherapies = new ArrayList<>();
        private List<String> references = new ArrayList<>();

        public Builder gene(String gene) {
            this.gene = gene;
            return this;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder tumorType(String tumorType) {
            this.tumorType = tumorType;
            return this;
        }

        public Builder tier(ActionabilityTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder confidenceScore(double confidenceScore) {
            this.confidenceScore = confidenceScore;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder rationale(String rationale) {
            this.rationale = rationale;
            return this;
        }

        public Builder evidenceStrength(String evidenceStrength) {
            this.evidenceStrength = evidenceStrength;
            return this;
        }

        public Builder clinicalTrialsAvailable(boolean clinicalTrialsAvailable) {
            this.clinicalTrialsAvailable = clinicalTrialsAvailable;
            return this;
        }

        public Builder recommendedTherapies(List<RecommendedTherapy> recommendedTherapies) {
            this.recommendedTherapies = recommendedTherapies != null ? new ArrayList<>(recommendedTherapies) : new ArrayList<>();
            return this;
        }

        public Builder addTherapy(RecommendedTherapy therapy) {
            this.recommendedTherapies.add(therapy);
            return this;
        }

        public Builder references(List<String> references) {
            this.references = references != null ? new ArrayList<>(references) : new ArrayList<>();
            return this;
        }

        /**
         * @throws IllegalArgumentException if a required field is missing or confidence is outside [0, 1]
         */
        public ActionabilityAssessment build() {
            return new ActionabilityAssessment(this);
        }
    }
}
