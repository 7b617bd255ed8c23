package com.tumorboard.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.List;

/**
 * A ClinVar significance record (one per RCV submission when present).
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class ClinVarEvidence {

    private final String clinicalSignificance;
    private final String reviewStatus;
    private final List<String> conditions;
    private final String variationId;

    public ClinVarEvidence(String clinicalSignificance, String reviewStatus,
                           List<String> conditions, String variationId) {
        this.clinicalSignificance = clinicalSignificance;
        this.reviewStatus = reviewStatus;
        this.conditions = conditions == null ? Collections.emptyList() : List.copyOf(conditions);
        this.variationId = variationId;
    }

    public String getClinicalSignificance() {
        return clinicalSignificance;
    }

    public String getReviewStatus() {
        return reviewStatus;
    }

    public List<String> getConditions() {
        return conditions;
    }

    public String getVariationId() {
        return variationId;
    }
}
