package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A therapy the model recommends for the variant.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public final class RecommendedTherapy {

    private final String drugName;
    private final String evidenceLevel;
    private final String approvalStatus;
    private final String clinicalContext;

    public RecommendedTherapy(String drugName, String evidenceLevel, String approvalStatus, String clinicalContext) {
        if (drugName == null || drugName.isBlank()) {
            throw new IllegalArgumentException("drug_name is required");
        }
        this.drugName = drugName;
        this.evidenceLevel = evidenceLevel;
        this.approvalStatus = approvalStatus;
        this.clinicalContext = clinicalContext;
    }

    public RecommendedTherapy(String drugName) {
        this(drugName, null, null, null);
    }

    public String getDrugName() {
        return drugName;
    }

    public String getEvidenceLevel() {
        return evidenceLevel;
    }

    public String getApprovalStatus() {
        return approvalStatus;
    }

    public String getClinicalContext() {
        return clinicalContext;
    }
}
