package com.tumorboard.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.List;

/**
 * A single CIViC evidence item.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class CivicEvidence {

    private final String evidenceType;
    private final String evidenceLevel;
    private final String clinicalSignificance;
    private final String disease;
    private final List<String> drugs;
    private final String description;

    public CivicEvidence(String evidenceType, String evidenceLevel, String clinicalSignificance,
                         String disease, List<String> drugs, String description) {
        this.evidenceType = evidenceType;
        this.evidenceLevel = evidenceLevel;
        this.clinicalSignificance = clinicalSignificance;
        this.disease = disease;
        this.drugs = drugs == null ? Collections.emptyList() : List.copyOf(drugs);
        this.description = description;
    }

    public String getEvidenceType() {
        return evidenceType;
    }

    public String getEvidenceLevel() {
        return evidenceLevel;
    }

    public String getClinicalSignificance() {
        return clinicalSignificance;
    }

    public String getDisease() {
        return disease;
    }

    public List<String> getDrugs() {
        return drugs;
    }

    public String getDescription() {
        return description;
    }
}
