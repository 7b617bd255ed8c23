package com.tumorboard.models;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class CosmicEvidence {

    private final String mutationId;
    private final String primarySite;
    private final Double mutationFrequency;
    private final String mutationNt;

    public CosmicEvidence(String mutationId, String primarySite, Double mutationFrequency, String mutationNt) {
        this.mutationId = mutationId;
        this.primarySite = primarySite;
        this.mutationFrequency = mutationFrequency;
        this.mutationNt = mutationNt;
    }

    public String getMutationId() {
        return mutationId;
    }

    public String getPrimarySite() {
        return primarySite;
    }

    public Double getMutationFrequency() {
        return mutationFrequency;
    }

    public String getMutationNt() {
        return mutationNt;
    }
}
