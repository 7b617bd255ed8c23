package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;

/**
 * A curated benchmark label: the tier a variant is expected to receive.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GoldStandardEntry {

    private final VariantInput input;
    private final ActionabilityTier expectedTier;
    private final String notes;
    private final List<String> references;

    @JsonCreator
    public GoldStandardEntry(@JsonProperty("gene") String gene,
                             @JsonProperty("variant") String variant,
                             @JsonProperty("tumor_type") String tumorType,
                             @JsonProperty("expected_tier") ActionabilityTier expectedTier,
                             @JsonProperty("notes") String notes,
                             @JsonProperty("references") List<String> references) {
        if (expectedTier == null) {
            throw new IllegalArgumentException("expected_tier is required");
        }
        this.input = new VariantInput(gene, variant, tumorType);
        this.expectedTier = expectedTier;
        this.notes = notes;
        this.references = references == null ? Collections.emptyList() : List.copyOf(references);
    }

    public GoldStandardEntry(String gene, String variant, String tumorType, ActionabilityTier expectedTier) {
        this(gene, variant, tumorType, expectedTier, null, null);
    }

    @JsonProperty("gene")
    public String getGene() {
        return input.getGene();
    }

    @JsonProperty("variant")
    public String getVariant() {
        return input.getVariant();
    }

    @JsonProperty("tumor_type")
    public String getTumorType() {
        return input.getTumorType();
    }

    @JsonProperty("expected_tier")
    public ActionabilityTier getExpectedTier() {
        return expectedTier;
    }

    @JsonProperty("notes")
    public String getNotes() {
        return notes;
    }

    @JsonProperty("references")
    public List<String> getReferences() {
        return references;
    }

    public VariantInput toVariantInput() {
        return input;
    }

    @Override
    public String toString() {
        return input + " expected " + expectedTier.getLabel();
    }
}
