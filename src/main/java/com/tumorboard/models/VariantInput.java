package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single variant to assess, e.g. BRAF V600E in Melanoma.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class VariantInput {

    private final String gene;
    private final String variant;
    private final String tumorType;

    @JsonCreator
    public VariantInput(@JsonProperty("gene") String gene,
                        @JsonProperty("variant") String variant,
                        @JsonProperty("tumor_type") String tumorType) {
        this.gene = requireText(gene, "gene");
        this.variant = requireText(variant, "variant");
        this.tumorType = requireText(tumorType, "tumor_type");
    }

    @JsonProperty("gene")
    public String getGene() {
        return gene;
    }

    @JsonProperty("variant")
    public String getVariant() {
        return variant;
    }

    @JsonProperty("tumor_type")
    public String getTumorType() {
        return tumorType;
    }

    /**
     * HGVS-like notation used as the evidence service query key.
     */
    public String toHgvs() {
        return gene + ":" + variant;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.trim();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantInput)) return false;
        VariantInput that = (VariantInput) o;
        return gene.equals(that.gene) && variant.equals(that.variant) && tumorType.equals(that.tumorType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, variant, tumorType);
    }

    @Override
    public String toString() {
        return gene + " " + variant + " (" + tumorType + ")";
    }
}
