package com.tumorboard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Collections;
import java.util.List;

/**
 * Evidence gathered for one variant, grouped by source database.
 * Instances are immutable once built.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class Evidence {

    private static final int MAX_DESCRIPTION_LENGTH = 300;

    private final String variantId;
    private final String gene;
    private final String variant;
    private final List<CivicEvidence> civic;
    private final List<ClinVarEvidence> clinvar;
    private final List<CosmicEvidence> cosmic;

    public Evidence(String variantId, String gene, String variant,
                    List<CivicEvidence> civic, List<ClinVarEvidence> clinvar, List<CosmicEvidence> cosmic) {
        this.variantId = variantId;
        this.gene = gene;
        this.variant = variant;
        this.civic = civic == null ? Collections.emptyList() : List.copyOf(civic);
        this.clinvar = clinvar == null ? Collections.emptyList() : List.copyOf(clinvar);
        this.cosmic = cosmic == null ? Collections.emptyList() : List.copyOf(cosmic);
    }

    public static Evidence empty(String gene, String variant) {
        return new Evidence(gene + ":" + variant, gene, variant, null, null, null);
    }

    public String getVariantId() {
        return variantId;
    }

    public String getGene() {
        return gene;
    }

    public String getVariant() {
        return variant;
    }

    public List<CivicEvidence> getCivic() {
        return civic;
    }

    public List<ClinVarEvidence> getClinvar() {
        return clinvar;
    }

    public List<CosmicEvidence> getCosmic() {
        return cosmic;
    }

    public boolean hasEvidence() {
        return !civic.isEmpty() || !clinvar.isEmpty() || !cosmic.isEmpty();
    }

    @JsonIgnore
    public int getTotalCount() {
        return civic.size() + clinvar.size() + cosmic.size();
    }

    /**
     * Plain-text rendering of the evidence, embedded verbatim in the model prompt.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Evidence for ").append(gene).append(' ').append(variant).append(":\n");

        if (!hasEvidence()) {
            sb.append("\nNo evidence found in databases.\n");
            return sb.toString();
        }

        if (!civic.isEmpty()) {
            sb.append("\nCIViC Evidence (").append(civic.size()).append(" items):\n");
            int idx = 1;
            for (CivicEvidence item : civic) {
                sb.append("  ").append(idx++).append(". ");
                sb.append("Type: ").append(orDash(item.getEvidenceType()));
                sb.append(", Level: ").append(orDash(item.getEvidenceLevel()));
                sb.append(", Significance: ").append(orDash(item.getClinicalSignificance()));
                sb.append('\n');
                if (item.getDisease() != null) {
                    sb.append("     Disease: ").append(item.getDisease()).append('\n');
                }
                if (!item.getDrugs().isEmpty()) {
                    sb.append("     Drugs: ").append(String.join(", ", item.getDrugs())).append('\n');
                }
                if (item.getDescription() != null && !item.getDescription().isBlank()) {
                    sb.append("     Description: ").append(truncate(item.getDescription().trim())).append('\n');
                }
            }
        }

        if (!clinvar.isEmpty()) {
            sb.append("\nClinVar Evidence (").append(clinvar.size()).append(" records):\n");
            int idx = 1;
            for (ClinVarEvidence item : clinvar) {
                sb.append("  ").append(idx++).append(". ");
                sb.append("Significance: ").append(orDash(item.getClinicalSignificance()));
                sb.append(", Review status: ").append(orDash(item.getReviewStatus()));
                sb.append('\n');
                if (!item.getConditions().isEmpty()) {
                    sb.append("     Conditions: ").append(String.join(", ", item.getConditions())).append('\n');
                }
            }
        }

        if (!cosmic.isEmpty()) {
            sb.append("\nCOSMIC Evidence (").append(cosmic.size()).append(" records):\n");
            int idx = 1;
            for (CosmicEvidence item : cosmic) {
                sb.append("  ").append(idx++).append(". ");
                sb.append("ID: ").append(orDash(item.getMutationId()));
                sb.append(", Primary site: ").append(orDash(item.getPrimarySite()));
                if (item.getMutationFrequency() != null) {
                    sb.append(", Frequency: ").append(item.getMutationFrequency());
                }
                if (item.getMutationNt() != null) {
                    sb.append(", Nucleotide change: ").append(item.getMutationNt());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }

    private static String truncate(String value) {
        if (value.length() <= MAX_DESCRIPTION_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_DESCRIPTION_LENGTH) + "...";
    }
}
