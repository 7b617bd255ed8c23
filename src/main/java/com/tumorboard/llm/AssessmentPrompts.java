package com.tumorboard.llm;

import com.tumorboard.llm.completion.ChatMessage;

import java.util.List;

/**
 * Prompt text for variant actionability assessment.
 * Output depends only on the arguments, so identical inputs give identical messages.
 */
public final class AssessmentPrompts {

    public static final String SYSTEM_PROMPT = String.join("\n",
        "You are an expert molecular tumor board assistant. You classify the clinical actionability",
        "of somatic variants in a specific tumor type using the AMP/ASCO/CAP 2017 guidelines.",
        "",
        "Tier definitions:",
        "- Tier I: Variants of strong clinical significance. FDA-approved therapy or professional",
        "  guideline recommendation for this tumor type, or well-powered studies with expert consensus.",
        "- Tier II: Variants of potential clinical significance. FDA-approved therapy for a different",
        "  tumor type, investigational therapies, or multiple small published studies.",
        "- Tier III: Variants of unknown clinical significance. Not observed at significant allele",
        "  frequency in population databases and no convincing published evidence of cancer association.",
        "- Tier IV: Variants deemed benign or likely benign.",
        "",
        "Base the classification on the supplied database evidence and on established knowledge.",
        "Prefer the lower tier when the evidence is weak or conflicting, and say so in the rationale.",
        "",
        "Respond with a single JSON object and nothing else, using exactly these fields:",
        "{",
        "  \"tier\": \"Tier I\" | \"Tier II\" | \"Tier III\" | \"Tier IV\",",
        "  \"confidence_score\": number between 0 and 1,",
        "  \"summary\": one or two sentence summary,",
        "  \"rationale\": detailed reasoning for the tier,",
        "  \"evidence_strength\": \"Strong\" | \"Moderate\" | \"Weak\",",
        "  \"clinical_trials_available\": true | false,",
        "  \"recommended_therapies\": [",
        "    {\"drug_name\": string, \"evidence_level\": string, \"approval_status\": string,",
        "     \"clinical_context\": string}",
        "  ],",
        "  \"references\": [string]",
        "}");

    private AssessmentPrompts() {
    }

    public static String buildUserPrompt(String gene, String variant, String tumorType, String evidenceSummary) {
        if (gene == null || gene.isBlank()) {
            throw new IllegalArgumentException("gene is required");
        }
        if (variant == null || variant.isBlank()) {
            throw new IllegalArgumentException("variant is required");
        }
        String tumor = tumorType == null || tumorType.isBlank() ? "Unspecified" : tumorType.trim();
        String evidence = evidenceSummary == null || evidenceSummary.isBlank()
            ? "No evidence found in databases."
            : evidenceSummary.trim();

        return String.join("\n",
            "Assess the clinical actionability of the following variant.",
            "",
            "Gene: " + gene.trim(),
            "Variant: " + variant.trim(),
            "Tumor Type: " + tumor,
            "",
            "Database evidence:",
            evidence,
            "",
            "Classify this variant for " + tumor + " and respond with the JSON object only.");
    }

    public static List<ChatMessage> buildMessages(String gene, String variant, String tumorType,
                                                  String evidenceSummary) {
        return List.of(
            ChatMessage.system(SYSTEM_PROMPT),
            ChatMessage.user(buildUserPrompt(gene, variant, tumorType, evidenceSummary))
        );
    }
}
