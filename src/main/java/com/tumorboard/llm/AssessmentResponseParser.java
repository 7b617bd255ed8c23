package com.tumorboard.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.AppLogger;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.ActionabilityTier;
import com.tumorboard.models.RecommendedTherapy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Turns raw model text into an {@link ActionabilityAssessment} in two stages:
 * {@link #extractJson} parses the text into a JSON tree, {@link #toAssessment} maps the tree
 * onto the schema with per-field defaults.
 */
public class AssessmentResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;
    static final String DEFAULT_SUMMARY = "No summary provided";
    static final String DEFAULT_RATIONALE = "No rationale provided";

    private static final String FENCE = "```";
    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[A-Za-z][A-Za-z0-9_+.-]*(?=[\\s{])");

    private final ObjectMapper objectMapper;
    private final AppLogger logger = AppLogger.get();

    public AssessmentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * Removes a surrounding markdown code fence, with or without a language tag. The tag may sit
     * on its own line or directly before the opening brace.
     */
    public static String stripCodeFence(String content) {
        if (content == null) {
            return "";
        }
        String text = content.trim();
        if (text.startsWith(FENCE)) {
            text = LANGUAGE_TAG.matcher(text.substring(FENCE.length())).replaceFirst("");
        }
        if (text.endsWith(FENCE)) {
            text = text.substring(0, text.length() - FENCE.length());
        }
        return text.trim();
    }

    /**
     * @throws LlmServiceException of kind {@code INVALID_JSON} when the text is not a JSON object
     */
    public JsonNode extractJson(String content) throws LlmServiceException {
        String json = stripCodeFence(content);
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (Exception e) {
            logger.error("Failed to parse JSON response: " + truncate(json, 500));
            throw new LlmServiceException(LlmServiceException.Kind.INVALID_JSON,
                "Invalid JSON response from LLM: " + e.getMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new LlmServiceException(LlmServiceException.Kind.INVALID_JSON,
                "Invalid JSON response from LLM: expected an object");
        }
        return node;
    }

    /**
     * Maps parsed model output onto the assessment schema.
     *
     * Only {@code tier} is required. An unrecognized tier degrades to {@link ActionabilityTier#UNKNOWN};
     * every other field falls back to its default when missing or null.
     *
     * @throws LlmServiceException of kind {@code INVALID_SCHEMA} when tier is missing or a field cannot be coerced
     */
    public ActionabilityAssessment toAssessment(JsonNode data, String gene, String variant, String tumorType)
        throws LlmServiceException {
        if (data == null || !data.isObject()) {
            throw schemaError("Response must be a JSON object");
        }
        JsonNode tierNode = data.get("tier");
        if (tierNode == null || tierNode.isNull()) {
            throw schemaError("Missing required field: tier");
        }

        try {
            return ActionabilityAssessment.builder()
                .gene(gene)
                .variant(variant)
                .tumorType(tumorType)
                .tier(parseTier(tierNode))
                .confidenceScore(readConfidence(data.get("confidence_score")))
                .summary(readText(data.get("summary"), "summary", DEFAULT_SUMMARY))
                .rationale(readText(data.get("rationale"), "rationale", DEFAULT_RATIONALE))
                .evidenceStrength(readText(data.get("evidence_strength"), "evidence_strength", null))
                .clinicalTrialsAvailable(readBoolean(data.get("clinical_trials_available"), "clinical_trials_available"))
                .recommendedTherapies(readTherapies(data.get("recommended_therapies")))
                .references(readStrings(data.get("references"), "references"))
                .build();
        } catch (IllegalArgumentException e) {
            throw schemaError("Failed to validate LLM response: " + e.getMessage());
        }
    }

    private ActionabilityTier parseTier(JsonNode node) {
        String raw = node.isValueNode() ? node.asText() : node.toString();
        if (!node.isTextual() || !ActionabilityTier.isKnownLabel(raw)) {
            logger.warn("Invalid tier '" + raw + "', defaulting to " + ActionabilityTier.UNKNOWN.getLabel());
            return ActionabilityTier.UNKNOWN;
        }
        return ActionabilityTier.parseOrUnknown(raw);
    }

    private static double readConfidence(JsonNode node) {
        if (isAbsent(node)) {
            return DEFAULT_CONFIDENCE;
        }
        if (node.isNumber()) {
            return node.asDouble();
        }
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("confidence_score is not a number: " + node.asText(), e);
            }
        }
        throw new IllegalArgumentException("confidence_score has unsupported type " + node.getNodeType());
    }

    private static String readText(JsonNode node, String field, String defaultValue) {
        if (isAbsent(node)) {
            return defaultValue;
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        throw new IllegalArgumentException(field + " must be a string");
    }

    private static boolean readBoolean(JsonNode node, String field) {
        if (isAbsent(node)) {
            return false;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber() && (node.asInt() == 0 || node.asInt() == 1)) {
            return node.asInt() == 1;
        }
        if (node.isTextual()) {
            String value = node.asText().trim().toLowerCase(Locale.ROOT);
            if ("true".equals(value)) {
                return true;
            }
            if ("false".equals(value)) {
                return false;
            }
        }
        throw new IllegalArgumentException(field + " must be a boolean");
    }

    private static List<RecommendedTherapy> readTherapies(JsonNode node) {
        List<RecommendedTherapy> therapies = new ArrayList<>();
        if (isAbsent(node)) {
            return therapies;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("recommended_therapies must be a list");
        }
        for (JsonNode item : node) {
            if (item.isTextual()) {
                therapies.add(new RecommendedTherapy(item.asText()));
                continue;
            }
            if (!item.isObject()) {
                throw new IllegalArgumentException("recommended_therapies entries must be objects");
            }
            therapies.add(new RecommendedTherapy(
                readText(item.get("drug_name"), "drug_name", null),
                readText(item.get("evidence_level"), "evidence_level", null),
                readText(item.get("approval_status"), "approval_status", null),
                readText(item.get("clinical_context"), "clinical_context", null)
            ));
        }
        return therapies;
    }

    private static List<String> readStrings(JsonNode node, String field) {
        List<String> values = new ArrayList<>();
        if (isAbsent(node)) {
            return values;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(field + " must be a list");
        }
        for (JsonNode item : node) {
            if (!item.isValueNode() || item.isNull()) {
                throw new IllegalArgumentException(field + " entries must be strings");
            }
            values.add(item.asText());
        }
        return values;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static LlmServiceException schemaError(String message) {
        return new LlmServiceException(LlmServiceException.Kind.INVALID_SCHEMA, message);
    }

    private static String truncate(String value, int max) {
        if (value.length() <= max) return value;
        return value.substring(0, max) + "...";
    }
}
