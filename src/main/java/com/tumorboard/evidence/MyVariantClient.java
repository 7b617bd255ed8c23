package com.tumorboard.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.AppLogger;
import com.tumorboard.models.CivicEvidence;
import com.tumorboard.models.ClinVarEvidence;
import com.tumorboard.models.CosmicEvidence;
import com.tumorboard.models.Evidence;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client for the MyVariant.info query API. Flattens CIViC, ClinVar and COSMIC
 * sub-records from every hit into one {@link Evidence} bundle.
 */
public class MyVariantClient implements EvidenceProvider {

    public static final String DEFAULT_BASE_URL = "https://myvariant.info";
    static final String FIELDS = "civic,clinvar,cosmic";
    static final int MAX_HITS = 10;

    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AppLogger logger = AppLogger.get();

    public MyVariantClient(ObjectMapper mapper, String baseUrl, Duration timeout) {
        this.mapper = mapper;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.timeout = timeout != null ? timeout : Duration.ofSeconds(30);
        this.httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(10))
            .build();
    }

    public MyVariantClient(ObjectMapper mapper) {
        this(mapper, DEFAULT_BASE_URL, null);
    }

    @Override
    public Evidence fetchEvidence(String gene, String variant) throws IOException, InterruptedException {
        String variantId = gene + ":" + variant;
        JsonNode response = query(variantId);
        Evidence evidence = parseResponse(gene, variant, response);
        if (evidence.hasEvidence()) {
            logger.info("Fetched evidence for " + variantId + ": civic=" + evidence.getCivic().size()
                + ", clinvar=" + evidence.getClinvar().size()
                + ", cosmic=" + evidence.getCosmic().size());
        } else {
            logger.info("No evidence found for " + variantId + "; assessing without database support");
        }
        return evidence;
    }

    JsonNode query(String variantId) throws IOException, InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("MyVariantClient is closed");
        }
        String url = baseUrl + "/v1/query?q=" + URLEncoder.encode(variantId, StandardCharsets.UTF_8)
            + "&fields=" + URLEncoder.encode(FIELDS, StandardCharsets.UTF_8)
            + "&size=" + MAX_HITS;
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new MyVariantApiException("MyVariant request failed for " + variantId + ": " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new MyVariantApiException("MyVariant request failed (" + status + "): " + response.body(), status);
        }
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new MyVariantApiException("MyVariant returned invalid JSON for " + variantId, e);
        }
    }

    /**
     * Builds the evidence bundle from a raw query response. Missing sections are tolerated.
     */
    public static Evidence parseResponse(String gene, String variant, JsonNode response) {
        List<CivicEvidence> civic = new ArrayList<>();
        List<ClinVarEvidence> clinvar = new ArrayList<>();
        List<CosmicEvidence> cosmic = new ArrayList<>();

        JsonNode hits = response != null ? response.path("hits") : null;
        if (hits != null && hits.isArray()) {
            for (JsonNode hit : hits) {
                for (JsonNode node : asList(hit.path("civic"))) {
                    civic.addAll(parseCivicEvidence(node));
                }
                for (JsonNode node : asList(hit.path("clinvar"))) {
                    clinvar.addAll(parseClinVarEvidence(node));
                }
                for (JsonNode node : asList(hit.path("cosmic"))) {
                    cosmic.addAll(parseCosmicEvidence(node));
                }
            }
        }
        return new Evidence(gene + ":" + variant, gene, variant, civic, clinvar, cosmic);
    }

    public static List<CivicEvidence> parseCivicEvidence(JsonNode civic) {
        List<CivicEvidence> result = new ArrayList<>();
        for (JsonNode item : asList(civic.path("evidence_items"))) {
            if (!item.isObject()) {
                continue;
            }
            List<String> drugs = names(item.path("drugs"));
            if (drugs.isEmpty()) {
                drugs = names(item.path("therapies"));
            }
            JsonNode disease = item.path("disease");
            result.add(new CivicEvidence(
                text(item.path("evidence_type")),
                text(item.path("evidence_level")),
                text(item.path("clinical_significance")),
                disease.isObject() ? text(disease.path("name")) : text(disease),
                drugs,
                text(item.path("description"))
            ));
        }
        return result;
    }

    public static List<ClinVarEvidence> parseClinVarEvidence(JsonNode clinvar) {
        if (!clinvar.isObject()) {
            return Collections.emptyList();
        }
        String variationId = text(clinvar.path("variation_id"));
        if (variationId == null) {
            variationId = text(clinvar.path("variant_id"));
        }
        List<ClinVarEvidence> result = new ArrayList<>();
        JsonNode rcv = clinvar.path("rcv");
        if (rcv.isObject() || rcv.isArray()) {
            for (JsonNode entry : asList(rcv)) {
                result.add(toClinVar(entry, variationId));
            }
        } else {
            result.add(toClinVar(clinvar, variationId));
        }
        return result;
    }

    public static List<CosmicEvidence> parseCosmicEvidence(JsonNode cosmic) {
        if (!cosmic.isObject()) {
            return Collections.emptyList();
        }
        JsonNode freq = cosmic.path("mut_freq");
        Double frequency = freq.isNumber() || (freq.isTextual() && isNumeric(freq.asText()))
            ? freq.asDouble()
            : null;
        return List.of(new CosmicEvidence(
            text(cosmic.path("cosmic_id")),
            text(cosmic.path("tumor_site")),
            frequency,
            text(cosmic.path("mut_nt"))
        ));
    }

    private static ClinVarEvidence toClinVar(JsonNode node, String variationId) {
        JsonNode significance = node.path("clinical_significance");
        String joined = significance.isArray() ? String.join(", ", texts(significance)) : text(significance);
        return new ClinVarEvidence(joined, text(node.path("review_status")), names(node.path("conditions")), variationId);
    }

    private static List<JsonNode> asList(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return Collections.emptyList();
        }
        List<JsonNode> list = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(list::add);
        } else {
            list.add(node);
        }
        return list;
    }

    /** Reads {@code name} from objects, or the value itself from plain strings. */
    private static List<String> names(JsonNode node) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : asList(node)) {
            String name = item.isObject() ? text(item.path("name")) : text(item);
            if (name != null) {
                result.add(name);
            }
        }
        return result;
    }

    private static List<String> texts(JsonNode array) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : array) {
            String value = text(item);
            if (value != null) {
                result.add(value);
            }
        }
        return result;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static boolean isNumeric(String value) {
        try {
            Double.parseDouble(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String normalizeBaseUrl(String baseUrl) {
        String url = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl.trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
