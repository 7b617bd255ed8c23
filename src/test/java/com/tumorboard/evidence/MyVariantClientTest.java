package com.tumorboard.evidence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.models.CivicEvidence;
import com.tumorboard.models.ClinVarEvidence;
import com.tumorboard.models.CosmicEvidence;
import com.tumorboard.models.Evidence;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class MyVariantClientTest {

    private static final String RESPONSE = "{\"total\":2,\"hits\":["
        + "{\"civic\":{\"evidence_items\":[{\"evidence_type\":\"Predictive\",\"evidence_level\":\"A\","
        + "\"clinical_significance\":\"Sensitivity/Response\",\"disease\":{\"name\":\"Melanoma\"},"
        + "\"drugs\":[{\"name\":\"Vemurafenib\"}],\"description\":\"Responds to BRAF inhibition\"}]},"
        + "\"clinvar\":{\"variant_id\":13961,\"rcv\":[{\"clinical_significance\":\"Pathogenic\","
        + "\"review_status\":\"criteria provided\",\"conditions\":{\"name\":\"Melanoma\"}},"
        + "{\"clinical_significance\":\"Likely pathogenic\",\"conditions\":[{\"name\":\"Lung cancer\"}]}]}},"
        + "{\"cosmic\":{\"cosmic_id\":\"COSM476\",\"tumor_site\":\"skin\",\"mut_freq\":\"45.5\",\"mut_nt\":\"T>A\"}}"
        + "]}";

    private final ObjectMapper mapper = new ObjectMapper();
    private Javalin app;

    @AfterEach
    void stopServer() {
        if (app != null) {
            app.stop();
        }
    }

    private MyVariantClient clientFor(Javalin server) {
        return new MyVariantClient(mapper, "http://localhost:" + server.port() + "/", Duration.ofSeconds(5));
    }

    @Test
    void fetchesAndFlattensAllSources() throws Exception {
        AtomicReference<String> query = new AtomicReference<>();
        AtomicReference<String> fields = new AtomicReference<>();
        app = Javalin.create()
            .get("/v1/query", ctx -> {
                query.set(ctx.queryParam("q"));
                fields.set(ctx.queryParam("fields"));
                ctx.contentType("application/json").result(RESPONSE);
            })
            .start(0);

        Evidence evidence;
        try (MyVariantClient client = clientFor(app)) {
            evidence = client.fetchEvidence("BRAF", "V600E");
        }

        assertEquals("BRAF:V600E", query.get());
        assertEquals("civic,clinvar,cosmic", fields.get());
        assertEquals(1, evidence.getCivic().size());
        CivicEvidence civic = evidence.getCivic().get(0);
        assertEquals("Melanoma", civic.getDisease());
        assertEquals(List.of("Vemurafenib"), civic.getDrugs());

        List<ClinVarEvidence> clinvar = evidence.getClinvar();
        assertEquals(2, clinvar.size());
        assertEquals("13961", clinvar.get(0).getVariationId());
        assertEquals("13961", clinvar.get(1).getVariationId());
        assertEquals(List.of("Lung cancer"), clinvar.get(1).getConditions());

        CosmicEvidence cosmic = evidence.getCosmic().get(0);
        assertEquals("COSM476", cosmic.getMutationId());
        assertEquals(45.5, cosmic.getMutationFrequency());
    }

    @Test
    void emptyHitsYieldEmptyEvidence() throws Exception {
        app = Javalin.create()
            .get("/v1/query", ctx -> ctx.contentType("application/json").result("{\"total\":0,\"hits\":[]}"))
            .start(0);

        try (MyVariantClient client = clientFor(app)) {
            Evidence evidence = client.fetchEvidence("TP53", "R999Z");
            assertFalse(evidence.hasEvidence());
        }
    }

    @Test
    void serverErrorRaisesApiException() {
        app = Javalin.create()
            .get("/v1/query", ctx -> ctx.status(500).result("boom"))
            .start(0);

        MyVariantClient client = clientFor(app);
        MyVariantApiException e = assertThrows(MyVariantApiException.class,
            () -> client.fetchEvidence("BRAF", "V600E"));
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void closedClientRejectsCalls() {
        MyVariantClient client = new MyVariantClient(mapper);
        client.close();
        assertTrue(client.isClosed());
        assertThrows(IllegalStateException.class, () -> client.fetchEvidence("BRAF", "V600E"));
    }

    @Test
    void parsesFlatClinVarAndCivicTherapies() throws Exception {
        JsonNode clinvar = mapper.readTree("{\"variation_id\":\"42\",\"clinical_significance\":[\"Pathogenic\",\"Drug response\"],"
            + "\"review_status\":\"expert panel\",\"conditions\":\"Glioma\"}");
        List<ClinVarEvidence> records = MyVariantClient.parseClinVarEvidence(clinvar);
        assertEquals(1, records.size());
        assertEquals("Pathogenic, Drug response", records.get(0).getClinicalSignificance());
        assertEquals(List.of("Glioma"), records.get(0).getConditions());
        assertEquals("42", records.get(0).getVariationId());

        JsonNode civic = mapper.readTree("{\"evidence_items\":[{\"disease\":\"Glioma\",\"therapies\":[\"Vorasidenib\"]}]}");
        CivicEvidence item = MyVariantClient.parseCivicEvidence(civic).get(0);
        assertEquals("Glioma", item.getDisease());
        assertEquals(List.of("Vorasidenib"), item.getDrugs());
    }

    @Test
    void missingHitsMeansNoEvidence() throws Exception {
        Evidence evidence = MyVariantClient.parseResponse("KRAS", "G12C", mapper.readTree("{\"total\":0}"));
        assertFalse(evidence.hasEvidence());
        assertEquals("KRAS:G12C", evidence.getVariantId());
    }
}
