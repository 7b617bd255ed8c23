package com.tumorboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tumorboard.batch.ItemOutcome;
import com.tumorboard.evidence.EvidenceProvider;
import com.tumorboard.evidence.MyVariantApiException;
import com.tumorboard.llm.LlmService;
import com.tumorboard.llm.LlmServiceException;
import com.tumorboard.llm.RetryPolicy;
import com.tumorboard.llm.completion.CompletionClient;
import com.tumorboard.llm.completion.CompletionException;
import com.tumorboard.llm.completion.CompletionRequest;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.Evidence;
import com.tumorboard.models.VariantInput;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentEngineTest {

    private final AtomicBoolean closed = new AtomicBoolean();

    private final EvidenceProvider evidence = new EvidenceProvider() {
        @Override
        public Evidence fetchEvidence(String gene, String variant) throws MyVariantApiException {
            if ("ERR".equals(gene)) {
                throw new MyVariantApiException("MyVariant request failed (500)", 500);
            }
            return Evidence.empty(gene, variant);
        }

        @Override
        public void close() {
            closed.set(true);
        }
    };

    private AssessmentEngine engine() {
        CompletionClient client = new CompletionClient() {
            @Override
            public String getProviderName() {
                return "fixed";
            }

            @Override
            public String complete(CompletionRequest request) {
                return "{\"tier\":\"Tier II\",\"confidence_score\":0.6}";
            }
        };
        LlmService llm = new LlmService(client, "gpt-4o-mini", 0.1, 2000,
            RetryPolicy.defaultPolicy(d -> { }), new ObjectMapper());
        return new AssessmentEngine(evidence, llm);
    }

    @Test
    void batchDropsFailuresAndKeepsOrder() throws Exception {
        List<VariantInput> inputs = List.of(
            new VariantInput("BRAF", "V600E", "Melanoma"),
            new VariantInput("KRAS", "G12C", "NSCLC"),
            new VariantInput("ERR", "X1", "Lung"),
            new VariantInput("EGFR", "L858R", "NSCLC"),
            new VariantInput("ALK", "F1174L", "Neuroblastoma"));

        try (AssessmentEngine engine = engine()) {
            List<ActionabilityAssessment> results = engine.batchAssess(inputs, 2);
            assertEquals(4, results.size());
            assertEquals(List.of("BRAF", "KRAS", "EGFR", "ALK"),
                results.stream().map(ActionabilityAssessment::getGene).collect(Collectors.toList()));

            List<ItemOutcome<VariantInput, ActionabilityAssessment>> detailed = engine.batchAssessDetailed(inputs, 2);
            assertEquals(5, detailed.size());
            assertTrue(detailed.get(2).getError() instanceof MyVariantApiException);
        }
        assertTrue(closed.get());
    }

    @Test
    void completionFailureOnOneItemLeavesTheOthersInOrder() throws Exception {
        List<CompletionRequest> nrasCalls = new CopyOnWriteArrayList<>();
        CompletionClient client = new CompletionClient() {
            @Override
            public String getProviderName() {
                return "flaky";
            }

            @Override
            public String complete(CompletionRequest request) throws CompletionException {
                if (request.getMessages().get(1).getContent().contains("Gene: NRAS")) {
                    nrasCalls.add(request);
                    throw new CompletionException("upstream 503");
                }
                return "{\"tier\":\"Tier II\",\"confidence_score\":0.6}";
            }
        };
        LlmService llm = new LlmService(client, "gpt-4o-mini", 0.1, 2000,
            RetryPolicy.defaultPolicy(d -> { }), new ObjectMapper());
        List<VariantInput> inputs = List.of(
            new VariantInput("BRAF", "V600E", "Melanoma"),
            new VariantInput("KRAS", "G12C", "NSCLC"),
            new VariantInput("NRAS", "Q61K", "Melanoma"),
            new VariantInput("EGFR", "L858R", "NSCLC"),
            new VariantInput("ALK", "F1174L", "Neuroblastoma"));

        try (AssessmentEngine engine = new AssessmentEngine(evidence, llm)) {
            List<ItemOutcome<VariantInput, ActionabilityAssessment>> outcomes = engine.batchAssessDetailed(inputs, 2);
            List<ActionabilityAssessment> results = AssessmentEngine.successes(outcomes);

            assertEquals(List.of("BRAF", "KRAS", "EGFR", "ALK"),
                results.stream().map(ActionabilityAssessment::getGene).collect(Collectors.toList()));
            Exception error = outcomes.get(2).getError();
            assertTrue(error instanceof LlmServiceException);
            assertEquals(LlmServiceException.Kind.COMPLETION_FAILED, ((LlmServiceException) error).getKind());
            assertEquals(RetryPolicy.DEFAULT_MAX_ATTEMPTS, nrasCalls.size());
        }
    }

    @Test
    void evidenceFailurePropagatesForSingleAssessment() {
        try (AssessmentEngine engine = engine()) {
            assertThrows(MyVariantApiException.class, () -> engine.assessVariant(new VariantInput("ERR", "X1", "Lung")));
        }
    }
}
