package com.tumorboard;

import com.tumorboard.batch.BatchExecutor;
import com.tumorboard.batch.ItemOutcome;
import com.tumorboard.evidence.EvidenceProvider;
import com.tumorboard.llm.LlmService;
import com.tumorboard.llm.LlmServiceException;
import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.Evidence;
import com.tumorboard.models.VariantInput;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines evidence lookup and LLM assessment, for one variant or a batch.
 * Closing the engine closes the evidence provider.
 */
public class AssessmentEngine implements VariantAssessor, AutoCloseable {

    public static final int DEFAULT_MAX_CONCURRENT = 5;

    private final EvidenceProvider evidenceProvider;
    private final LlmService llmService;
    private final AppLogger logger = AppLogger.get();

    public AssessmentEngine(EvidenceProvider evidenceProvider, LlmService llmService) {
        this.evidenceProvider = Objects.requireNonNull(evidenceProvider, "evidenceProvider");
        this.llmService = Objects.requireNonNull(llmService, "llmService");
    }

    /**
     * @throws IOException          if the evidence service fails
     * @throws LlmServiceException  if the model assessment fails
     */
    public ActionabilityAssessment assessVariant(VariantInput input)
        throws IOException, LlmServiceException, InterruptedException {
        Evidence evidence = evidenceProvider.fetchEvidence(input.getGene(), input.getVariant());
        return llmService.assessVariant(input.getGene(), input.getVariant(), input.getTumorType(), evidence);
    }

    @Override
    public ActionabilityAssessment assess(VariantInput input) throws Exception {
        return assessVariant(input);
    }

    public List<ActionabilityAssessment> batchAssess(List<VariantInput> inputs) throws InterruptedException {
        return batchAssess(inputs, DEFAULT_MAX_CONCURRENT);
    }

    /**
     * Assess every input with at most {@code maxConcurrent} in flight. Failed items are logged and
     * dropped; the successful assessments keep their input order.
     */
    public List<ActionabilityAssessment> batchAssess(List<VariantInput> inputs, int maxConcurrent)
        throws InterruptedException {
        return successes(batchAssessDetailed(inputs, maxConcurrent));
    }

    public List<ItemOutcome<VariantInput, ActionabilityAssessment>> batchAssessDetailed(List<VariantInput> inputs,
                                                                                        int maxConcurrent)
        throws InterruptedException {
        BatchExecutor executor = new BatchExecutor(maxConcurrent);
        logger.info("Assessing " + (inputs != null ? inputs.size() : 0) + " variants (max concurrent: "
            + maxConcurrent + ")");
        return executor.runAll(inputs, this::assessVariant);
    }

    public static List<ActionabilityAssessment> successes(
        List<ItemOutcome<VariantInput, ActionabilityAssessment>> outcomes) {
        List<ActionabilityAssessment> assessments = new ArrayList<>();
        for (ItemOutcome<VariantInput, ActionabilityAssessment> outcome : outcomes) {
            if (outcome.isSuccess()) {
                assessments.add(outcome.getValue());
            }
        }
        return assessments;
    }

    @Override
    public void close() {
        evidenceProvider.close();
    }
}
