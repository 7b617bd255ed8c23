package com.tumorboard;

import com.tumorboard.models.ActionabilityAssessment;
import com.tumorboard.models.VariantInput;

/**
 * Produces an assessment for one variant.
 */
@FunctionalInterface
public interface VariantAssessor {

    ActionabilityAssessment assess(VariantInput input) throws Exception;
}
